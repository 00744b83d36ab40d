package com.raditha.metaast.document;

import com.raditha.metaast.complexity.ComplexityAnalyzer;
import com.raditha.metaast.complexity.ComplexityResult;
import com.raditha.metaast.model.*;
import com.raditha.metaast.tree.ValidationException;
import com.raditha.metaast.tree.ValidationOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdapterRegistryTest {

    @Mock
    private LanguageAdapter python;

    private AdapterRegistry registry;

    private final MetaNode assignment = new Assignment(new Variable("x"), Literal.integer(1));

    @BeforeEach
    void setUp() {
        when(python.language()).thenReturn("python");
        when(python.fileExtensions()).thenReturn(Set.of(".py", ".pyw"));
        registry = AdapterRegistry.builder().register(python).build();
    }

    @Test
    void testAdapterLookupIgnoresCase() {
        assertSame(python, registry.adapterFor("Python"));
        assertTrue(registry.supports("PYTHON"));
        assertFalse(registry.supports("ruby"));
        assertFalse(registry.supports(null));
        assertEquals(Set.of("python"), registry.languages());
    }

    @Test
    void testUnknownLanguage() {
        UnsupportedLanguageException e = assertThrows(UnsupportedLanguageException.class,
                () -> registry.adapterFor("cobol"));

        assertEquals("No adapter found for language: cobol", e.getMessage());
        assertEquals("cobol", e.language());
    }

    @Test
    void testDetectLanguage() {
        assertEquals("python", registry.detectLanguage("src/app.PY"));
        assertEquals("python", registry.detectLanguage("gui.pyw"));

        UnsupportedLanguageException e = assertThrows(UnsupportedLanguageException.class,
                () -> registry.detectLanguage("Makefile"));
        assertEquals("Unknown file extension: Makefile", e.getMessage());
        assertNull(e.language());

        assertThrows(UnsupportedLanguageException.class, () -> registry.detectLanguage("lib/tool.rb"));
    }

    @Test
    void testToDocumentValidates() throws AdapterException {
        Object nativeAst = new Object();
        when(python.toMeta(nativeAst)).thenReturn(assignment);

        Document document = registry.toDocument("python", nativeAst);

        assertSame(assignment, document.ast());
        assertEquals("python", document.language());
        assertTrue(document.metadata().isEmpty());
    }

    @Test
    void testToDocumentRejectsMalformedTree() throws AdapterException {
        when(python.toMeta(any())).thenReturn(new Variable(""));

        assertThrows(ValidationException.class, () -> registry.toDocument("python", "ast"));
    }

    @Test
    void testStrictRegistryRejectsNativeNodes() throws AdapterException {
        AdapterRegistry strict = AdapterRegistry.builder()
                .register(python)
                .validation(ValidationOptions.strict())
                .build();
        when(python.toMeta(any())).thenReturn(Block.of(new LanguageSpecific("python", "decorator", null)));

        assertThrows(ValidationException.class, () -> strict.toDocument("python", "ast"));
        assertDoesNotThrow(() -> registry.toDocument("python", "ast"));
    }

    @Test
    void testParseRecordsLineCount() throws AdapterException {
        String source = "x = 1\nprint(x)\n";
        Object nativeAst = List.of("module");
        when(python.parse(source)).thenReturn(nativeAst);
        when(python.toMeta(nativeAst)).thenReturn(assignment);

        Document document = registry.parse("python", source);

        assertEquals(2, document.lineCount().getAsInt());
        assertEquals(source, document.originalSource());
        verify(python).parse(source);
    }

    @Test
    void testAdapterFailurePropagates() throws AdapterException {
        when(python.parse(any())).thenThrow(new AdapterException("python", "unexpected indent"));

        AdapterException e = assertThrows(AdapterException.class, () -> registry.parse("python", "  x"));

        assertEquals("python", e.language());
        assertEquals("unexpected indent", e.getMessage());
    }

    @Test
    void testUnparse() throws AdapterException {
        when(python.fromMeta(assignment)).thenReturn("native");
        when(python.unparse("native")).thenReturn("x = 1");

        assertEquals("x = 1", registry.unparse("python", assignment));
    }

    @Test
    void testAnalyzerAcceptsNativeTree() throws AdapterException {
        when(python.toMeta("ast")).thenReturn(new Conditional(new Variable("x"), assignment, null));

        ComplexityResult result = new ComplexityAnalyzer().analyze("python", "ast", registry);

        assertEquals(2, result.cyclomatic());
    }
}
