package com.raditha.metaast.document;

import com.raditha.metaast.model.MetaNode;

import java.util.Set;

/**
 * Bridge between one source language and the language-neutral tree.
 * <p>
 * Implementations live outside this library. They must produce conforming
 * trees from {@link #toMeta(Object)} and equivalent native trees from
 * {@link #fromMeta(MetaNode)}.
 */
public interface LanguageAdapter {

    /**
     * Language tag, e.g. {@code python}.
     */
    String language();

    /**
     * File extensions handled by this adapter, including the leading dot.
     */
    Set<String> fileExtensions();

    Object parse(String source) throws AdapterException;

    String unparse(Object nativeAst) throws AdapterException;

    MetaNode toMeta(Object nativeAst) throws AdapterException;

    Object fromMeta(MetaNode tree) throws AdapterException;
}
