package com.raditha.metaast.duplication;

import com.raditha.metaast.RandomTrees;
import com.raditha.metaast.fingerprint.Fingerprinter;
import com.raditha.metaast.model.MetaNode;
import net.jqwik.api.*;

import static org.junit.jupiter.api.Assertions.*;

class DuplicationPropertiesTest {

    private final DuplicationDetector detector = new DuplicationDetector();
    private final Fingerprinter fingerprinter = new Fingerprinter();

    @Provide
    Arbitrary<Long> seeds() {
        return Arbitraries.longs();
    }

    @Property(tries = 200)
    void selfComparisonIsExactClone(@ForAll("seeds") long seed) {
        MetaNode tree = RandomTrees.statement(seed);

        DuplicationResult result = detector.detect(tree, tree);

        assertTrue(result.duplicate());
        assertEquals(CloneType.TYPE_I, result.cloneType());
        assertEquals(1.0, result.similarity());
    }

    @Property(tries = 200)
    void exactFingerprintIsDeterministic(@ForAll("seeds") long seed) {
        assertEquals(fingerprinter.exact(RandomTrees.statement(seed)), fingerprinter.exact(RandomTrees.statement(seed)));
    }

    @Property(tries = 200)
    void consistentRenamingKeepsNormalizedFingerprint(@ForAll("seeds") long seed) {
        MetaNode original = new RandomTrees(seed, "a", 0, true).statement(4);
        MetaNode renamed = new RandomTrees(seed, "b", 1000, true).statement(4);

        assertEquals(fingerprinter.normalized(original), fingerprinter.normalized(renamed));

        DuplicationResult result = detector.detect(original, renamed);
        assertTrue(result.cloneType() == CloneType.TYPE_I || result.cloneType() == CloneType.TYPE_II);
        assertEquals(1.0, result.similarity());
    }
}
