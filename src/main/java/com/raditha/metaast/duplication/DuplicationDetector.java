package com.raditha.metaast.duplication;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import com.raditha.metaast.clustering.CloneGroup;
import com.raditha.metaast.clustering.CloneGrouper;
import com.raditha.metaast.config.DuplicationConfig;
import com.raditha.metaast.document.Document;
import com.raditha.metaast.fingerprint.Fingerprinter;
import com.raditha.metaast.fingerprint.Fingerprints;
import com.raditha.metaast.fingerprint.Identifier;
import com.raditha.metaast.fingerprint.Token;
import com.raditha.metaast.model.MetaNode;
import com.raditha.metaast.similarity.SimilarityStrategy;
import com.raditha.metaast.tree.MetaTrees;
import com.raditha.metaast.tree.TreeStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies pairs of trees as clones.
 * <p>
 * Equal exact fingerprints make a Type I clone and equal normalized
 * fingerprints a Type II clone, both with similarity 1.0. Otherwise the token
 * sequences are scored and a score at or above the threshold makes a Type III
 * clone. A match between documents of different languages is reported as
 * Type IV.
 */
public class DuplicationDetector {

    private static final Logger logger = LoggerFactory.getLogger(DuplicationDetector.class);

    private final DuplicationConfig config;
    private final SimilarityStrategy strategy;
    private final Fingerprinter fingerprinter = new Fingerprinter();

    public DuplicationDetector() {
        this(DuplicationConfig.moderate());
    }

    public DuplicationDetector(DuplicationConfig config) {
        this.config = config;
        this.strategy = config.createStrategy();
    }

    public DuplicationConfig config() {
        return config;
    }

    public DuplicationResult detect(MetaNode first, MetaNode second) {
        return detect(Document.of(first), Document.of(second));
    }

    public DuplicationResult detect(Document first, Document second) {
        Fingerprints fp1 = fingerprinter.fingerprints(first.ast());
        Fingerprints fp2 = fingerprinter.fingerprints(second.ast());

        CloneType matchType;
        double similarity;
        List<Difference> differences;

        if (fp1.exact().equals(fp2.exact())) {
            matchType = CloneType.TYPE_I;
            similarity = 1.0;
            differences = List.of();
        } else if (fp1.normalized().equals(fp2.normalized())) {
            matchType = CloneType.TYPE_II;
            similarity = 1.0;
            differences = renames(first.ast(), second.ast());
        } else {
            List<Token> tokens1 = fingerprinter.tokens(first.ast());
            List<Token> tokens2 = fingerprinter.tokens(second.ast());
            similarity = strategy.calculate(tokens1, tokens2);
            matchType = similarity >= config.threshold() ? CloneType.TYPE_III : CloneType.NONE;
            differences = tokenDeltas(tokens1, tokens2);
        }

        boolean crossLanguage = !first.language().equals(second.language());
        TreeStats stats = MetaTrees.stats(first.ast());
        DuplicationResult result = DuplicationResult.of(
                matchType,
                crossLanguage,
                similarity,
                List.of(CloneLocation.of(first), CloneLocation.of(second)),
                fp1,
                new DuplicationMetrics(stats.nodeCount(), stats.variableCount()),
                differences);

        logger.debug("Compared {} and {}: {} (similarity {})",
                first.language(), second.language(), result.cloneType(), similarity);
        return result;
    }

    /**
     * Group clones among many documents.
     *
     * @see CloneGrouper
     */
    public List<CloneGroup> detectBatch(List<Document> documents) {
        return new CloneGrouper(config, fingerprinter, strategy).group(documents);
    }

    /**
     * Pair identifiers position by position. Only valid when the normalized
     * fingerprints are equal, which makes both lists line up.
     */
    private List<Difference> renames(MetaNode first, MetaNode second) {
        List<Identifier> ids1 = fingerprinter.identifiers(first);
        List<Identifier> ids2 = fingerprinter.identifiers(second);
        List<Difference> differences = new ArrayList<>();
        int size = Math.min(ids1.size(), ids2.size());
        for (int i = 0; i < size; i++) {
            Identifier a = ids1.get(i);
            Identifier b = ids2.get(i);
            if (!a.value().equals(b.value())) {
                Difference.Type type = "literal".equals(a.role()) ? Difference.Type.VALUE_CHANGE : Difference.Type.RENAME;
                differences.add(new Difference(type, i, a.role(), a.value(), b.value()));
            }
        }
        return differences;
    }

    private static List<Difference> tokenDeltas(List<Token> tokens1, List<Token> tokens2) {
        List<String> labels1 = tokens1.stream().map(Token::label).toList();
        List<String> labels2 = tokens2.stream().map(Token::label).toList();
        Patch<String> patch = DiffUtils.diff(labels1, labels2);

        List<Difference> differences = new ArrayList<>();
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            String original = String.join(" ", delta.getSource().getLines());
            String revised = String.join(" ", delta.getTarget().getLines());
            int position = delta.getSource().getPosition();
            switch (delta.getType()) {
                case INSERT -> differences.add(new Difference(Difference.Type.INSERT, position, "token", "", revised));
                case DELETE -> differences.add(new Difference(Difference.Type.DELETE, position, "token", original, ""));
                case CHANGE -> differences.add(new Difference(Difference.Type.CHANGE, position, "token", original, revised));
                default -> {
                    // equal runs carry no difference
                }
            }
        }
        return differences;
    }
}
