package com.raditha.metaast.clustering;

import com.raditha.metaast.config.DuplicationConfig;
import com.raditha.metaast.document.Document;
import com.raditha.metaast.duplication.CloneType;
import com.raditha.metaast.fingerprint.Fingerprinter;
import com.raditha.metaast.fingerprint.Fingerprints;
import com.raditha.metaast.fingerprint.Token;
import com.raditha.metaast.similarity.SimilarityStrategy;
import com.raditha.metaast.tree.MetaTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Groups clones among many documents.
 * <p>
 * Documents are bucketed by exact fingerprint and then by normalized
 * fingerprint, so Type I and Type II groups form without any pairwise
 * scoring. Token similarity is only computed between one representative of
 * each normalized bucket, and pairs at or above the threshold are merged with
 * union-find. Merging is not transitive in the similarity sense: A may join C
 * through B even when A and C score below the threshold.
 */
public class CloneGrouper {

    private static final Logger logger = LoggerFactory.getLogger(CloneGrouper.class);

    private final DuplicationConfig config;
    private final Fingerprinter fingerprinter;
    private final SimilarityStrategy strategy;

    public CloneGrouper(DuplicationConfig config) {
        this(config, new Fingerprinter(), config.createStrategy());
    }

    public CloneGrouper(DuplicationConfig config, Fingerprinter fingerprinter, SimilarityStrategy strategy) {
        this.config = config;
        this.fingerprinter = fingerprinter;
        this.strategy = strategy;
    }

    /**
     * Find clone groups.
     *
     * @param documents documents to compare; those with fewer nodes than the
     *                  configured minimum are ignored
     * @return groups of two or more documents, ordered by their first member
     */
    public List<CloneGroup> group(List<Document> documents) {
        List<Document> candidates = documents.stream()
                .filter(d -> MetaTrees.nodeCount(d.ast()) >= config.minNodes())
                .toList();
        int n = candidates.size();
        if (n < 2) {
            return List.of();
        }

        List<Fingerprints> fingerprints = candidates.stream()
                .map(d -> fingerprinter.fingerprints(d.ast()))
                .toList();

        UnionFind unionFind = new UnionFind(n);
        unionBuckets(unionFind, bucket(fingerprints, Fingerprints::exact));
        Map<String, List<Integer>> normalizedBuckets = bucket(fingerprints, Fingerprints::normalized);
        unionBuckets(unionFind, normalizedBuckets);

        List<Integer> representatives = normalizedBuckets.values().stream()
                .map(members -> members.get(0))
                .toList();
        mergeSimilar(unionFind, candidates, representatives);

        List<CloneGroup> groups = collect(unionFind, candidates, fingerprints);
        logger.info("Found {} clone group(s) among {} documents", groups.size(), n);
        return groups;
    }

    private void mergeSimilar(UnionFind unionFind, List<Document> candidates, List<Integer> representatives) {
        Map<Integer, List<Token>> tokens = new HashMap<>();
        for (Integer index : representatives) {
            tokens.put(index, fingerprinter.tokens(candidates.get(index).ast()));
        }
        int comparisons = 0;
        for (int i = 0; i < representatives.size(); i++) {
            for (int j = i + 1; j < representatives.size(); j++) {
                int a = representatives.get(i);
                int b = representatives.get(j);
                comparisons++;
                if (strategy.calculate(tokens.get(a), tokens.get(b)) >= config.threshold()) {
                    unionFind.union(a, b);
                }
            }
        }
        logger.debug("Scored {} representative pairs", comparisons);
    }

    private static Map<String, List<Integer>> bucket(List<Fingerprints> fingerprints,
            Function<Fingerprints, String> key) {
        Map<String, List<Integer>> buckets = new LinkedHashMap<>();
        for (int i = 0; i < fingerprints.size(); i++) {
            buckets.computeIfAbsent(key.apply(fingerprints.get(i)), k -> new ArrayList<>()).add(i);
        }
        return buckets;
    }

    private static void unionBuckets(UnionFind unionFind, Map<String, List<Integer>> buckets) {
        for (List<Integer> members : buckets.values()) {
            for (int i = 1; i < members.size(); i++) {
                unionFind.union(members.get(0), members.get(i));
            }
        }
    }

    private static List<CloneGroup> collect(UnionFind unionFind, List<Document> candidates,
            List<Fingerprints> fingerprints) {
        Map<Integer, List<Integer>> components = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            components.computeIfAbsent(unionFind.find(i), k -> new ArrayList<>()).add(i);
        }

        List<CloneGroup> groups = new ArrayList<>();
        for (List<Integer> members : components.values()) {
            if (members.size() < 2) {
                continue;
            }
            List<Document> docs = members.stream().map(candidates::get).toList();
            groups.add(CloneGroup.of(classify(members, docs, fingerprints), docs));
        }
        return groups;
    }

    private static CloneType classify(List<Integer> members, List<Document> docs, List<Fingerprints> fingerprints) {
        long languages = docs.stream().map(Document::language).distinct().count();
        if (languages > 1) {
            return CloneType.TYPE_IV;
        }
        Fingerprints first = fingerprints.get(members.get(0));
        boolean sameExact = members.stream().allMatch(i -> fingerprints.get(i).exact().equals(first.exact()));
        if (sameExact) {
            return CloneType.TYPE_I;
        }
        boolean sameNormalized = members.stream()
                .allMatch(i -> fingerprints.get(i).normalized().equals(first.normalized()));
        return sameNormalized ? CloneType.TYPE_II : CloneType.TYPE_III;
    }

    /**
     * Disjoint sets over indices with path compression.
     */
    static final class UnionFind {
        private final int[] parent;

        UnionFind(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        int find(int x) {
            int root = x;
            while (parent[root] != root) {
                root = parent[root];
            }
            while (parent[x] != root) {
                int next = parent[x];
                parent[x] = root;
                x = next;
            }
            return root;
        }

        void union(int a, int b) {
            int rootA = find(a);
            int rootB = find(b);
            if (rootA != rootB) {
                // keep the lower index as root so groups keep input order
                if (rootA < rootB) {
                    parent[rootB] = rootA;
                } else {
                    parent[rootA] = rootB;
                }
            }
        }
    }
}
