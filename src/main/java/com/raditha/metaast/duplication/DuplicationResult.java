package com.raditha.metaast.duplication;

import com.raditha.metaast.fingerprint.Fingerprints;

import java.util.List;
import java.util.Locale;

/**
 * Outcome of comparing two trees.
 *
 * @param duplicate    whether any clone type matched
 * @param cloneType    reported classification; {@link CloneType#TYPE_IV} when a match crosses languages
 * @param matchType    structural match underneath the classification, never {@link CloneType#TYPE_IV}
 * @param similarity   1.0 for Type I and II matches, the token similarity otherwise
 * @param locations    locations of both trees
 * @param fingerprints fingerprints of the first tree
 * @param metrics      size of the first tree
 * @param differences  renames for Type II matches, token deltas for near-misses and non-clones
 * @param summary      one-line description
 */
public record DuplicationResult(
        boolean duplicate,
        CloneType cloneType,
        CloneType matchType,
        double similarity,
        List<CloneLocation> locations,
        Fingerprints fingerprints,
        DuplicationMetrics metrics,
        List<Difference> differences,
        String summary) {

    public DuplicationResult {
        locations = List.copyOf(locations);
        differences = List.copyOf(differences);
    }

    /**
     * Build a result, deriving the duplicate flag and summary from the types.
     *
     * @param crossLanguage whether the two trees come from different languages
     */
    public static DuplicationResult of(
            CloneType matchType,
            boolean crossLanguage,
            double similarity,
            List<CloneLocation> locations,
            Fingerprints fingerprints,
            DuplicationMetrics metrics,
            List<Difference> differences) {
        if (matchType == CloneType.TYPE_IV) {
            throw new IllegalArgumentException("Type IV is a classification, not a structural match");
        }
        boolean duplicate = matchType.isClone();
        CloneType cloneType = duplicate && crossLanguage ? CloneType.TYPE_IV : matchType;
        return new DuplicationResult(duplicate, cloneType, matchType, similarity, locations, fingerprints,
                metrics, differences, summarize(cloneType, similarity));
    }

    static String summarize(CloneType cloneType, double similarity) {
        String percent = String.format(Locale.ROOT, "%.1f%%", similarity * 100);
        return switch (cloneType) {
            case TYPE_I -> "Exact clone detected (Type I)";
            case TYPE_II -> "Renamed clone detected (Type II)";
            case TYPE_III -> "Near-miss clone detected (Type III) - " + percent + " similar";
            case TYPE_IV -> "Semantic clone detected (Type IV) - " + percent + " similar";
            case NONE -> "No duplication detected";
        };
    }
}
