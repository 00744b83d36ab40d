package com.raditha.metaast.report;

import com.raditha.metaast.clustering.CloneGroup;
import com.raditha.metaast.duplication.CloneLocation;
import com.raditha.metaast.duplication.CloneType;
import com.raditha.metaast.duplication.Difference;
import com.raditha.metaast.duplication.DuplicationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders pairwise duplication results and clone groups.
 */
public class DuplicationReporter {

    private static final String RULE = "=".repeat(50);

    public String format(DuplicationResult result, ReportFormat format) {
        return switch (format) {
            case TEXT -> formatText(result);
            case JSON -> JsonWriter.write(toMap(result));
            case DETAILED -> formatDetailed(result);
        };
    }

    public String formatGroups(List<CloneGroup> groups, ReportFormat format) {
        return switch (format) {
            case TEXT -> formatGroupsText(groups);
            case JSON -> JsonWriter.write(groupsToMap(groups));
            case DETAILED -> formatGroupsDetailed(groups);
        };
    }

    private String formatText(DuplicationResult result) {
        if (!result.duplicate()) {
            return "No duplicate detected";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Duplicate detected: ").append(result.cloneType().displayName()).append("\n");
        sb.append("Similarity score: ").append(score(result.similarity()));
        List<CloneLocation> locations = result.locations();
        for (int i = 0; i < locations.size(); i++) {
            sb.append("\n  [").append(i + 1).append("] ").append(locations.get(i));
        }
        return sb.toString();
    }

    private String formatDetailed(DuplicationResult result) {
        if (!result.duplicate()) {
            return "No duplicate detected";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Duplicate Detection Result\n");
        sb.append(RULE).append("\n\n");
        sb.append("Clone Type: ").append(result.cloneType().displayName()).append("\n");
        sb.append("Similarity: ").append(score(result.similarity())).append("\n\n");

        sb.append("Locations:\n");
        List<CloneLocation> locations = result.locations();
        for (int i = 0; i < locations.size(); i++) {
            CloneLocation location = locations.get(i);
            sb.append("  [").append(i + 1).append("] File: ").append(orUnknown(location.file())).append("\n");
            sb.append("       Lines: ").append(orQuestion(location.startLine())).append("-")
                    .append(orQuestion(location.endLine())).append("\n");
            sb.append("       Language: ").append(location.language()).append("\n");
        }

        sb.append("\nFingerprints:\n");
        sb.append("  Exact: ").append(prefix(result.fingerprints().exact())).append("...\n");
        sb.append("  Normalized: ").append(prefix(result.fingerprints().normalized())).append("...\n");

        sb.append("\nMetrics:\n");
        sb.append("  Size: ").append(result.metrics().size()).append(" nodes\n");
        sb.append("  Variables: ").append(result.metrics().variables());

        if (!result.differences().isEmpty()) {
            sb.append("\n\nDifferences:");
            for (Difference difference : result.differences()) {
                sb.append("\n  - ").append(difference);
            }
        }
        return sb.toString();
    }

    private String formatGroupsText(List<CloneGroup> groups) {
        if (groups.isEmpty()) {
            return "No clone groups found";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(groups.size()).append(" clone group(s)\n");
        sb.append(RULE);
        for (int i = 0; i < groups.size(); i++) {
            CloneGroup group = groups.get(i);
            sb.append("\n\nClone Group ").append(i + 1).append("\n");
            sb.append("Type: ").append(group.cloneType().displayName()).append("\n");
            sb.append("Size: ").append(group.size()).append(" documents\n");
            sb.append("Locations:");
            for (CloneLocation location : group.locations()) {
                sb.append("\n  - ").append(location);
            }
        }
        return sb.toString();
    }

    private String formatGroupsDetailed(List<CloneGroup> groups) {
        if (groups.isEmpty()) {
            return "No clone groups found";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Clone Group Analysis\n");
        sb.append(RULE).append("\n\n");
        sb.append("Total Groups: ").append(groups.size()).append("\n");
        sb.append("Total Clones: ").append(totalClones(groups));
        for (int i = 0; i < groups.size(); i++) {
            CloneGroup group = groups.get(i);
            sb.append("\n\nClone Group ").append(i + 1).append("\n");
            sb.append("-".repeat(50)).append("\n");
            sb.append("Clone Type: ").append(group.cloneType().displayName()).append("\n");
            sb.append("Group Size: ").append(group.size()).append(" documents\n\n");
            sb.append("Locations:");
            List<CloneLocation> locations = group.locations();
            for (int j = 0; j < locations.size(); j++) {
                sb.append("\n  [").append(j + 1).append("] ").append(locations.get(j));
            }
        }
        return sb.toString();
    }

    Map<String, Object> toMap(DuplicationResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("duplicate", result.duplicate());
        map.put("clone_type", typeTag(result.cloneType()));
        map.put("match_type", typeTag(result.matchType()));
        map.put("similarity_score", result.similarity());
        map.put("locations", locations(result.locations()));

        Map<String, Object> fingerprints = new LinkedHashMap<>();
        fingerprints.put("exact", result.fingerprints().exact());
        fingerprints.put("normalized", result.fingerprints().normalized());
        map.put("fingerprints", fingerprints);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("size", result.metrics().size());
        metrics.put("variables", result.metrics().variables());
        map.put("metrics", metrics);

        List<Map<String, Object>> differences = new ArrayList<>();
        for (Difference difference : result.differences()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", difference.type().name().toLowerCase(Locale.ROOT));
            entry.put("position", difference.position());
            entry.put("role", difference.role());
            entry.put("original", difference.original());
            entry.put("revised", difference.revised());
            differences.add(entry);
        }
        map.put("differences", differences);
        map.put("summary", result.summary());
        return map;
    }

    Map<String, Object> groupsToMap(List<CloneGroup> groups) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (CloneGroup group : groups) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("clone_type", typeTag(group.cloneType()));
            entry.put("size", group.size());
            entry.put("locations", locations(group.locations()));
            entries.add(entry);
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("clone_groups", entries);
        map.put("total_groups", groups.size());
        map.put("total_clones", totalClones(groups));
        return map;
    }

    private static List<Map<String, Object>> locations(List<CloneLocation> locations) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (CloneLocation location : locations) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("file", location.file());
            entry.put("start_line", location.startLine());
            entry.put("end_line", location.endLine());
            entry.put("language", location.language());
            list.add(entry);
        }
        return list;
    }

    private static int totalClones(List<CloneGroup> groups) {
        return groups.stream().mapToInt(CloneGroup::size).sum();
    }

    private static String typeTag(CloneType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }

    private static String score(double similarity) {
        return String.format(Locale.ROOT, "%.2f", similarity);
    }

    private static String prefix(String hash) {
        return hash.length() > 16 ? hash.substring(0, 16) : hash;
    }

    private static String orUnknown(String value) {
        return value == null ? "unknown" : value;
    }

    private static Object orQuestion(Integer value) {
        return value == null ? "?" : value;
    }
}
