package com.raditha.metaast.duplication;

/**
 * One difference between two compared trees.
 *
 * @param type     kind of difference
 * @param position index of the first affected identifier or token in the first tree
 * @param role     what differs: an identifier role for renames and value changes, {@code token} otherwise
 * @param original value or token labels in the first tree, empty for insertions
 * @param revised  value or token labels in the second tree, empty for deletions
 */
public record Difference(Type type, int position, String role, String original, String revised) {

    public enum Type {
        RENAME,
        VALUE_CHANGE,
        INSERT,
        DELETE,
        CHANGE
    }

    @Override
    public String toString() {
        return switch (type) {
            case RENAME -> String.format("%s renamed: %s -> %s", role, original, revised);
            case VALUE_CHANGE -> String.format("%s changed: %s -> %s", role, original, revised);
            case INSERT -> String.format("inserted at %d: %s", position, revised);
            case DELETE -> String.format("deleted at %d: %s", position, original);
            case CHANGE -> String.format("changed at %d: %s -> %s", position, original, revised);
        };
    }
}
