package com.raditha.metaast.fingerprint;

/**
 * A name or literal value found in a tree, tagged with the role it plays.
 *
 * @param role  e.g. {@code variable}, {@code function}, {@code literal}
 * @param value the name, or the canonical rendering of a literal
 */
public record Identifier(String role, String value) {

    @Override
    public String toString() {
        return role + " " + value;
    }
}
