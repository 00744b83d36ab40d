package com.raditha.metaast.clustering;

import com.raditha.metaast.document.Document;
import com.raditha.metaast.duplication.CloneLocation;
import com.raditha.metaast.duplication.CloneType;

import java.util.List;

/**
 * Documents that are clones of one another.
 *
 * @param cloneType weakest match holding across the group, Type IV when languages differ
 * @param documents members in input order
 * @param locations member locations, same order as {@code documents}
 * @param size      number of members, at least two
 */
public record CloneGroup(
        CloneType cloneType,
        List<Document> documents,
        List<CloneLocation> locations,
        int size) {

    public CloneGroup {
        documents = List.copyOf(documents);
        locations = List.copyOf(locations);
    }

    public static CloneGroup of(CloneType cloneType, List<Document> documents) {
        List<CloneLocation> locations = documents.stream()
                .map(CloneLocation::of)
                .toList();
        return new CloneGroup(cloneType, documents, locations, documents.size());
    }
}
