package com.raditha.metaast.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers shared by the node records.
 */
final class NodeLists {

    private NodeLists() {
    }

    /**
     * Flatten single nodes and node lists into one child list, dropping nulls.
     */
    static List<MetaNode> of(Object... parts) {
        List<MetaNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof MetaNode) {
                result.add((MetaNode) part);
            } else if (part instanceof List<?>) {
                for (Object element : (List<?>) part) {
                    if (element instanceof MetaNode) {
                        result.add((MetaNode) element);
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
