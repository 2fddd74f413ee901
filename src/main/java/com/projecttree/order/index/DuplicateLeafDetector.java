package com.projecttree.order.index;

import com.projecttree.order.model.ProjectItemIdentity;
import com.projecttree.order.path.PathSegments;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finds leaf names that more than one item shares, ignoring case.
 */
public class DuplicateLeafDetector {

    public Set<String> detect(Collection<ProjectItemIdentity> items) {
        Map<String, Integer> counts = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (ProjectItemIdentity item : items) {
            String leaf = PathSegments.leafName(item.getEvaluatedInclude());
            if (!leaf.isEmpty()) {
                counts.merge(leaf, 1, Integer::sum);
            }
        }

        Set<String> duplicates = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        counts.forEach((leaf, count) -> {
            if (count > 1) {
                duplicates.add(leaf);
            }
        });
        return Collections.unmodifiableSet(duplicates);
    }
}
