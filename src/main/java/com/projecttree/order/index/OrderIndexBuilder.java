package com.projecttree.order.index;

import com.projecttree.order.model.ProjectItemIdentity;
import com.projecttree.order.path.PathRooter;
import com.projecttree.order.path.PathSegments;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Assigns display order to every folder and file name reachable from an ordered
 * list of includes, in order of first appearance.
 *
 * Names shared by the leaves of several items cannot tell those items apart, so any
 * segment matching such a name is keyed by the rooted path of the item it belongs to
 * instead. That includes folder segments that happen to carry the same text.
 */
public class OrderIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(OrderIndexBuilder.class);

    private final PathRooter pathRooter;
    private final DuplicateLeafDetector duplicateLeafDetector;

    public OrderIndexBuilder(@NonNull PathRooter pathRooter) {
        this(pathRooter, new DuplicateLeafDetector());
    }

    public OrderIndexBuilder(@NonNull PathRooter pathRooter, @NonNull DuplicateLeafDetector duplicateLeafDetector) {
        this.pathRooter = pathRooter;
        this.duplicateLeafDetector = duplicateLeafDetector;
    }

    public OrderIndex build(@NonNull List<ProjectItemIdentity> orderedItems) {
        if (orderedItems.isEmpty()) {
            return OrderIndex.empty();
        }

        Set<String> duplicateLeaves = duplicateLeafDetector.detect(orderedItems);
        NavigableMap<String, Integer> nameOrder = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        NavigableMap<String, Integer> pathOrder = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        int index = 1;
        for (ProjectItemIdentity item : orderedItems) {
            String include = item.getEvaluatedInclude();
            for (String part : PathSegments.split(include)) {
                if (duplicateLeaves.contains(part)) {
                    String rootedPath = pathRooter.makeRooted(include);
                    if (!pathOrder.containsKey(rootedPath)) {
                        pathOrder.put(rootedPath, index++);
                    }
                } else if (!nameOrder.containsKey(part)) {
                    nameOrder.put(part, index++);
                }
            }
        }

        log.debug("Indexed {} items: {} names, {} rooted paths, duplicate leaves {}",
                orderedItems.size(), nameOrder.size(), pathOrder.size(), duplicateLeaves);

        return new OrderIndex(
                Collections.unmodifiableNavigableMap(nameOrder),
                Collections.unmodifiableNavigableMap(pathOrder));
    }
}
