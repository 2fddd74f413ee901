package com.projecttree.order.index;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Read-only display order lookup produced by {@link OrderIndexBuilder}.
 *
 * Both maps compare keys ignoring case and are never modified once built, so lookups
 * may run from any number of threads.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public final class OrderIndex {

    private static final OrderIndex EMPTY = new OrderIndex(
            Collections.unmodifiableNavigableMap(new TreeMap<>(String.CASE_INSENSITIVE_ORDER)),
            Collections.unmodifiableNavigableMap(new TreeMap<>(String.CASE_INSENSITIVE_ORDER)));

    /**
     * Folder and file names keyed to their order.
     */
    @NonNull
    private final NavigableMap<String, Integer> nameOrder;

    /**
     * Rooted paths of items whose leaf name is shared with another item.
     */
    @NonNull
    private final NavigableMap<String, Integer> pathOrder;

    public static OrderIndex empty() {
        return EMPTY;
    }

    public OptionalInt findByName(String name) {
        return lookup(nameOrder, name);
    }

    public OptionalInt findByPath(String rootedPath) {
        return lookup(pathOrder, rootedPath);
    }

    /**
     * Name first, then rooted path.
     */
    public OptionalInt findByNameOrPath(String name, String rootedPath) {
        OptionalInt byName = findByName(name);
        return byName.isPresent() ? byName : findByPath(rootedPath);
    }

    public int size() {
        return nameOrder.size() + pathOrder.size();
    }

    public boolean isEmpty() {
        return nameOrder.isEmpty() && pathOrder.isEmpty();
    }

    private static OptionalInt lookup(Map<String, Integer> map, String key) {
        if (key == null) {
            return OptionalInt.empty();
        }
        Integer index = map.get(key);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }
}
