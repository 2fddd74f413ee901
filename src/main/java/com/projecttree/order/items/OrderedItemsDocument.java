package com.projecttree.order.items;

import com.projecttree.order.model.ProjectItemIdentity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ordered items read from a list file, with the problems found along the way.
 */
public class OrderedItemsDocument {
    private final List<ProjectItemIdentity> items = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final Set<String> seenIncludes = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    /**
     * Appends an item, returning false when an equal include (ignoring case) was already listed.
     * Repeated includes are kept; they do not change the order.
     */
    public boolean addItem(ProjectItemIdentity item) {
        items.add(item);
        return seenIncludes.add(item.getEvaluatedInclude());
    }

    public List<ProjectItemIdentity> getItems() {
        return Collections.unmodifiableList(items);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }
}
