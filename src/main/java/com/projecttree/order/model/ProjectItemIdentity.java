package com.projecttree.order.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One entry of the ordered item list: the evaluated include of a project item.
 * The include may be relative and may mix '/' and '\' separators.
 */
@Value
public class ProjectItemIdentity {

    @NonNull
    String evaluatedInclude;

    public static ProjectItemIdentity of(String evaluatedInclude) {
        return new ProjectItemIdentity(evaluatedInclude);
    }
}
