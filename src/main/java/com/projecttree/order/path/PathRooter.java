package com.projecttree.order.path;

/**
 * Resolves a possibly relative include to its fully-qualified form.
 * Implementations must be deterministic; results are compared case-insensitively.
 */
@FunctionalInterface
public interface PathRooter {

    String makeRooted(String path);
}
