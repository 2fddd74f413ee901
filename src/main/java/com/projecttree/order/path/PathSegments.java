package com.projecttree.order.path;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Splitting of evaluated includes on the separators a project file may use.
 */
@UtilityClass
public class PathSegments {

    public static final String SEPARATORS = "/\\";

    public static boolean isSeparator(char c) {
        return SEPARATORS.indexOf(c) >= 0;
    }

    /**
     * Splits a path into its segments. Empty segments produced by leading, trailing or
     * doubled separators are dropped, so {@code "\\a//b/"} yields {@code [a, b]}.
     */
    public static List<String> split(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null || path.isEmpty()) {
            return segments;
        }
        int start = 0;
        for (int i = 0; i <= path.length(); i++) {
            if (i == path.length() || isSeparator(path.charAt(i))) {
                if (i > start) {
                    segments.add(path.substring(start, i));
                }
                start = i + 1;
            }
        }
        return segments;
    }

    /**
     * Returns the text after the last separator, empty when the path ends with one.
     */
    public static String leafName(String path) {
        if (path == null) {
            return "";
        }
        for (int i = path.length() - 1; i >= 0; i--) {
            if (isSeparator(path.charAt(i))) {
                return path.substring(i + 1);
            }
        }
        return path;
    }
}
