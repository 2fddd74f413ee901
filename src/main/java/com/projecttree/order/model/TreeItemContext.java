package com.projecttree.order.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * What the tree pipeline knows about a node when it asks providers for property values.
 */
@Value
@Builder
public class TreeItemContext {

    public static final String FULL_PATH_PROPERTY = "FullPath";

    @NonNull
    String itemName;

    boolean folder;

    /**
     * Null while the node is still being populated.
     */
    String itemType;

    @Singular("metadataEntry")
    Map<String, String> metadata;

    public Optional<String> getFullPath() {
        return Optional.ofNullable(metadata.get(FULL_PATH_PROPERTY));
    }
}
