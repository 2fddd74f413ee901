package com.projecttree.order.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node of the project tree built by the host pipeline. Mutable: children are attached
 * while the tree is assembled and the display order is written after providers ran.
 */
@Data
@NoArgsConstructor
public class TreeNode {

    /** File or folder name as shown in the tree */
    private String name;

    /** Rooted path of the node */
    private String fullPath;

    private boolean folder;

    /** Item type, null for files that are not project items */
    private String itemType;

    private Map<String, String> metadata = new HashMap<>();

    /** File on disk that is not a project item, only present in show-all mode */
    private boolean excluded;

    /** Value assigned by the property providers, 0 when none had an opinion */
    private int displayOrder;

    private List<TreeNode> children = new ArrayList<>();

    public static TreeNode folder(String name, String fullPath) {
        TreeNode node = new TreeNode();
        node.setName(name);
        node.setFullPath(fullPath);
        node.setFolder(true);
        node.setItemType(ItemTypes.FOLDER);
        node.getMetadata().put(TreeItemContext.FULL_PATH_PROPERTY, fullPath);
        return node;
    }

    public static TreeNode file(String name, String fullPath, String itemType) {
        TreeNode node = new TreeNode();
        node.setName(name);
        node.setFullPath(fullPath);
        node.setFolder(false);
        node.setItemType(itemType);
        node.getMetadata().put(TreeItemContext.FULL_PATH_PROPERTY, fullPath);
        return node;
    }

    public Optional<TreeNode> findChild(String childName, boolean childIsFolder) {
        return children.stream()
                .filter(c -> c.isFolder() == childIsFolder && c.getName().equalsIgnoreCase(childName))
                .findFirst();
    }

    public TreeItemContext toContext() {
        return TreeItemContext.builder()
                .itemName(name)
                .folder(folder)
                .itemType(itemType)
                .metadata(metadata)
                .build();
    }
}
