package com.projecttree.order.tree;

import com.projecttree.order.model.ItemTypes;
import com.projecttree.order.model.ProjectItemIdentity;
import com.projecttree.order.model.TreeNode;
import com.projecttree.order.path.PathRooter;
import com.projecttree.order.path.PathSegments;
import com.projecttree.order.provider.ProjectTreePropertiesProvider;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the project tree from the ordered items, optionally merging in what is on
 * disk, then runs every node through the property providers and sorts siblings.
 */
public class ProjectTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(ProjectTreeBuilder.class);

    /**
     * Host default: display order, then folders before files, then name.
     */
    static final Comparator<TreeNode> SIBLING_ORDER = Comparator
            .comparingInt(TreeNode::getDisplayOrder)
            .thenComparing((TreeNode n) -> n.isFolder() ? 0 : 1)
            .thenComparing(TreeNode::getName, String.CASE_INSENSITIVE_ORDER);

    private final List<ProjectTreePropertiesProvider> providers;
    private final PathRooter pathRooter;
    private final String itemType;

    @Builder
    private ProjectTreeBuilder(@Singular List<ProjectTreePropertiesProvider> providers,
                               @NonNull PathRooter pathRooter,
                               String itemType) {
        this.providers = providers;
        this.pathRooter = pathRooter;
        this.itemType = itemType == null || itemType.isBlank() ? ItemTypes.COMPILE : itemType;
    }

    /**
     * Builds the tree for the listed items only.
     */
    public TreeNode build(String projectName, List<ProjectItemIdentity> items) {
        TreeNode root = createRoot(projectName);
        items.forEach(item -> addItem(root, item));
        applyProviders(root);
        return root;
    }

    /**
     * Builds the tree for the listed items plus every file and folder found under the
     * project directory. Files that are not listed carry no item type.
     */
    public TreeNode buildShowingAll(Path projectDir, List<ProjectItemIdentity> items) throws IOException {
        TreeNode root = createRoot(projectDir.getFileName() == null ? projectDir.toString() : projectDir.getFileName().toString());
        items.forEach(item -> addItem(root, item));

        List<Path> onDisk;
        try (Stream<Path> stream = Files.walk(projectDir)) {
            onDisk = stream
                    .filter(p -> !p.equals(projectDir))
                    .map(projectDir::relativize)
                    .filter(p -> !isHidden(p))
                    .sorted()
                    .collect(Collectors.toList());
        }
        int added = 0;
        for (Path relative : onDisk) {
            if (addFromDisk(root, relative, Files.isDirectory(projectDir.resolve(relative)))) {
                added++;
            }
        }
        log.debug("Show-all added {} entries from {}", added, projectDir);

        applyProviders(root);
        return root;
    }

    private TreeNode createRoot(String projectName) {
        return TreeNode.folder(projectName, pathRooter.makeRooted(""));
    }

    private void addItem(TreeNode root, ProjectItemIdentity item) {
        String include = item.getEvaluatedInclude();
        List<String> segments = PathSegments.split(include);
        if (segments.isEmpty()) {
            log.warn("Skipping include without path segments: '{}'", include);
            return;
        }
        boolean endsWithFolder = PathSegments.leafName(include).isEmpty();
        int folderCount = endsWithFolder ? segments.size() : segments.size() - 1;

        TreeNode parent = descend(root, segments, folderCount);
        if (!endsWithFolder) {
            String leaf = segments.get(segments.size() - 1);
            if (parent.findChild(leaf, false).isEmpty()) {
                parent.getChildren().add(TreeNode.file(leaf, pathRooter.makeRooted(include), itemType));
            }
        }
    }

    private boolean addFromDisk(TreeNode root, Path relative, boolean directory) {
        List<String> segments = PathSegments.split(relative.toString());
        int folderCount = directory ? segments.size() : segments.size() - 1;
        TreeNode parent = descend(root, segments, folderCount);
        if (directory) {
            return false;
        }
        String leaf = segments.get(segments.size() - 1);
        if (parent.findChild(leaf, false).isPresent()) {
            return false;
        }
        TreeNode file = TreeNode.file(leaf, pathRooter.makeRooted(relative.toString()), null);
        file.setExcluded(true);
        parent.getChildren().add(file);
        return true;
    }

    private TreeNode descend(TreeNode root, List<String> segments, int folderCount) {
        TreeNode current = root;
        for (int i = 0; i < folderCount; i++) {
            String name = segments.get(i);
            String folderPath = String.join("/", segments.subList(0, i + 1));
            TreeNode parent = current;
            current = parent.findChild(name, true).orElseGet(() -> {
                TreeNode folder = TreeNode.folder(name, pathRooter.makeRooted(folderPath));
                parent.getChildren().add(folder);
                return folder;
            });
        }
        return current;
    }

    private void applyProviders(TreeNode node) {
        for (TreeNode child : node.getChildren()) {
            TreeNodePropertyValues values = new TreeNodePropertyValues(child);
            for (ProjectTreePropertiesProvider provider : providers) {
                provider.calculatePropertyValues(child.toContext(), values);
            }
            applyProviders(child);
        }
        node.getChildren().sort(SIBLING_ORDER);
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
