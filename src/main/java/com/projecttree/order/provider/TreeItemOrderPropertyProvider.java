package com.projecttree.order.provider;

import com.projecttree.order.index.OrderIndex;
import com.projecttree.order.index.OrderIndexBuilder;
import com.projecttree.order.model.ProjectItemIdentity;
import com.projecttree.order.model.TreeItemContext;
import com.projecttree.order.path.PathRooter;
import lombok.Getter;
import lombok.NonNull;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Provider that computes the display order of tree items from the order of their
 * evaluated includes.
 *
 * <p>The index is built eagerly in the constructor and is read-only afterwards.
 */
public class TreeItemOrderPropertyProvider implements ProjectTreePropertiesProvider {

    @Getter
    private final List<ProjectItemIdentity> orderedItems;

    @Getter
    private final OrderIndex orderIndex;

    /**
     * @throws RuntimeException whatever the rooter throws for a malformed include
     */
    public TreeItemOrderPropertyProvider(@NonNull List<ProjectItemIdentity> orderedItems,
                                         @NonNull PathRooter pathRooter) {
        this.orderedItems = List.copyOf(orderedItems);
        this.orderIndex = new OrderIndexBuilder(pathRooter).build(this.orderedItems);
    }

    /**
     * Assigns a display order to items that were preordered, and moves other non-folder
     * items (typically hidden items shown by "show all files") to the end.
     *
     * @param context   the node being evaluated
     * @param values    the node's property values; only written when they accept a display order
     */
    @Override
    public void calculatePropertyValues(@NonNull TreeItemContext context, @NonNull TreePropertyValues values) {
        if (values instanceof DisplayOrderPropertyValues orderValues) {
            evaluate(context.getItemName(), context.isFolder(), context.getItemType(), context.getMetadata())
                    .ifPresent(orderValues::setDisplayOrder);
        }
    }

    /**
     * Looks up the display order of a node.
     *
     * @return the order to apply, or empty when the node should keep the host's default
     */
    public OptionalInt evaluate(String itemName, boolean isFolder, String itemType, Map<String, String> metadata) {
        String fullPath = metadata == null ? null : metadata.get(TreeItemContext.FULL_PATH_PROPERTY);
        OptionalInt index = orderIndex.findByNameOrPath(itemName, fullPath);

        if (index.isPresent()) {
            // nodes briefly show up without an item type while the tree is populated
            if (itemType == null || itemType.isEmpty()) {
                return OptionalInt.empty();
            }
            return index;
        }

        if (!isFolder) {
            return OptionalInt.of(Integer.MAX_VALUE);
        }
        return OptionalInt.empty();
    }
}
