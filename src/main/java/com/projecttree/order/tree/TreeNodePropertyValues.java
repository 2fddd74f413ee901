package com.projecttree.order.tree;

import com.projecttree.order.model.TreeNode;
import com.projecttree.order.provider.DisplayOrderPropertyValues;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Writes provider output straight through to a {@link TreeNode}.
 */
@RequiredArgsConstructor
public class TreeNodePropertyValues implements DisplayOrderPropertyValues {

    @NonNull
    private final TreeNode node;

    @Override
    public int getDisplayOrder() {
        return node.getDisplayOrder();
    }

    @Override
    public void setDisplayOrder(int displayOrder) {
        node.setDisplayOrder(displayOrder);
    }
}
