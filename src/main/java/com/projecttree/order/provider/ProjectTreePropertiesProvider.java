package com.projecttree.order.provider;

import com.projecttree.order.model.TreeItemContext;

/**
 * Called by the tree pipeline once per node, possibly from several threads at once.
 */
public interface ProjectTreePropertiesProvider {

    void calculatePropertyValues(TreeItemContext context, TreePropertyValues values);
}
