package com.projecttree.order.provider;

/**
 * Extended property values that also accept a display order. Hosts that cannot sort
 * by display order hand providers the plain {@link TreePropertyValues} only.
 */
public interface DisplayOrderPropertyValues extends TreePropertyValues {

    int getDisplayOrder();

    void setDisplayOrder(int displayOrder);
}
