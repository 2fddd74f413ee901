package com.projecttree.order.provider;

/**
 * Property values of a tree node handed to providers. Hosts that let providers change
 * more than this pass a richer subtype such as {@link DisplayOrderPropertyValues}.
 */
public interface TreePropertyValues {
}
