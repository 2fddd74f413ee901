package com.projecttree.order.model;

import lombok.experimental.UtilityClass;

@UtilityClass
public class ItemTypes {

    public static final String FOLDER = "Folder";

    public static final String COMPILE = "Compile";
}
