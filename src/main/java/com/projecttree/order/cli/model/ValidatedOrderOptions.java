package com.projecttree.order.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps OrderCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedOrderOptions {
    Path itemsFile;
    Path projectDir;
    String projectName;
}
