package com.projecttree.order;

import com.projecttree.order.cli.OrderCommand;
import picocli.CommandLine;

/**
 * Main entry point for the tree item order tool.
 * Reads an ordered item list and prints the project tree in that order.
 */
public class TreeOrderApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OrderCommand()).execute(args);
        System.exit(exitCode);
    }
}
