package com.projecttree.order.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.projecttree.order.cli.model.OrderOptions;
import com.projecttree.order.cli.model.ValidatedOrderOptions;
import com.projecttree.order.index.OrderIndex;
import com.projecttree.order.items.OrderedItemsDocument;
import com.projecttree.order.model.TreeNode;

/**
 * Responsible only for printing CLI output for the "tree-order" command.
 * No validation, no execution.
 */
public class OrderResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(OrderResultsPrinter.class);

    private static final String INDENT = "  ";

    public void printBanner(OrderOptions o, ValidatedOrderOptions v) {
        log.info("=================================================");
        log.info("Tree Item Order");
        log.info("=================================================");
        log.info("Item List: {}", v.getItemsFile());
        log.info("Project Directory: {}", v.getProjectDir());
        log.info("Item Type: {}", o.getItemType());
        log.info("Show All Files: {}", o.isShowAll());
        log.info("=================================================");
    }

    public void printDocumentProblems(OrderedItemsDocument doc) {
        doc.getErrors().forEach(e -> log.warn("Skipped: {}", e));
        doc.getWarnings().forEach(w -> log.warn("{}", w));
    }

    public void printTree(TreeNode root) {
        log.info("{}/", root.getName());
        root.getChildren().forEach(child -> printNode(child, 1));
    }

    public void printSummary(OrderedItemsDocument doc, OrderIndex index) {
        log.info("");
        log.info("Items Listed: {}", doc.getItems().size());
        log.info("Names Ordered: {}", index.getNameOrder().size());
        log.info("Paths Ordered: {}", index.getPathOrder().size());
        if (doc.hasErrors()) {
            log.info("Lines Skipped: {}", doc.getErrors().size());
        }
        log.info("=================================================");
    }

    private void printNode(TreeNode node, int depth) {
        StringBuilder line = new StringBuilder(INDENT.repeat(depth))
                .append(node.getName());
        if (node.isFolder()) {
            line.append('/');
        }
        line.append("  [").append(formatOrder(node.getDisplayOrder())).append(']');
        if (node.isExcluded()) {
            line.append(" (not in project)");
        }
        log.info("{}", line);
        node.getChildren().forEach(child -> printNode(child, depth + 1));
    }

    static String formatOrder(int displayOrder) {
        if (displayOrder == Integer.MAX_VALUE) return "last";
        if (displayOrder == 0) return "-";
        return Integer.toString(displayOrder);
    }
}
