package com.projecttree.order.cli;

import ch.qos.logback.classic.Level;
import com.projecttree.order.cli.exception.OptionsValidationException;
import com.projecttree.order.cli.model.OrderOptions;
import com.projecttree.order.cli.model.ValidatedOrderOptions;
import com.projecttree.order.cli.output.OrderResultsPrinter;
import com.projecttree.order.cli.validation.OrderOptionsValidator;
import com.projecttree.order.items.OrderedItemsDocument;
import com.projecttree.order.items.OrderedItemsParser;
import com.projecttree.order.model.TreeNode;
import com.projecttree.order.path.ProjectPathRooter;
import com.projecttree.order.provider.TreeItemOrderPropertyProvider;
import com.projecttree.order.tree.ProjectTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command that prints a project tree ordered by an item list.
 */
@Command(
        name = "tree-order",
        mixinStandardHelpOptions = true,
        version = "tree-item-order 1.0.0",
        description = "Orders a project tree the way its items are listed, keying items that share a file name by full path."
)
public class OrderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(OrderCommand.class);

    private static final String BASE_LOGGER = "com.projecttree.order";

    @Mixin
    private OrderOptions options;

    private final OrderOptionsValidator validator = new OrderOptionsValidator();
    private final OrderedItemsParser parser = new OrderedItemsParser();
    private final OrderResultsPrinter printer = new OrderResultsPrinter();

    @Override
    public Integer call() {
        Level previousLevel = options.isVerbose() ? switchLevel(Level.DEBUG) : null;
        try {
            return run();
        } finally {
            if (options.isVerbose()) {
                switchLevel(previousLevel);
            }
        }
    }

    private int run() {
        ValidatedOrderOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        try {
            printer.printBanner(options, validated);

            OrderedItemsDocument doc = parser.parse(validated.getItemsFile());
            printer.printDocumentProblems(doc);

            ProjectPathRooter rooter = new ProjectPathRooter(validated.getProjectDir());
            TreeItemOrderPropertyProvider provider = new TreeItemOrderPropertyProvider(doc.getItems(), rooter);

            ProjectTreeBuilder treeBuilder = ProjectTreeBuilder.builder()
                    .provider(provider)
                    .pathRooter(rooter)
                    .itemType(options.getItemType())
                    .build();

            TreeNode root = options.isShowAll()
                    ? treeBuilder.buildShowingAll(validated.getProjectDir(), provider.getOrderedItems())
                    : treeBuilder.build(validated.getProjectName(), provider.getOrderedItems());

            printer.printTree(root);
            printer.printSummary(doc, provider.getOrderIndex());
            return 0;

        } catch (Exception e) {
            log.error("Ordering failed with exception", e);
            return 1;
        }
    }

    /**
     * Sets the level of the package logger and returns the one it had, which may be null
     * when the level was inherited.
     */
    private static Level switchLevel(Level level) {
        if (LoggerFactory.getLogger(BASE_LOGGER) instanceof ch.qos.logback.classic.Logger logbackLogger) {
            Level previous = logbackLogger.getLevel();
            logbackLogger.setLevel(level);
            return previous;
        }
        return null;
    }
}
