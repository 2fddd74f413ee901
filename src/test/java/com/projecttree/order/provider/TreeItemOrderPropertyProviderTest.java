package com.projecttree.order.provider;

import com.projecttree.order.model.ItemTypes;
import com.projecttree.order.model.ProjectItemIdentity;
import com.projecttree.order.model.TreeItemContext;
import com.projecttree.order.model.TreeNode;
import com.projecttree.order.path.PathRooter;
import com.projecttree.order.tree.TreeNodePropertyValues;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TreeItemOrderPropertyProvider.
 */
class TreeItemOrderPropertyProviderTest {

    private static final PathRooter ROOTER = path -> "/proj/" + path.replace('\\', '/');

    private final TreeItemOrderPropertyProvider provider = new TreeItemOrderPropertyProvider(
            items("Folder1/FileA.cs", "Folder1/FileB.cs", "Folder2/FileB.cs"), ROOTER);

    @Test
    void testFolderFoundByName() {
        assertThat(provider.evaluate("Folder1", true, ItemTypes.FOLDER, Map.of())).hasValue(1);
        assertThat(provider.evaluate("Folder2", true, ItemTypes.FOLDER, Map.of())).hasValue(4);
    }

    @Test
    void testFileFoundByName() {
        assertThat(provider.evaluate("FileA.cs", false, ItemTypes.COMPILE, Map.of())).hasValue(2);
        assertThat(provider.evaluate("filea.CS", false, ItemTypes.COMPILE, Map.of())).hasValue(2);
    }

    @Test
    void testSharedFileNameFoundByFullPath() {
        assertThat(provider.evaluate("FileB.cs", false, ItemTypes.COMPILE, fullPath("/proj/Folder1/FileB.cs")))
                .hasValue(3);
        assertThat(provider.evaluate("FileB.cs", false, ItemTypes.COMPILE, fullPath("/PROJ/folder2/fileb.cs")))
                .hasValue(5);
    }

    @Test
    void testUnknownFileMovesToEnd() {
        assertThat(provider.evaluate("Notes.txt", false, ItemTypes.COMPILE, fullPath("/proj/Notes.txt")))
                .hasValue(Integer.MAX_VALUE);
        assertThat(provider.evaluate("Notes.txt", false, null, null)).hasValue(Integer.MAX_VALUE);
    }

    @Test
    void testSharedFileNameWithoutFullPathMovesToEnd() {
        assertThat(provider.evaluate("FileB.cs", false, ItemTypes.COMPILE, Map.of())).hasValue(Integer.MAX_VALUE);
    }

    @Test
    void testUnknownFolderHasNoOpinion() {
        assertThat(provider.evaluate("Properties", true, ItemTypes.FOLDER, fullPath("/proj/Properties"))).isEmpty();
        assertThat(provider.evaluate("Properties", true, null, Map.of())).isEmpty();
    }

    @Test
    void testMatchWithoutItemTypeHasNoOpinion() {
        assertThat(provider.evaluate("Folder1", true, null, Map.of())).isEmpty();
        assertThat(provider.evaluate("FileA.cs", false, "", Map.of())).isEmpty();
        assertThat(provider.evaluate("FileB.cs", false, null, fullPath("/proj/Folder2/FileB.cs"))).isEmpty();
    }

    @Test
    void testEvaluateIsIdempotent() {
        OptionalInt first = provider.evaluate("FileB.cs", false, ItemTypes.COMPILE, fullPath("/proj/Folder2/FileB.cs"));

        for (int i = 0; i < 10; i++) {
            assertThat(provider.evaluate("FileB.cs", false, ItemTypes.COMPILE, fullPath("/proj/Folder2/FileB.cs")))
                    .isEqualTo(first);
        }
        assertThat(provider.getOrderIndex().size()).isEqualTo(5);
    }

    @Test
    void testConcurrentQueries() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<OptionalInt>> tasks = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                switch (i % 4) {
                    case 0 -> tasks.add(() -> provider.evaluate("Folder1", true, ItemTypes.FOLDER, Map.of()));
                    case 1 -> tasks.add(() -> provider.evaluate("FileB.cs", false, ItemTypes.COMPILE,
                            fullPath("/proj/Folder2/FileB.cs")));
                    case 2 -> tasks.add(() -> provider.evaluate("Other.cs", false, ItemTypes.COMPILE, Map.of()));
                    default -> tasks.add(() -> provider.evaluate("Other", true, ItemTypes.FOLDER, Map.of()));
                }
            }

            List<Future<OptionalInt>> results = executor.invokeAll(tasks);

            for (int i = 0; i < results.size(); i++) {
                OptionalInt result = results.get(i).get();
                switch (i % 4) {
                    case 0 -> assertThat(result).hasValue(1);
                    case 1 -> assertThat(result).hasValue(5);
                    case 2 -> assertThat(result).hasValue(Integer.MAX_VALUE);
                    default -> assertThat(result).isEmpty();
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testCalculateWritesDisplayOrder() {
        TreeNode node = TreeNode.folder("Folder2", "/proj/Folder2");

        provider.calculatePropertyValues(node.toContext(), new TreeNodePropertyValues(node));

        assertThat(node.getDisplayOrder()).isEqualTo(4);
    }

    @Test
    void testCalculateLeavesDefaultWhenNoOpinion() {
        TreeNode node = TreeNode.folder("Properties", "/proj/Properties");
        node.setDisplayOrder(42);

        provider.calculatePropertyValues(node.toContext(), new TreeNodePropertyValues(node));

        assertThat(node.getDisplayOrder()).isEqualTo(42);
    }

    @Test
    void testCalculateSkipsValuesWithoutDisplayOrder() {
        TreePropertyValues values = new TreePropertyValues() {
        };
        TreeItemContext context = TreeItemContext.builder()
                .itemName("Notes.txt")
                .folder(false)
                .itemType(ItemTypes.COMPILE)
                .build();

        assertThatCode(() -> provider.calculatePropertyValues(context, values)).doesNotThrowAnyException();
    }

    @Test
    void testOrderedItemsAreKeptAsSupplied() {
        List<ProjectItemIdentity> source = items("b/Two.cs", "a/One.cs");
        TreeItemOrderPropertyProvider p = new TreeItemOrderPropertyProvider(source, ROOTER);
        source.add(ProjectItemIdentity.of("c/Three.cs"));

        assertThat(p.getOrderedItems())
                .extracting(ProjectItemIdentity::getEvaluatedInclude)
                .containsExactly("b/Two.cs", "a/One.cs");
        assertThatThrownBy(() -> p.getOrderedItems().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testEmptyItemsOrderNothing() {
        TreeItemOrderPropertyProvider p = new TreeItemOrderPropertyProvider(List.of(), ROOTER);

        assertThat(p.getOrderIndex().isEmpty()).isTrue();
        assertThat(p.evaluate("src", true, ItemTypes.FOLDER, Map.of())).isEmpty();
        assertThat(p.evaluate("App.cs", false, ItemTypes.COMPILE, Map.of())).hasValue(Integer.MAX_VALUE);
    }

    @Test
    void testRooterFailureFailsConstruction() {
        IllegalStateException failure = new IllegalStateException("cannot root");

        assertThatThrownBy(() -> new TreeItemOrderPropertyProvider(items("a/x.cs", "b/x.cs"), path -> {
            throw failure;
        })).isSameAs(failure);
    }

    @Test
    void testRejectsNullArguments() {
        assertThatThrownBy(() -> new TreeItemOrderPropertyProvider(null, ROOTER))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new TreeItemOrderPropertyProvider(List.of(), null))
                .isInstanceOf(NullPointerException.class);
    }

    private static Map<String, String> fullPath(String path) {
        return Map.of(TreeItemContext.FULL_PATH_PROPERTY, path);
    }

    private static List<ProjectItemIdentity> items(String... includes) {
        return List.of(includes).stream().map(ProjectItemIdentity::of).collect(Collectors.toList());
    }
}
