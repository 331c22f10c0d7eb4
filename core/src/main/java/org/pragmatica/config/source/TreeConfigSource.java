package org.pragmatica.config.source;

import org.pragmatica.config.tree.LeafForSequence;
import org.pragmatica.config.tree.PropertyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Configuration source answering from a single in-memory tree.
public record TreeConfigSource(Set<String> names, PropertyTree<String> tree, LeafForSequence leafForSequence)
        implements ConfigSource {
    private static final Logger log = LoggerFactory.getLogger(TreeConfigSource.class);

    public TreeConfigSource {
        names = Set.copyOf(names);
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(leafForSequence, "leafForSequence");
    }

    public static TreeConfigSource treeConfigSource(Set<String> names,
                                                    PropertyTree<String> tree,
                                                    LeafForSequence leafForSequence) {
        return new TreeConfigSource(names, tree, leafForSequence);
    }

    /// Source trying each of the trees in order, first tree first.
    ///
    /// @param trees           Trees, usually the alternatives produced by a merge
    /// @param sourceName      Name of the source
    /// @param leafForSequence Policy for singleton sequences
    /// @return Combined source, empty when there are no trees
    public static ConfigSource fromTrees(List<PropertyTree<String>> trees,
                                         String sourceName,
                                         LeafForSequence leafForSequence) {
        log.debug("Creating source '{}' from {} tree(s)", sourceName, trees.size());
        return trees.stream()
                    .<ConfigSource>map(tree -> treeConfigSource(Set.of(sourceName), tree, leafForSequence))
                    .reduce((first, second) -> first.orElse(second))
                    .orElseGet(() -> treeConfigSource(Set.of(sourceName), PropertyTree.empty(), leafForSequence));
    }

    /// Normalize trees built from flat data: drop empty positions, remove trees left without
    /// any value and collapse one-element sequences.
    static List<PropertyTree<String>> normalize(List<PropertyTree<String>> trees) {
        var normalized = trees.stream()
                              .map(PropertyTree::dropEmpty)
                              .filter(tree -> !tree.isEmpty())
                              .map(PropertyTree::unwrapSingletonLists)
                              .toList();
        return normalized.isEmpty() ? List.of(PropertyTree.empty()) : normalized;
    }

    @Override
    public PropertyTree<String> getValue(List<String> path) {
        return tree.getPath(path);
    }
}
