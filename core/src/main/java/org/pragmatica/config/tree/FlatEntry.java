package org.pragmatica.config.tree;

import java.util.List;

/// Path from the root of a tree together with the leaf values found there.
///
/// @param path   Keys and sequence positions from the root
/// @param values Leaf values at that path, never empty
public record FlatEntry<V>(List<Step> path, List<V> values) {
    public FlatEntry {
        path = List.copyOf(path);
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Flattened entry at " + Step.render(path) + " has no values");
        }
    }

    public static <V> FlatEntry<V> flatEntry(List<Step> path, List<V> values) {
        return new FlatEntry<>(path, values);
    }

    /// Entry addressed by plain keys.
    public static <V> FlatEntry<V> keyed(List<String> keys, List<V> values) {
        return new FlatEntry<>(keys.stream()
                                   .<Step>map(Step::key)
                                   .toList(),
                               values);
    }

    boolean isTerminal() {
        return path.isEmpty();
    }

    Step head() {
        return path.get(0);
    }

    FlatEntry<V> tail() {
        return new FlatEntry<>(path.subList(1, path.size()), values);
    }
}
