package org.pragmatica.config.source;

import org.pragmatica.config.ReadError;
import org.pragmatica.config.tree.LeafForSequence;
import org.pragmatica.config.tree.PropertyTree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Source standing in for one which failed to load. Holds no values.
record UnavailableConfigSource(ReadError error) implements ConfigSource {
    UnavailableConfigSource {
        Objects.requireNonNull(error, "error");
    }

    static UnavailableConfigSource unavailableConfigSource(ReadError error) {
        return new UnavailableConfigSource(error);
    }

    @Override
    public Set<String> names() {
        return Set.of();
    }

    @Override
    public PropertyTree<String> getValue(List<String> path) {
        return PropertyTree.empty();
    }

    @Override
    public LeafForSequence leafForSequence() {
        return LeafForSequence.VALID;
    }

    @Override
    public Optional<ReadError> failure() {
        return Optional.of(error);
    }
}
