package org.pragmatica.config.source;

import org.pragmatica.config.ReadError;
import org.pragmatica.config.tree.LeafForSequence;
import org.pragmatica.config.tree.PropertyTree;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/// Source converting every key of a path before delegating the lookup.
record KeyConvertingConfigSource(ConfigSource delegate, UnaryOperator<String> conversion) implements ConfigSource {
    static KeyConvertingConfigSource keyConvertingConfigSource(ConfigSource delegate, UnaryOperator<String> conversion) {
        return new KeyConvertingConfigSource(delegate, conversion);
    }

    @Override
    public Set<String> names() {
        return delegate.names();
    }

    @Override
    public PropertyTree<String> getValue(List<String> path) {
        return delegate.getValue(convert(path));
    }

    @Override
    public LeafForSequence leafForSequence() {
        return delegate.leafForSequence();
    }

    @Override
    public LeafForSequence leafForSequence(List<String> path) {
        return delegate.leafForSequence(convert(path));
    }

    @Override
    public Optional<ReadError> failure() {
        return delegate.failure();
    }

    private List<String> convert(List<String> path) {
        return path.stream()
                   .map(conversion)
                   .toList();
    }
}
