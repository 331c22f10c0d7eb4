package org.pragmatica.config.source;

import org.pragmatica.config.tree.LeafForSequence;
import org.pragmatica.config.tree.PropertyTree;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/// Source answering from a primary source and, for paths the primary has nothing for,
/// from a fallback built on first use.
final class FallbackConfigSource implements ConfigSource {
    private final ConfigSource primary;
    private final Supplier<? extends ConfigSource> fallbackSupplier;
    private volatile ConfigSource fallback;

    private FallbackConfigSource(ConfigSource primary, Supplier<? extends ConfigSource> fallbackSupplier) {
        this.primary = primary;
        this.fallbackSupplier = fallbackSupplier;
    }

    static FallbackConfigSource fallbackConfigSource(ConfigSource primary, Supplier<? extends ConfigSource> fallbackSupplier) {
        return new FallbackConfigSource(Objects.requireNonNull(primary, "primary"),
                                        Objects.requireNonNull(fallbackSupplier, "fallbackSupplier"));
    }

    @Override
    public Set<String> names() {
        var names = new LinkedHashSet<>(primary.names());
        names.addAll(fallback().names());
        return names;
    }

    @Override
    public PropertyTree<String> getValue(List<String> path) {
        var value = primary.getValue(path);
        if (!value.isEmpty()) {
            return value;
        }
        return fallback().getValue(path);
    }

    @Override
    public LeafForSequence leafForSequence() {
        return fallback().leafForSequence();
    }

    @Override
    public LeafForSequence leafForSequence(List<String> path) {
        if (!primary.getValue(path)
                    .isEmpty()) {
            return primary.leafForSequence(path);
        }
        return fallback().leafForSequence(path);
    }

    private ConfigSource fallback() {
        var current = fallback;
        if (current == null) {
            synchronized (this) {
                current = fallback;
                if (current == null) {
                    current = Objects.requireNonNull(fallbackSupplier.get(), "fallback source");
                    fallback = current;
                }
            }
        }
        return current;
    }

    @Override
    public String toString() {
        return "FallbackConfigSource[" + primary + " orElse " + (fallback == null ? "<not built>" : fallback) + "]";
    }
}
