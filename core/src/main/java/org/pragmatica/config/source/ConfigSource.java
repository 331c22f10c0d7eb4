package org.pragmatica.config.source;

import org.pragmatica.config.Either;
import org.pragmatica.config.ReadError;
import org.pragmatica.config.cli.CommandLineConfigSource;
import org.pragmatica.config.tree.LeafForSequence;
import org.pragmatica.config.tree.PropertyTree;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/// Abstraction for configuration sources.
///
/// A ConfigSource answers, for a path of keys, with the [PropertyTree] found there.
/// Absence is answered with an empty tree, never with an exception.
///
/// Sources compose: [#orElse(ConfigSource)] consults a fallback source for every path
/// this source has nothing for, and [#convertKeys(UnaryOperator)] rewrites keys before
/// lookup. Different parts of one read may therefore be answered by different sources.
public interface ConfigSource {
    /// Names of the underlying sources, used in diagnostics.
    Set<String> names();

    /// Get the tree at the given path.
    ///
    /// @param path Keys from the root
    /// @return Tree at the path, empty when absent
    PropertyTree<String> getValue(List<String> path);

    /// Whether a single leaf in this source may stand for a one-element sequence.
    LeafForSequence leafForSequence();

    /// Policy of the part of this source which answers for `path`. Combined sources do not
    /// build a fallback for a path the primary source answers.
    ///
    /// @param path Keys from the root
    /// @return Policy applying to the tree at the path
    default LeafForSequence leafForSequence(List<String> path) {
        return leafForSequence();
    }

    /// Failure which made this source unavailable, empty for a usable source.
    default Optional<ReadError> failure() {
        return Optional.empty();
    }

    /// Try this source, and for paths it has nothing for, try `other`.
    ///
    /// @param other Fallback source
    /// @return Combined source
    default ConfigSource orElse(ConfigSource other) {
        return FallbackConfigSource.fallbackConfigSource(this, () -> other);
    }

    /// Try this source, and for paths it has nothing for, try the source built by `other`.
    ///
    /// The fallback is built on the first query this source cannot answer and reused afterwards.
    ///
    /// @param other Builder of the fallback source
    /// @return Combined source
    default ConfigSource orElse(Supplier<? extends ConfigSource> other) {
        return FallbackConfigSource.fallbackConfigSource(this, other);
    }

    /// Convert every key of a path before it is looked up in this source.
    ///
    /// @param conversion Key conversion, e.g. `String::toUpperCase`
    /// @return Converting source
    default ConfigSource convertKeys(UnaryOperator<String> conversion) {
        return KeyConvertingConfigSource.keyConvertingConfigSource(this, conversion);
    }

    /// Source without any value.
    static ConfigSource empty() {
        return TreeConfigSource.treeConfigSource(Set.of(), PropertyTree.empty(), LeafForSequence.VALID);
    }

    /// Source which could not be obtained, e.g. a properties file which cannot be read.
    /// It holds no values; a descriptor bound to it with [org.pragmatica.config.descriptor.Descriptor#from(Either)]
    /// fails with `error` instead of reading.
    static ConfigSource unavailable(ReadError error) {
        return UnavailableConfigSource.unavailableConfigSource(error);
    }

    static ConfigSource fromTree(PropertyTree<String> tree, String sourceName, LeafForSequence leafForSequence) {
        return TreeConfigSource.treeConfigSource(Set.of(sourceName), tree, leafForSequence);
    }

    /// Source trying each of the trees in order.
    static ConfigSource fromTrees(List<PropertyTree<String>> trees, String sourceName, LeafForSequence leafForSequence) {
        return TreeConfigSource.fromTrees(trees, sourceName, leafForSequence);
    }

    /// Source of constant values named `constant`.
    static ConfigSource fromMap(Map<String, String> map) {
        return MapConfigSource.mapConfigSource(map, SourceOptions.sourceOptions(MapConfigSource.DEFAULT_NAME));
    }

    static ConfigSource fromMap(Map<String, String> map, SourceOptions options) {
        return MapConfigSource.mapConfigSource(map, options);
    }

    static ConfigSource fromMultiMap(Map<String, List<String>> map, SourceOptions options) {
        return MapConfigSource.multiMapConfigSource(map, options);
    }

    static ConfigSource fromProperties(Properties properties) {
        return fromProperties(properties, SourceOptions.sourceOptions(PropertiesConfigSource.DEFAULT_NAME));
    }

    static ConfigSource fromProperties(Properties properties, SourceOptions options) {
        return PropertiesConfigSource.propertiesConfigSource(properties, options);
    }

    static Either<ReadError, ConfigSource> fromPropertiesFile(Path path, SourceOptions options) {
        return PropertiesConfigSource.propertiesConfigSource(path, options);
    }

    /// Snapshot of the process environment named `system environment`, keys used as they are.
    static Either<ReadError, ConfigSource> fromSystemEnv() {
        return fromSystemEnv(SourceOptions.sourceOptions(EnvironmentConfigSource.DEFAULT_NAME));
    }

    static Either<ReadError, ConfigSource> fromSystemEnv(SourceOptions options) {
        return EnvironmentConfigSource.environmentConfigSource(options);
    }

    /// Snapshot of the system properties named `system properties`, keys used as they are.
    static ConfigSource fromSystemProperties() {
        return fromSystemProperties(SourceOptions.sourceOptions(SystemPropertyConfigSource.DEFAULT_NAME));
    }

    static ConfigSource fromSystemProperties(SourceOptions options) {
        return SystemPropertyConfigSource.systemPropertyConfigSource(options);
    }

    static ConfigSource fromCommandLineArgs(List<String> args) {
        return CommandLineConfigSource.commandLineConfigSource(args, Optional.empty(), Optional.empty());
    }

    static ConfigSource fromCommandLineArgs(List<String> args,
                                            Optional<Character> keyDelimiter,
                                            Optional<Character> valueDelimiter) {
        return CommandLineConfigSource.commandLineConfigSource(args, keyDelimiter, valueDelimiter);
    }
}
