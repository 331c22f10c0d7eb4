package org.pragmatica.config.source;

import org.pragmatica.config.tree.LeafForSequence;
import org.pragmatica.config.tree.PropertyTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// In-memory configuration source backed by a flat map.
///
/// Keys are split into nested keys by the key delimiter and values into lists by the value
/// delimiter of the [SourceOptions]. Given key delimiter `_` and value delimiter `,`:
///
///   - KAFKA_SERVERS=server1, server2 -> KAFKA.SERVERS = [server1, server2]
///   - KAFKA_SERDE=confluent -> KAFKA.SERDE = confluent
///
/// Useful for default values, testing, or programmatic configuration.
public final class MapConfigSource implements ConfigSource {
    static final String DEFAULT_NAME = "constant";

    private final SourceOptions options;
    private final Map<String, List<String>> values;
    private final ConfigSource resolved;

    private MapConfigSource(SourceOptions options, Map<String, List<String>> values) {
        this.options = options;
        this.values = Map.copyOf(values);
        this.resolved = TreeConfigSource.fromTrees(TreeConfigSource.normalize(buildTrees(options, values)),
                                                   options.sourceName(),
                                                   options.leafForSequence());
    }

    /// Create a MapConfigSource from single-valued entries.
    ///
    /// @param values  Flat key/value pairs
    /// @param options Delimiters, naming and filtering
    /// @return New MapConfigSource
    public static MapConfigSource mapConfigSource(Map<String, String> values, SourceOptions options) {
        var multiMap = new LinkedHashMap<String, List<String>>();
        values.forEach((key, value) -> {
            if (options.keyFilter()
                       .test(key)) {
                multiMap.put(key, options.splitValue(value));
            }
        });
        return new MapConfigSource(options, multiMap);
    }

    /// Create a MapConfigSource from multi-valued entries. Values are used as given; entries
    /// without values are ignored.
    ///
    /// @param values  Flat keys with their values
    /// @param options Key delimiter, naming and filtering
    /// @return New MapConfigSource
    public static MapConfigSource multiMapConfigSource(Map<String, List<String>> values, SourceOptions options) {
        var multiMap = new LinkedHashMap<String, List<String>>();
        values.forEach((key, list) -> {
            if (options.keyFilter()
                       .test(key) && !list.isEmpty()) {
                multiMap.put(key, List.copyOf(list));
            }
        });
        return new MapConfigSource(options, multiMap);
    }

    /// Values this source was built from, after filtering and value splitting.
    public Map<String, List<String>> values() {
        return values;
    }

    @Override
    public Set<String> names() {
        return Set.of(options.sourceName());
    }

    @Override
    public PropertyTree<String> getValue(List<String> path) {
        return resolved.getValue(path);
    }

    @Override
    public LeafForSequence leafForSequence() {
        return options.leafForSequence();
    }

    @Override
    public String toString() {
        return "MapConfigSource[" + options.sourceName() + "]";
    }

    private static List<PropertyTree<String>> buildTrees(SourceOptions options, Map<String, List<String>> values) {
        var trees = new ArrayList<PropertyTree<String>>();
        values.forEach((key, list) -> trees.add(PropertyTree.unflatten(options.splitKey(key), list)));
        return PropertyTree.mergeAll(trees);
    }
}
