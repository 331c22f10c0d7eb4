package org.pragmatica.config.source;

import org.pragmatica.config.tree.LeafForSequence;
import org.pragmatica.config.tree.PropertyTree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/// Configuration source backed by Java system properties.
///
/// The properties are captured when the source is created. Example with key delimiter `.`:
///
///   - -Ddatabase.host=localhost -> database.host
///   - -Dserver.port=8080 -> server.port
///
public final class SystemPropertyConfigSource implements ConfigSource {
    static final String DEFAULT_NAME = "system properties";

    private final MapConfigSource values;

    private SystemPropertyConfigSource(MapConfigSource values) {
        this.values = values;
    }

    /// Create a SystemPropertyConfigSource from the current system properties.
    ///
    /// @param options Delimiters, naming and filtering
    /// @return New SystemPropertyConfigSource
    public static SystemPropertyConfigSource systemPropertyConfigSource(SourceOptions options) {
        return systemPropertyConfigSource(System.getProperties(), options);
    }

    /// Create a SystemPropertyConfigSource from the given properties.
    ///
    /// @param properties Properties to capture
    /// @param options    Delimiters, naming and filtering
    /// @return New SystemPropertyConfigSource
    public static SystemPropertyConfigSource systemPropertyConfigSource(Properties properties, SourceOptions options) {
        return new SystemPropertyConfigSource(MapConfigSource.mapConfigSource(fetch(properties), options));
    }

    @Override
    public Set<String> names() {
        return values.names();
    }

    @Override
    public PropertyTree<String> getValue(List<String> path) {
        return values.getValue(path);
    }

    @Override
    public LeafForSequence leafForSequence() {
        return values.leafForSequence();
    }

    @Override
    public String toString() {
        return "SystemPropertyConfigSource" + names();
    }

    private static Map<String, String> fetch(Properties properties) {
        var result = new LinkedHashMap<String, String>();
        properties.stringPropertyNames()
                  .forEach(key -> result.put(key, properties.getProperty(key)));
        return result;
    }
}
