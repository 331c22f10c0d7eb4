package org.pragmatica.config.source;

import org.pragmatica.config.Either;
import org.pragmatica.config.ReadError;
import org.pragmatica.config.tree.LeafForSequence;
import org.pragmatica.config.tree.PropertyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/// Configuration source backed by [Properties], optionally loaded from a file.
///
/// With key delimiter `.` the properties
/// ```
/// database.host = localhost
/// database.port = 5432
/// ```
/// are read as a `database` record with `host` and `port`.
public final class PropertiesConfigSource implements ConfigSource {
    private static final Logger log = LoggerFactory.getLogger(PropertiesConfigSource.class);

    static final String DEFAULT_NAME = "properties";

    private final Optional<Path> path;
    private final MapConfigSource values;

    private PropertiesConfigSource(Optional<Path> path, MapConfigSource values) {
        this.path = path;
        this.values = values;
    }

    /// Create a PropertiesConfigSource from loaded properties.
    ///
    /// @param properties Properties to read, only string keys and values are used
    /// @param options    Delimiters, naming and filtering
    /// @return New PropertiesConfigSource
    public static PropertiesConfigSource propertiesConfigSource(Properties properties, SourceOptions options) {
        return new PropertiesConfigSource(Optional.empty(), MapConfigSource.mapConfigSource(toMap(properties), options));
    }

    /// Create a PropertiesConfigSource from a file, read as UTF-8.
    ///
    /// When the options carry the default source name, the source is named after the file.
    ///
    /// @param path    Path to the properties file
    /// @param options Delimiters, naming and filtering
    /// @return The source, or [ReadError.SourceError] when the file cannot be read
    public static Either<ReadError, ConfigSource> propertiesConfigSource(Path path, SourceOptions options) {
        var properties = new Properties();
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Unable to read properties file {}: {}", path, e.getMessage());
            return Either.left(ReadError.sourceError("Unable to read properties file '" + path + "': " + e.getMessage()));
        }
        var named = DEFAULT_NAME.equals(options.sourceName()) ? options.withSourceName(path.toString()) : options;
        return Either.right(new PropertiesConfigSource(Optional.of(path),
                                                       MapConfigSource.mapConfigSource(toMap(properties), named)));
    }

    /// File this source was loaded from, if any.
    public Optional<Path> path() {
        return path;
    }

    @Override
    public Set<String> names() {
        return values.names();
    }

    @Override
    public PropertyTree<String> getValue(List<String> keys) {
        return values.getValue(keys);
    }

    @Override
    public LeafForSequence leafForSequence() {
        return values.leafForSequence();
    }

    @Override
    public String toString() {
        return path.map(p -> "PropertiesConfigSource[" + p + "]")
                   .orElse("PropertiesConfigSource[inline]");
    }

    private static Map<String, String> toMap(Properties properties) {
        var result = new LinkedHashMap<String, String>();
        properties.stringPropertyNames()
                  .forEach(name -> result.put(name, properties.getProperty(name)));
        return result;
    }
}
