package org.pragmatica.config.source;

import org.pragmatica.config.Either;
import org.pragmatica.config.ReadError;
import org.pragmatica.config.tree.LeafForSequence;
import org.pragmatica.config.tree.PropertyTree;

import java.util.List;
import java.util.Map;
import java.util.Set;

/// Configuration source backed by environment variables.
///
/// The environment is captured when the source is created. Only letters and `_` are
/// accepted as key delimiter, since nothing else can appear in a variable name.
///
/// Example with key delimiter `_`:
///
///   - DATABASE_HOST -> DATABASE.HOST
///   - SERVER_PORT -> SERVER.PORT
///
public final class EnvironmentConfigSource implements ConfigSource {
    static final String DEFAULT_NAME = "system environment";

    private final MapConfigSource values;

    private EnvironmentConfigSource(MapConfigSource values) {
        this.values = values;
    }

    /// Create an EnvironmentConfigSource from the process environment.
    ///
    /// @param options Delimiters, naming and filtering
    /// @return The source, or [ReadError.SourceError] for an unusable key delimiter
    public static Either<ReadError, ConfigSource> environmentConfigSource(SourceOptions options) {
        return environmentConfigSource(System.getenv(), options);
    }

    /// Create an EnvironmentConfigSource from the given variables.
    ///
    /// @param environment Variable names and values
    /// @param options     Delimiters, naming and filtering
    /// @return The source, or [ReadError.SourceError] for an unusable key delimiter
    public static Either<ReadError, ConfigSource> environmentConfigSource(Map<String, String> environment,
                                                                          SourceOptions options) {
        var invalid = options.keyDelimiter()
                             .filter(delimiter -> !isValidDelimiter(delimiter));
        if (invalid.isPresent()) {
            return Either.left(ReadError.sourceError("Invalid system key delimiter: " + invalid.get()));
        }
        return Either.right(new EnvironmentConfigSource(MapConfigSource.mapConfigSource(environment, options)));
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
        return "EnvironmentConfigSource" + names();
    }

    private static boolean isValidDelimiter(char delimiter) {
        return (delimiter >= 'a' && delimiter <= 'z') || (delimiter >= 'A' && delimiter <= 'Z') || delimiter == '_';
    }
}
