package org.pragmatica.config.source;

import org.pragmatica.config.tree.LeafForSequence;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/// Options for building a source from flat key/value data.
///
/// @param sourceName      Name reported in diagnostics
/// @param keyDelimiter    Splits a flat key into nested keys (e.g. `.` for `db.port`)
/// @param valueDelimiter  Splits a value into a list (e.g. `,` for `a,b,c`)
/// @param leafForSequence Whether a single value may stand for a one-element list
/// @param keyFilter       Only keys accepted by the filter are used
public record SourceOptions(String sourceName,
                            Optional<Character> keyDelimiter,
                            Optional<Character> valueDelimiter,
                            LeafForSequence leafForSequence,
                            Predicate<String> keyFilter) {
    public SourceOptions {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(keyDelimiter, "keyDelimiter");
        Objects.requireNonNull(valueDelimiter, "valueDelimiter");
        Objects.requireNonNull(leafForSequence, "leafForSequence");
        Objects.requireNonNull(keyFilter, "keyFilter");
    }

    /// Options with no delimiters, singleton leaves accepted as sequences and all keys used.
    public static SourceOptions sourceOptions(String sourceName) {
        return new SourceOptions(sourceName, Optional.empty(), Optional.empty(), LeafForSequence.VALID, key -> true);
    }

    public SourceOptions withSourceName(String name) {
        return new SourceOptions(name, keyDelimiter, valueDelimiter, leafForSequence, keyFilter);
    }

    public SourceOptions withKeyDelimiter(char delimiter) {
        return new SourceOptions(sourceName, Optional.of(delimiter), valueDelimiter, leafForSequence, keyFilter);
    }

    public SourceOptions withValueDelimiter(char delimiter) {
        return new SourceOptions(sourceName, keyDelimiter, Optional.of(delimiter), leafForSequence, keyFilter);
    }

    public SourceOptions withLeafForSequence(LeafForSequence policy) {
        return new SourceOptions(sourceName, keyDelimiter, valueDelimiter, policy, keyFilter);
    }

    public SourceOptions withKeyFilter(Predicate<String> filter) {
        return new SourceOptions(sourceName, keyDelimiter, valueDelimiter, leafForSequence, filter);
    }

    /// Split a flat key into nested keys. Blank parts are dropped.
    public List<String> splitKey(String key) {
        return keyDelimiter.map(delimiter -> List.of(key.split(Pattern.quote(String.valueOf(delimiter)))))
                           .map(parts -> parts.stream()
                                              .filter(part -> !part.isBlank())
                                              .toList())
                           .orElse(List.of(key));
    }

    /// Split a value into trimmed list elements.
    public List<String> splitValue(String value) {
        return valueDelimiter.map(delimiter -> List.of(value.split(Pattern.quote(String.valueOf(delimiter)))))
                             .map(parts -> parts.stream()
                                                .map(String::trim)
                                                .toList())
                             .orElse(List.of(value));
    }
}
