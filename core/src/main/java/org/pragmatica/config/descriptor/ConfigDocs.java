package org.pragmatica.config.descriptor;

import org.pragmatica.config.descriptor.Descriptor.Default;
import org.pragmatica.config.descriptor.Descriptor.Describe;
import org.pragmatica.config.descriptor.Descriptor.Lazy;
import org.pragmatica.config.descriptor.Descriptor.MapOf;
import org.pragmatica.config.descriptor.Descriptor.Nested;
import org.pragmatica.config.descriptor.Descriptor.OptionalOf;
import org.pragmatica.config.descriptor.Descriptor.OrElse;
import org.pragmatica.config.descriptor.Descriptor.OrElseEither;
import org.pragmatica.config.descriptor.Descriptor.SequenceOf;
import org.pragmatica.config.descriptor.Descriptor.SourcedFrom;
import org.pragmatica.config.descriptor.Descriptor.Transform;
import org.pragmatica.config.descriptor.Descriptor.Value;
import org.pragmatica.config.descriptor.Descriptor.Zip;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Documentation of the values a [Descriptor] reads, one entry per scalar.
///
/// @param entries Documented scalars in descriptor order
public record ConfigDocs(List<Entry> entries) {
    public static final String ANY_ELEMENT = "[*]";
    public static final String ANY_KEY = "<key>";

    public ConfigDocs {
        entries = List.copyOf(entries);
    }

    /// Documented scalar.
    ///
    /// @param path         Keys leading to the value, [#ANY_ELEMENT] for list elements, [#ANY_KEY] for map keys
    /// @param type         Name of the property type
    /// @param descriptions Descriptions attached on the way, outermost first
    /// @param optional     Whether the value may be absent
    /// @param defaultValue Default used when absent
    /// @param sources      Names of the sources bound to the value, empty when read from the ambient source
    public record Entry(String path,
                        String type,
                        List<String> descriptions,
                        boolean optional,
                        Optional<String> defaultValue,
                        Set<String> sources) {
        public Entry {
            descriptions = List.copyOf(descriptions);
            sources = Set.copyOf(sources);
        }
    }

    public static ConfigDocs configDocs(Descriptor<?> descriptor) {
        var entries = new ArrayList<Entry>();
        var visited = Collections.newSetFromMap(new IdentityHashMap<Lazy<?>, Boolean>());
        collect(descriptor, State.initial(), entries, visited);
        return new ConfigDocs(entries);
    }

    /// Render as a table with columns path, type, required, default, sources, description.
    public String toTable() {
        var builder = new StringBuilder("| Path | Type | Required | Default | Sources | Description |\n")
            .append("|------|------|----------|---------|---------|-------------|\n");
        entries.forEach(entry -> builder.append("| ")
                                        .append(entry.path())
                                        .append(" | ")
                                        .append(entry.type())
                                        .append(" | ")
                                        .append(entry.optional() || entry.defaultValue()
                                                                         .isPresent() ? "no" : "yes")
                                        .append(" | ")
                                        .append(entry.defaultValue()
                                                     .orElse(""))
                                        .append(" | ")
                                        .append(String.join(", ", entry.sources()))
                                        .append(" | ")
                                        .append(String.join("; ", entry.descriptions()))
                                        .append(" |\n"));
        return builder.toString();
    }

    private static void collect(Descriptor<?> descriptor, State state, List<Entry> entries, Set<Lazy<?>> visited) {
        if (descriptor instanceof Value<?> value) {
            entries.add(new Entry(state.renderPath(),
                                  value.type()
                                       .name(),
                                  state.descriptions(),
                                  state.optional(),
                                  state.defaultValue(),
                                  state.sources()));
        } else if (descriptor instanceof Nested<?> nested) {
            collect(nested.inner(), state.withSegment(nested.key()), entries, visited);
        } else if (descriptor instanceof Zip<?, ?> zip) {
            collect(zip.left(), state, entries, visited);
            collect(zip.right(), state, entries, visited);
        } else if (descriptor instanceof OrElseEither<?, ?> orElseEither) {
            collect(orElseEither.left(), state, entries, visited);
            collect(orElseEither.right(), state, entries, visited);
        } else if (descriptor instanceof OrElse<?> orElse) {
            collect(orElse.primary(), state, entries, visited);
            collect(orElse.fallback(), state, entries, visited);
        } else if (descriptor instanceof SequenceOf<?> sequence) {
            collect(sequence.element(), state.withSegment(ANY_ELEMENT), entries, visited);
        } else if (descriptor instanceof MapOf<?> map) {
            collect(map.element(), state.withSegment(ANY_KEY), entries, visited);
        } else if (descriptor instanceof OptionalOf<?> optional) {
            collect(optional.inner(), state.asOptional(), entries, visited);
        } else if (descriptor instanceof Default<?> withDefault) {
            collect(withDefault.inner(), state.withDefault(String.valueOf(withDefault.value())), entries, visited);
        } else if (descriptor instanceof Transform<?, ?> transform) {
            collect(transform.inner(), state, entries, visited);
        } else if (descriptor instanceof Describe<?> describe) {
            collect(describe.inner(), state.withDescription(describe.description()), entries, visited);
        } else if (descriptor instanceof SourcedFrom<?> sourced) {
            collect(sourced.inner(), state.withSources(sourced.source()
                                                              .names()), entries, visited);
        } else if (descriptor instanceof Lazy<?> lazy && visited.add(lazy)) {
            collect(lazy.supplier()
                        .get(), state, entries, visited);
        }
    }

    private record State(List<String> segments,
                         List<String> descriptions,
                         boolean optional,
                         Optional<String> defaultValue,
                         Set<String> sources) {
        static State initial() {
            return new State(List.of(), List.of(), false, Optional.empty(), Set.of());
        }

        State withSegment(String segment) {
            return new State(append(segments, segment), descriptions, optional, defaultValue, sources);
        }

        State withDescription(String description) {
            return new State(segments, append(descriptions, description), optional, defaultValue, sources);
        }

        State asOptional() {
            return new State(segments, descriptions, true, defaultValue, sources);
        }

        State withDefault(String value) {
            return new State(segments, descriptions, optional, Optional.of(value), sources);
        }

        State withSources(Set<String> names) {
            return new State(segments, descriptions, optional, defaultValue, names);
        }

        String renderPath() {
            if (segments.isEmpty()) {
                return "<root>";
            }
            var builder = new StringBuilder();
            for (var segment : segments) {
                if (builder.length() > 0 && !ANY_ELEMENT.equals(segment)) {
                    builder.append('.');
                }
                builder.append(segment);
            }
            return builder.toString();
        }

        private static List<String> append(List<String> list, String element) {
            var result = new ArrayList<>(list);
            result.add(element);
            return List.copyOf(result);
        }
    }
}
