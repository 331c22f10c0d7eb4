package org.pragmatica.config.descriptor;

import org.pragmatica.config.Either;
import org.pragmatica.config.Pair;
import org.pragmatica.config.ReadError;
import org.pragmatica.config.source.ConfigSource;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/// Description of a configuration value of type `A`.
///
/// A descriptor is plain data. The same descriptor is interpreted by the reader to extract
/// a value from a [ConfigSource] and by the writer to turn a value back into a tree, so
/// read and write always agree on the shape of the configuration.
///
/// Descriptors are built from scalars ([#value(String, PropertyType)], [Descriptors]) and
/// combined:
/// ```java
/// var database = Descriptor.nested("database",
///                                  Descriptors.string("host")
///                                             .zip(Descriptors.integer("port").withDefault(5432)));
/// ```
///
/// @param <A> Type of the described value
public sealed interface Descriptor<A> {
    /// Scalar at the current position.
    record Value<A>(PropertyType<A> type) implements Descriptor<A> {
        public Value {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public Descriptor<A> mapKey(UnaryOperator<String> conversion) {
            return this;
        }
    }

    /// Inner descriptor one level down, under `key`.
    record Nested<A>(String key, Descriptor<A> inner) implements Descriptor<A> {
        public Nested {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public Descriptor<A> mapKey(UnaryOperator<String> conversion) {
            return new Nested<>(conversion.apply(key), inner.mapKey(conversion));
        }
    }

    /// Both descriptors, read from the same position.
    record Zip<A, B>(Descriptor<A> left, Descriptor<B> right) implements Descriptor<Pair<A, B>> {
        @Override
        public Descriptor<Pair<A, B>> mapKey(UnaryOperator<String> conversion) {
            return new Zip<>(left.mapKey(conversion), right.mapKey(conversion));
        }
    }

    /// Left descriptor, or the right one when the left cannot be read.
    record OrElseEither<A, B>(Descriptor<A> left, Descriptor<B> right) implements Descriptor<Either<A, B>> {
        @Override
        public Descriptor<Either<A, B>> mapKey(UnaryOperator<String> conversion) {
            return new OrElseEither<>(left.mapKey(conversion), right.mapKey(conversion));
        }
    }

    /// Primary descriptor, or the fallback of the same type when the primary cannot be read.
    record OrElse<A>(Descriptor<A> primary, Descriptor<A> fallback) implements Descriptor<A> {
        @Override
        public Descriptor<A> mapKey(UnaryOperator<String> conversion) {
            return new OrElse<>(primary.mapKey(conversion), fallback.mapKey(conversion));
        }
    }

    /// Sequence of elements, each read by `element`.
    record SequenceOf<A>(Descriptor<A> element) implements Descriptor<List<A>> {
        @Override
        public Descriptor<List<A>> mapKey(UnaryOperator<String> conversion) {
            return new SequenceOf<>(element.mapKey(conversion));
        }
    }

    /// Record with arbitrary keys, each value read by `element`. Keys are taken as they are.
    record MapOf<A>(Descriptor<A> element) implements Descriptor<Map<String, A>> {
        @Override
        public Descriptor<Map<String, A>> mapKey(UnaryOperator<String> conversion) {
            return new MapOf<>(element.mapKey(conversion));
        }
    }

    /// Value which may be absent.
    record OptionalOf<A>(Descriptor<A> inner) implements Descriptor<Optional<A>> {
        @Override
        public Descriptor<Optional<A>> mapKey(UnaryOperator<String> conversion) {
            return new OptionalOf<>(inner.mapKey(conversion));
        }
    }

    /// Value replaced by `value` when missing. Ignored when writing.
    record Default<A>(Descriptor<A> inner, A value) implements Descriptor<A> {
        public Default {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Descriptor<A> mapKey(UnaryOperator<String> conversion) {
            return new Default<>(inner.mapKey(conversion), value);
        }
    }

    /// Conversion between `A` and `B`, fallible in both directions.
    record Transform<A, B>(Descriptor<A> inner,
                           Function<A, Either<String, B>> forward,
                           Function<B, Either<String, A>> backward) implements Descriptor<B> {
        @Override
        public Descriptor<B> mapKey(UnaryOperator<String> conversion) {
            return new Transform<>(inner.mapKey(conversion), forward, backward);
        }
    }

    /// Human readable description, used in documentation only.
    record Describe<A>(Descriptor<A> inner, String description) implements Descriptor<A> {
        @Override
        public Descriptor<A> mapKey(UnaryOperator<String> conversion) {
            return new Describe<>(inner.mapKey(conversion), description);
        }
    }

    /// Inner descriptor read from `source` instead of the source of the enclosing read.
    record SourcedFrom<A>(Descriptor<A> inner, ConfigSource source) implements Descriptor<A> {
        @Override
        public Descriptor<A> mapKey(UnaryOperator<String> conversion) {
            return new SourcedFrom<>(inner.mapKey(conversion), source);
        }
    }

    /// Descriptor built on demand, which allows recursive descriptors.
    record Lazy<A>(Supplier<Descriptor<A>> supplier) implements Descriptor<A> {
        @Override
        public Descriptor<A> mapKey(UnaryOperator<String> conversion) {
            return new Lazy<>(() -> supplier.get()
                                            .mapKey(conversion));
        }
    }

    /// Rewrite every key of this descriptor, e.g. to read `camelCase` keys from `UPPER_SNAKE` sources.
    Descriptor<A> mapKey(UnaryOperator<String> conversion);

    /// Read both this and `other` from the same position.
    default <B> Descriptor<Pair<A, B>> zip(Descriptor<B> other) {
        return new Zip<>(this, other);
    }

    /// Read this, or `other` when this cannot be read.
    default <B> Descriptor<Either<A, B>> orElseEither(Descriptor<B> other) {
        return new OrElseEither<>(this, other);
    }

    /// Read this, or `other` when this cannot be read.
    default Descriptor<A> orElse(Descriptor<A> other) {
        return new OrElse<>(this, other);
    }

    /// Value which is allowed to be absent.
    default Descriptor<Optional<A>> optional() {
        return new OptionalOf<>(this);
    }

    /// Value replaced by `value` when absent.
    default Descriptor<A> withDefault(A value) {
        return new Default<>(this, value);
    }

    /// Convert to another type with an infallible conversion in both directions.
    default <B> Descriptor<B> to(Function<A, B> forward, Function<B, A> backward) {
        return new Transform<>(this,
                               value -> Either.right(forward.apply(value)),
                               value -> Either.right(backward.apply(value)));
    }

    /// Convert to another type, failing with a message in either direction.
    default <B> Descriptor<B> transformOrFail(Function<A, Either<String, B>> forward,
                                             Function<B, Either<String, A>> backward) {
        return new Transform<>(this, forward, backward);
    }

    /// Convert to another type, failing only while reading.
    default <B> Descriptor<B> transformOrFailLeft(Function<A, Either<String, B>> forward, Function<B, A> backward) {
        return new Transform<>(this, forward, value -> Either.right(backward.apply(value)));
    }

    /// Convert to another type, failing only while writing.
    default <B> Descriptor<B> transformOrFailRight(Function<A, B> forward, Function<B, Either<String, A>> backward) {
        return new Transform<>(this, value -> Either.right(forward.apply(value)), backward);
    }

    /// Attach a description.
    default Descriptor<A> describe(String description) {
        return new Describe<>(this, description);
    }

    /// Read this descriptor from `source` regardless of the source the read started with.
    default Descriptor<A> from(ConfigSource source) {
        return new SourcedFrom<>(this, source);
    }

    /// Read this descriptor from a source which may have failed to load, e.g. the result of
    /// [ConfigSource#fromPropertiesFile(java.nio.file.Path, org.pragmatica.config.source.SourceOptions)].
    /// Reading a failed source fails with its error.
    default Descriptor<A> from(Either<ReadError, ConfigSource> source) {
        return from(source.<ConfigSource>fold(ConfigSource::unavailable, Function.identity()));
    }

    /// Scalar at the current position.
    static <A> Descriptor<A> value(PropertyType<A> type) {
        return new Value<>(type);
    }

    /// Scalar under `key`.
    static <A> Descriptor<A> value(String key, PropertyType<A> type) {
        return nested(key, value(type));
    }

    static <A> Descriptor<A> nested(String key, Descriptor<A> inner) {
        return new Nested<>(key, inner);
    }

    static <A> Descriptor<List<A>> list(Descriptor<A> element) {
        return new SequenceOf<>(element);
    }

    static <A> Descriptor<List<A>> list(String key, Descriptor<A> element) {
        return nested(key, list(element));
    }

    /// Sequence without repeated elements. Duplicates are reported while reading.
    static <A> Descriptor<Set<A>> set(Descriptor<A> element) {
        return list(element).<Set<A>>transformOrFail(Descriptor::toSet, values -> Either.right(List.copyOf(values)));
    }

    static <A> Descriptor<Set<A>> set(String key, Descriptor<A> element) {
        return nested(key, set(element));
    }

    static <A> Descriptor<Map<String, A>> map(Descriptor<A> element) {
        return new MapOf<>(element);
    }

    static <A> Descriptor<Map<String, A>> map(String key, Descriptor<A> element) {
        return nested(key, map(element));
    }

    static <A> Descriptor<A> lazy(Supplier<Descriptor<A>> supplier) {
        return new Lazy<>(supplier);
    }

    private static <A> Either<String, Set<A>> toSet(List<A> values) {
        var set = new LinkedHashSet<A>(values);
        if (set.size() != values.size()) {
            return Either.left("Duplicate elements in " + values);
        }
        return Either.right(Collections.unmodifiableSet(set));
    }
}
