package org.pragmatica.config.read;

import org.pragmatica.config.Either;
import org.pragmatica.config.Pair;
import org.pragmatica.config.ReadError;
import org.pragmatica.config.descriptor.Descriptor;
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
import org.pragmatica.config.source.ConfigSource;
import org.pragmatica.config.tree.LeafForSequence;
import org.pragmatica.config.tree.PropertyTree;
import org.pragmatica.config.tree.PropertyTree.Branch;
import org.pragmatica.config.tree.PropertyTree.Leaf;
import org.pragmatica.config.tree.PropertyTree.Sequence;
import org.pragmatica.config.tree.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static org.pragmatica.config.ReadError.conversionError;
import static org.pragmatica.config.ReadError.missingValue;

/// Reads configuration values described by a [Descriptor] from a [ConfigSource].
///
/// Independent failures are collected: when both parts of a zipped descriptor fail, both
/// failures are reported. Elements of a sequence are read one by one and the first failing
/// element ends the read.
public final class ConfigReader {
    private static final Logger log = LoggerFactory.getLogger(ConfigReader.class);

    private ConfigReader() {}

    /// Read a value from the given source.
    ///
    /// A scalar found where a list of values is stored reads the first value of the list, so
    /// a flag repeated on the command line yields its first occurrence. A descriptor bound to
    /// an unavailable source fails with the [ReadError.SourceError] of that source, which no
    /// alternative or default replaces.
    ///
    /// @param descriptor Descriptor of the value
    /// @param source     Source to read from
    /// @return Value or the error describing every failure found
    public static <A> Either<ReadError, A> read(Descriptor<A> descriptor, ConfigSource source) {
        log.debug("Reading configuration from {}", source);
        return cast(readAny(descriptor, Context.root(source)));
    }

    /// Read a value whose sources are all bound with [Descriptor#from(ConfigSource)].
    /// Parts without a bound source are read from an empty source.
    public static <A> Either<ReadError, A> read(Descriptor<A> descriptor) {
        return read(descriptor, ConfigSource.empty());
    }

    /// Read a value, throwing [ConfigReadException] on failure.
    public static <A> A readOrThrow(Descriptor<A> descriptor, ConfigSource source) {
        return read(descriptor, source).orElseThrow(ConfigReadException::new);
    }

    private static Either<ReadError, ?> readAny(Descriptor<?> descriptor, Context context) {
        if (descriptor instanceof Value<?> value) {
            return readValue(value, context);
        }
        if (descriptor instanceof Nested<?> nested) {
            return readAny(nested.inner(), context.nested(nested.key()));
        }
        if (descriptor instanceof Zip<?, ?> zip) {
            return readZip(zip, context);
        }
        if (descriptor instanceof OrElseEither<?, ?> orElseEither) {
            return readAlternatives(orElseEither.left(),
                                    orElseEither.right(),
                                    context,
                                    Either::left,
                                    Either::right);
        }
        if (descriptor instanceof OrElse<?> orElse) {
            return readAlternatives(orElse.primary(),
                                    orElse.fallback(),
                                    context,
                                    Function.identity(),
                                    Function.identity());
        }
        if (descriptor instanceof SequenceOf<?> sequence) {
            return readSequence(sequence, context);
        }
        if (descriptor instanceof MapOf<?> map) {
            return readMap(map, context);
        }
        if (descriptor instanceof OptionalOf<?> optional) {
            if (isAbsent(optional.inner(), context)) {
                return Either.right(Optional.empty());
            }
            return readAny(optional.inner(), context).map(Optional::of);
        }
        if (descriptor instanceof Default<?> withDefault) {
            return readDefault(withDefault, context);
        }
        if (descriptor instanceof Transform<?, ?> transform) {
            return readTransform(transform, context);
        }
        if (descriptor instanceof Describe<?> describe) {
            return readAny(describe.inner(), context);
        }
        if (descriptor instanceof SourcedFrom<?> sourced) {
            var failure = sourced.source()
                                 .failure();
            if (failure.isPresent()) {
                return Either.left(failure.get());
            }
            return readAny(sourced.inner(), context.withSource(sourced.source()));
        }
        if (descriptor instanceof Lazy<?> lazy) {
            return readAny(lazy.supplier()
                               .get(), context);
        }
        throw new IllegalStateException("Unknown descriptor " + descriptor.getClass());
    }

    private static Either<ReadError, ?> readValue(Value<?> value, Context context) {
        var tree = context.tree();
        var type = value.type();

        if (tree.isEmpty()) {
            return Either.left(missingValue(context.path()));
        }
        if (tree instanceof Branch<String>) {
            return Either.left(conversionError(context.path(), render(tree), type.name(), "expected a value, found a record"));
        }
        var leaf = firstLeaf(tree);
        if (leaf.isEmpty()) {
            return Either.left(conversionError(context.path(), render(tree), type.name(), "expected a value, found a list of records"));
        }
        var raw = leaf.get();
        return type.read(raw)
                   .<ReadError>mapLeft(detail -> conversionError(context.path(), raw, type.name(), detail));
    }

    private static Either<ReadError, ?> readZip(Zip<?, ?> zip, Context context) {
        var left = readAny(zip.left(), context);
        var right = readAny(zip.right(), context);

        if (left.isRight() && right.isRight()) {
            return Either.right(Pair.pair(left.unwrap(), right.unwrap()));
        }
        if (left.isLeft() && right.isLeft()) {
            return Either.left(ReadError.and(leftOf(left), leftOf(right)));
        }
        return Either.left(left.isLeft() ? leftOf(left) : leftOf(right));
    }

    private static Either<ReadError, ?> readAlternatives(Descriptor<?> first,
                                                         Descriptor<?> second,
                                                         Context context,
                                                         Function<Object, Object> wrapFirst,
                                                         Function<Object, Object> wrapSecond) {
        var primary = readAny(first, context);
        if (primary.isRight()) {
            return Either.right(wrapFirst.apply(primary.unwrap()));
        }
        var primaryError = leftOf(primary);
        // An unavailable source is not a reason to try the alternative
        if (!primaryError.isRecoverable()) {
            return Either.left(primaryError);
        }
        log.debug("Trying alternative at {}: {}", Step.render(context.path()), primaryError.message());

        var alternative = readAny(second, context);
        if (alternative.isRight()) {
            return Either.right(wrapSecond.apply(alternative.unwrap()));
        }
        return Either.left(ReadError.or(primaryError, leftOf(alternative)));
    }

    private static Either<ReadError, ?> readSequence(SequenceOf<?> sequence, Context context) {
        var tree = context.tree();

        if (tree instanceof Sequence<String> elements && !isAbsentSequence(tree)) {
            var values = new ArrayList<Object>(elements.elements()
                                                       .size());
            for (int i = 0; i < elements.elements()
                                        .size(); i++) {
                var element = readAny(sequence.element(),
                                      context.element(i,
                                                      elements.elements()
                                                              .get(i)));
                if (element.isLeft()) {
                    return element;
                }
                values.add(element.unwrap());
            }
            return Either.right(Collections.unmodifiableList(values));
        }
        if (tree.isEmpty()) {
            return Either.left(missingValue(context.path()));
        }
        if (context.source()
                   .leafForSequence(context.keys()) == LeafForSequence.INVALID) {
            return Either.left(conversionError(context.path(), render(tree), "sequence", "single value is not accepted as a list"));
        }
        return readAny(sequence.element(), context.element(0, tree)).map(value -> List.<Object>of(value));
    }

    private static Either<ReadError, ?> readMap(MapOf<?> map, Context context) {
        var tree = context.tree();

        if (tree.isEmpty()) {
            return Either.left(missingValue(context.path()));
        }
        if (!(tree instanceof Branch<String> branch)) {
            return Either.left(conversionError(context.path(), render(tree), "map", "expected a record"));
        }
        var values = new LinkedHashMap<String, Object>();
        var errors = new ArrayList<ReadError>();

        branch.children()
              .forEach((key, child) -> {
                  if (!child.isEmpty()) {
                      readAny(map.element(), context.nested(key))
                          .onLeft(errors::add)
                          .onRight(value -> values.put(key, value));
                  }
              });
        if (!errors.isEmpty()) {
            return Either.left(errors.stream()
                                     .reduce(ReadError::and)
                                     .orElseThrow());
        }
        return Either.right(Collections.unmodifiableMap(values));
    }

    private static Either<ReadError, ?> readDefault(Default<?> withDefault, Context context) {
        var result = readAny(withDefault.inner(), context);
        if (result.isLeft() && leftOf(result).isMissingOnly()) {
            log.debug("Using default value at {}", Step.render(context.path()));
            return Either.right(withDefault.value());
        }
        return result;
    }

    private static Either<ReadError, ?> readTransform(Transform<?, ?> transform, Context context) {
        Function<Object, Either<String, Object>> forward = cast(transform.forward());

        return readAny(transform.inner(), context)
            .flatMap(value -> forward.apply(value)
                                     .<ReadError>mapLeft(detail -> conversionError(context.path(),
                                                                        String.valueOf(value),
                                                                        "valid value",
                                                                        detail)));
    }

    /// True when nothing the descriptor would read is present at all.
    private static boolean isAbsent(Descriptor<?> descriptor, Context context) {
        if (descriptor instanceof Value<?>) {
            return context.tree()
                          .isEmpty();
        }
        if (descriptor instanceof Nested<?> nested) {
            return isAbsent(nested.inner(), context.nested(nested.key()));
        }
        if (descriptor instanceof Zip<?, ?> zip) {
            return isAbsent(zip.left(), context) && isAbsent(zip.right(), context);
        }
        if (descriptor instanceof OrElseEither<?, ?> orElseEither) {
            return isAbsent(orElseEither.left(), context) && isAbsent(orElseEither.right(), context);
        }
        if (descriptor instanceof OrElse<?> orElse) {
            return isAbsent(orElse.primary(), context) && isAbsent(orElse.fallback(), context);
        }
        if (descriptor instanceof SequenceOf<?> || descriptor instanceof MapOf<?>) {
            return isAbsentSequence(context.tree());
        }
        if (descriptor instanceof OptionalOf<?> optional) {
            return isAbsent(optional.inner(), context);
        }
        if (descriptor instanceof Default<?> withDefault) {
            return isAbsent(withDefault.inner(), context);
        }
        if (descriptor instanceof Transform<?, ?> transform) {
            return isAbsent(transform.inner(), context);
        }
        if (descriptor instanceof Describe<?> describe) {
            return isAbsent(describe.inner(), context);
        }
        if (descriptor instanceof SourcedFrom<?> sourced) {
            return sourced.source()
                          .failure()
                          .isEmpty() && isAbsent(sourced.inner(), context.withSource(sourced.source()));
        }
        if (descriptor instanceof Lazy<?> lazy) {
            return isAbsent(lazy.supplier()
                                .get(), context);
        }
        throw new IllegalStateException("Unknown descriptor " + descriptor.getClass());
    }

    /// An empty list is a value; a list holding nothing but empty elements is not.
    private static boolean isAbsentSequence(PropertyTree<String> tree) {
        if (tree instanceof Sequence<String> sequence && sequence.elements()
                                                                 .isEmpty()) {
            return false;
        }
        return tree.isEmpty();
    }

    private static Optional<String> firstLeaf(PropertyTree<String> tree) {
        if (tree instanceof Leaf<String> leaf) {
            return Optional.of(leaf.value());
        }
        if (tree instanceof Sequence<String> sequence) {
            return sequence.elements()
                           .stream()
                           .map(ConfigReader::firstLeaf)
                           .flatMap(Optional::stream)
                           .findFirst();
        }
        return Optional.empty();
    }

    private static String render(PropertyTree<String> tree) {
        if (tree instanceof Leaf<String> leaf) {
            return leaf.value();
        }
        if (tree instanceof Branch<String>) {
            return "{...}";
        }
        if (tree instanceof Sequence<String>) {
            return "[...]";
        }
        return "";
    }

    private static ReadError leftOf(Either<ReadError, ?> result) {
        return result.leftValue()
                     .orElseThrow();
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(Object value) {
        return (T) value;
    }

    /// Position of the reader: the source, the keys to query it with and the full path for
    /// diagnostics. Inside a sequence element the source is the element itself.
    private record Context(ConfigSource source, List<String> keys, List<Step> path) {
        static Context root(ConfigSource source) {
            return new Context(source, List.of(), List.of());
        }

        PropertyTree<String> tree() {
            return source.getValue(keys);
        }

        Context nested(String key) {
            return new Context(source, append(keys, key), append(path, Step.key(key)));
        }

        Context element(int index, PropertyTree<String> element) {
            return new Context(new ElementSource(source, keys, element), List.of(), append(path, Step.index(index)));
        }

        Context withSource(ConfigSource other) {
            return new Context(other, keys, path);
        }

        private static <T> List<T> append(List<T> list, T element) {
            var result = new ArrayList<T>(list.size() + 1);
            result.addAll(list);
            result.add(element);
            return List.copyOf(result);
        }
    }

    /// Source answering from one element of a sequence. Names and policy are those of the source
    /// holding the sequence and are looked up only when asked for.
    private record ElementSource(ConfigSource parent,
                                 List<String> parentKeys,
                                 PropertyTree<String> element) implements ConfigSource {
        @Override
        public Set<String> names() {
            return parent.names();
        }

        @Override
        public PropertyTree<String> getValue(List<String> path) {
            return element.getPath(path);
        }

        @Override
        public LeafForSequence leafForSequence() {
            return parent.leafForSequence(parentKeys);
        }

        @Override
        public String toString() {
            return "element of " + parent;
        }
    }
}
