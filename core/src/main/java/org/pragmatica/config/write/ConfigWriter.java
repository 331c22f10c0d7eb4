package org.pragmatica.config.write;

import org.pragmatica.config.Either;
import org.pragmatica.config.Pair;
import org.pragmatica.config.WriteError;
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
import org.pragmatica.config.descriptor.PropertyType;
import org.pragmatica.config.tree.PropertyTree;
import org.pragmatica.config.tree.PropertyTree.Branch;
import org.pragmatica.config.tree.PropertyTree.Empty;
import org.pragmatica.config.tree.Step;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/// Writes configuration values back into a [PropertyTree], using the same [Descriptor]
/// which reads them.
///
/// Reading the written tree with the same descriptor yields the written value. Defaults are
/// not consulted while writing and descriptions have no effect.
public final class ConfigWriter {
    private ConfigWriter() {}

    /// Write a value.
    ///
    /// @param descriptor Descriptor of the value
    /// @param value      Value to write
    /// @return Tree holding the value, or the error when a conversion rejects the value
    public static <A> Either<WriteError, PropertyTree<String>> write(Descriptor<A> descriptor, A value) {
        return writeAny(descriptor, value, List.of());
    }

    private static Either<WriteError, PropertyTree<String>> writeAny(Descriptor<?> descriptor, Object value, List<Step> path) {
        if (descriptor instanceof Value<?> scalar) {
            PropertyType<Object> type = cast(scalar.type());
            return Either.right(PropertyTree.leaf(type.write(value)));
        }
        if (descriptor instanceof Nested<?> nested) {
            return writeAny(nested.inner(), value, append(path, Step.key(nested.key())))
                .map(tree -> PropertyTree.branch(nested.key(), tree));
        }
        if (descriptor instanceof Zip<?, ?> zip) {
            Pair<?, ?> pair = (Pair<?, ?>) value;
            return writeAny(zip.left(), pair.first(), path)
                .flatMap(left -> writeAny(zip.right(), pair.second(), path)
                    .flatMap(right -> mergeDisjoint(left, right, path)));
        }
        if (descriptor instanceof OrElseEither<?, ?> orElseEither) {
            Either<?, ?> either = (Either<?, ?>) value;
            return either.<Either<WriteError, PropertyTree<String>>>fold(left -> writeAny(orElseEither.left(), left, path),
                                                                         right -> writeAny(orElseEither.right(), right, path));
        }
        if (descriptor instanceof OrElse<?> orElse) {
            var primary = writeAny(orElse.primary(), value, path);
            return primary.isRight() ? primary : writeAny(orElse.fallback(), value, path);
        }
        if (descriptor instanceof SequenceOf<?> sequence) {
            return writeSequence(sequence, (List<?>) value, path);
        }
        if (descriptor instanceof MapOf<?> map) {
            return writeMap(map, (Map<?, ?>) value, path);
        }
        if (descriptor instanceof OptionalOf<?> optional) {
            Optional<?> present = (Optional<?>) value;
            return present.map(inner -> writeAny(optional.inner(), inner, path))
                          .orElseGet(() -> Either.right(PropertyTree.empty()));
        }
        if (descriptor instanceof Default<?> withDefault) {
            return writeAny(withDefault.inner(), value, path);
        }
        if (descriptor instanceof Transform<?, ?> transform) {
            Function<Object, Either<String, Object>> backward = cast(transform.backward());
            return backward.apply(value)
                           .<WriteError>mapLeft(detail -> WriteError.conversionFailed(path, detail))
                           .flatMap(inner -> writeAny(transform.inner(), inner, path));
        }
        if (descriptor instanceof Describe<?> describe) {
            return writeAny(describe.inner(), value, path);
        }
        if (descriptor instanceof SourcedFrom<?> sourced) {
            return writeAny(sourced.inner(), value, path);
        }
        if (descriptor instanceof Lazy<?> lazy) {
            return writeAny(lazy.supplier()
                                .get(), value, path);
        }
        throw new IllegalStateException("Unknown descriptor " + descriptor.getClass());
    }

    private static Either<WriteError, PropertyTree<String>> writeSequence(SequenceOf<?> sequence, List<?> values, List<Step> path) {
        var elements = new ArrayList<PropertyTree<String>>(values.size());
        for (int i = 0; i < values.size(); i++) {
            var element = writeAny(sequence.element(), values.get(i), append(path, Step.index(i)));
            if (element.isLeft()) {
                return element;
            }
            elements.add(element.unwrap());
        }
        return Either.right(PropertyTree.sequence(elements));
    }

    private static Either<WriteError, PropertyTree<String>> writeMap(MapOf<?> map, Map<?, ?> values, List<Step> path) {
        var children = new LinkedHashMap<String, PropertyTree<String>>();
        for (var entry : values.entrySet()) {
            var key = String.valueOf(entry.getKey());
            var child = writeAny(map.element(), entry.getValue(), append(path, Step.key(key)));
            if (child.isLeft()) {
                return child;
            }
            children.put(key, child.unwrap());
        }
        return Either.right(PropertyTree.branch(children));
    }

    /// Union of trees written by the two sides of a zip. Only records can be combined.
    private static Either<WriteError, PropertyTree<String>> mergeDisjoint(PropertyTree<String> left,
                                                                          PropertyTree<String> right,
                                                                          List<Step> path) {
        if (left instanceof Empty<String>) {
            return Either.right(right);
        }
        if (right instanceof Empty<String>) {
            return Either.right(left);
        }
        if (left instanceof Branch<String> leftBranch && right instanceof Branch<String> rightBranch) {
            var children = new LinkedHashMap<>(leftBranch.children());
            for (var entry : rightBranch.children()
                                        .entrySet()) {
                var existing = children.get(entry.getKey());
                if (existing == null) {
                    children.put(entry.getKey(), entry.getValue());
                    continue;
                }
                var merged = mergeDisjoint(existing, entry.getValue(), append(path, Step.key(entry.getKey())));
                if (merged.isLeft()) {
                    return merged;
                }
                children.put(entry.getKey(), merged.unwrap());
            }
            return Either.right(PropertyTree.branch(children));
        }
        return Either.left(WriteError.collision(path));
    }

    private static List<Step> append(List<Step> path, Step step) {
        var result = new ArrayList<Step>(path.size() + 1);
        result.addAll(path);
        result.add(step);
        return List.copyOf(result);
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(Object value) {
        return (T) value;
    }
}
