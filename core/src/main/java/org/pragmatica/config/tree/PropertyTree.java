package org.pragmatica.config.tree;

import org.pragmatica.config.Either;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.regex.Pattern;

/// Generic hierarchical representation of configuration data.
///
/// Every source of configuration (command line, environment, property files, structured
/// documents) is turned into a tree of this shape before it is read, and every written
/// configuration value comes back as one.
///
/// Trees are immutable. All operations return new trees.
///
/// @param <V> Leaf value type
public sealed interface PropertyTree<V> {
    /// Single scalar value.
    record Leaf<V>(V value) implements PropertyTree<V> {
        public Leaf {
            Objects.requireNonNull(value, "value");
        }
    }

    /// Mapping from unique keys to subtrees. Key order carries no meaning.
    record Branch<V>(Map<String, PropertyTree<V>> children) implements PropertyTree<V> {
        public Branch {
            children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        }
    }

    /// Ordered, possibly empty list of subtrees.
    record Sequence<V>(List<PropertyTree<V>> elements) implements PropertyTree<V> {
        public Sequence {
            elements = List.copyOf(elements);
        }
    }

    /// Absence of a value.
    record Empty<V>() implements PropertyTree<V> {}

    static <V> PropertyTree<V> leaf(V value) {
        return new Leaf<>(value);
    }

    static <V> PropertyTree<V> branch(Map<String, PropertyTree<V>> children) {
        return new Branch<>(children);
    }

    static <V> PropertyTree<V> branch(String key, PropertyTree<V> child) {
        return new Branch<>(Map.of(key, child));
    }

    static <V> PropertyTree<V> sequence(List<PropertyTree<V>> elements) {
        return new Sequence<>(elements);
    }

    @SafeVarargs
    static <V> PropertyTree<V> sequence(PropertyTree<V>... elements) {
        return new Sequence<>(List.of(elements));
    }

    /// Sequence of leaves holding the given values.
    static <V> PropertyTree<V> sequenceOfLeaves(List<V> values) {
        return new Sequence<>(values.stream()
                                    .map(PropertyTree::leaf)
                                    .toList());
    }

    static <V> PropertyTree<V> empty() {
        return new Empty<>();
    }

    /// Single-branch tree placing `tree` under the given keys.
    static <V> PropertyTree<V> fromPath(List<String> path, PropertyTree<V> tree) {
        var result = tree;
        for (int i = path.size() - 1; i >= 0; i--) {
            result = branch(path.get(i), result);
        }
        return result;
    }

    /// Single-branch tree placing a sequence of leaves under the given keys.
    static <V> PropertyTree<V> unflatten(List<String> path, List<V> values) {
        return fromPath(path, sequenceOfLeaves(values));
    }

    /// Rebuild trees from flattened entries.
    ///
    /// Entries sharing a key prefix end up in a common branch, entries differing in a
    /// sequence position build a sequence, and values of entries with the same full path
    /// accumulate into one sequence of leaves. Conflicting shapes at the same position
    /// (for example a leaf and a branch) produce several alternative trees, in the order
    /// branch, indexed sequence, leaves.
    static <V> List<PropertyTree<V>> unflatten(List<FlatEntry<V>> entries) {
        return unflattenLevel(entries);
    }

    /// Trees built from a flat string map. Keys are split by `keyDelimiter`,
    /// values by `valueDelimiter` (trimmed), when present.
    static List<PropertyTree<String>> fromStringMap(Map<String, String> map,
                                                    Optional<Character> keyDelimiter,
                                                    Optional<Character> valueDelimiter) {
        var trees = new ArrayList<PropertyTree<String>>();
        map.forEach((key, value) -> trees.add(unflatten(splitKey(key, keyDelimiter), splitValue(value, valueDelimiter))));
        return mergeAll(trees);
    }

    /// Merge a list of trees, earlier trees on the left of every merge.
    static <V> List<PropertyTree<V>> mergeAll(List<PropertyTree<V>> trees) {
        if (trees.isEmpty()) {
            return List.of();
        }
        List<PropertyTree<V>> accumulated = List.of(trees.get(trees.size() - 1));
        for (int i = trees.size() - 2; i >= 0; i--) {
            var tree = trees.get(i);
            var next = new ArrayList<PropertyTree<V>>();
            accumulated.forEach(right -> next.addAll(tree.merge(right)));
            accumulated = next;
        }
        return accumulated;
    }

    /// True when the tree holds no leaf at all.
    default boolean isEmpty() {
        if (this instanceof Leaf<V>) {
            return false;
        }
        if (this instanceof Branch<V> branch) {
            return branch.children()
                         .values()
                         .stream()
                         .allMatch(PropertyTree::isEmpty);
        }
        if (this instanceof Sequence<V> sequence) {
            return sequence.elements()
                           .stream()
                           .allMatch(PropertyTree::isEmpty);
        }
        return true;
    }

    /// Apply `mapper` to every leaf value, preserving shape.
    default <W> PropertyTree<W> map(Function<? super V, ? extends W> mapper) {
        if (this instanceof Leaf<V> leaf) {
            return leaf(mapper.apply(leaf.value()));
        }
        if (this instanceof Branch<V> branch) {
            var children = new LinkedHashMap<String, PropertyTree<W>>();
            branch.children()
                  .forEach((key, child) -> children.put(key, child.map(mapper)));
            return branch(children);
        }
        if (this instanceof Sequence<V> sequence) {
            return sequence(sequence.elements()
                                    .stream()
                                    .<PropertyTree<W>>map(element -> element.map(mapper))
                                    .toList());
        }
        return empty();
    }

    /// Pair leaves at corresponding positions. Positions present in only one of the trees,
    /// or holding different shapes, become [Empty].
    default <W, X> PropertyTree<X> zipWith(PropertyTree<W> other, BiFunction<? super V, ? super W, ? extends X> combiner) {
        if (this instanceof Leaf<V> left && other instanceof Leaf<W> right) {
            return leaf(combiner.apply(left.value(), right.value()));
        }
        if (this instanceof Branch<V> left && other instanceof Branch<W> right) {
            var keys = new LinkedHashSet<>(left.children()
                                               .keySet());
            keys.addAll(right.children()
                             .keySet());
            var children = new LinkedHashMap<String, PropertyTree<X>>();
            for (var key : keys) {
                var leftChild = left.children()
                                    .getOrDefault(key, empty());
                var rightChild = right.children()
                                      .getOrDefault(key, empty());
                children.put(key, leftChild.zipWith(rightChild, combiner));
            }
            return branch(children);
        }
        if (this instanceof Sequence<V> left && other instanceof Sequence<W> right) {
            var size = Math.max(left.elements()
                                    .size(),
                                right.elements()
                                     .size());
            var elements = new ArrayList<PropertyTree<X>>(size);
            for (int i = 0; i < size; i++) {
                elements.add(elementAt(left, i).zipWith(elementAt(right, i), combiner));
            }
            return sequence(elements);
        }
        return empty();
    }

    /// Subtree at the given keys. A sequence on the way answers with the sequence of the
    /// lookups in each of its elements; anything else missing is [Empty].
    default PropertyTree<V> getPath(List<String> path) {
        if (path.isEmpty()) {
            return this;
        }
        if (this instanceof Branch<V> branch) {
            return branch.children()
                         .getOrDefault(path.get(0), empty())
                         .getPath(path.subList(1, path.size()));
        }
        if (this instanceof Sequence<V> sequence) {
            return sequence(sequence.elements()
                                    .stream()
                                    .map(element -> element.getPath(path))
                                    .toList());
        }
        return empty();
    }

    /// Merge with another tree.
    ///
    /// Branches merge key by key, sequences concatenate, an empty side yields the other side.
    /// Any other combination cannot be reconciled and both trees are returned, this tree first.
    default List<PropertyTree<V>> merge(PropertyTree<V> other) {
        if (this instanceof Sequence<V> left && other instanceof Sequence<V> right) {
            var elements = new ArrayList<>(left.elements());
            elements.addAll(right.elements());
            return List.of(sequence(elements));
        }
        if (this instanceof Branch<V> left && other instanceof Branch<V> right) {
            return mergeBranches(left, right);
        }
        if (isEmpty()) {
            return List.of(other);
        }
        if (other.isEmpty()) {
            return List.of(this);
        }
        return List.of(this, other);
    }

    /// Remove empty branch entries and sequence elements, recursively. A tree without any
    /// leaf becomes [Empty].
    default PropertyTree<V> dropEmpty() {
        if (isEmpty()) {
            return empty();
        }
        if (this instanceof Branch<V> branch) {
            var children = new LinkedHashMap<String, PropertyTree<V>>();
            branch.children()
                  .forEach((key, child) -> {
                      if (!child.isEmpty()) {
                          children.put(key, child.dropEmpty());
                      }
                  });
            return branch(children);
        }
        if (this instanceof Sequence<V> sequence) {
            return sequence(sequence.elements()
                                    .stream()
                                    .filter(element -> !element.isEmpty())
                                    .map(PropertyTree::dropEmpty)
                                    .toList());
        }
        return this;
    }

    /// Replace every sequence of exactly one element with that element, recursively.
    default PropertyTree<V> unwrapSingletonLists() {
        if (this instanceof Branch<V> branch) {
            var children = new LinkedHashMap<String, PropertyTree<V>>();
            branch.children()
                  .forEach((key, child) -> children.put(key, child.unwrapSingletonLists()));
            return branch(children);
        }
        if (this instanceof Sequence<V> sequence) {
            if (sequence.elements()
                        .size() == 1) {
                return sequence.elements()
                               .get(0)
                               .unwrapSingletonLists();
            }
            return sequence(sequence.elements()
                                    .stream()
                                    .map(PropertyTree::unwrapSingletonLists)
                                    .toList());
        }
        return this;
    }

    /// Mark every absent position with `error` and every leaf as present.
    default <E> PropertyTree<Either<E, V>> mapEmptyToError(E error) {
        if (this instanceof Leaf<V> leaf) {
            return leaf(Either.<E, V>right(leaf.value()));
        }
        if (this instanceof Branch<V> branch) {
            var children = new LinkedHashMap<String, PropertyTree<Either<E, V>>>();
            branch.children()
                  .forEach((key, child) -> children.put(key, child.mapEmptyToError(error)));
            return branch(children);
        }
        if (this instanceof Sequence<V> sequence) {
            return sequence(sequence.elements()
                                    .stream()
                                    .map(element -> element.<E>mapEmptyToError(error))
                                    .toList());
        }
        return leaf(Either.<E, V>left(error));
    }

    /// Flatten into paths and the leaf values found at each of them.
    ///
    /// A sequence made only of leaves yields a single entry with all values. Any other
    /// sequence is flattened element by element under an [Step.Index] step.
    default List<FlatEntry<V>> flatten() {
        var result = new ArrayList<FlatEntry<V>>();
        flattenInto(List.of(), this, result);
        return List.copyOf(result);
    }

    /// Flatten with paths joined into strings by `delimiter`.
    default Map<String, List<V>> flattenString(String delimiter) {
        var result = new LinkedHashMap<String, List<V>>();
        for (var entry : flatten()) {
            var key = String.join(delimiter,
                                  entry.path()
                                       .stream()
                                       .map(PropertyTree::stepText)
                                       .toList());
            result.computeIfAbsent(key, _k -> new ArrayList<>())
                  .addAll(entry.values());
        }
        return result;
    }

    private static String stepText(Step step) {
        if (step instanceof Step.Index index) {
            return String.valueOf(index.position());
        }
        return ((Step.Key) step).name();
    }

    private static <V> PropertyTree<V> elementAt(Sequence<V> sequence, int index) {
        return index < sequence.elements()
                               .size()
               ? sequence.elements()
                         .get(index)
               : empty();
    }

    private static <V> List<PropertyTree<V>> mergeBranches(Branch<V> left, Branch<V> right) {
        var keys = new LinkedHashSet<>(left.children()
                                           .keySet());
        keys.addAll(right.children()
                         .keySet());
        var keyOrder = new ArrayList<String>(keys);
        var options = new ArrayList<List<PropertyTree<V>>>();
        for (var key : keyOrder) {
            var leftChild = left.children()
                                .get(key);
            var rightChild = right.children()
                                  .get(key);
            if (leftChild != null && rightChild != null) {
                options.add(leftChild.merge(rightChild));
            } else {
                options.add(List.of(leftChild != null ? leftChild : rightChild));
            }
        }
        return cartesian(options).stream()
                                 .map(children -> toBranch(keyOrder, children))
                                 .toList();
    }

    private static <V> PropertyTree<V> toBranch(List<String> keys, List<PropertyTree<V>> children) {
        var map = new LinkedHashMap<String, PropertyTree<V>>();
        for (int i = 0; i < keys.size(); i++) {
            map.put(keys.get(i), children.get(i));
        }
        return branch(map);
    }

    /// Every combination picking one element from each list, in order.
    private static <T> List<List<T>> cartesian(List<List<T>> options) {
        List<List<T>> combinations = List.of(List.of());
        for (var option : options) {
            var next = new ArrayList<List<T>>();
            for (var prefix : combinations) {
                for (var element : option) {
                    var combination = new ArrayList<T>(prefix);
                    combination.add(element);
                    next.add(combination);
                }
            }
            combinations = next;
        }
        return combinations;
    }

    private static <V> void flattenInto(List<Step> prefix, PropertyTree<V> tree, List<FlatEntry<V>> result) {
        if (tree instanceof Leaf<V> leaf) {
            result.add(FlatEntry.flatEntry(prefix, List.of(leaf.value())));
        } else if (tree instanceof Branch<V> branch) {
            branch.children()
                  .forEach((key, child) -> flattenInto(append(prefix, Step.key(key)), child, result));
        } else if (tree instanceof Sequence<V> sequence) {
            var elements = sequence.elements();
            if (!elements.isEmpty() && elements.stream()
                                               .allMatch(Leaf.class::isInstance)) {
                result.add(FlatEntry.flatEntry(prefix,
                                               elements.stream()
                                                       .map(element -> ((Leaf<V>) element).value())
                                                       .toList()));
            } else {
                for (int i = 0; i < elements.size(); i++) {
                    flattenInto(append(prefix, Step.index(i)), elements.get(i), result);
                }
            }
        }
    }

    private static List<Step> append(List<Step> prefix, Step step) {
        var path = new ArrayList<Step>(prefix.size() + 1);
        path.addAll(prefix);
        path.add(step);
        return path;
    }

    private static <V> List<PropertyTree<V>> unflattenLevel(List<FlatEntry<V>> entries) {
        var terminal = new ArrayList<V>();
        var keyed = new LinkedHashMap<String, List<FlatEntry<V>>>();
        var indexed = new TreeMap<Integer, List<FlatEntry<V>>>();

        for (var entry : entries) {
            if (entry.isTerminal()) {
                terminal.addAll(entry.values());
            } else if (entry.head() instanceof Step.Key key) {
                keyed.computeIfAbsent(key.name(), _k -> new ArrayList<>())
                     .add(entry.tail());
            } else {
                indexed.computeIfAbsent(((Step.Index) entry.head()).position(), _k -> new ArrayList<>())
                       .add(entry.tail());
            }
        }

        var alternatives = new ArrayList<PropertyTree<V>>();
        if (!keyed.isEmpty()) {
            var keys = new ArrayList<>(keyed.keySet());
            var options = keys.stream()
                              .map(key -> unflattenLevel(keyed.get(key)))
                              .toList();
            cartesian(options).forEach(children -> alternatives.add(toBranch(keys, children)));
        }
        if (!indexed.isEmpty()) {
            var options = new ArrayList<List<PropertyTree<V>>>();
            for (int i = 0; i <= indexed.lastKey(); i++) {
                var atPosition = indexed.get(i);
                options.add(atPosition == null ? List.of(empty()) : unflattenLevel(atPosition));
            }
            cartesian(options).forEach(elements -> alternatives.add(sequence(elements)));
        }
        if (!terminal.isEmpty()) {
            alternatives.add(sequenceOfLeaves(terminal));
        }
        if (alternatives.isEmpty()) {
            alternatives.add(empty());
        }
        return alternatives;
    }

    private static List<String> splitKey(String key, Optional<Character> delimiter) {
        return delimiter.map(c -> List.of(key.split(Pattern.quote(String.valueOf(c)))))
                        .map(parts -> parts.stream()
                                           .filter(part -> !part.isBlank())
                                           .toList())
                        .orElse(List.of(key));
    }

    private static List<String> splitValue(String value, Optional<Character> delimiter) {
        return delimiter.map(c -> List.of(value.split(Pattern.quote(String.valueOf(c)))))
                        .map(parts -> parts.stream()
                                           .map(String::trim)
                                           .toList())
                        .orElse(List.of(value));
    }
}
