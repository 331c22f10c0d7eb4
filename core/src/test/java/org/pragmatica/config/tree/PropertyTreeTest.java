package org.pragmatica.config.tree;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.config.Either;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.config.tree.PropertyTree.branch;
import static org.pragmatica.config.tree.PropertyTree.empty;
import static org.pragmatica.config.tree.PropertyTree.leaf;
import static org.pragmatica.config.tree.PropertyTree.sequence;
import static org.pragmatica.config.tree.PropertyTree.sequenceOfLeaves;

class PropertyTreeTest {
    private static final PropertyTree<String> SAMPLE = branch(Map.of("db",
                                                                     branch(Map.of("host", leaf("localhost"),
                                                                                   "ports", sequenceOfLeaves(List.of("1", "2")))),
                                                                     "users",
                                                                     sequence(branch("name", leaf("a")),
                                                                              branch("name", leaf("b")))));

    @Nested
    class FunctorTests {
        @Test
        void map_preservesTree_whenIdentity() {
            randomTrees(50).forEach(tree -> assertThat(tree.map(Function.identity())).isEqualTo(tree));
        }

        @Test
        void map_composes() {
            Function<String, String> f = value -> value + "!";
            Function<String, Integer> g = String::length;

            randomTrees(50).forEach(tree -> assertThat(tree.map(f)
                                                           .map(g)).isEqualTo(tree.map(f.andThen(g))));
        }

        @Test
        void map_appliesToEveryLeaf() {
            var result = SAMPLE.map(String::toUpperCase);

            assertThat(result.getPath(List.of("db", "host"))).isEqualTo(leaf("LOCALHOST"));
            assertThat(result.getPath(List.of("users", "name"))).isEqualTo(sequence(leaf("A"), leaf("B")));
        }
    }

    @Nested
    class ZipTests {
        @Test
        void zipWith_returnsSameTree_whenPickingEitherSideOfItself() {
            randomTrees(50).forEach(tree -> {
                assertThat(tree.zipWith(tree, (left, right) -> left)).isEqualTo(tree);
                assertThat(tree.zipWith(tree, (left, right) -> right)).isEqualTo(tree);
            });
        }

        @Test
        void zipWith_producesEmpty_whenShapesDiffer() {
            var left = sequenceOfLeaves(List.of("1", "2"));
            var right = sequenceOfLeaves(List.of("a"));

            var result = left.zipWith(right, (l, r) -> l + r);

            assertThat(result).isEqualTo(sequence(leaf("1a"), empty()));
        }

        @Test
        void zipWith_producesEmpty_whenLeafMeetsBranch() {
            PropertyTree<String> left = leaf("1");
            PropertyTree<String> right = branch("a", leaf("2"));

            assertThat(left.zipWith(right, (l, r) -> l + r)).isEqualTo(empty());
        }
    }

    @Nested
    class PathTests {
        @Test
        void getPath_returnsSubtree_whenPresent() {
            assertThat(SAMPLE.getPath(List.of("db", "ports"))).isEqualTo(sequenceOfLeaves(List.of("1", "2")));
        }

        @Test
        void getPath_returnsEmpty_whenMissing() {
            assertThat(SAMPLE.getPath(List.of("db", "user"))).isEqualTo(empty());
            assertThat(SAMPLE.getPath(List.of("db", "host", "deeper"))).isEqualTo(empty());
        }

        @Test
        void getPath_looksIntoEveryElement_whenSequenceOnTheWay() {
            assertThat(SAMPLE.getPath(List.of("users", "name"))).isEqualTo(sequence(leaf("a"), leaf("b")));
        }

        @Test
        void fromPath_buildsSingleBranch() {
            var tree = PropertyTree.fromPath(List.of("a", "b"), leaf("x"));

            assertThat(tree).isEqualTo(branch("a", branch("b", leaf("x"))));
        }
    }

    @Nested
    class MergeTests {
        @Test
        void merge_combinesBranchesKeyByKey() {
            PropertyTree<String> first = branch("db", branch("host", leaf("h")));
            PropertyTree<String> second = branch("db", branch("port", leaf("1")));

            var result = first.merge(second);

            assertThat(result).containsExactly(branch("db", branch(Map.of("host", leaf("h"), "port", leaf("1")))));
        }

        @Test
        void merge_concatenatesSequences() {
            var result = sequenceOfLeaves(List.of("1")).merge(sequenceOfLeaves(List.of("2", "3")));

            assertThat(result).containsExactly(sequenceOfLeaves(List.of("1", "2", "3")));
        }

        @Test
        void merge_returnsBothTrees_whenLeavesConflict() {
            PropertyTree<String> first = branch("a", leaf("1"));
            PropertyTree<String> second = branch("a", leaf("2"));

            var result = first.merge(second);

            assertThat(result).containsExactly(branch("a", leaf("1")), branch("a", leaf("2")));
        }

        @Test
        void merge_returnsOtherSide_whenOneSideIsEmpty() {
            PropertyTree<String> tree = leaf("1");

            assertThat(tree.merge(empty())).containsExactly(tree);
            assertThat(PropertyTree.<String>empty()
                                   .merge(tree)).containsExactly(tree);
        }

        @Test
        void mergeAll_keepsEarlierTreesFirst() {
            var trees = List.<PropertyTree<String>>of(branch("a", sequenceOfLeaves(List.of("1"))),
                                                      branch("a", sequenceOfLeaves(List.of("2"))),
                                                      branch("a", sequenceOfLeaves(List.of("3"))));

            assertThat(PropertyTree.mergeAll(trees)).containsExactly(branch("a", sequenceOfLeaves(List.of("1", "2", "3"))));
        }

        @Test
        void mergeAll_returnsNothing_whenNoTrees() {
            assertThat(PropertyTree.<String>mergeAll(List.of())).isEmpty();
        }
    }

    @Nested
    class NormalizationTests {
        @Test
        void isEmpty_isStructural() {
            assertThat(PropertyTree.<String>empty()
                                   .isEmpty()).isTrue();
            assertThat(PropertyTree.<String>sequence(List.of())
                                   .isEmpty()).isTrue();
            assertThat(branch("a", sequence(PropertyTree.<String>empty())).isEmpty()).isTrue();
            assertThat(branch("a", leaf("1")).isEmpty()).isFalse();
        }

        @Test
        void dropEmpty_removesEmptyChildren() {
            var tree = branch(Map.of("a", leaf("1"), "b", PropertyTree.<String>empty(), "c", sequence(empty(), leaf("2"))));

            assertThat(tree.dropEmpty()).isEqualTo(branch(Map.of("a", leaf("1"), "c", sequence(leaf("2")))));
        }

        @Test
        void dropEmpty_returnsEmpty_whenNoLeafAtAll() {
            var tree = branch("a", branch("b", PropertyTree.<String>empty()));

            assertThat(tree.dropEmpty()).isEqualTo(empty());
        }

        @Test
        void unwrapSingletonLists_collapsesOneElementSequences() {
            var tree = branch(Map.of("a", sequence(leaf("1")), "b", sequence(sequence(leaf("2")), leaf("3"))));

            assertThat(tree.unwrapSingletonLists()).isEqualTo(branch(Map.of("a", leaf("1"), "b", sequence(leaf("2"), leaf("3")))));
        }

        @Test
        void mapEmptyToError_marksAbsentPositions() {
            var tree = branch(Map.of("a", leaf("1"), "b", PropertyTree.<String>empty()));

            var result = tree.mapEmptyToError("missing");

            assertThat(result.getPath(List.of("a"))).isEqualTo(leaf(Either.right("1")));
            assertThat(result.getPath(List.of("b"))).isEqualTo(leaf(Either.left("missing")));
        }
    }

    @Nested
    class FlattenTests {
        @Test
        void flatten_groupsLeafSequenceIntoSingleEntry() {
            var entries = branch("ports", sequenceOfLeaves(List.of("1", "2"))).flatten();

            assertThat(entries).containsExactly(FlatEntry.keyed(List.of("ports"), List.of("1", "2")));
        }

        @Test
        void flatten_addressesRecordsInSequenceByIndex() {
            var entries = branch("users", sequence(branch("name", leaf("a")), branch("name", leaf("b")))).flatten();

            assertThat(entries).containsExactly(FlatEntry.flatEntry(List.of(Step.key("users"), Step.index(0), Step.key("name")),
                                                                    List.of("a")),
                                                FlatEntry.flatEntry(List.of(Step.key("users"), Step.index(1), Step.key("name")),
                                                                    List.of("b")));
        }

        @Test
        void flattenString_joinsPathWithDelimiter() {
            var result = SAMPLE.flattenString(".");

            assertThat(result).containsEntry("db.host", List.of("localhost"))
                              .containsEntry("db.ports", List.of("1", "2"))
                              .containsEntry("users.0.name", List.of("a"))
                              .containsEntry("users.1.name", List.of("b"));
        }

        @Test
        void unflatten_invertsFlatten_uptoSingletonLists() {
            randomTrees(50).forEach(tree -> {
                var rebuilt = PropertyTree.unflatten(tree.flatten());

                assertThat(rebuilt).hasSize(1);
                assertThat(rebuilt.get(0)
                                  .unwrapSingletonLists()).isEqualTo(tree.unwrapSingletonLists());
            });
        }

        @Test
        void unflatten_producesAlternatives_whenShapesConflict() {
            var entries = List.of(FlatEntry.keyed(List.of("a"), List.of("1")),
                                  FlatEntry.keyed(List.of("a", "b"), List.of("2")));

            var result = PropertyTree.unflatten(entries);

            assertThat(result).containsExactly(branch("a", branch("b", sequenceOfLeaves(List.of("2")))),
                                               branch("a", sequenceOfLeaves(List.of("1"))));
        }

        @Test
        void unflatten_accumulatesValuesOfSamePath() {
            var entries = List.of(FlatEntry.keyed(List.of("ints"), List.of("1")),
                                  FlatEntry.keyed(List.of("ints"), List.of("2")));

            assertThat(PropertyTree.unflatten(entries)).containsExactly(branch("ints", sequenceOfLeaves(List.of("1", "2"))));
        }

        @Test
        void fromStringMap_splitsKeysAndValues() {
            var map = new LinkedHashMap<String, String>();
            map.put("db.host", "h");
            map.put("db.ports", "1, 2");

            var result = PropertyTree.fromStringMap(map, Optional.of('.'), Optional.of(','));

            assertThat(result).containsExactly(branch("db",
                                                      branch(Map.of("host", sequenceOfLeaves(List.of("h")),
                                                                    "ports", sequenceOfLeaves(List.of("1", "2"))))));
        }
    }

    /// Trees without empty positions and without one-element sequences, so flattening loses nothing.
    static List<PropertyTree<String>> randomTrees(int count) {
        var random = new Random(42);
        var trees = new ArrayList<PropertyTree<String>>();
        for (int i = 0; i < count; i++) {
            trees.add(randomTree(random, 3));
        }
        return trees;
    }

    private static PropertyTree<String> randomTree(Random random, int depth) {
        var kind = depth == 0 ? 0 : random.nextInt(3);
        if (kind == 0) {
            return leaf("v" + random.nextInt(100));
        }
        if (kind == 1) {
            var children = new LinkedHashMap<String, PropertyTree<String>>();
            var size = 1 + random.nextInt(3);
            for (int i = 0; i < size; i++) {
                children.put("k" + i, randomTree(random, depth - 1));
            }
            return branch(children);
        }
        var elements = new ArrayList<PropertyTree<String>>();
        var size = 2 + random.nextInt(2);
        for (int i = 0; i < size; i++) {
            elements.add(randomTree(random, depth - 1));
        }
        return sequence(elements);
    }
}
