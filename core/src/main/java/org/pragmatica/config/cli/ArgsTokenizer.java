package org.pragmatica.config.cli;

import org.pragmatica.config.cli.Token.Both;
import org.pragmatica.config.cli.Token.KeyOnly;
import org.pragmatica.config.cli.Token.ValueOnly;
import org.pragmatica.config.tree.PropertyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/// Turns a list of command line arguments into property trees.
///
/// Arguments are consumed two at a time with one argument of lookahead, which is what it
/// takes to tell `--key value` from `--key=value`. Supported forms:
///
/// ```
/// --key=value      -key=value      key assignment
/// --key value                      key followed by its value
/// --outer --inner=value            nested assignment
/// value                            positional value
/// ```
/// Repeated keys accumulate into a sequence.
public final class ArgsTokenizer {
    private static final Logger log = LoggerFactory.getLogger(ArgsTokenizer.class);

    private final Optional<Character> keyDelimiter;
    private final Optional<Character> valueDelimiter;

    private ArgsTokenizer(Optional<Character> keyDelimiter, Optional<Character> valueDelimiter) {
        this.keyDelimiter = keyDelimiter;
        this.valueDelimiter = valueDelimiter;
    }

    /// Create tokenizer.
    ///
    /// @param keyDelimiter   Splits a key into nested keys, e.g. `.` for `--db.port=5432`
    /// @param valueDelimiter Splits a value into a sequence, e.g. `,` for `--hosts=a,b`
    /// @return New tokenizer
    public static ArgsTokenizer argsTokenizer(Optional<Character> keyDelimiter, Optional<Character> valueDelimiter) {
        return new ArgsTokenizer(keyDelimiter, valueDelimiter);
    }

    /// Tokenize arguments. Empty arguments are ignored.
    ///
    /// @param args Command line arguments
    /// @return Alternative trees, first one preferred; a single [PropertyTree.Empty] when nothing was found
    public List<PropertyTree<String>> tokenize(List<String> args) {
        var nonEmpty = args.stream()
                           .filter(arg -> !arg.isEmpty())
                           .toList();
        var trees = loop(nonEmpty);
        log.debug("Tokenized {} argument(s) into {} partial tree(s)", nonEmpty.size(), trees.size());

        var normalized = PropertyTree.mergeAll(trees)
                                     .stream()
                                     .map(PropertyTree::dropEmpty)
                                     .filter(tree -> !tree.isEmpty())
                                     .map(PropertyTree::unwrapSingletonLists)
                                     .toList();
        return normalized.isEmpty() ? List.of(PropertyTree.empty()) : normalized;
    }

    private List<PropertyTree<String>> loop(List<String> args) {
        if (args.isEmpty()) {
            return List.of();
        }
        if (args.size() == 1) {
            return single(args.get(0));
        }
        var first = Token.classify(args.get(0));
        var second = Token.classify(args.get(1));
        var rest = args.subList(2, args.size());

        if (first.isEmpty() && second.isEmpty()) {
            return loop(rest);
        }
        if (second.isEmpty()) {
            return loop(prepend(args.get(0), rest));
        }
        if (first.isEmpty()) {
            return loop(prepend(args.get(1), rest));
        }
        return pair(first.get(), second.get(), rest);
    }

    private List<PropertyTree<String>> pair(Token first, Token second, List<String> rest) {
        var result = new ArrayList<PropertyTree<String>>();

        if (first instanceof Both both1) {
            result.add(assignment(both1));
            if (second instanceof Both both2) {
                result.add(assignment(both2));
                result.addAll(loop(rest));
            } else if (second instanceof KeyOnly key2) {
                if (!rest.isEmpty()) {
                    loop(List.of(rest.get(0))).forEach(tree -> result.add(nest(key2.key(), tree)));
                    result.addAll(loop(rest.subList(1, rest.size())));
                }
            } else {
                result.add(toSequence(((ValueOnly) second).value()));
                result.addAll(loop(rest));
            }
            return result;
        }

        if (first instanceof KeyOnly key1) {
            if (second instanceof Both both2) {
                result.add(nest(key1.key(), assignment(both2)));
                result.addAll(loop(rest));
            } else if (second instanceof KeyOnly key2) {
                return keyChain(key1, key2, rest);
            } else {
                result.add(nest(key1.key(), toSequence(((ValueOnly) second).value())));
                result.addAll(loop(rest));
            }
            return result;
        }

        var value1 = (ValueOnly) first;
        result.add(toSequence(value1.value()));
        if (second instanceof Both both2) {
            result.add(assignment(both2));
            result.addAll(loop(rest));
        } else if (second instanceof KeyOnly key2) {
            loop(rest).forEach(tree -> result.add(nest(key2.key(), tree)));
        } else {
            result.add(toSequence(((ValueOnly) second).value()));
            result.addAll(loop(rest));
        }
        return result;
    }

    /// Two keys in a row. The chain of keys continues up to the first argument which parses
    /// into a value on its own, and that value is nested under every key of the chain.
    private List<PropertyTree<String>> keyChain(KeyOnly key1, KeyOnly key2, List<String> rest) {
        for (int i = 0; i < rest.size(); i++) {
            var trees = loop(List.of(rest.get(i)));
            if (trees.isEmpty()) {
                continue;
            }
            var keys = new ArrayList<String>();
            keys.add(key1.key());
            keys.add(key2.key());
            for (var argument : rest.subList(0, i)) {
                var token = Token.classify(argument);
                if (token.isEmpty() || !(token.get() instanceof KeyOnly key)) {
                    log.warn("Discarding key chain starting at '{}': '{}' is not a key", key1.key(), argument);
                    return List.of();
                }
                keys.add(key.key());
            }
            var result = new ArrayList<PropertyTree<String>>();
            trees.forEach(tree -> result.add(nestAll(keys, tree)));
            result.addAll(loop(rest.subList(i + 1, rest.size())));
            return result;
        }
        log.warn("Discarding key chain starting at '{}': no value follows", key1.key());
        return List.of();
    }

    private List<PropertyTree<String>> single(String argument) {
        var token = Token.classify(argument);
        if (token.isEmpty()) {
            return List.of();
        }
        if (token.get() instanceof Both both) {
            return List.of(assignment(both));
        }
        if (token.get() instanceof ValueOnly value) {
            return List.of(toSequence(value.value()));
        }
        return List.of();
    }

    private PropertyTree<String> assignment(Both both) {
        return nest(both.key(), toSequence(both.value()));
    }

    private PropertyTree<String> nestAll(List<String> keys, PropertyTree<String> tree) {
        var result = tree;
        for (int i = keys.size() - 1; i >= 0; i--) {
            result = nest(keys.get(i), result);
        }
        return result;
    }

    private PropertyTree<String> nest(String key, PropertyTree<String> tree) {
        return keyDelimiter.map(delimiter -> PropertyTree.fromPath(split(key, delimiter), tree))
                           .orElseGet(() -> PropertyTree.branch(key, tree));
    }

    private PropertyTree<String> toSequence(String value) {
        return valueDelimiter.map(delimiter -> PropertyTree.sequenceOfLeaves(List.of(value.split(Pattern.quote(String.valueOf(delimiter))))))
                             .orElseGet(() -> PropertyTree.sequenceOfLeaves(List.of(value)));
    }

    private static List<String> split(String key, char delimiter) {
        return List.of(key.split(Pattern.quote(String.valueOf(delimiter))))
                   .stream()
                   .filter(part -> !part.isBlank())
                   .toList();
    }

    private static List<String> prepend(String head, List<String> tail) {
        var result = new ArrayList<String>(tail.size() + 1);
        result.add(head);
        result.addAll(tail);
        return result;
    }
}
