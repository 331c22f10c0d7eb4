package org.pragmatica.config.cli;

import org.pragmatica.config.source.ConfigSource;
import org.pragmatica.config.source.TreeConfigSource;
import org.pragmatica.config.tree.LeafForSequence;

import java.util.List;
import java.util.Optional;

/// Configuration source built from command line arguments.
///
/// Example with key delimiter `.` and value delimiter `,`:
/// ```
/// --db.username=admin --db.password=secret --regions 111,122
/// ```
/// reads as a `db` record with `username` and `password` and a `regions` list.
public final class CommandLineConfigSource {
    public static final String SOURCE_NAME = "command line arguments";

    private CommandLineConfigSource() {}

    /// Create a source from command line arguments.
    ///
    /// @param args           Arguments as passed to `main`
    /// @param keyDelimiter   Splits keys into nested keys
    /// @param valueDelimiter Splits values into lists
    /// @return New source
    public static ConfigSource commandLineConfigSource(List<String> args,
                                                       Optional<Character> keyDelimiter,
                                                       Optional<Character> valueDelimiter) {
        var trees = ArgsTokenizer.argsTokenizer(keyDelimiter, valueDelimiter)
                                 .tokenize(args);
        return TreeConfigSource.fromTrees(trees, SOURCE_NAME, LeafForSequence.VALID);
    }
}
