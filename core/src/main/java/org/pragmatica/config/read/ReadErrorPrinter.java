package org.pragmatica.config.read;

import org.pragmatica.config.ReadError;
import org.pragmatica.config.ReadError.AndErrors;
import org.pragmatica.config.ReadError.OrErrors;

import java.util.List;

/// Renders a [ReadError] as an indented report, one line per failure.
///
/// ```
/// All of:
///   Missing value at database.host
///   Any of:
///     Invalid value 'abc' at database.port, expected int
///     Missing value at database.socket
/// ```
public final class ReadErrorPrinter {
    private static final String INDENT = "  ";

    private ReadErrorPrinter() {}

    public static String prettyPrint(ReadError error) {
        var builder = new StringBuilder();
        print(error, 0, builder);
        return builder.toString();
    }

    private static void print(ReadError error, int depth, StringBuilder builder) {
        if (error instanceof AndErrors and) {
            printGroup("All of:", and.errors(), depth, builder);
        } else if (error instanceof OrErrors or) {
            printGroup("Any of:", or.errors(), depth, builder);
        } else {
            line(error.message(), depth, builder);
        }
    }

    private static void printGroup(String title, List<ReadError> errors, int depth, StringBuilder builder) {
        line(title, depth, builder);
        errors.forEach(error -> print(error, depth + 1, builder));
    }

    private static void line(String text, int depth, StringBuilder builder) {
        if (builder.length() > 0) {
            builder.append(System.lineSeparator());
        }
        builder.append(INDENT.repeat(depth))
               .append(text);
    }
}
