package org.pragmatica.config.cli;

import java.util.Optional;

/// Classification of a single command line argument.
sealed interface Token {
    /// `--key=value` in one argument.
    record Both(String key, String value) implements Token {}

    /// `--key` alone, its value is expected in the following arguments.
    record KeyOnly(String key) implements Token {}

    /// Plain value, positional or belonging to a preceding key.
    record ValueOnly(String value) implements Token {}

    /// Classify an argument. The argument is split at the first `=` only.
    ///
    /// @param argument Non-empty command line argument
    /// @return Token, empty when neither side of the argument carries anything
    static Optional<Token> classify(String argument) {
        var parts = argument.split("=", 2);
        var keyPart = parts[0].isEmpty() ? Optional.<String>empty() : Optional.of(parts[0]);
        var valuePart = parts.length > 1 ? Optional.of(parts[1]) : Optional.<String>empty();

        if (keyPart.isPresent() && valuePart.isPresent()) {
            var value = valuePart.get();
            return Optional.of(keyName(keyPart.get()).<Token>map(key -> value.isEmpty()
                                                                        ? new KeyOnly(key)
                                                                        : new Both(key, value))
                                                     .orElseGet(() -> new ValueOnly(value)));
        }
        if (valuePart.isPresent()) {
            return Optional.of(new ValueOnly(valuePart.get()));
        }
        if (keyPart.isPresent()) {
            var text = keyPart.get();
            return Optional.of(keyName(text).<Token>map(KeyOnly::new)
                                            .orElseGet(() -> new ValueOnly(text)));
        }
        return Optional.empty();
    }

    /// Key name of a dashed argument with all leading dashes removed.
    private static Optional<String> keyName(String text) {
        if (!text.startsWith("-")) {
            return Optional.empty();
        }
        var start = 0;
        while (start < text.length() && text.charAt(start) == '-') {
            start++;
        }
        return start < text.length() ? Optional.of(text.substring(start)) : Optional.empty();
    }
}
