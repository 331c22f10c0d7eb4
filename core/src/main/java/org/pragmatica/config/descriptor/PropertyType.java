package org.pragmatica.config.descriptor;

import org.pragmatica.config.Either;

import java.util.Objects;
import java.util.function.Function;

/// Conversion between the textual form of a leaf and a scalar value.
///
/// @param <A> Scalar type
public interface PropertyType<A> {
    /// Name of the type, reported as the expected kind in conversion errors.
    String name();

    /// Parse the textual form.
    ///
    /// @param raw Leaf value
    /// @return Parsed value, or a description of why it cannot be parsed
    Either<String, A> read(String raw);

    /// Render the value as text which [#read(String)] accepts.
    String write(A value);

    /// Create a property type from a parser and a printer. Runtime exceptions thrown by the
    /// parser are reported as parse failures.
    ///
    /// @param name    Type name
    /// @param parser  Parser of the textual form
    /// @param printer Printer of the value
    /// @return New property type
    static <A> PropertyType<A> propertyType(String name, Function<String, A> parser, Function<A, String> printer) {
        record propertyType<A>(String name, Function<String, A> parser, Function<A, String> printer)
                implements PropertyType<A> {
            propertyType {
                Objects.requireNonNull(parser, "parser");
                Objects.requireNonNull(printer, "printer");
            }

            @Override
            public Either<String, A> read(String raw) {
                try {
                    var value = parser.apply(raw);
                    return value == null
                           ? Either.left("Unable to parse '" + raw + "' as " + name)
                           : Either.right(value);
                } catch (RuntimeException e) {
                    return Either.left("Unable to parse '" + raw + "' as " + name + ": " + e.getMessage());
                }
            }

            @Override
            public String write(A value) {
                return printer.apply(value);
            }

            @Override
            public String toString() {
                return "PropertyType[" + name + "]";
            }
        }
        return new propertyType<>(name, parser, printer);
    }
}
