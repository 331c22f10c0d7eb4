package org.pragmatica.config;

import org.pragmatica.config.tree.Step;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/// Error types for reading a configuration value.
///
/// Errors form a tree mirroring the traversal of the descriptor: independent failures
/// of zipped descriptors are collected under [AndErrors], failures of every attempted
/// alternative under [OrErrors].
public sealed interface ReadError {
    String message();

    /// False when a [SourceError] is reachable, i.e. the failure is not caused by the
    /// content of the configuration and trying an alternative would not help.
    default boolean isRecoverable() {
        return leaves().stream()
                       .noneMatch(SourceError.class::isInstance);
    }

    /// True when every underlying failure is a [MissingValue].
    default boolean isMissingOnly() {
        return leaves().stream()
                       .allMatch(MissingValue.class::isInstance);
    }

    /// Number of underlying failures.
    default int size() {
        return leaves().size();
    }

    /// Underlying failures, with the grouping nodes removed.
    default List<ReadError> leaves() {
        if (this instanceof AndErrors and) {
            return flattenLeaves(and.errors());
        }
        if (this instanceof OrErrors or) {
            return flattenLeaves(or.errors());
        }
        return List.of(this);
    }

    /// No value at the path.
    record MissingValue(List<Step> path, String detail) implements ReadError {
        public MissingValue {
            path = List.copyOf(path);
        }

        public static MissingValue missingValue(List<Step> path) {
            return new MissingValue(path, "");
        }

        public static MissingValue missingValue(List<Step> path, String detail) {
            return new MissingValue(path, detail);
        }

        @Override
        public String message() {
            var base = "Missing value at " + Step.render(path);
            return detail.isEmpty() ? base : base + ": " + detail;
        }
    }

    static MissingValue missingValue(List<Step> path) {
        return MissingValue.missingValue(path);
    }

    /// Value present but not convertible to the expected kind.
    record ConversionError(List<Step> path, String rawValue, String expectedKind, String detail) implements ReadError {
        public ConversionError {
            path = List.copyOf(path);
        }

        public static ConversionError conversionError(List<Step> path, String rawValue, String expectedKind, String detail) {
            return new ConversionError(path, rawValue, expectedKind, detail);
        }

        @Override
        public String message() {
            var base = "Invalid value '" + rawValue + "' at " + Step.render(path) + ", expected " + expectedKind;
            return detail.isEmpty() ? base : base + ": " + detail;
        }
    }

    static ConversionError conversionError(List<Step> path, String rawValue, String expectedKind, String detail) {
        return ConversionError.conversionError(path, rawValue, expectedKind, detail);
    }

    /// Configuration source could not be obtained or queried.
    record SourceError(String message) implements ReadError {
        public static SourceError sourceError(String message) {
            return new SourceError(message);
        }
    }

    static SourceError sourceError(String message) {
        return SourceError.sourceError(message);
    }

    /// Every one of these failures happened.
    record AndErrors(List<ReadError> errors) implements ReadError {
        public AndErrors {
            errors = List.copyOf(errors);
        }

        @Override
        public String message() {
            return errors.stream()
                         .map(ReadError::message)
                         .collect(Collectors.joining("; ", "All of: [", "]"));
        }
    }

    /// Failures of every attempted alternative.
    record OrErrors(List<ReadError> errors) implements ReadError {
        public OrErrors {
            errors = List.copyOf(errors);
        }

        @Override
        public String message() {
            return errors.stream()
                         .map(ReadError::message)
                         .collect(Collectors.joining("; ", "Any of: [", "]"));
        }
    }

    /// Combine independent failures. Nested [AndErrors] are flattened.
    static ReadError and(ReadError left, ReadError right) {
        var errors = new ArrayList<ReadError>();
        addFlattened(errors, left, AndErrors.class);
        addFlattened(errors, right, AndErrors.class);
        return new AndErrors(errors);
    }

    /// Combine failures of alternatives. Nested [OrErrors] are flattened.
    static ReadError or(ReadError left, ReadError right) {
        var errors = new ArrayList<ReadError>();
        addFlattened(errors, left, OrErrors.class);
        addFlattened(errors, right, OrErrors.class);
        return new OrErrors(errors);
    }

    private static void addFlattened(List<ReadError> errors, ReadError error, Class<? extends ReadError> group) {
        if (group == AndErrors.class && error instanceof AndErrors and) {
            errors.addAll(and.errors());
        } else if (group == OrErrors.class && error instanceof OrErrors or) {
            errors.addAll(or.errors());
        } else {
            errors.add(error);
        }
    }

    private static List<ReadError> flattenLeaves(List<ReadError> errors) {
        return errors.stream()
                     .flatMap(error -> error.leaves()
                                            .stream())
                     .toList();
    }
}
