package org.pragmatica.config;

import org.pragmatica.config.tree.Step;

import java.util.List;

/// Error types for writing a configuration value back into a tree.
public sealed interface WriteError {
    String message();

    /// Backward conversion of a transformed descriptor rejected the value.
    record ConversionFailed(List<Step> path, String detail) implements WriteError {
        public ConversionFailed {
            path = List.copyOf(path);
        }

        public static ConversionFailed conversionFailed(List<Step> path, String detail) {
            return new ConversionFailed(path, detail);
        }

        @Override
        public String message() {
            return "Unable to write value at " + Step.render(path) + ": " + detail;
        }
    }

    static ConversionFailed conversionFailed(List<Step> path, String detail) {
        return ConversionFailed.conversionFailed(path, detail);
    }

    /// Two zipped descriptors wrote to the same position.
    record Collision(List<Step> path) implements WriteError {
        public Collision {
            path = List.copyOf(path);
        }

        public static Collision collision(List<Step> path) {
            return new Collision(path);
        }

        @Override
        public String message() {
            return "Zipped descriptors both write to " + Step.render(path);
        }
    }

    static Collision collision(List<Step> path) {
        return Collision.collision(path);
    }
}
