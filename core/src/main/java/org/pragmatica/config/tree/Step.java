package org.pragmatica.config.tree;

import java.util.List;
import java.util.Objects;

/// Single element of a path into a [PropertyTree]: a record key or a sequence position.
public sealed interface Step {
    record Key(String name) implements Step {
        public Key {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Index(int position) implements Step {
        public Index {
            if (position < 0) {
                throw new IllegalArgumentException("Negative index " + position);
            }
        }

        @Override
        public String toString() {
            return "[" + position + "]";
        }
    }

    static Key key(String name) {
        return new Key(name);
    }

    static Index index(int position) {
        return new Index(position);
    }

    /// Render path in `a.b[0].c` form. Empty path renders as `<root>`.
    static String render(List<Step> path) {
        if (path.isEmpty()) {
            return "<root>";
        }
        var builder = new StringBuilder();
        for (var step : path) {
            if (step instanceof Key key) {
                if (builder.length() > 0) {
                    builder.append('.');
                }
                builder.append(key.name());
            } else {
                builder.append(step);
            }
        }
        return builder.toString();
    }
}
