package org.pragmatica.config;

/// Product of two values, produced by zipping two descriptors.
public record Pair<A, B>(A first, B second) {
    public static <A, B> Pair<A, B> pair(A first, B second) {
        return new Pair<>(first, second);
    }
}
