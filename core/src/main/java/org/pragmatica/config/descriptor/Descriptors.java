package org.pragmatica.config.descriptor;

import org.pragmatica.config.Pair;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Function;

import static org.pragmatica.config.descriptor.Descriptor.value;

/// Ready made descriptors for scalar values and records.
///
/// Each scalar comes in two forms: keyless, reading the current position (useful as list
/// element), and keyed, reading the value under the given key.
public final class Descriptors {
    private Descriptors() {}

    /// Constructor of a value from three components.
    @FunctionalInterface
    public interface Function3<A, B, C, R> {
        R apply(A first, B second, C third);
    }

    public static Descriptor<String> string() {
        return value(PropertyTypes.STRING);
    }

    public static Descriptor<String> string(String key) {
        return value(key, PropertyTypes.STRING);
    }

    public static Descriptor<Integer> integer() {
        return value(PropertyTypes.INTEGER);
    }

    public static Descriptor<Integer> integer(String key) {
        return value(key, PropertyTypes.INTEGER);
    }

    public static Descriptor<Long> longValue() {
        return value(PropertyTypes.LONG);
    }

    public static Descriptor<Long> longValue(String key) {
        return value(key, PropertyTypes.LONG);
    }

    public static Descriptor<Short> shortValue() {
        return value(PropertyTypes.SHORT);
    }

    public static Descriptor<Short> shortValue(String key) {
        return value(key, PropertyTypes.SHORT);
    }

    public static Descriptor<Byte> byteValue() {
        return value(PropertyTypes.BYTE);
    }

    public static Descriptor<Byte> byteValue(String key) {
        return value(key, PropertyTypes.BYTE);
    }

    /// Boolean, accepting `true` and `false` in any case.
    public static Descriptor<Boolean> bool() {
        return value(PropertyTypes.BOOLEAN);
    }

    public static Descriptor<Boolean> bool(String key) {
        return value(key, PropertyTypes.BOOLEAN);
    }

    public static Descriptor<Double> doubleValue() {
        return value(PropertyTypes.DOUBLE);
    }

    public static Descriptor<Double> doubleValue(String key) {
        return value(key, PropertyTypes.DOUBLE);
    }

    public static Descriptor<Float> floatValue() {
        return value(PropertyTypes.FLOAT);
    }

    public static Descriptor<Float> floatValue(String key) {
        return value(key, PropertyTypes.FLOAT);
    }

    public static Descriptor<BigDecimal> bigDecimal() {
        return value(PropertyTypes.BIG_DECIMAL);
    }

    public static Descriptor<BigDecimal> bigDecimal(String key) {
        return value(key, PropertyTypes.BIG_DECIMAL);
    }

    public static Descriptor<BigInteger> bigInteger() {
        return value(PropertyTypes.BIG_INTEGER);
    }

    public static Descriptor<BigInteger> bigInteger(String key) {
        return value(key, PropertyTypes.BIG_INTEGER);
    }

    public static Descriptor<UUID> uuid() {
        return value(PropertyTypes.UUID_TYPE);
    }

    public static Descriptor<UUID> uuid(String key) {
        return value(key, PropertyTypes.UUID_TYPE);
    }

    /// Duration in ISO-8601 form, e.g. `PT30S`.
    public static Descriptor<Duration> duration() {
        return value(PropertyTypes.DURATION);
    }

    public static Descriptor<Duration> duration(String key) {
        return value(key, PropertyTypes.DURATION);
    }

    public static Descriptor<LocalDate> localDate() {
        return value(PropertyTypes.LOCAL_DATE);
    }

    public static Descriptor<LocalDate> localDate(String key) {
        return value(key, PropertyTypes.LOCAL_DATE);
    }

    public static Descriptor<LocalTime> localTime() {
        return value(PropertyTypes.LOCAL_TIME);
    }

    public static Descriptor<LocalTime> localTime(String key) {
        return value(key, PropertyTypes.LOCAL_TIME);
    }

    public static Descriptor<LocalDateTime> localDateTime() {
        return value(PropertyTypes.LOCAL_DATE_TIME);
    }

    public static Descriptor<LocalDateTime> localDateTime(String key) {
        return value(key, PropertyTypes.LOCAL_DATE_TIME);
    }

    public static Descriptor<Instant> instant() {
        return value(PropertyTypes.INSTANT);
    }

    public static Descriptor<Instant> instant(String key) {
        return value(key, PropertyTypes.INSTANT);
    }

    public static Descriptor<URI> uri() {
        return value(PropertyTypes.URI_TYPE);
    }

    public static Descriptor<URI> uri(String key) {
        return value(key, PropertyTypes.URI_TYPE);
    }

    public static Descriptor<URL> url() {
        return value(PropertyTypes.URL_TYPE);
    }

    public static Descriptor<URL> url(String key) {
        return value(key, PropertyTypes.URL_TYPE);
    }

    public static Descriptor<ZoneId> zoneId() {
        return value(PropertyTypes.ZONE_ID);
    }

    public static Descriptor<ZoneId> zoneId(String key) {
        return value(key, PropertyTypes.ZONE_ID);
    }

    /// Record of two components.
    ///
    /// @param first       Descriptor of the first component
    /// @param second      Descriptor of the second component
    /// @param constructor Builds the record from its components
    /// @param getFirst    Extracts the first component for writing
    /// @param getSecond   Extracts the second component for writing
    public static <A, B, T> Descriptor<T> product(Descriptor<A> first,
                                                  Descriptor<B> second,
                                                  BiFunction<A, B, T> constructor,
                                                  Function<T, A> getFirst,
                                                  Function<T, B> getSecond) {
        return first.zip(second)
                    .to(pair -> constructor.apply(pair.first(), pair.second()),
                        value -> Pair.pair(getFirst.apply(value), getSecond.apply(value)));
    }

    /// Record of three components.
    public static <A, B, C, T> Descriptor<T> product(Descriptor<A> first,
                                                     Descriptor<B> second,
                                                     Descriptor<C> third,
                                                     Function3<A, B, C, T> constructor,
                                                     Function<T, A> getFirst,
                                                     Function<T, B> getSecond,
                                                     Function<T, C> getThird) {
        return first.zip(second)
                    .zip(third)
                    .to(pair -> constructor.apply(pair.first()
                                                      .first(),
                                                  pair.first()
                                                      .second(),
                                                  pair.second()),
                        value -> Pair.pair(Pair.pair(getFirst.apply(value), getSecond.apply(value)),
                                           getThird.apply(value)));
    }
}
