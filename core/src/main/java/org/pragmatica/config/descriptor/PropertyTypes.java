package org.pragmatica.config.descriptor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.UUID;

import static org.pragmatica.config.descriptor.PropertyType.propertyType;

/// Property types for common scalar values.
public final class PropertyTypes {
    public static final PropertyType<String> STRING = propertyType("string", raw -> raw, value -> value);
    public static final PropertyType<Integer> INTEGER = propertyType("int", Integer::valueOf, String::valueOf);
    public static final PropertyType<Long> LONG = propertyType("long", Long::valueOf, String::valueOf);
    public static final PropertyType<Short> SHORT = propertyType("short", Short::valueOf, String::valueOf);
    public static final PropertyType<Byte> BYTE = propertyType("byte", Byte::valueOf, String::valueOf);
    public static final PropertyType<Boolean> BOOLEAN = propertyType("boolean", PropertyTypes::parseBoolean, String::valueOf);
    public static final PropertyType<Double> DOUBLE = propertyType("double", Double::valueOf, String::valueOf);
    public static final PropertyType<Float> FLOAT = propertyType("float", Float::valueOf, String::valueOf);
    public static final PropertyType<BigDecimal> BIG_DECIMAL = propertyType("bigDecimal", BigDecimal::new, BigDecimal::toString);
    public static final PropertyType<BigInteger> BIG_INTEGER = propertyType("bigInteger", BigInteger::new, BigInteger::toString);
    public static final PropertyType<UUID> UUID_TYPE = propertyType("uuid", UUID::fromString, UUID::toString);
    public static final PropertyType<Duration> DURATION = propertyType("duration", Duration::parse, Duration::toString);
    public static final PropertyType<LocalDate> LOCAL_DATE = propertyType("localDate", LocalDate::parse, LocalDate::toString);
    public static final PropertyType<LocalTime> LOCAL_TIME = propertyType("localTime", LocalTime::parse, LocalTime::toString);
    public static final PropertyType<LocalDateTime> LOCAL_DATE_TIME = propertyType("localDateTime",
                                                                                   LocalDateTime::parse,
                                                                                   LocalDateTime::toString);
    public static final PropertyType<Instant> INSTANT = propertyType("instant", Instant::parse, Instant::toString);
    public static final PropertyType<URI> URI_TYPE = propertyType("uri", URI::create, URI::toString);
    public static final PropertyType<URL> URL_TYPE = propertyType("url", PropertyTypes::parseUrl, URL::toString);
    public static final PropertyType<ZoneId> ZONE_ID = propertyType("zoneId", ZoneId::of, ZoneId::getId);

    private PropertyTypes() {}

    private static Boolean parseBoolean(String raw) {
        if ("true".equalsIgnoreCase(raw)) {
            return true;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return false;
        }
        throw new IllegalArgumentException("expected true or false");
    }

    private static URL parseUrl(String raw) {
        try {
            return URI.create(raw)
                      .toURL();
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }
}
