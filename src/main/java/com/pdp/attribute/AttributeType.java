package com.pdp.attribute;

import com.pdp.exception.AttributeTypeException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Supported attribute types.
 * Type tags are matched case-insensitively when read from a policy document.
 */
public enum AttributeType {
    BOOLEAN("Boolean", false, false),
    STRING("String", false, true),
    INTEGER("Integer", false, true),
    FLOAT("Float", false, true),
    ADDRESS("Address", false, true),
    NETWORK("Network", false, false),
    DOMAIN("Domain", false, false),
    TIME("Time", false, true),

    SET_OF_STRINGS("Set of Strings", true, false),
    SET_OF_NETWORKS("Set of Networks", true, false),
    SET_OF_DOMAINS("Set of Domains", true, false),
    LIST_OF_STRINGS("List of Strings", true, false);

    private static final Map<String, AttributeType> BY_TAG = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(t -> t.tag.toLowerCase(Locale.ROOT), Function.identity()));

    private final String tag;
    private final boolean collection;
    private final boolean ordered;

    AttributeType(String tag, boolean collection, boolean ordered) {
        this.tag = tag;
        this.collection = collection;
        this.ordered = ordered;
    }

    /**
     * Document tag of this type, e.g. "Set of Strings".
     */
    public String getTag() {
        return tag;
    }

    public boolean isCollection() {
        return collection;
    }

    /**
     * Whether values of this type support greater/less comparisons.
     */
    public boolean isOrdered() {
        return ordered;
    }

    /**
     * Element type of a collection type, or empty for scalars.
     */
    public Optional<AttributeType> getElementType() {
        return switch (this) {
            case SET_OF_STRINGS, LIST_OF_STRINGS -> Optional.of(STRING);
            case SET_OF_NETWORKS -> Optional.of(NETWORK);
            case SET_OF_DOMAINS -> Optional.of(DOMAIN);
            default -> Optional.empty();
        };
    }

    /**
     * Look up a type by its document tag, ignoring case.
     */
    public static Optional<AttributeType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(tag.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Coerce a raw document or request value into a typed value.
     *
     * @param raw Raw value as produced by a JSON/YAML decoder (Boolean, Number, String, Collection)
     * @return Typed value
     * @throws AttributeTypeException if the raw value does not fit this type
     */
    public AttributeValue coerce(Object raw) {
        if (raw == null) {
            throw new AttributeTypeException(this, null);
        }
        if (raw instanceof AttributeValue value) {
            if (value.getType() != this) {
                throw new AttributeTypeException(this, value);
            }
            return value;
        }

        try {
            return switch (this) {
                case BOOLEAN -> {
                    if (raw instanceof Boolean b) {
                        yield AttributeValue.ofBoolean(b);
                    }
                    throw new AttributeTypeException(this, raw);
                }
                case STRING -> AttributeValue.ofString(requireString(raw));
                case INTEGER -> AttributeValue.ofInteger(toLong(raw));
                case FLOAT -> {
                    if (raw instanceof Number n) {
                        yield AttributeValue.ofFloat(n.doubleValue());
                    }
                    throw new AttributeTypeException(this, raw);
                }
                case ADDRESS -> AttributeValue.ofAddress(requireString(raw));
                case NETWORK -> AttributeValue.ofNetwork(Network.parse(requireString(raw)));
                case DOMAIN -> AttributeValue.ofDomain(DomainName.parse(requireString(raw)));
                case TIME -> {
                    if (raw instanceof Instant instant) {
                        yield AttributeValue.ofTime(instant);
                    }
                    yield AttributeValue.ofTime(Instant.parse(requireString(raw)));
                }
                case SET_OF_STRINGS -> AttributeValue.ofStringSet(toStrings(raw));
                case SET_OF_NETWORKS -> {
                    List<Network> networks = new ArrayList<>();
                    for (String s : toStrings(raw)) {
                        networks.add(Network.parse(s));
                    }
                    yield AttributeValue.ofNetworkSet(networks);
                }
                case SET_OF_DOMAINS -> {
                    List<DomainName> domains = new ArrayList<>();
                    for (String s : toStrings(raw)) {
                        domains.add(DomainName.parse(s));
                    }
                    yield AttributeValue.ofDomainSet(domains);
                }
                case LIST_OF_STRINGS -> AttributeValue.ofStringList(toStrings(raw));
            };
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new AttributeTypeException(this, raw, e);
        }
    }

    private String requireString(Object raw) {
        if (raw instanceof String s) {
            return s;
        }
        throw new AttributeTypeException(this, raw);
    }

    private long toLong(Object raw) {
        if (raw instanceof Long l) {
            return l;
        }
        if (raw instanceof Integer i) {
            return i.longValue();
        }
        if (raw instanceof Short s) {
            return s.longValue();
        }
        if (raw instanceof Byte b) {
            return b.longValue();
        }
        if (raw instanceof java.math.BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new AttributeTypeException(this, raw, e);
            }
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 0x1p63) {
                return (long) d;
            }
        }
        throw new AttributeTypeException(this, raw);
    }

    private List<String> toStrings(Object raw) {
        if (!(raw instanceof Collection<?> items)) {
            throw new AttributeTypeException(this, raw);
        }
        List<String> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof String s)) {
                throw new AttributeTypeException(this, raw);
            }
            result.add(s);
        }
        return result;
    }

    @Override
    public String toString() {
        return tag;
    }
}
