package com.pdp.attribute;

import com.google.common.net.InetAddresses;

import java.net.InetAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable typed attribute value.
 * <p>
 * The static type of every expression is known once a policy is parsed, so the typed
 * accessors treat a type mismatch as a programming error rather than an evaluation error.
 * Sets keep insertion order for iteration so decisions and serialized documents are deterministic.
 */
public final class AttributeValue {

    public static final AttributeValue TRUE = new AttributeValue(AttributeType.BOOLEAN, Boolean.TRUE);
    public static final AttributeValue FALSE = new AttributeValue(AttributeType.BOOLEAN, Boolean.FALSE);

    private final AttributeType type;
    private final Object value;

    private AttributeValue(AttributeType type, Object value) {
        this.type = type;
        this.value = value;
    }

    // Factories

    public static AttributeValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static AttributeValue ofString(String value) {
        return new AttributeValue(AttributeType.STRING, Objects.requireNonNull(value, "value"));
    }

    public static AttributeValue ofInteger(long value) {
        return new AttributeValue(AttributeType.INTEGER, value);
    }

    public static AttributeValue ofFloat(double value) {
        return new AttributeValue(AttributeType.FLOAT, value);
    }

    /**
     * Address from its literal form. Never performs a DNS lookup.
     *
     * @throws IllegalArgumentException if the text is not an IP address literal
     */
    public static AttributeValue ofAddress(String literal) {
        return ofAddress(InetAddresses.forString(literal.trim()));
    }

    public static AttributeValue ofAddress(InetAddress value) {
        return new AttributeValue(AttributeType.ADDRESS, Objects.requireNonNull(value, "value"));
    }

    public static AttributeValue ofNetwork(Network value) {
        return new AttributeValue(AttributeType.NETWORK, Objects.requireNonNull(value, "value"));
    }

    public static AttributeValue ofDomain(DomainName value) {
        return new AttributeValue(AttributeType.DOMAIN, Objects.requireNonNull(value, "value"));
    }

    public static AttributeValue ofTime(Instant value) {
        return new AttributeValue(AttributeType.TIME, Objects.requireNonNull(value, "value"));
    }

    public static AttributeValue ofStringSet(Collection<String> values) {
        return new AttributeValue(AttributeType.SET_OF_STRINGS, immutableSet(values));
    }

    public static AttributeValue ofNetworkSet(Collection<Network> values) {
        return new AttributeValue(AttributeType.SET_OF_NETWORKS, immutableSet(values));
    }

    public static AttributeValue ofDomainSet(Collection<DomainName> values) {
        return new AttributeValue(AttributeType.SET_OF_DOMAINS, immutableSet(values));
    }

    public static AttributeValue ofStringList(Collection<String> values) {
        return new AttributeValue(AttributeType.LIST_OF_STRINGS, List.copyOf(values));
    }

    private static <T> Set<T> immutableSet(Collection<T> values) {
        Set<T> copy = new LinkedHashSet<>();
        for (T v : values) {
            copy.add(Objects.requireNonNull(v, "set element"));
        }
        return Collections.unmodifiableSet(copy);
    }

    // Accessors

    public AttributeType getType() {
        return type;
    }

    public boolean booleanValue() {
        return (Boolean) expect(AttributeType.BOOLEAN);
    }

    public String stringValue() {
        return (String) expect(AttributeType.STRING);
    }

    public long integerValue() {
        return (Long) expect(AttributeType.INTEGER);
    }

    public double floatValue() {
        return (Double) expect(AttributeType.FLOAT);
    }

    public InetAddress addressValue() {
        return (InetAddress) expect(AttributeType.ADDRESS);
    }

    public Network networkValue() {
        return (Network) expect(AttributeType.NETWORK);
    }

    public DomainName domainValue() {
        return (DomainName) expect(AttributeType.DOMAIN);
    }

    public Instant timeValue() {
        return (Instant) expect(AttributeType.TIME);
    }

    @SuppressWarnings("unchecked")
    public Set<String> stringSetValue() {
        return (Set<String>) expect(AttributeType.SET_OF_STRINGS);
    }

    @SuppressWarnings("unchecked")
    public Set<Network> networkSetValue() {
        return (Set<Network>) expect(AttributeType.SET_OF_NETWORKS);
    }

    @SuppressWarnings("unchecked")
    public Set<DomainName> domainSetValue() {
        return (Set<DomainName>) expect(AttributeType.SET_OF_DOMAINS);
    }

    @SuppressWarnings("unchecked")
    public List<String> stringListValue() {
        return (List<String>) expect(AttributeType.LIST_OF_STRINGS);
    }

    /**
     * Number of elements of a collection, or characters of a string.
     */
    public int size() {
        return switch (type) {
            case STRING -> stringValue().length();
            case SET_OF_STRINGS, SET_OF_NETWORKS, SET_OF_DOMAINS -> ((Set<?>) value).size();
            case LIST_OF_STRINGS -> stringListValue().size();
            default -> throw new IllegalStateException(type + " has no size");
        };
    }

    private Object expect(AttributeType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " value but got " + type);
        }
        return value;
    }

    /**
     * Compare two values of the same ordered type.
     *
     * @throws IllegalStateException if the types differ or are not ordered
     */
    public static int compare(AttributeValue left, AttributeValue right) {
        if (left.type != right.type || !left.type.isOrdered()) {
            throw new IllegalStateException("Cannot compare " + left.type + " with " + right.type);
        }
        return switch (left.type) {
            case STRING -> left.stringValue().compareTo(right.stringValue());
            case INTEGER -> Long.compare(left.integerValue(), right.integerValue());
            case FLOAT -> Double.compare(left.floatValue(), right.floatValue());
            case TIME -> left.timeValue().compareTo(right.timeValue());
            case ADDRESS -> compareAddresses(left.addressValue(), right.addressValue());
            default -> throw new IllegalStateException("Cannot compare " + left.type);
        };
    }

    private static int compareAddresses(InetAddress left, InetAddress right) {
        byte[] a = left.getAddress();
        byte[] b = right.getAddress();
        if (a.length != b.length) {
            return Integer.compare(a.length, b.length);
        }
        for (int i = 0; i < a.length; i++) {
            int cmp = Integer.compare(a[i] & 0xff, b[i] & 0xff);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    /**
     * Raw form suitable for JSON/YAML output: Boolean, Long, Double, String or List of String.
     * Feeding it back to {@link AttributeType#coerce(Object)} yields an equal value.
     */
    public Object toRaw() {
        return switch (type) {
            case BOOLEAN, STRING, INTEGER, FLOAT -> value;
            case ADDRESS -> InetAddresses.toAddrString(addressValue());
            case NETWORK, DOMAIN, TIME -> value.toString();
            case SET_OF_STRINGS, SET_OF_NETWORKS, SET_OF_DOMAINS, LIST_OF_STRINGS -> {
                List<String> items = new ArrayList<>();
                for (Object item : (Collection<?>) value) {
                    items.add(item.toString());
                }
                yield items;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeValue that)) return false;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        Object raw = toRaw();
        if (raw instanceof List<?> items) {
            return type + "[" + items.stream().map(Object::toString).collect(Collectors.joining(", ")) + "]";
        }
        if (type == AttributeType.STRING) {
            return type + "(\"" + raw + "\")";
        }
        return type + "(" + raw + ")";
    }
}
