package com.pdp.attribute;

import com.google.common.net.InternetDomainName;

import java.util.Locale;

/**
 * A normalized domain name: lower case, without a trailing dot.
 */
public final class DomainName {

    private final String name;

    private DomainName(String name) {
        this.name = name;
    }

    /**
     * Parse and validate a domain name.
     *
     * @throws IllegalArgumentException if the text is not a syntactically valid domain name
     */
    public static DomainName parse(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (!InternetDomainName.isValid(normalized)) {
            throw new IllegalArgumentException("Invalid domain name '" + text + "'");
        }
        return new DomainName(normalized);
    }

    /**
     * True if {@code other} is this domain or one of its subdomains.
     */
    public boolean covers(DomainName other) {
        return other.name.equals(name) || other.name.endsWith("." + name);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainName that)) return false;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
