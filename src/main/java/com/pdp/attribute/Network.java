package com.pdp.attribute;

import com.google.common.net.InetAddresses;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

/**
 * An IP network in CIDR notation. Host bits of the base address are cleared on parse,
 * so {@code 10.1.2.3/8} and {@code 10.0.0.0/8} are the same network.
 *
 * @param address Base address with host bits cleared
 * @param prefix  Prefix length in bits
 */
public record Network(InetAddress address, int prefix) {

    public Network {
        int bits = address.getAddress().length * 8;
        if (prefix < 0 || prefix > bits) {
            throw new IllegalArgumentException("Invalid prefix length " + prefix + " for " + address);
        }
        address = mask(address, prefix);
    }

    /**
     * Parse {@code address/prefix}. A bare address is treated as a host network.
     */
    public static Network parse(String text) {
        String trimmed = text.trim();
        int slash = trimmed.indexOf('/');
        InetAddress address = InetAddresses.forString(slash < 0 ? trimmed : trimmed.substring(0, slash));
        int bits = address.getAddress().length * 8;
        if (slash < 0) {
            return new Network(address, bits);
        }
        String prefixText = trimmed.substring(slash + 1);
        int prefix;
        try {
            prefix = Integer.parseInt(prefixText);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid prefix length '" + prefixText + "'", e);
        }
        return new Network(address, prefix);
    }

    /**
     * Whether the address falls in this network. Addresses of the other family never match.
     */
    public boolean contains(InetAddress candidate) {
        byte[] base = address.getAddress();
        byte[] other = candidate.getAddress();
        if (base.length != other.length) {
            return false;
        }
        return Arrays.equals(base, mask(candidate, prefix).getAddress());
    }

    private static InetAddress mask(InetAddress address, int prefix) {
        byte[] bytes = address.getAddress();
        for (int i = 0; i < bytes.length; i++) {
            int remaining = prefix - i * 8;
            if (remaining >= 8) {
                continue;
            }
            bytes[i] = remaining <= 0 ? 0 : (byte) (bytes[i] & (0xff << (8 - remaining)));
        }
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid address length " + bytes.length, e);
        }
    }

    @Override
    public String toString() {
        return InetAddresses.toAddrString(address) + "/" + prefix;
    }
}
