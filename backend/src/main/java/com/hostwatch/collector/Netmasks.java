package com.hostwatch.collector;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Prefix length to netmask text, e.g. 24 to "255.255.255.0".
 */
final class Netmasks {

    private Netmasks() {}

    static String ipv4(Short prefix) {
        return fromPrefix(prefix, 4);
    }

    static String ipv6(Short prefix) {
        return fromPrefix(prefix, 16);
    }

    private static String fromPrefix(Short prefix, int length) {
        if (prefix == null || prefix < 0 || prefix > length * 8) return null;
        byte[] mask = new byte[length];
        int remaining = prefix;
        for (int i = 0; i < length && remaining > 0; i++) {
            int bits = Math.min(8, remaining);
            mask[i] = (byte) (0xFF << (8 - bits));
            remaining -= bits;
        }
        try {
            return InetAddress.getByAddress(mask).getHostAddress();
        } catch (UnknownHostException e) {
            // only thrown for an illegal array length
            throw new IllegalStateException(e);
        }
    }
}
