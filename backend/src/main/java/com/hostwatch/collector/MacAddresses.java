package com.hostwatch.collector;

import java.util.Locale;

/**
 * Conversions between 48-bit node identifiers and colon separated MAC strings.
 */
final class MacAddresses {

    static final long NODE_MASK = 0xFFFF_FFFF_FFFFL;
    // multicast bit marks a node id that is not a real hardware address
    static final long MULTICAST_BIT = 0x0100_0000_0000L;

    private MacAddresses() {}

    /** Lower-case hex octets, most significant first. */
    static String format(long node) {
        StringBuilder sb = new StringBuilder(17);
        for (int shift = 40; shift >= 0; shift -= 8) {
            if (sb.length() > 0) sb.append(':');
            sb.append(String.format(Locale.ROOT, "%02x", (node >>> shift) & 0xFF));
        }
        return sb.toString();
    }

    /**
     * Parses "aa:bb:cc:dd:ee:ff" (or dash separated). Returns 0 for anything that is not six octets.
     */
    static long parse(String mac) {
        if (mac == null) return 0L;
        String[] parts = mac.trim().split("[:-]");
        if (parts.length != 6) return 0L;
        long node = 0L;
        try {
            for (String part : parts) {
                if (part.isEmpty() || part.length() > 2) return 0L;
                node = (node << 8) | Integer.parseInt(part, 16);
            }
        } catch (NumberFormatException e) {
            return 0L;
        }
        return node & NODE_MASK;
    }
}
