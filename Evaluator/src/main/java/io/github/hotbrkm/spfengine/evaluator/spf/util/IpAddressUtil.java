package io.github.hotbrkm.spfengine.evaluator.spf.util;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;

/**
 * Utility class for IP address operations.
 * <p>
 * Provides CIDR matching for both address families and the textual forms used by SPF macros.
 */
public final class IpAddressUtil {

    private IpAddressUtil() {
        // Prevent instantiation
    }

    /**
     * Checks if an address belongs to a network.
     *
     * @param ip      address to check
     * @param network network address bytes (4 or 16)
     * @param prefix  prefix length in bits
     * @return true if both are of the same family and the first {@code prefix} bits are equal
     */
    public static boolean inNetwork(InetAddress ip, byte[] network, int prefix) {
        if (ip == null || network == null) {
            return false;
        }
        byte[] candidate = ip.getAddress();
        if (candidate.length != network.length || prefix < 0 || prefix > candidate.length * 8) {
            return false;
        }

        int fullBytes = prefix / 8;
        int remainingBits = prefix % 8;

        for (int i = 0; i < fullBytes; i++) {
            if (candidate[i] != network[i]) {
                return false;
            }
        }

        if (remainingBits == 0) {
            return true;
        }

        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    public static boolean isIpv6(InetAddress ip) {
        return ip instanceof Inet6Address;
    }

    public static boolean isIpv4(InetAddress ip) {
        return ip instanceof Inet4Address;
    }

    /**
     * Formats an address for the {@code %{i}} macro: dotted decimal for IPv4, dot-separated nibbles for IPv6
     * (e.g. {@code 2.0.0.1.0.d.b.8...}).
     */
    public static String toMacroForm(InetAddress ip) {
        if (!isIpv6(ip)) {
            return ip.getHostAddress();
        }
        byte[] bytes = ip.getAddress();
        StringBuilder sb = new StringBuilder(bytes.length * 4);
        for (int i = 0; i < bytes.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            int b = bytes[i] & 0xFF;
            sb.append(Integer.toHexString((b >> 4) & 0x0F));
            sb.append('.');
            sb.append(Integer.toHexString(b & 0x0F));
        }
        return sb.toString();
    }

    /**
     * Formats an address for the {@code %{c}} macro: dotted decimal for IPv4, RFC 5952 compressed form for IPv6
     * (e.g. {@code 2001:db8::cb01}).
     */
    public static String toReadableForm(InetAddress ip) {
        if (!isIpv6(ip)) {
            return ip.getHostAddress();
        }
        byte[] bytes = ip.getAddress();
        int[] groups = new int[8];
        for (int i = 0; i < groups.length; i++) {
            groups[i] = ((bytes[i * 2] & 0xFF) << 8) | (bytes[i * 2 + 1] & 0xFF);
        }

        // Longest run of two or more zero groups, leftmost on ties
        int bestStart = -1;
        int bestLength = 1;
        for (int i = 0; i < groups.length; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int start = i;
            while (i < groups.length && groups[i] == 0) {
                i++;
            }
            if (i - start > bestLength) {
                bestStart = start;
                bestLength = i - start;
            }
        }

        StringBuilder sb = new StringBuilder(39);
        for (int i = 0; i < groups.length; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLength - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }
}
