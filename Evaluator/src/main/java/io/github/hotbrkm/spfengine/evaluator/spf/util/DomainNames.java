package io.github.hotbrkm.spfengine.evaluator.spf.util;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Utility class for bringing domain names into the form that may be put on the wire.
 */
public final class DomainNames {

    /** Maximum length of a single label in bytes (RFC 1035, 2.3.4). */
    public static final int MAX_LABEL_LENGTH = 63;

    /** Maximum length of a name in its dotted text form (RFC 4408, 8.1/25). */
    public static final int MAX_NAME_LENGTH = 253;

    private DomainNames() {
        // Prevent instantiation
    }

    /**
     * Canonicalizes a domain name before it is queried.
     * <p>
     * The name is lower-cased, trailing dots are removed, labels longer than 63 bytes are cut to their first
     * 63 bytes and leading labels are dropped while the name is longer than 253 bytes. Lengths are counted in
     * UTF-8 bytes and cuts never split a code point. Applying the method to its own output returns the same value.
     *
     * @param domain domain name, possibly with a trailing dot
     * @return canonical domain name, or an empty string for null input
     */
    public static String canonicalize(String domain) {
        if (domain == null) {
            return "";
        }

        String name = domain.toLowerCase(Locale.ROOT);
        while (name.endsWith(".")) {
            name = name.substring(0, name.length() - 1);
        }

        String[] labels = name.split("\\.", -1);
        StringBuilder truncated = new StringBuilder(name.length());
        for (int i = 0; i < labels.length; i++) {
            if (i > 0) {
                truncated.append('.');
            }
            truncated.append(truncateToBytes(labels[i], MAX_LABEL_LENGTH));
        }
        name = truncated.toString();

        while (utf8Length(name) > MAX_NAME_LENGTH) {
            int dot = name.indexOf('.');
            if (dot < 0) {
                name = truncateToBytes(name, MAX_NAME_LENGTH);
                break;
            }
            name = name.substring(dot + 1);
        }

        return name;
    }

    /**
     * Checks whether {@code name} equals {@code domain} or is a subdomain of it. Comparison ignores case and a
     * trailing dot on either side.
     */
    public static boolean isSubdomainOrSelf(String name, String domain) {
        String candidate = canonicalize(name);
        String parent = canonicalize(domain);
        if (parent.isEmpty()) {
            return false;
        }
        return candidate.equals(parent) || candidate.endsWith("." + parent);
    }

    private static String truncateToBytes(String value, int maxBytes) {
        if (utf8Length(value) <= maxBytes) {
            return value;
        }
        int bytes = 0;
        int end = 0;
        while (end < value.length()) {
            int codePoint = value.codePointAt(end);
            int size = utf8Length(codePoint);
            if (bytes + size > maxBytes) {
                break;
            }
            bytes += size;
            end += Character.charCount(codePoint);
        }
        return value.substring(0, end);
    }

    private static int utf8Length(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
