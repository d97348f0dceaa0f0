package io.github.hotbrkm.spfengine.evaluator.spf.util;

/**
 * Utility class for email address operations.
 */
public final class EmailUtil {

    private EmailUtil() {
        // Prevent instantiation
    }

    /**
     * Extracts the local part of an address.
     *
     * @param address Email address (e.g. user@example.com)
     * @return local part, or null if the address has no {@code @} or an empty local part
     */
    public static String extractLocalPart(String address) {
        if (address == null) {
            return null;
        }
        int at = address.lastIndexOf('@');
        if (at <= 0) {
            return null;
        }
        return address.substring(0, at);
    }

    /**
     * Extracts the domain part of an address.
     *
     * @param address Email address (e.g. user@example.com)
     * @return Domain part, or null if invalid
     */
    public static String extractDomain(String address) {
        if (address == null) {
            return null;
        }
        int at = address.lastIndexOf('@');
        if (at < 0 || at == address.length() - 1) {
            return null;
        }
        return address.substring(at + 1);
    }
}
