package io.github.hotbrkm.spfengine.evaluator.spf;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Identity under evaluation.
 */
public enum Scope {

    /** HELO/EHLO host name (RFC 4408). */
    HELO("helo", "helo"),
    /** MAIL FROM envelope sender (RFC 4408, RFC 4406). */
    MFROM("mfrom", "mailfrom"),
    /** Purported responsible address (RFC 4406). */
    PRA("pra", "pra");

    private static final Map<String, Scope> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Scope::scopeName, Function.identity()));

    private final String scopeName;
    private final String receivedSpfIdentity;

    Scope(String scopeName, String receivedSpfIdentity) {
        this.scopeName = scopeName;
        this.receivedSpfIdentity = receivedSpfIdentity;
    }

    /**
     * Name as used in {@code spf2.0/} version tags and in configuration.
     */
    public String scopeName() {
        return scopeName;
    }

    /**
     * Value of the {@code identity} key of a {@code Received-SPF} header.
     */
    public String receivedSpfIdentity() {
        return receivedSpfIdentity;
    }

    public static Scope byName(String name) {
        Scope scope = name == null ? null : BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
        if (scope == null) {
            throw new IllegalArgumentException("Unsupported scope: " + name);
        }
        return scope;
    }
}
