package io.github.hotbrkm.spfengine.evaluator.spf.record;

import io.github.hotbrkm.spfengine.evaluator.spf.Scope;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Record formats understood by the server, each with its version tag.
 */
public enum RecordVersion {

    /** {@code v=spf1} (RFC 4408, RFC 7208). */
    V1(1, "v=spf1", Pattern.compile("^v=spf1(?=\\x20|$)", Pattern.CASE_INSENSITIVE),
            EnumSet.of(Scope.HELO, Scope.MFROM)),
    /** {@code spf2.0/<scopes>} (RFC 4406). */
    V2(2, "spf2.0", Pattern.compile("^spf2\\.0/([^\\x20]+)(?=\\x20|$)", Pattern.CASE_INSENSITIVE),
            EnumSet.of(Scope.MFROM, Scope.PRA));

    private final int version;
    private final String versionTag;
    private final Pattern versionTagPattern;
    private final Set<Scope> validScopes;

    RecordVersion(int version, String versionTag, Pattern versionTagPattern, Set<Scope> validScopes) {
        this.version = version;
        this.versionTag = versionTag;
        this.versionTagPattern = versionTagPattern;
        this.validScopes = Collections.unmodifiableSet(validScopes);
    }

    public int version() {
        return version;
    }

    public String versionTag() {
        return versionTag;
    }

    Pattern versionTagPattern() {
        return versionTagPattern;
    }

    /**
     * Scopes a record of this version may cover.
     */
    public Set<Scope> validScopes() {
        return validScopes;
    }

    public boolean supports(Scope scope) {
        return validScopes.contains(scope);
    }

    /**
     * Parses a record text as this version.
     *
     * @throws io.github.hotbrkm.spfengine.evaluator.spf.exception.InvalidRecordVersionException if the text does
     *         not start with this version's tag
     * @throws io.github.hotbrkm.spfengine.evaluator.spf.exception.RecordSyntaxException        if the terms are
     *         malformed
     */
    public SpfRecord parse(String text) {
        return SpfRecordParser.parse(this, text);
    }

    public static RecordVersion of(int version) {
        for (RecordVersion recordVersion : values()) {
            if (recordVersion.version == version) {
                return recordVersion;
            }
        }
        throw new IllegalArgumentException("Unsupported record version: " + version);
    }
}
