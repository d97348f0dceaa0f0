package io.github.hotbrkm.spfengine.evaluator.spf;

import io.github.hotbrkm.spfengine.evaluator.spf.record.RecordVersion;
import io.github.hotbrkm.spfengine.evaluator.spf.record.SpfRecord;
import io.github.hotbrkm.spfengine.evaluator.spf.util.EmailUtil;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One evaluation of one identity against one client address.
 * <p>
 * A root request is built through {@link #builder()}; {@code include} and {@code redirect=} derive
 * sub-requests with {@link #newSubRequest(String)}. A sub-request keeps the identity, address and
 * versions of its parent, points at the same root and shares its {@link LimitTracker}.
 */
@Getter
public class SpfRequest {

    private static final String DEFAULT_LOCAL_PART = "postmaster";

    private final Scope scope;
    private final String identity;
    private final String localPart;
    private final String domain;
    private final String authorityDomain;
    private final InetAddress ipAddress;
    private final String heloIdentity;
    private final List<RecordVersion> versions;

    @Getter(AccessLevel.NONE)
    private final SpfRequest rootRequest;
    private final SpfRequest superRequest;
    private final LimitTracker limitTracker;

    @Getter(AccessLevel.NONE)
    private final Map<String, String> state;

    private SpfRecord record;
    private String authorityExplanation;

    /**
     * @param scope          identity scope, {@link Scope#MFROM} when null
     * @param identity       mail address or host name under evaluation
     * @param ipAddress      address of the SMTP client
     * @param heloIdentity   HELO/EHLO argument; defaults to the identity for the helo scope
     * @param versions       acceptable record versions; defaults to every version covering the scope
     * @param authorityDomain domain whose policy is looked up; defaults to the identity's domain
     * @throws IllegalArgumentException on a missing identity or address, an unknown version, or
     *                                  versions none of which cover the scope
     */
    @Builder
    private SpfRequest(Scope scope, String identity, InetAddress ipAddress, String heloIdentity,
                       List<Integer> versions, String authorityDomain) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity must not be blank");
        }
        if (ipAddress == null) {
            throw new IllegalArgumentException("ipAddress must not be null");
        }
        this.scope = scope == null ? Scope.MFROM : scope;
        this.identity = identity.trim();

        if (this.scope == Scope.HELO || this.identity.indexOf('@') < 0) {
            this.localPart = DEFAULT_LOCAL_PART;
            this.domain = this.identity;
        } else {
            String local = EmailUtil.extractLocalPart(this.identity);
            this.localPart = local == null || local.isEmpty() ? DEFAULT_LOCAL_PART : local;
            this.domain = EmailUtil.extractDomain(this.identity);
        }
        if (this.domain == null || this.domain.isEmpty()) {
            throw new IllegalArgumentException("identity has no domain: " + identity);
        }

        this.ipAddress = ipAddress;
        this.heloIdentity = heloIdentity == null && this.scope == Scope.HELO ? this.identity : heloIdentity;
        this.versions = resolveVersions(this.scope, versions);
        this.authorityDomain = authorityDomain == null || authorityDomain.isBlank() ? this.domain : authorityDomain;

        this.rootRequest = null;
        this.superRequest = null;
        this.limitTracker = new LimitTracker();
        this.state = new HashMap<>();
    }

    private SpfRequest(SpfRequest parent, String authorityDomain) {
        this.scope = parent.scope;
        this.identity = parent.identity;
        this.localPart = parent.localPart;
        this.domain = parent.domain;
        this.authorityDomain = authorityDomain;
        this.ipAddress = parent.ipAddress;
        this.heloIdentity = parent.heloIdentity;
        this.versions = parent.versions;

        this.rootRequest = parent.getRootRequest();
        this.superRequest = parent;
        this.limitTracker = parent.limitTracker;
        this.state = new HashMap<>();
    }

    /**
     * Derives a request for evaluating the policy of another domain on behalf of this one.
     */
    public SpfRequest newSubRequest(String authorityDomain) {
        if (authorityDomain == null || authorityDomain.isBlank()) {
            throw new IllegalArgumentException("authorityDomain must not be blank");
        }
        return new SpfRequest(this, authorityDomain);
    }

    public SpfRequest getRootRequest() {
        return rootRequest == null ? this : rootRequest;
    }

    public boolean isRootRequest() {
        return rootRequest == null;
    }

    /**
     * Sender mailbox used by the {@code s} macro, {@code postmaster@<domain>} when no local part was given.
     */
    public String getSender() {
        return localPart + "@" + domain;
    }

    public String getState(String key, String defaultValue) {
        return state.getOrDefault(key, defaultValue);
    }

    public void setState(String key, String value) {
        state.put(key, value);
    }

    /**
     * Stores the selected record; a request evaluates exactly one record.
     *
     * @throws IllegalStateException if a record was already stored
     */
    public void setRecord(SpfRecord record) {
        if (this.record != null) {
            throw new IllegalStateException("Record already selected for request on " + authorityDomain);
        }
        this.record = Objects.requireNonNull(record, "record must not be null");
    }

    public void setAuthorityExplanation(String authorityExplanation) {
        this.authorityExplanation = authorityExplanation;
    }

    void resetTransientState() {
        authorityExplanation = null;
        if (isRootRequest()) {
            limitTracker.reset();
        }
    }

    private static List<RecordVersion> resolveVersions(Scope scope, List<Integer> versions) {
        List<RecordVersion> resolved = versions == null || versions.isEmpty()
                ? Arrays.stream(RecordVersion.values()).filter(version -> version.supports(scope)).toList()
                : versions.stream().map(RecordVersion::of).distinct().toList();
        if (resolved.stream().noneMatch(version -> version.supports(scope))) {
            throw new IllegalArgumentException("None of the versions " + versions + " covers scope '" + scope.scopeName() + "'");
        }
        return resolved.stream()
                .sorted(Comparator.comparingInt(RecordVersion::version).reversed())
                .toList();
    }

    @Override
    public String toString() {
        return "SpfRequest{scope=" + scope.scopeName()
                + ", identity=" + identity
                + ", ipAddress=" + ipAddress.getHostAddress()
                + ", authorityDomain=" + authorityDomain + "}";
    }
}
