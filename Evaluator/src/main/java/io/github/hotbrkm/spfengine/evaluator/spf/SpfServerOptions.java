package io.github.hotbrkm.spfengine.evaluator.spf;

import io.github.hotbrkm.spfengine.evaluator.spf.dns.DnsResolver;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import lombok.Builder;
import lombok.Getter;

/**
 * Immutable construction parameters of an {@link SpfServer}.
 * <p>
 * Null fields are filled in by the server: the local host name, the system resolver and the
 * per-term lookup limit for the MX and PTR specific limits. A limit of zero or less disables the check.
 */
@Getter
@Builder(toBuilder = true)
public class SpfServerOptions {

    public static final String DEFAULT_AUTHORITY_EXPLANATION =
            "Please see http://www.openspf.org/Why?s=%{_scope};id=%{S};ip=%{C};r=%{R}";

    // RFC 4408, 10.1/6
    public static final int DEFAULT_MAX_DNS_INTERACTIVE_TERMS = 10;
    // RFC 4408, 10.1/7
    public static final int DEFAULT_MAX_NAME_LOOKUPS_PER_TERM = 10;
    // RFC 7208, 4.6.4
    public static final int DEFAULT_MAX_VOID_DNS_LOOKUPS = 2;

    @Builder.Default
    private final String defaultAuthorityExplanation = DEFAULT_AUTHORITY_EXPLANATION;

    /** Takes precedence over {@link #defaultAuthorityExplanation} when set. */
    private final MacroString defaultAuthorityExplanationTemplate;

    private final String hostname;

    private final DnsResolver dnsResolver;

    @Builder.Default
    private final QueryRrTypes queryRrTypes = QueryRrTypes.TXT;

    /** Drop timeouts of type 99 queries instead of reporting them; some servers never answer those. */
    @Builder.Default
    private final boolean ignoreSpfTypeTimeouts = false;

    @Builder.Default
    private final int maxDnsInteractiveTerms = DEFAULT_MAX_DNS_INTERACTIVE_TERMS;

    @Builder.Default
    private final int maxNameLookupsPerTerm = DEFAULT_MAX_NAME_LOOKUPS_PER_TERM;

    private final Integer maxNameLookupsPerMxMech;

    private final Integer maxNameLookupsPerPtrMech;

    @Builder.Default
    private final int maxVoidDnsLookups = DEFAULT_MAX_VOID_DNS_LOOKUPS;

    public static SpfServerOptions defaults() {
        return SpfServerOptions.builder().build();
    }
}
