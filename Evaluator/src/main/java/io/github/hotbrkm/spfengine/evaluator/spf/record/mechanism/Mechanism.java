package io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.RecordSyntaxException;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.record.Qualifier;
import io.github.hotbrkm.spfengine.evaluator.spf.record.TermOutcome;
import io.github.hotbrkm.spfengine.evaluator.spf.util.DomainNames;
import io.github.hotbrkm.spfengine.evaluator.spf.util.IpAddressUtil;
import org.xbill.DNS.Record;
import org.xbill.DNS.Type;

import java.util.List;

/**
 * A directive of a policy record: a qualifier plus a mechanism that either matches the client or not.
 */
public abstract class Mechanism {

    private final Qualifier qualifier;

    protected Mechanism(Qualifier qualifier) {
        this.qualifier = qualifier == null ? Qualifier.PASS : qualifier;
    }

    public Qualifier getQualifier() {
        return qualifier;
    }

    /**
     * Mechanism name as written in records, e.g. {@code ip4}.
     */
    public abstract String getName();

    /**
     * Evaluates the mechanism for the request.
     *
     * @throws io.github.hotbrkm.spfengine.evaluator.spf.exception.DnsException on a failing lookup
     * @throws io.github.hotbrkm.spfengine.evaluator.spf.exception.ProcessingLimitExceededException on a
     *         tripped limit
     */
    public abstract TermOutcome evaluate(SpfServer server, SpfRequest request);

    /**
     * Text following the name, e.g. {@code :example.com/24}.
     */
    protected String params() {
        return "";
    }

    /**
     * Expands the domain-spec, or falls back to the current authority domain when there is none.
     *
     * @throws RecordSyntaxException if the expansion leaves no domain name
     */
    protected static String targetDomain(MacroString domainSpec, SpfServer server, SpfRequest request) {
        String target = domainSpec == null ? request.getAuthorityDomain() : domainSpec.expand(server, request);
        String canonical = DomainNames.canonicalize(target);
        if (canonical.isEmpty()) {
            throw new RecordSyntaxException("Domain-spec '" + (domainSpec == null ? target : domainSpec)
                    + "' expands to an empty domain name");
        }
        return canonical;
    }

    /**
     * Runs the primary query of a mechanism and counts a void lookup when nothing of the type comes back.
     */
    protected static List<Record> lookupCountingVoid(SpfServer server, SpfRequest request, String domain, int type) {
        List<Record> answers = server.dnsLookup(domain, type).answers(type);
        if (answers.isEmpty()) {
            server.countVoidDnsLookup(request);
        }
        return answers;
    }

    /**
     * Address record type matching the client's address family.
     */
    protected static int addressType(SpfRequest request) {
        return IpAddressUtil.isIpv6(request.getIpAddress()) ? Type.AAAA : Type.A;
    }

    @Override
    public String toString() {
        String prefix = qualifier == Qualifier.PASS ? "" : String.valueOf(qualifier.getSymbol());
        return prefix + getName() + params();
    }
}
