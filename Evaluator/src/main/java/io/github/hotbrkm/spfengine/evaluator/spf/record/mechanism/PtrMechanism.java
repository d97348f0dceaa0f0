package io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.exception.DnsException;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.record.Qualifier;
import io.github.hotbrkm.spfengine.evaluator.spf.record.TermOutcome;
import io.github.hotbrkm.spfengine.evaluator.spf.util.ValidatedDomains;
import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Record;
import org.xbill.DNS.Type;

import java.util.List;

/**
 * {@code ptr}: matches when a forward-confirmed reverse name of the client lies in the target domain.
 * Only the first names up to the per-PTR limit are checked. A failing PTR lookup is no match (RFC 7208, 5.5).
 */
@Slf4j
public class PtrMechanism extends Mechanism {

    private final MacroString domainSpec;

    public PtrMechanism(Qualifier qualifier, MacroString domainSpec) {
        super(qualifier);
        this.domainSpec = domainSpec;
    }

    @Override
    public String getName() {
        return "ptr";
    }

    public MacroString getDomainSpec() {
        return domainSpec;
    }

    @Override
    public TermOutcome evaluate(SpfServer server, SpfRequest request) {
        server.countDnsInteractiveTerm(request);
        String target = targetDomain(domainSpec, server, request);
        List<Record> answers;
        try {
            answers = lookupCountingVoid(server, request, ValidatedDomains.reverseName(request.getIpAddress()), Type.PTR);
        } catch (DnsException e) {
            log.debug("PTR lookup failed, ptr does not match: ip={}, message={}",
                    request.getIpAddress().getHostAddress(), e.getMessage());
            return TermOutcome.NO_MATCH;
        }
        List<String> names = ValidatedDomains.ptrNames(answers, server.getMaxNameLookupsPerPtrMech());
        return TermOutcome.of(ValidatedDomains.find(server, request, names, target, false) != null);
    }

    @Override
    protected String params() {
        return domainSpec == null ? "" : ":" + domainSpec;
    }
}
