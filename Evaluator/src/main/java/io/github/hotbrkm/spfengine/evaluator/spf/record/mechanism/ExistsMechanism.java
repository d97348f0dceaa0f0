package io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.record.Qualifier;
import io.github.hotbrkm.spfengine.evaluator.spf.record.TermOutcome;
import org.xbill.DNS.Type;

/**
 * {@code exists}: matches when the expanded name has any A record, whatever its address.
 */
public class ExistsMechanism extends Mechanism {

    private final MacroString domainSpec;

    public ExistsMechanism(Qualifier qualifier, MacroString domainSpec) {
        super(qualifier);
        this.domainSpec = domainSpec;
    }

    @Override
    public String getName() {
        return "exists";
    }

    public MacroString getDomainSpec() {
        return domainSpec;
    }

    @Override
    public TermOutcome evaluate(SpfServer server, SpfRequest request) {
        server.countDnsInteractiveTerm(request);
        String target = targetDomain(domainSpec, server, request);
        // RFC 4408, 5.7/3: always A, even for IPv6 clients
        return TermOutcome.of(!lookupCountingVoid(server, request, target, Type.A).isEmpty());
    }

    @Override
    protected String params() {
        return ":" + domainSpec;
    }
}
