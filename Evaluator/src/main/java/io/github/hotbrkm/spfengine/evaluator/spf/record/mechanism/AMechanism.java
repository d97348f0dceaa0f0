package io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.record.Qualifier;
import io.github.hotbrkm.spfengine.evaluator.spf.record.TermOutcome;

public class AMechanism extends AddressMechanism {

    public AMechanism(Qualifier qualifier, MacroString domainSpec, int ipv4PrefixLength, int ipv6PrefixLength) {
        super(qualifier, domainSpec, ipv4PrefixLength, ipv6PrefixLength);
    }

    @Override
    public String getName() {
        return "a";
    }

    @Override
    public TermOutcome evaluate(SpfServer server, SpfRequest request) {
        server.countDnsInteractiveTerm(request);
        String target = targetDomain(getDomainSpec(), server, request);
        return TermOutcome.of(matchesAny(request, lookupCountingVoid(server, request, target, addressType(request))));
    }
}
