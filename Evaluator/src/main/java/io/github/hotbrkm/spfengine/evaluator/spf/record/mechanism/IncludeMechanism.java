package io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.macro.MacroString;
import io.github.hotbrkm.spfengine.evaluator.spf.record.Qualifier;
import io.github.hotbrkm.spfengine.evaluator.spf.record.TermOutcome;
import io.github.hotbrkm.spfengine.evaluator.spf.result.SpfResult;

/**
 * {@code include}: evaluates the policy of another domain as a sub-request sharing the processing limits.
 */
public class IncludeMechanism extends Mechanism {

    private final MacroString domainSpec;

    public IncludeMechanism(Qualifier qualifier, MacroString domainSpec) {
        super(qualifier);
        this.domainSpec = domainSpec;
    }

    @Override
    public String getName() {
        return "include";
    }

    public MacroString getDomainSpec() {
        return domainSpec;
    }

    @Override
    public TermOutcome evaluate(SpfServer server, SpfRequest request) {
        server.countDnsInteractiveTerm(request);
        String target = targetDomain(domainSpec, server, request);
        SpfResult result = server.process(request.newSubRequest(target));

        // RFC 7208, 5.2
        return switch (result.code()) {
            case PASS -> TermOutcome.MATCH;
            case FAIL, SOFTFAIL, NEUTRAL -> TermOutcome.NO_MATCH;
            case TEMPERROR -> TermOutcome.terminal(server.newResult(SpfResult.Code.TEMPERROR, request,
                    "Included domain '" + target + "': " + result.text()));
            case PERMERROR -> TermOutcome.terminal(server.newResult(SpfResult.Code.PERMERROR, request,
                    "Included domain '" + target + "': " + result.text()));
            case NONE -> TermOutcome.terminal(server.newResult(SpfResult.Code.PERMERROR, request,
                    "Included domain '" + target + "' has no applicable sender policy"));
        };
    }

    @Override
    protected String params() {
        return ":" + domainSpec;
    }
}
