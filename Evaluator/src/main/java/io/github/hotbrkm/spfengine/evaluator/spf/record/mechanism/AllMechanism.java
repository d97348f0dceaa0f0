package io.github.hotbrkm.spfengine.evaluator.spf.record.mechanism;

import io.github.hotbrkm.spfengine.evaluator.spf.SpfRequest;
import io.github.hotbrkm.spfengine.evaluator.spf.SpfServer;
import io.github.hotbrkm.spfengine.evaluator.spf.record.Qualifier;
import io.github.hotbrkm.spfengine.evaluator.spf.record.TermOutcome;

public class AllMechanism extends Mechanism {

    public AllMechanism(Qualifier qualifier) {
        super(qualifier);
    }

    @Override
    public String getName() {
        return "all";
    }

    @Override
    public TermOutcome evaluate(SpfServer server, SpfRequest request) {
        return TermOutcome.MATCH;
    }
}
