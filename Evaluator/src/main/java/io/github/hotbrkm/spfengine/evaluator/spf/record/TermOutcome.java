package io.github.hotbrkm.spfengine.evaluator.spf.record;

import io.github.hotbrkm.spfengine.evaluator.spf.result.SpfResult;

/**
 * Outcome of evaluating one mechanism: match, no match, or a verdict that ends the evaluation
 * regardless of the qualifier (e.g. a {@code temperror} from an included policy).
 */
public record TermOutcome(boolean match, SpfResult result) {

    public static final TermOutcome MATCH = new TermOutcome(true, null);
    public static final TermOutcome NO_MATCH = new TermOutcome(false, null);

    public static TermOutcome of(boolean match) {
        return match ? MATCH : NO_MATCH;
    }

    public static TermOutcome terminal(SpfResult result) {
        return new TermOutcome(false, result);
    }

    public boolean isTerminal() {
        return result != null;
    }
}
