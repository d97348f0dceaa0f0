package io.github.hotbrkm.spfengine.evaluator.spf.exception;

/**
 * Base class of the protocol-level failures raised while selecting or evaluating a sender policy.
 * <p>
 * {@link io.github.hotbrkm.spfengine.evaluator.spf.SpfServer#process} converts the subclasses into
 * terminal verdicts. Anything outside this hierarchy is treated as a defect and propagates.
 */
public class SpfException extends RuntimeException {

    public SpfException(String message) {
        super(message);
    }

    public SpfException(String message, Throwable cause) {
        super(message, cause);
    }
}
