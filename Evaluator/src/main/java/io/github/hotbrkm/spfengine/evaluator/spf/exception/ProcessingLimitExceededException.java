package io.github.hotbrkm.spfengine.evaluator.spf.exception;

/**
 * A DNS-interactive term, void lookup or per-mechanism name lookup limit was exceeded. Mapped to {@code permerror}.
 */
public class ProcessingLimitExceededException extends SpfException {

    public ProcessingLimitExceededException(String message) {
        super(message);
    }
}
