package io.github.hotbrkm.spfengine.evaluator.spf.exception;

/**
 * A record, term or macro string that is correctly tagged but malformed. Mapped to {@code permerror}.
 */
public class RecordSyntaxException extends SpfException {

    public RecordSyntaxException(String message) {
        super(message);
    }
}
