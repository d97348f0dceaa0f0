package io.github.hotbrkm.spfengine.evaluator.spf.exception;

/**
 * The authority domain publishes no policy record applicable to the requested scope. Mapped to {@code none}.
 */
public class NoAcceptableRecordException extends SpfException {

    public NoAcceptableRecordException(String message) {
        super(message);
    }
}
