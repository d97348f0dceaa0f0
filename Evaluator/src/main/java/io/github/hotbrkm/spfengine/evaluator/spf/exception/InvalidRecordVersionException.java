package io.github.hotbrkm.spfengine.evaluator.spf.exception;

/**
 * The text is not tagged for the record version being tried.
 * <p>
 * Only raised by the record parsers; record extraction catches it and tries the next version.
 */
public class InvalidRecordVersionException extends SpfException {

    public InvalidRecordVersionException(String message) {
        super(message);
    }
}
