package io.github.hotbrkm.spfengine.evaluator.spf.exception;

/**
 * More than one record of the selected version applies to the requested scope (RFC 4408, 4.5/6).
 * Mapped to {@code permerror}.
 */
public class RedundantAcceptableRecordsException extends SpfException {

    public RedundantAcceptableRecordsException(String message) {
        super(message);
    }
}
