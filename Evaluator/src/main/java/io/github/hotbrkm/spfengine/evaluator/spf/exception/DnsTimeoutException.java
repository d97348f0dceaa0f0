package io.github.hotbrkm.spfengine.evaluator.spf.exception;

/**
 * The resolver gave up waiting for an answer.
 */
public class DnsTimeoutException extends DnsException {

    public DnsTimeoutException(String message) {
        super(message);
    }
}
