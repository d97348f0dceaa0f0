package io.github.hotbrkm.spfengine.evaluator.spf.exception;

/**
 * DNS-layer failure: no answer, or an answer whose RCODE is neither NOERROR nor NXDOMAIN.
 * Mapped to {@code temperror}.
 */
public class DnsException extends SpfException {

    public DnsException(String message) {
        super(message);
    }

    public DnsException(String message, Throwable cause) {
        super(message, cause);
    }
}
