package io.github.hotbrkm.spfengine.evaluator.spf;

/**
 * Counters shared by a root request and every sub-request spawned from it through {@code include} or
 * {@code redirect=}.
 * <p>
 * One instance is created per root request and handed down by reference; it is never shared between
 * unrelated evaluations and is not thread-safe.
 */
public final class LimitTracker {

    private int dnsInteractiveTerms;
    private int voidDnsLookups;

    /**
     * Counts one term that is about to issue DNS queries.
     *
     * @return the count including this term
     */
    public int countDnsInteractiveTerm() {
        return ++dnsInteractiveTerms;
    }

    /**
     * Counts one query that returned no usable answer.
     *
     * @return the count including this lookup
     */
    public int countVoidDnsLookup() {
        return ++voidDnsLookups;
    }

    public int getDnsInteractiveTerms() {
        return dnsInteractiveTerms;
    }

    public int getVoidDnsLookups() {
        return voidDnsLookups;
    }

    void reset() {
        dnsInteractiveTerms = 0;
        voidDnsLookups = 0;
    }
}
