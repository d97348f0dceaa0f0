package io.github.hotbrkm.spfengine.evaluator.spf;

/**
 * Resource record types queried when looking up a policy record.
 */
public enum QueryRrTypes {

    NONE(false, false),
    /** Type 99 records only. */
    SPF(true, false),
    TXT(false, true),
    /** Type 99 first, TXT when no type 99 record applies. */
    ALL(true, true);

    private final boolean spf;
    private final boolean txt;

    QueryRrTypes(boolean spf, boolean txt) {
        this.spf = spf;
        this.txt = txt;
    }

    public boolean includesSpf() {
        return spf;
    }

    public boolean includesTxt() {
        return txt;
    }
}
