package gr.imsi.athenarc.tsdb.query;

import gr.imsi.athenarc.tsdb.exception.QueryException;

import java.util.Locale;

/**
 * What to put in empty time buckets.
 */
public enum FillPolicy {
    NULL,
    NONE,
    PREVIOUS,
    LINEAR,
    VALUE;

    public static FillPolicy fromString(String policy) {
        try {
            return valueOf(policy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new QueryException("Unknown fill policy: " + policy, null, e);
        }
    }
}
