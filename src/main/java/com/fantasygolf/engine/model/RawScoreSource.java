package com.fantasygolf.engine.model;

/**
 * Where a recomputed record's raw score came from.
 */
public enum RawScoreSource {
    /** Joined to a new-format source row. */
    MATCHED,
    /** No source row; the record already carried a numeric raw score. */
    RETAINED,
    /** No source row; legacy flag was true, mapped to the configured bonus floor. */
    FALLBACK_FLAG_TRUE,
    /** No source row; legacy flag false or absent, mapped to unknown (no bonus). */
    FALLBACK_NO_BONUS,
    /** No source row and no legacy flag, left untouched under the EXCLUDE policy. */
    EXCLUDED,
    /** Record did not participate; raw score is irrelevant. */
    NOT_PARTICIPATED
}
