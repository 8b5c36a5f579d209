package com.netcourier.docstruct.service.dedup;

public enum MergeOutcome {
    /** First record seen for the normalized key. */
    CREATED,
    /** Same key and an equivalent value: only the comment was merged. */
    MERGED,
    /** Same key with a value not seen before: kept as a flagged variant. */
    CONFLICT
}
