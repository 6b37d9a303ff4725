package com.di.qualitygate.gate;

/**
 * What the quality gate does with a row holding a value that no rule can
 * interpret (see {@link com.di.qualitygate.rules.UnparsableValueException}).
 */
public enum UnparsableValuePolicy {

    /**
     * Fail the whole entity: nothing is published for it, the previous cleansed
     * table is kept and the batch run ends as FAILED.
     */
    FAIL_ENTITY,

    /** Quarantine the row as "Unparsable Value" and carry on. */
    QUARANTINE_ROW
}
