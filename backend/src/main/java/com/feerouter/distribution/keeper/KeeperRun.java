package com.feerouter.distribution.keeper;

/**
 * How one keeper pass over a vault ended.
 */
public enum KeeperRun {
    /** The day was finalized during this pass. */
    DAY_COMPLETED,
    /** The 24h window has not elapsed; nothing to do. */
    NOT_DUE,
    /** Sequencing or concurrency rejections outlasted the retry budget. */
    RETRIES_EXHAUSTED,
    /** Safety violation; the vault needs an operator. */
    HALTED,
    /** Non-retriable rejection or external failure; next sweep tries again. */
    FAILED,
    /** Page budget for one pass used up before the day closed. */
    PAGE_LIMIT,
    /** Another pass for the same vault is still running. */
    SKIPPED,
    INTERRUPTED
}
