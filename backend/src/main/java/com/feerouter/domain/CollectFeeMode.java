package com.feerouter.domain;

/**
 * How a pool collects trading fees. Wire values follow the AMM's numeric encoding.
 */
public enum CollectFeeMode {
    /** Fees accrue in both assets; never acceptable for an honorary position. */
    BOTH_TOKENS(0),
    /** Fees accrue only in token B. */
    ONLY_B(1);

    private final int wireValue;

    CollectFeeMode(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    /** Null for values the AMM does not define. */
    public static CollectFeeMode fromWire(int value) {
        for (CollectFeeMode mode : values()) {
            if (mode.wireValue == value) {
                return mode;
            }
        }
        return null;
    }
}
