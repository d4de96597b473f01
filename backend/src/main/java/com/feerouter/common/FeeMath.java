package com.feerouter.common;

import java.math.BigInteger;

/**
 * Integer fee arithmetic in lamports and basis points. All divisions floor; intermediates are computed
 * in 128-bit-or-wider precision so that {@code amount * bps} and {@code pool * locked} never overflow.
 */
public final class FeeMath {

    public static final long BPS_DENOMINATOR = 10_000L;
    public static final long SECONDS_PER_DAY = 86_400L;

    private static final BigInteger BPS = BigInteger.valueOf(BPS_DENOMINATOR);

    private FeeMath() {
    }

    /** floor(locked * 10000 / y0), capped at 10000. Returns 0 when y0 is not positive. */
    public static int lockedFractionBps(long totalLocked, long y0TotalAllocation) {
        if (y0TotalAllocation <= 0 || totalLocked <= 0) {
            return 0;
        }
        BigInteger fraction = BigInteger.valueOf(totalLocked).multiply(BPS)
                .divide(BigInteger.valueOf(y0TotalAllocation));
        return fraction.min(BPS).intValue();
    }

    /** min(maxShareBps, lockedFractionBps(totalLocked, y0)). */
    public static int eligibleShareBps(long totalLocked, long y0TotalAllocation, int maxShareBps) {
        return Math.min(maxShareBps, lockedFractionBps(totalLocked, y0TotalAllocation));
    }

    /** floor(claimed * bps / 10000). */
    public static long applyBps(long claimed, int bps) {
        if (claimed <= 0 || bps <= 0) {
            return 0L;
        }
        return BigInteger.valueOf(claimed).multiply(BigInteger.valueOf(bps)).divide(BPS).longValueExact();
    }

    /** floor(pool * locked / totalLocked); zero when totalLocked is zero. */
    public static long proRata(long pool, long locked, long totalLocked) {
        if (totalLocked <= 0 || pool <= 0 || locked <= 0) {
            return 0L;
        }
        return BigInteger.valueOf(pool).multiply(BigInteger.valueOf(locked))
                .divide(BigInteger.valueOf(totalLocked))
                .longValueExact();
    }

    /** Sum that throws {@link ArithmeticException} on overflow. */
    public static long sum(Iterable<Long> values) {
        long total = 0L;
        for (Long v : values) {
            total = Math.addExact(total, v == null ? 0L : v);
        }
        return total;
    }
}
