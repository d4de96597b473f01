package com.feerouter.distribution.service;

import com.feerouter.distribution.engine.DayProgress;
import com.feerouter.domain.DistributionProgress;
import com.feerouter.domain.PaidBitmap;
import com.feerouter.domain.Policy;

/**
 * Converts between the persisted progress document and the engine's immutable snapshot.
 */
final class ProgressMapper {

    private ProgressMapper() {
    }

    static DayProgress toState(Policy policy, DistributionProgress doc) {
        return new DayProgress(
                doc.getLastDistributionTs(),
                doc.getCurrentDayStartedTs(),
                doc.getCursor(),
                PaidBitmap.fromBytes(policy.getTotalInvestors(), doc.getPaidBitmap()),
                doc.isDayCompleted(),
                doc.getCurrentDayTotalClaimed(),
                doc.getCurrentDayTotalLocked(),
                doc.getCurrentDayEligibleBps(),
                doc.getCurrentDayInvestorPool(),
                doc.getCurrentDayDistributed(),
                doc.getTotalDistributions(),
                doc.getTotalInvestorDistributed(),
                doc.getTotalCreatorDistributed());
    }

    /** Copies every state field onto {@code target}; id and version are left alone. */
    static DistributionProgress apply(DayProgress state, DistributionProgress target) {
        target.setLastDistributionTs(state.lastDistributionTs());
        target.setCurrentDayStartedTs(state.currentDayStartedTs());
        target.setCursor(state.cursor());
        target.setPaidBitmap(state.paid().toBytes());
        target.setDayCompleted(state.dayCompleted());
        target.setCurrentDayTotalClaimed(state.totalClaimed());
        target.setCurrentDayTotalLocked(state.totalLocked());
        target.setCurrentDayEligibleBps(state.eligibleBps());
        target.setCurrentDayInvestorPool(state.investorPool());
        target.setCurrentDayDistributed(state.distributed());
        target.setTotalDistributions(state.totalDistributions());
        target.setTotalInvestorDistributed(state.totalInvestorDistributed());
        target.setTotalCreatorDistributed(state.totalCreatorDistributed());
        return target;
    }
}
