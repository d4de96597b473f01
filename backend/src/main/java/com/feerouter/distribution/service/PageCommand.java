package com.feerouter.distribution.service;

import com.feerouter.distribution.engine.InvestorShare;

import java.time.Instant;
import java.util.List;

/**
 * A crank page prepared outside the transaction: investors resolved, locked amounts read, fees claimed.
 *
 * @param opensDay            whether the page was prepared as the first page of a day
 * @param observedDayStartedTs start of the day the locked amounts were read for; null on a day-opening page
 * @param investors           the whole investor set on a day-opening page, otherwise the page's own slice
 */
public record PageCommand(
        String vault,
        int pageStart,
        int pageSize,
        boolean opensDay,
        Instant observedDayStartedTs,
        List<InvestorShare> investors,
        Instant now
) {
}
