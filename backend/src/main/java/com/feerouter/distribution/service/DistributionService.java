package com.feerouter.distribution.service;

import com.feerouter.distribution.engine.DayProgress;
import com.feerouter.distribution.engine.DistributionEngine;
import com.feerouter.distribution.engine.InvestorShare;
import com.feerouter.distribution.position.FeeClaimLedger;
import com.feerouter.distribution.position.HonoraryPositionGuard;
import com.feerouter.domain.DayInvestorSet;
import com.feerouter.domain.DayInvestorSetRepository;
import com.feerouter.domain.DistributionProgress;
import com.feerouter.domain.DistributionProgressRepository;
import com.feerouter.domain.HonoraryPosition;
import com.feerouter.domain.HonoraryPositionRepository;
import com.feerouter.domain.InvestorRoster;
import com.feerouter.domain.InvestorRosterRepository;
import com.feerouter.domain.Policy;
import com.feerouter.error.ErrorCodes;
import com.feerouter.error.NotFoundException;
import com.feerouter.error.SequenceViolationException;
import com.feerouter.integration.FeeClaim;
import com.feerouter.integration.FeeSource;
import com.feerouter.integration.VestingOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one crank page for a vault. External calls happen here, outside any transaction; the page itself is
 * committed by {@link DistributionPageWriter}.
 * <p>
 * On a day-opening page the order is: 24h gate, locked amounts for the whole investor set, fee claim, claim record,
 * base-fee guard, commit. The claim drains the position, so it runs only after every read that can fail and is never
 * retried. Its amount is on the fee-claim ledger before anything else can fail, and the commit folds every pending
 * claim into the day it opens.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributionService {

    private final DistributionEngine engine;
    private final DistributionQueryService queryService;
    private final DistributionProgressRepository progressRepository;
    private final HonoraryPositionRepository positionRepository;
    private final InvestorRosterRepository rosterRepository;
    private final DayInvestorSetRepository dayInvestorSetRepository;
    private final FeeSource feeSource;
    private final VestingOracle vestingOracle;
    private final HonoraryPositionGuard guard;
    private final FeeClaimLedger claimLedger;
    private final DistributionPageWriter pageWriter;
    private final Clock clock;

    /**
     * @param investors the page's investors in index order; the first page of a day carries the whole investor set.
     *                  Null or empty takes them from the set the day opened with, or from the registered roster.
     * @throws SequenceViolationException INVALID_PAGINATION, INVALID_PAGINATION_SEQUENCE, INVESTOR_SET_MISMATCH
     * @throws com.feerouter.error.WindowViolationException DISTRIBUTION_WINDOW_NOT_ELAPSED
     * @throws com.feerouter.error.SafetyViolationException BASE_FEES_DETECTED
     * @throws com.feerouter.error.ConcurrentCrankException another page for the vault committed first
     */
    public CrankResult runPage(String vault, int pageStart, int pageSize, List<InvestorRef> investors) {
        Instant now = clock.instant();
        Policy policy = queryService.findPolicy(vault)
                .orElseThrow(() -> new NotFoundException(ErrorCodes.POLICY_NOT_FOUND, "No policy for vault " + vault));
        DistributionProgress doc = progressRepository.findById(vault)
                .orElseThrow(() -> new NotFoundException(ErrorCodes.POLICY_NOT_FOUND, "No progress for vault " + vault));
        DayProgress state = ProgressMapper.toState(policy, doc);

        engine.admit(policy, state, pageStart, pageSize);
        boolean opensDay = engine.opensDay(state);
        if (opensDay) {
            engine.checkWindow(state, now);
        }

        int expected = opensDay ? policy.getTotalInvestors() : engine.expectedPageLength(policy, pageStart, pageSize);
        int firstIndex = opensDay ? 0 : pageStart;
        Optional<List<InvestorRoster.Entry>> registered = opensDay
                ? rosterEntries(vault)
                : dayEntries(vault, state.currentDayStartedTs()).or(() -> rosterEntries(vault));
        List<InvestorRef> refs = resolveInvestors(vault, registered, investors, firstIndex, expected);
        if (opensDay) {
            requireDistinct(refs);
        }

        Instant lockedAt = opensDay ? now : state.currentDayStartedTs();
        List<InvestorShare> shares = readLocked(refs, firstIndex, lockedAt);
        if (opensDay) {
            claimFees(vault);
        }

        return pageWriter.commit(new PageCommand(vault, pageStart, pageSize, opensDay,
                opensDay ? null : state.currentDayStartedTs(), shares, now));
    }

    private Optional<List<InvestorRoster.Entry>> rosterEntries(String vault) {
        return rosterRepository.findById(vault).map(InvestorRoster::getEntries);
    }

    private Optional<List<InvestorRoster.Entry>> dayEntries(String vault, Instant dayStartedTs) {
        return dayInvestorSetRepository.findById(vault)
                .filter(s -> Objects.equals(s.getDayStartedTs(), dayStartedTs))
                .map(DayInvestorSet::getEntries);
    }

    /**
     * Investors for indices {@code firstIndex .. firstIndex + expected - 1}: the caller's list when given, else the
     * registered slice. A caller's list must agree with the registered set, when there is one.
     */
    private static List<InvestorRef> resolveInvestors(String vault, Optional<List<InvestorRoster.Entry>> registered,
                                                      List<InvestorRef> supplied, int firstIndex, int expected) {
        if (supplied == null || supplied.isEmpty()) {
            List<InvestorRoster.Entry> entries = registered.orElseThrow(() -> new NotFoundException(
                    ErrorCodes.ROSTER_NOT_FOUND, "No investors supplied and no roster registered for vault " + vault));
            if (entries.size() < firstIndex + expected) {
                throw new SequenceViolationException(ErrorCodes.INVESTOR_SET_MISMATCH,
                        "Investor set for vault " + vault + " has " + entries.size() + " investors");
            }
            List<InvestorRef> refs = new ArrayList<>(expected);
            for (InvestorRoster.Entry e : entries.subList(firstIndex, firstIndex + expected)) {
                refs.add(new InvestorRef(e.getInvestorId(), e.getPayoutAccount()));
            }
            return refs;
        }

        if (supplied.size() != expected) {
            throw new SequenceViolationException(ErrorCodes.INVESTOR_SET_MISMATCH,
                    "Page at " + firstIndex + " must carry " + expected + " investors, got " + supplied.size());
        }
        if (registered.isPresent()) {
            List<InvestorRoster.Entry> entries = registered.get();
            for (int offset = 0; offset < supplied.size(); offset++) {
                int index = firstIndex + offset;
                InvestorRef ref = supplied.get(offset);
                InvestorRoster.Entry entry = index < entries.size() ? entries.get(index) : null;
                if (entry == null || ref == null
                        || !entry.getInvestorId().equals(ref.investorId())
                        || !entry.getPayoutAccount().equals(ref.payoutAccount())) {
                    throw new SequenceViolationException(ErrorCodes.INVESTOR_SET_MISMATCH,
                            "Investor at index " + index + " does not match the registered investor set");
                }
            }
        }
        return supplied;
    }

    private static void requireDistinct(List<InvestorRef> refs) {
        Set<String> seen = new HashSet<>();
        for (InvestorRef ref : refs) {
            if (ref != null && ref.investorId() != null && !seen.add(ref.investorId())) {
                throw new SequenceViolationException(ErrorCodes.INVESTOR_SET_MISMATCH,
                        "Investor " + ref.investorId() + " appears more than once");
            }
        }
    }

    private List<InvestorShare> readLocked(List<InvestorRef> refs, int firstIndex, Instant at) {
        List<InvestorShare> shares = new ArrayList<>(refs.size());
        for (int offset = 0; offset < refs.size(); offset++) {
            InvestorRef ref = refs.get(offset);
            if (ref == null || ref.investorId() == null || ref.payoutAccount() == null) {
                throw new SequenceViolationException(ErrorCodes.INVESTOR_SET_MISMATCH,
                        "Investor at index " + (firstIndex + offset) + " is incomplete");
            }
            long locked = vestingOracle.lockedAmount(ref.investorId(), at);
            shares.add(new InvestorShare(firstIndex + offset, ref.investorId(), ref.payoutAccount(), locked));
        }
        return shares;
    }

    private void claimFees(String vault) {
        HonoraryPosition position = positionRepository.findById(vault)
                .orElseThrow(() -> new NotFoundException(ErrorCodes.POSITION_NOT_FOUND,
                        "No honorary position for vault " + vault));
        FeeClaim claim = feeSource.claim(position.getPositionHandle(), position.getDesignatedAsset());
        try {
            claimLedger.record(vault, position.getPositionHandle(), claim);
        } catch (RuntimeException e) {
            log.error("Fees claimed for vault {} could not be recorded: designated={}, other={}",
                    vault, claim.designatedAmount(), claim.otherAmount(), e);
            throw e;
        }
        guard.checkClaim(vault, claim);
    }
}
