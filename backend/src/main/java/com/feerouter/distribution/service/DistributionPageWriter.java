package com.feerouter.distribution.service;

import com.feerouter.common.FeeMath;
import com.feerouter.distribution.engine.DayProgress;
import com.feerouter.distribution.engine.DaySplit;
import com.feerouter.distribution.engine.DistributionEngine;
import com.feerouter.distribution.engine.InvestorPayout;
import com.feerouter.distribution.engine.InvestorShare;
import com.feerouter.distribution.engine.PageOutcome;
import com.feerouter.distribution.event.CreatorPayoutDayClosedEvent;
import com.feerouter.distribution.event.FeesClaimedEvent;
import com.feerouter.distribution.event.InvestorPayoutPageEvent;
import com.feerouter.distribution.position.FeeClaimLedger;
import com.feerouter.domain.DayInvestorSet;
import com.feerouter.domain.DayInvestorSetRepository;
import com.feerouter.domain.DistributionProgress;
import com.feerouter.domain.DistributionProgressRepository;
import com.feerouter.domain.HonoraryPosition;
import com.feerouter.domain.HonoraryPositionRepository;
import com.feerouter.domain.InvestorRoster;
import com.feerouter.domain.PayoutTransfer;
import com.feerouter.domain.PayoutTransferRepository;
import com.feerouter.domain.Policy;
import com.feerouter.error.ConcurrentCrankException;
import com.feerouter.error.ErrorCodes;
import com.feerouter.error.NotFoundException;
import com.feerouter.error.SequenceViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Commits one prepared crank page. Progress, payout ledger, reconciled claims, the day's investor set and the
 * position counter are written in one transaction; the {@code @Version} on the progress document rejects a second
 * page racing on the same cursor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributionPageWriter {

    private final DistributionEngine engine;
    private final DistributionQueryService queryService;
    private final DistributionProgressRepository progressRepository;
    private final HonoraryPositionRepository positionRepository;
    private final DayInvestorSetRepository dayInvestorSetRepository;
    private final PayoutTransferRepository payoutTransferRepository;
    private final FeeClaimLedger claimLedger;
    private final ApplicationEventPublisher applicationEventPublisher;

    @Transactional
    public CrankResult commit(PageCommand command) {
        String vault = command.vault();
        Instant now = command.now();
        Policy policy = queryService.findPolicy(vault)
                .orElseThrow(() -> new NotFoundException(ErrorCodes.POLICY_NOT_FOUND, "No policy for vault " + vault));
        DistributionProgress doc = progressRepository.findById(vault)
                .orElseThrow(() -> new NotFoundException(ErrorCodes.POLICY_NOT_FOUND, "No progress for vault " + vault));
        DayProgress state = ProgressMapper.toState(policy, doc);

        engine.admit(policy, state, command.pageStart(), command.pageSize());
        if (engine.opensDay(state) != command.opensDay()
                || (!command.opensDay()
                && !Objects.equals(state.currentDayStartedTs(), command.observedDayStartedTs()))) {
            throw new SequenceViolationException(ErrorCodes.INVALID_PAGINATION_SEQUENCE,
                    "Day state of vault " + vault + " changed while the page was prepared; re-read the cursor");
        }

        List<InvestorShare> page;
        DayProgress started = null;
        if (command.opensDay()) {
            engine.checkWindow(state, now);
            long claimed = claimLedger.reconcile(claimLedger.unreconciled(vault), now);
            long totalLocked = FeeMath.sum(command.investors().stream().map(InvestorShare::locked).toList());
            DaySplit split = engine.computeSplit(policy, claimed, totalLocked);
            state = engine.startDay(policy, state, split, now);
            started = state;
            addToPosition(vault, claimed);
            freezeInvestorSet(vault, now, command.investors());
            log.info("Day opened for vault {}: claimed={}, totalLocked={}, eligibleBps={}, investorPool={}",
                    vault, split.totalClaimed(), split.totalLocked(), split.eligibleBps(), split.investorPool());
            page = command.investors().subList(0, engine.expectedPageLength(policy, 0, command.pageSize()));
        } else {
            checkAgainstDaySet(vault, state.currentDayStartedTs(), command.investors());
            page = command.investors();
        }

        PageOutcome outcome = engine.applyPage(policy, state, command.pageStart(), command.pageSize(), page, now);
        DayProgress next = outcome.next();
        writeTransfers(vault, policy, next.currentDayStartedTs(), outcome, now);

        try {
            progressRepository.save(ProgressMapper.apply(next, doc));
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrentCrankException("Progress for vault " + vault + " changed concurrently", e);
        }

        publish(command, started, outcome);
        log.info("Crank page vault={} start={} size={}: paid {} investors, distributed={}, dust={}, skipped={}, cursor {}",
                vault, command.pageStart(), command.pageSize(), outcome.payouts().size(), outcome.pageDistributed(),
                outcome.pageDust(), outcome.alreadyPaid(), next.cursor());
        if (outcome.dayClosed()) {
            log.info("Day closed for vault {}: investors={}, creator={}, claimed={}",
                    vault, next.distributed(), outcome.creatorRemainder(), next.totalClaimed());
        }

        return new CrankResult(vault, command.pageStart(), command.pageSize(), next.cursor(), command.opensDay(),
                outcome.dayClosed(), outcome.payouts().size(), outcome.pageDistributed(), outcome.pageDust(),
                outcome.alreadyPaid(), outcome.creatorRemainder());
    }

    private void addToPosition(String vault, long claimed) {
        HonoraryPosition position = positionRepository.findById(vault)
                .orElseThrow(() -> new NotFoundException(ErrorCodes.POSITION_NOT_FOUND,
                        "No honorary position for vault " + vault));
        position.setTotalFeesClaimed(Math.addExact(position.getTotalFeesClaimed(), claimed));
        positionRepository.save(position);
    }

    private void freezeInvestorSet(String vault, Instant dayStartedTs, List<InvestorShare> investors) {
        DayInvestorSet set = new DayInvestorSet();
        set.setVault(vault);
        set.setDayStartedTs(dayStartedTs);
        set.setEntries(investors.stream()
                .map(s -> new InvestorRoster.Entry(s.investorId(), s.payoutAccount()))
                .toList());
        dayInvestorSetRepository.save(set);
    }

    private void checkAgainstDaySet(String vault, Instant dayStartedTs, List<InvestorShare> page) {
        List<InvestorRoster.Entry> entries = dayInvestorSetRepository.findById(vault)
                .filter(s -> Objects.equals(s.getDayStartedTs(), dayStartedTs))
                .map(DayInvestorSet::getEntries)
                .orElseThrow(() -> new SequenceViolationException(ErrorCodes.INVESTOR_SET_MISMATCH,
                        "No investor set recorded for the day in progress on vault " + vault));
        for (InvestorShare share : page) {
            InvestorRoster.Entry entry = share.index() < entries.size() ? entries.get(share.index()) : null;
            if (entry == null
                    || !entry.getInvestorId().equals(share.investorId())
                    || !entry.getPayoutAccount().equals(share.payoutAccount())) {
                throw new SequenceViolationException(ErrorCodes.INVESTOR_SET_MISMATCH,
                        "Investor at index " + share.index() + " differs from the set the day opened with");
            }
        }
    }

    private void writeTransfers(String vault, Policy policy, Instant dayStartedTs, PageOutcome outcome, Instant now) {
        List<PayoutTransfer> transfers = new ArrayList<>(outcome.payouts().size() + 1);
        for (InvestorPayout payout : outcome.payouts()) {
            transfers.add(transfer(vault, dayStartedTs, PayoutTransfer.Kind.INVESTOR, payout.index(),
                    payout.payoutAccount(), payout.amount(), now));
        }
        if (outcome.dayClosed() && outcome.creatorRemainder() > 0) {
            transfers.add(transfer(vault, dayStartedTs, PayoutTransfer.Kind.CREATOR, -1,
                    policy.getCreatorWallet(), outcome.creatorRemainder(), now));
        }
        if (transfers.isEmpty()) {
            return;
        }
        try {
            payoutTransferRepository.insert(transfers);
        } catch (DuplicateKeyException e) {
            throw new ConcurrentCrankException("Payout already recorded for vault " + vault + " day " + dayStartedTs, e);
        }
    }

    private static PayoutTransfer transfer(String vault, Instant dayStartedTs, PayoutTransfer.Kind kind, int index,
                                           String recipient, long amount, Instant now) {
        PayoutTransfer t = new PayoutTransfer();
        t.setVault(vault);
        t.setDayStartedTs(dayStartedTs);
        t.setKind(kind);
        t.setInvestorIndex(index);
        t.setRecipient(recipient);
        t.setAmount(amount);
        t.setCreatedAt(now);
        return t;
    }

    private void publish(PageCommand command, DayProgress started, PageOutcome outcome) {
        String vault = command.vault();
        Instant now = command.now();
        if (started != null) {
            applicationEventPublisher.publishEvent(new FeesClaimedEvent(this, vault, now, started.totalClaimed(),
                    started.totalLocked(), started.eligibleBps(), started.investorPool()));
        }
        applicationEventPublisher.publishEvent(new InvestorPayoutPageEvent(this, vault, now, command.pageStart(),
                command.pageSize(), outcome.payouts().size(), outcome.pageDistributed(), outcome.pageDust()));
        if (outcome.dayClosed()) {
            DayProgress closed = outcome.next();
            applicationEventPublisher.publishEvent(new CreatorPayoutDayClosedEvent(this, vault, now,
                    outcome.creatorRemainder(), closed.distributed(), closed.totalClaimed()));
        }
    }
}
