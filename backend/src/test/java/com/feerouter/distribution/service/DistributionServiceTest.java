package com.feerouter.distribution.service;

import com.feerouter.distribution.engine.DayProgress;
import com.feerouter.distribution.engine.DistributionEngine;
import com.feerouter.distribution.event.CreatorPayoutDayClosedEvent;
import com.feerouter.distribution.event.FeesClaimedEvent;
import com.feerouter.distribution.event.InvestorPayoutPageEvent;
import com.feerouter.distribution.position.FeeClaimLedger;
import com.feerouter.distribution.position.HonoraryPositionGuard;
import com.feerouter.domain.DayInvestorSet;
import com.feerouter.domain.DayInvestorSetRepository;
import com.feerouter.domain.DistributionProgress;
import com.feerouter.domain.DistributionProgressRepository;
import com.feerouter.domain.FeeClaimRecord;
import com.feerouter.domain.FeeClaimRecordRepository;
import com.feerouter.domain.HonoraryPosition;
import com.feerouter.domain.HonoraryPositionRepository;
import com.feerouter.domain.InvestorRoster;
import com.feerouter.domain.InvestorRosterRepository;
import com.feerouter.domain.PaidBitmap;
import com.feerouter.domain.PayoutTransfer;
import com.feerouter.domain.PayoutTransferRepository;
import com.feerouter.domain.Policy;
import com.feerouter.error.ConcurrentCrankException;
import com.feerouter.error.ErrorCodes;
import com.feerouter.error.IntegrationException;
import com.feerouter.error.NotFoundException;
import com.feerouter.error.SafetyViolationException;
import com.feerouter.error.SequenceViolationException;
import com.feerouter.error.WindowViolationException;
import com.feerouter.integration.FeeClaim;
import com.feerouter.integration.FeeSource;
import com.feerouter.integration.VestingOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DistributionServiceTest {

    private static final String VAULT = "vault-1";
    private static final Instant NOW = Instant.parse("2025-03-02T00:00:00Z");

    @Mock
    DistributionQueryService queryService;
    @Mock
    DistributionProgressRepository progressRepository;
    @Mock
    HonoraryPositionRepository positionRepository;
    @Mock
    InvestorRosterRepository rosterRepository;
    @Mock
    DayInvestorSetRepository dayInvestorSetRepository;
    @Mock
    FeeClaimRecordRepository claimRecordRepository;
    @Mock
    PayoutTransferRepository payoutTransferRepository;
    @Mock
    FeeSource feeSource;
    @Mock
    VestingOracle vestingOracle;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;
    @Captor
    ArgumentCaptor<List<PayoutTransfer>> transfers;
    @Captor
    ArgumentCaptor<List<FeeClaimRecord>> reconciled;
    @Captor
    ArgumentCaptor<DistributionProgress> savedProgress;
    @Captor
    ArgumentCaptor<HonoraryPosition> savedPosition;
    @Captor
    ArgumentCaptor<DayInvestorSet> savedDaySet;

    /** Committed state of the fee_claims collection; page writes against it are never applied, as on rollback. */
    final List<FeeClaimRecord> claimStore = new ArrayList<>();

    DistributionService service;
    Policy policy;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        DistributionEngine engine = new DistributionEngine(50);
        FeeClaimLedger claimLedger = new FeeClaimLedger(claimRecordRepository, clock);
        DistributionPageWriter pageWriter = new DistributionPageWriter(engine, queryService, progressRepository,
                positionRepository, dayInvestorSetRepository, payoutTransferRepository, claimLedger,
                applicationEventPublisher);
        service = new DistributionService(engine, queryService, progressRepository, positionRepository,
                rosterRepository, dayInvestorSetRepository, feeSource, vestingOracle, new HonoraryPositionGuard(),
                claimLedger, pageWriter, clock);
        policy = Policy.builder()
                .vault(VAULT)
                .creatorWallet("creator-wallet")
                .investorFeeShareBps(10_000)
                .minPayoutLamports(0L)
                .y0TotalAllocation(1_000_000L)
                .totalInvestors(4)
                .createdAt(NOW.minus(Duration.ofDays(3)))
                .build();
        when(queryService.findPolicy(VAULT)).thenReturn(Optional.of(policy));
    }

    private static List<InvestorRef> investors(int from, int to) {
        return java.util.stream.IntStream.range(from, to)
                .mapToObj(i -> new InvestorRef("inv-" + i, "acct-" + i))
                .toList();
    }

    private static DistributionProgress progressDoc(DayProgress state) {
        DistributionProgress doc = new DistributionProgress();
        doc.setVault(VAULT);
        doc.setVersion(3L);
        return ProgressMapper.apply(state, doc);
    }

    private static DayProgress dayDue() {
        return DayProgress.initial(4, NOW.minus(Duration.ofDays(1)));
    }

    /** Investors 0 and 1 paid from a 1001 pool; cursor at 2. */
    private static DayProgress midDay(Instant dayStart) {
        return new DayProgress(NOW.minus(Duration.ofDays(2)), dayStart, 2,
                PaidBitmap.empty(4).markPaid(0).markPaid(1), false,
                1_001L, 1_000_000L, 10_000, 1_001L, 500L, 5L, 100L, 100L);
    }

    private DistributionProgress stubProgress(DayProgress state) {
        DistributionProgress doc = progressDoc(state);
        when(progressRepository.findById(VAULT)).thenReturn(Optional.of(doc));
        return doc;
    }

    private DistributionProgress stubDayDue() {
        return stubProgress(dayDue());
    }

    private static HonoraryPosition position() {
        HonoraryPosition position = new HonoraryPosition();
        position.setVault(VAULT);
        position.setPositionHandle("pos-1");
        position.setDesignatedAsset("QUOTE");
        position.setOtherAsset("BASE");
        return position;
    }

    private HonoraryPosition stubPosition() {
        HonoraryPosition position = position();
        when(positionRepository.findById(VAULT)).thenReturn(Optional.of(position));
        return position;
    }

    private void stubDaySet(Instant dayStartedTs) {
        DayInvestorSet set = new DayInvestorSet();
        set.setVault(VAULT);
        set.setDayStartedTs(dayStartedTs);
        set.setEntries(investors(0, 4).stream()
                .map(r -> new InvestorRoster.Entry(r.investorId(), r.payoutAccount()))
                .toList());
        when(dayInvestorSetRepository.findById(VAULT)).thenReturn(Optional.of(set));
    }

    /** Claim records are committed on insert, as the ledger writes them in their own transaction. */
    private void recordClaims() {
        when(claimRecordRepository.insert(any(FeeClaimRecord.class))).thenAnswer(inv -> {
            FeeClaimRecord record = inv.getArgument(0);
            record.setId("claim-" + (claimStore.size() + 1));
            record.setVersion(0L);
            claimStore.add(copy(record));
            return record;
        });
    }

    private void servePendingClaims() {
        when(claimRecordRepository.findByVaultAndStatusOrderByClaimedAtAsc(VAULT, FeeClaimRecord.Status.PENDING))
                .thenAnswer(inv -> claimStore.stream()
                        .filter(r -> r.getStatus() == FeeClaimRecord.Status.PENDING)
                        .map(DistributionServiceTest::copy)
                        .toList());
    }

    private static FeeClaimRecord copy(FeeClaimRecord source) {
        FeeClaimRecord record = new FeeClaimRecord();
        record.setId(source.getId());
        record.setVersion(source.getVersion());
        record.setVault(source.getVault());
        record.setPositionHandle(source.getPositionHandle());
        record.setDesignatedAmount(source.getDesignatedAmount());
        record.setOtherAmount(source.getOtherAmount());
        record.setStatus(source.getStatus());
        record.setClaimedAt(source.getClaimedAt());
        record.setReconciledDayStartedTs(source.getReconciledDayStartedTs());
        return record;
    }

    @Test
    @DisplayName("first page reads every investor, claims once, pays its slice and keeps the day open")
    void firstPageOpensDay() {
        DistributionProgress doc = stubDayDue();
        HonoraryPosition position = stubPosition();
        recordClaims();
        servePendingClaims();
        when(vestingOracle.lockedAmount(anyString(), eq(NOW))).thenReturn(250_000L);
        when(feeSource.claim("pos-1", "QUOTE")).thenReturn(new FeeClaim(1_000L, 0L));

        CrankResult result = service.runPage(VAULT, 0, 2, investors(0, 4));

        assertThat(result.dayOpened()).isTrue();
        assertThat(result.dayClosed()).isFalse();
        assertThat(result.nextCursor()).isEqualTo(2);
        assertThat(result.investorsPaid()).isEqualTo(2);
        assertThat(result.pageDistributed()).isEqualTo(500L);

        verify(vestingOracle, times(4)).lockedAmount(anyString(), eq(NOW));
        verify(feeSource, times(1)).claim("pos-1", "QUOTE");
        assertThat(position.getTotalFeesClaimed()).isEqualTo(1_000L);
        verify(positionRepository).save(position);

        assertThat(claimStore).singleElement().satisfies(r -> {
            assertThat(r.getStatus()).isEqualTo(FeeClaimRecord.Status.PENDING);
            assertThat(r.getDesignatedAmount()).isEqualTo(1_000L);
            assertThat(r.getPositionHandle()).isEqualTo("pos-1");
            assertThat(r.getClaimedAt()).isEqualTo(NOW);
        });
        verify(claimRecordRepository).saveAll(reconciled.capture());
        assertThat(reconciled.getValue()).singleElement().satisfies(r -> {
            assertThat(r.getStatus()).isEqualTo(FeeClaimRecord.Status.RECONCILED);
            assertThat(r.getReconciledDayStartedTs()).isEqualTo(NOW);
        });

        verify(dayInvestorSetRepository).save(savedDaySet.capture());
        assertThat(savedDaySet.getValue().getDayStartedTs()).isEqualTo(NOW);
        assertThat(savedDaySet.getValue().getEntries())
                .extracting(InvestorRoster.Entry::getInvestorId)
                .containsExactly("inv-0", "inv-1", "inv-2", "inv-3");

        verify(payoutTransferRepository).insert(transfers.capture());
        assertThat(transfers.getValue()).extracting(PayoutTransfer::getRecipient).containsExactly("acct-0", "acct-1");
        assertThat(transfers.getValue()).allSatisfy(t -> {
            assertThat(t.getKind()).isEqualTo(PayoutTransfer.Kind.INVESTOR);
            assertThat(t.getAmount()).isEqualTo(250L);
            assertThat(t.getDayStartedTs()).isEqualTo(NOW);
        });

        verify(progressRepository).save(doc);
        assertThat(doc.getCursor()).isEqualTo(2);
        assertThat(doc.isDayCompleted()).isFalse();
        assertThat(doc.getCurrentDayTotalClaimed()).isEqualTo(1_000L);
        assertThat(doc.getCurrentDayDistributed()).isEqualTo(500L);
        assertThat(doc.getVersion()).isEqualTo(3L);

        verify(applicationEventPublisher).publishEvent(any(FeesClaimedEvent.class));
        verify(applicationEventPublisher).publishEvent(any(InvestorPayoutPageEvent.class));
        verify(applicationEventPublisher, never()).publishEvent(any(CreatorPayoutDayClosedEvent.class));
    }

    @Test
    @DisplayName("last page reads locked amounts at day start, never claims, and pays the creator remainder")
    void lastPageClosesDay() {
        Instant dayStart = NOW.minus(Duration.ofHours(1));
        DistributionProgress doc = stubProgress(midDay(dayStart));
        stubDaySet(dayStart);
        when(vestingOracle.lockedAmount(anyString(), eq(dayStart))).thenReturn(250_000L);

        CrankResult result = service.runPage(VAULT, 2, 2, investors(2, 4));

        assertThat(result.dayOpened()).isFalse();
        assertThat(result.dayClosed()).isTrue();
        assertThat(result.creatorPayout()).isEqualTo(1L);
        verifyNoInteractions(feeSource, claimRecordRepository);

        verify(payoutTransferRepository).insert(transfers.capture());
        assertThat(transfers.getValue()).hasSize(3);
        PayoutTransfer creator = transfers.getValue().get(2);
        assertThat(creator.getKind()).isEqualTo(PayoutTransfer.Kind.CREATOR);
        assertThat(creator.getRecipient()).isEqualTo("creator-wallet");
        assertThat(creator.getAmount()).isEqualTo(1L);

        assertThat(doc.isDayCompleted()).isTrue();
        assertThat(doc.getCursor()).isZero();
        assertThat(doc.getLastDistributionTs()).isEqualTo(NOW);
        assertThat(doc.getTotalDistributions()).isEqualTo(6L);
        assertThat(doc.getTotalInvestorDistributed()).isEqualTo(1_100L);
        assertThat(doc.getTotalCreatorDistributed()).isEqualTo(101L);
        verify(applicationEventPublisher).publishEvent(any(CreatorPayoutDayClosedEvent.class));
    }

    @Test
    @DisplayName("base fees abort the page, quarantine the claim, and keep it out of the next day")
    void baseFeesAbort() {
        DistributionProgress doc = stubDayDue();
        stubPosition();
        recordClaims();
        when(vestingOracle.lockedAmount(anyString(), eq(NOW))).thenReturn(250_000L);
        when(feeSource.claim("pos-1", "QUOTE")).thenReturn(new FeeClaim(1_000L, 7L), new FeeClaim(200L, 0L));

        assertThatThrownBy(() -> service.runPage(VAULT, 0, 4, investors(0, 4)))
                .isInstanceOf(SafetyViolationException.class)
                .satisfies(e -> assertThat(((SafetyViolationException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.BASE_FEES_DETECTED));

        assertThat(claimStore).singleElement().satisfies(r -> {
            assertThat(r.getStatus()).isEqualTo(FeeClaimRecord.Status.QUARANTINED);
            assertThat(r.getDesignatedAmount()).isEqualTo(1_000L);
            assertThat(r.getOtherAmount()).isEqualTo(7L);
            assertThat(r.getReconciledDayStartedTs()).isNull();
        });
        verify(claimRecordRepository, never()).saveAll(anyList());
        verify(progressRepository, never()).save(any());
        verify(positionRepository, never()).save(any());
        verifyNoInteractions(payoutTransferRepository, applicationEventPublisher, dayInvestorSetRepository);

        servePendingClaims();
        CrankResult next = service.runPage(VAULT, 0, 4, investors(0, 4));

        assertThat(next.pageDistributed()).isEqualTo(200L);
        assertThat(doc.getCurrentDayTotalClaimed()).isEqualTo(200L);
        assertThat(claimStore).extracting(FeeClaimRecord::getStatus)
                .containsExactly(FeeClaimRecord.Status.QUARANTINED, FeeClaimRecord.Status.PENDING);
        verify(claimRecordRepository).saveAll(reconciled.capture());
        assertThat(reconciled.getValue()).extracting(FeeClaimRecord::getId).containsExactly("claim-2");
    }

    @Test
    @DisplayName("a page that loses the race leaves its claim pending and the retry distributes it")
    void lostRaceClaimCarriedIntoRetry() {
        when(progressRepository.findById(VAULT)).thenAnswer(inv -> Optional.of(progressDoc(dayDue())));
        when(positionRepository.findById(VAULT)).thenAnswer(inv -> Optional.of(position()));
        recordClaims();
        servePendingClaims();
        when(vestingOracle.lockedAmount(anyString(), eq(NOW))).thenReturn(250_000L);
        when(feeSource.claim("pos-1", "QUOTE")).thenReturn(new FeeClaim(1_000L, 0L), new FeeClaim(0L, 0L));
        when(progressRepository.save(any(DistributionProgress.class)))
                .thenThrow(new OptimisticLockingFailureException("version 3 is stale"))
                .thenAnswer(inv -> inv.getArgument(0));

        assertThatThrownBy(() -> service.runPage(VAULT, 0, 4, investors(0, 4)))
                .isInstanceOf(ConcurrentCrankException.class);

        CrankResult retry = service.runPage(VAULT, 0, 4, investors(0, 4));

        assertThat(retry.dayOpened()).isTrue();
        assertThat(retry.dayClosed()).isTrue();
        assertThat(retry.pageDistributed()).isEqualTo(1_000L);
        verify(feeSource, times(2)).claim("pos-1", "QUOTE");
        assertThat(claimStore).extracting(FeeClaimRecord::getDesignatedAmount).containsExactly(1_000L, 0L);

        verify(progressRepository, times(2)).save(savedProgress.capture());
        DistributionProgress committed = savedProgress.getAllValues().get(1);
        assertThat(committed.getCurrentDayTotalClaimed()).isEqualTo(1_000L);
        assertThat(committed.getTotalInvestorDistributed()).isEqualTo(1_000L);

        verify(claimRecordRepository, times(2)).saveAll(reconciled.capture());
        assertThat(reconciled.getValue()).extracting(FeeClaimRecord::getId).containsExactly("claim-1", "claim-2");
        verify(positionRepository, times(2)).save(savedPosition.capture());
        assertThat(savedPosition.getValue().getTotalFeesClaimed()).isEqualTo(1_000L);
        verify(applicationEventPublisher).publishEvent(any(FeesClaimedEvent.class));
    }

    @Test
    @DisplayName("a day opened by another page while this one claimed is refused and the claim stays pending")
    void dayChangedWhilePreparing() {
        Instant otherStart = NOW.minus(Duration.ofMinutes(1));
        when(progressRepository.findById(VAULT))
                .thenReturn(Optional.of(progressDoc(dayDue())), Optional.of(progressDoc(midDay(otherStart))));
        stubPosition();
        recordClaims();
        when(vestingOracle.lockedAmount(anyString(), eq(NOW))).thenReturn(250_000L);
        when(feeSource.claim("pos-1", "QUOTE")).thenReturn(new FeeClaim(1_000L, 0L));

        assertThatThrownBy(() -> service.runPage(VAULT, 0, 4, investors(0, 4)))
                .isInstanceOf(SequenceViolationException.class)
                .satisfies(e -> assertThat(((SequenceViolationException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.INVALID_PAGINATION_SEQUENCE));

        assertThat(claimStore).singleElement()
                .satisfies(r -> assertThat(r.getStatus()).isEqualTo(FeeClaimRecord.Status.PENDING));
        verify(claimRecordRepository, never()).saveAll(anyList());
        verify(progressRepository, never()).save(any());
        verifyNoInteractions(payoutTransferRepository, applicationEventPublisher);
    }

    @Test
    @DisplayName("a new day before the window elapses is refused without touching external systems")
    void windowNotElapsed() {
        stubProgress(DayProgress.initial(4, NOW.minus(Duration.ofHours(20))));

        assertThatThrownBy(() -> service.runPage(VAULT, 0, 4, investors(0, 4)))
                .isInstanceOf(WindowViolationException.class);

        verifyNoInteractions(feeSource, vestingOracle, payoutTransferRepository, claimRecordRepository);
    }

    @Test
    @DisplayName("page start off the cursor is refused before any external read")
    void sequenceViolation() {
        stubDayDue();

        assertThatThrownBy(() -> service.runPage(VAULT, 2, 2, investors(2, 4)))
                .isInstanceOf(SequenceViolationException.class)
                .satisfies(e -> assertThat(((SequenceViolationException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.INVALID_PAGINATION_SEQUENCE));

        verifyNoInteractions(feeSource, vestingOracle);
    }

    @Test
    @DisplayName("first page without the whole investor set is INVESTOR_SET_MISMATCH")
    void firstPageNeedsWholeSet() {
        stubDayDue();

        assertThatThrownBy(() -> service.runPage(VAULT, 0, 2, investors(0, 2)))
                .isInstanceOf(SequenceViolationException.class)
                .satisfies(e -> assertThat(((SequenceViolationException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.INVESTOR_SET_MISMATCH));
        verifyNoInteractions(feeSource);
    }

    @Test
    @DisplayName("an investor named twice on the first page is refused before the claim")
    void duplicateInvestorOnFirstPage() {
        stubDayDue();
        List<InvestorRef> investors = List.of(
                new InvestorRef("inv-0", "acct-0"),
                new InvestorRef("inv-1", "acct-1"),
                new InvestorRef("inv-2", "acct-2"),
                new InvestorRef("inv-0", "acct-0"));

        assertThatThrownBy(() -> service.runPage(VAULT, 0, 4, investors))
                .isInstanceOf(SequenceViolationException.class)
                .hasMessageContaining("inv-0 appears more than once")
                .satisfies(e -> assertThat(((SequenceViolationException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.INVESTOR_SET_MISMATCH));
        verifyNoInteractions(feeSource, vestingOracle, claimRecordRepository);
    }

    @Test
    @DisplayName("a later page naming investors other than the day's set is INVESTOR_SET_MISMATCH")
    void laterPageMustMatchDaySet() {
        Instant dayStart = NOW.minus(Duration.ofHours(1));
        stubProgress(midDay(dayStart));
        stubDaySet(dayStart);
        List<InvestorRef> repeated = List.of(new InvestorRef("inv-0", "acct-0"), new InvestorRef("inv-0", "acct-0"));

        assertThatThrownBy(() -> service.runPage(VAULT, 2, 2, repeated))
                .isInstanceOf(SequenceViolationException.class)
                .satisfies(e -> assertThat(((SequenceViolationException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.INVESTOR_SET_MISMATCH));
        verifyNoInteractions(vestingOracle, feeSource, payoutTransferRepository);
        verify(progressRepository, never()).save(any());
    }

    @Test
    @DisplayName("a later page with no investor set recorded for the current day writes nothing")
    void laterPageWithoutDaySet() {
        Instant dayStart = NOW.minus(Duration.ofHours(1));
        stubProgress(midDay(dayStart));
        stubDaySet(dayStart.minus(Duration.ofDays(1)));
        when(vestingOracle.lockedAmount(anyString(), eq(dayStart))).thenReturn(250_000L);

        assertThatThrownBy(() -> service.runPage(VAULT, 2, 2, investors(2, 4)))
                .isInstanceOf(SequenceViolationException.class)
                .hasMessageContaining("No investor set recorded")
                .satisfies(e -> assertThat(((SequenceViolationException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.INVESTOR_SET_MISMATCH));
        verifyNoInteractions(payoutTransferRepository, applicationEventPublisher);
        verify(progressRepository, never()).save(any());
    }

    @Test
    @DisplayName("a later page without supplied investors takes them from the day's set")
    void laterPageUsesDaySet() {
        Instant dayStart = NOW.minus(Duration.ofHours(1));
        stubProgress(midDay(dayStart));
        stubDaySet(dayStart);
        when(vestingOracle.lockedAmount(anyString(), eq(dayStart))).thenReturn(250_000L);

        CrankResult result = service.runPage(VAULT, 2, 2, null);

        assertThat(result.dayClosed()).isTrue();
        assertThat(result.investorsPaid()).isEqualTo(2);
        verify(vestingOracle).lockedAmount("inv-3", dayStart);
        verifyNoInteractions(rosterRepository);
    }

    @Test
    @DisplayName("supplied investors must match the registered roster")
    void rosterMismatch() {
        stubDayDue();
        InvestorRoster roster = new InvestorRoster();
        roster.setVault(VAULT);
        roster.setEntries(List.of(
                new InvestorRoster.Entry("inv-0", "acct-0"),
                new InvestorRoster.Entry("inv-1", "acct-1"),
                new InvestorRoster.Entry("inv-2", "acct-2"),
                new InvestorRoster.Entry("inv-3", "someone-else")));
        when(rosterRepository.findById(VAULT)).thenReturn(Optional.of(roster));

        assertThatThrownBy(() -> service.runPage(VAULT, 0, 4, investors(0, 4)))
                .isInstanceOf(SequenceViolationException.class)
                .satisfies(e -> assertThat(((SequenceViolationException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.INVESTOR_SET_MISMATCH));
        verifyNoInteractions(feeSource, vestingOracle);
    }

    @Test
    @DisplayName("without supplied investors the roster is used")
    void usesRoster() {
        stubDayDue();
        stubPosition();
        recordClaims();
        servePendingClaims();
        InvestorRoster roster = new InvestorRoster();
        roster.setVault(VAULT);
        roster.setEntries(investors(0, 4).stream()
                .map(r -> new InvestorRoster.Entry(r.investorId(), r.payoutAccount()))
                .toList());
        when(rosterRepository.findById(VAULT)).thenReturn(Optional.of(roster));
        when(vestingOracle.lockedAmount(anyString(), eq(NOW))).thenReturn(250_000L);
        when(feeSource.claim("pos-1", "QUOTE")).thenReturn(new FeeClaim(1_000L, 0L));

        CrankResult result = service.runPage(VAULT, 0, 4, null);

        assertThat(result.dayClosed()).isTrue();
        assertThat(result.investorsPaid()).isEqualTo(4);
        verify(vestingOracle).lockedAmount("inv-3", NOW);
    }

    @Test
    @DisplayName("no investors and no roster is ROSTER_NOT_FOUND")
    void noRoster() {
        stubDayDue();

        assertThatThrownBy(() -> service.runPage(VAULT, 0, 4, List.of()))
                .isInstanceOf(NotFoundException.class)
                .satisfies(e -> assertThat(((NotFoundException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.ROSTER_NOT_FOUND));
    }

    @Test
    @DisplayName("a failed vesting read on the first page leaves the fees unclaimed")
    void oracleFailureBeforeClaim() {
        stubDayDue();
        when(vestingOracle.lockedAmount(anyString(), eq(NOW))).thenThrow(new IntegrationException("down"));

        assertThatThrownBy(() -> service.runPage(VAULT, 0, 4, investors(0, 4)))
                .isInstanceOf(IntegrationException.class);
        verifyNoInteractions(feeSource, claimRecordRepository);
    }

    @Test
    @DisplayName("a concurrent page that committed first surfaces as CONCURRENT_CRANK")
    void optimisticLockConflict() {
        stubDayDue();
        stubPosition();
        recordClaims();
        servePendingClaims();
        when(vestingOracle.lockedAmount(anyString(), eq(NOW))).thenReturn(250_000L);
        when(feeSource.claim("pos-1", "QUOTE")).thenReturn(new FeeClaim(1_000L, 0L));
        when(progressRepository.save(any(DistributionProgress.class)))
                .thenThrow(new OptimisticLockingFailureException("version 3 is stale"));

        assertThatThrownBy(() -> service.runPage(VAULT, 0, 4, investors(0, 4)))
                .isInstanceOf(ConcurrentCrankException.class)
                .satisfies(e -> assertThat(((ConcurrentCrankException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.CONCURRENT_CRANK));
        assertThat(claimStore).singleElement()
                .satisfies(r -> assertThat(r.getStatus()).isEqualTo(FeeClaimRecord.Status.PENDING));
        verifyNoInteractions(applicationEventPublisher);
    }
}
