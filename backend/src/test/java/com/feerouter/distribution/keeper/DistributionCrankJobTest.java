package com.feerouter.distribution.keeper;

import com.feerouter.distribution.config.KeeperProperties;
import com.feerouter.distribution.engine.DistributionEngine;
import com.feerouter.distribution.service.CrankResult;
import com.feerouter.distribution.service.DistributionQueryService;
import com.feerouter.distribution.service.DistributionService;
import com.feerouter.domain.DistributionProgress;
import com.feerouter.domain.InvestorRoster;
import com.feerouter.domain.InvestorRosterRepository;
import com.feerouter.domain.Policy;
import com.feerouter.error.ConcurrentCrankException;
import com.feerouter.error.ErrorCodes;
import com.feerouter.error.SafetyViolationException;
import com.feerouter.error.SequenceViolationException;
import com.feerouter.error.WindowViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DistributionCrankJobTest {

    private static final String VAULT = "vault-1";

    @Mock
    InvestorRosterRepository rosterRepository;
    @Mock
    DistributionQueryService queryService;
    @Mock
    DistributionService distributionService;

    DistributionCrankJob job;

    @BeforeEach
    void setUp() {
        KeeperProperties properties = new KeeperProperties();
        properties.setEnabled(true);
        properties.setPageSize(2);
        properties.setRetryBaseDelayMs(0);
        properties.setRetryJitterFactor(0);
        properties.setRetryMaxAttempts(3);
        job = new DistributionCrankJob(rosterRepository, queryService, distributionService,
                new DistributionEngine(50), properties, Runnable::run);
        when(queryService.findPolicy(VAULT)).thenReturn(Optional.of(Policy.builder()
                .vault(VAULT).creatorWallet("creator").investorFeeShareBps(5_000)
                .y0TotalAllocation(1_000L).totalInvestors(4).createdAt(Instant.EPOCH).build()));
    }

    private void stubCursors(int first, int... rest) {
        Optional<DistributionProgress> head = Optional.of(progressAt(first));
        @SuppressWarnings("unchecked")
        Optional<DistributionProgress>[] tail = new Optional[rest.length];
        for (int i = 0; i < rest.length; i++) {
            tail[i] = Optional.of(progressAt(rest[i]));
        }
        when(queryService.findProgress(VAULT)).thenReturn(head, tail);
    }

    private static DistributionProgress progressAt(int cursor) {
        DistributionProgress p = new DistributionProgress();
        p.setVault(VAULT);
        p.setCursor(cursor);
        return p;
    }

    private static CrankResult page(int start, boolean closed) {
        return new CrankResult(VAULT, start, 2, closed ? 0 : start + 2, start == 0, closed, 2, 100L, 0L, 0, 0L);
    }

    @Test
    @DisplayName("walks the cursor page by page until the day closes")
    void cranksToEndOfDay() {
        stubCursors(0, 2);
        when(distributionService.runPage(VAULT, 0, 2, null)).thenReturn(page(0, false));
        when(distributionService.runPage(VAULT, 2, 2, null)).thenReturn(page(2, true));

        assertThat(job.crankVault(VAULT)).isEqualTo(KeeperRun.DAY_COMPLETED);
    }

    @Test
    @DisplayName("stops quietly when the day is not due")
    void notDue() {
        stubCursors(0);
        when(distributionService.runPage(VAULT, 0, 2, null))
                .thenThrow(new WindowViolationException(ErrorCodes.DISTRIBUTION_WINDOW_NOT_ELAPSED, "not yet"));

        assertThat(job.crankVault(VAULT)).isEqualTo(KeeperRun.NOT_DUE);
    }

    @Test
    @DisplayName("re-reads the cursor after another caller moved it")
    void resumesAfterSequenceViolation() {
        stubCursors(0, 2);
        when(distributionService.runPage(VAULT, 0, 2, null)).thenThrow(
                new SequenceViolationException(ErrorCodes.INVALID_PAGINATION_SEQUENCE, "cursor moved"));
        when(distributionService.runPage(VAULT, 2, 2, null)).thenReturn(page(2, true));

        assertThat(job.crankVault(VAULT)).isEqualTo(KeeperRun.DAY_COMPLETED);
    }

    @Test
    @DisplayName("never retries a safety violation")
    void haltsOnSafetyViolation() {
        stubCursors(0);
        when(distributionService.runPage(VAULT, 0, 2, null))
                .thenThrow(new SafetyViolationException(ErrorCodes.BASE_FEES_DETECTED, "base fees"));

        assertThat(job.crankVault(VAULT)).isEqualTo(KeeperRun.HALTED);
        verify(distributionService, times(1)).runPage(eq(VAULT), anyInt(), anyInt(), isNull());
    }

    @Test
    @DisplayName("gives up after the retry budget on repeated conflicts")
    void retriesExhausted() {
        stubCursors(0);
        when(distributionService.runPage(VAULT, 0, 2, null))
                .thenThrow(new ConcurrentCrankException(ErrorCodes.CONCURRENT_CRANK, "lost race"));

        assertThat(job.crankVault(VAULT)).isEqualTo(KeeperRun.RETRIES_EXHAUSTED);
        verify(distributionService, times(3)).runPage(VAULT, 0, 2, null);
    }

    @Test
    @DisplayName("an investor set mismatch is not retried")
    void mismatchNotRetried() {
        stubCursors(0);
        when(distributionService.runPage(VAULT, 0, 2, null))
                .thenThrow(new SequenceViolationException(ErrorCodes.INVESTOR_SET_MISMATCH, "bad roster"));

        assertThat(job.crankVault(VAULT)).isEqualTo(KeeperRun.FAILED);
        verify(distributionService, times(1)).runPage(VAULT, 0, 2, null);
    }

    @Test
    @DisplayName("scheduled sweep cranks every vault with a roster")
    void sweep() {
        InvestorRoster roster = new InvestorRoster();
        roster.setVault(VAULT);
        when(rosterRepository.findAll()).thenReturn(List.of(roster));
        stubCursors(0, 2);
        when(distributionService.runPage(VAULT, 0, 2, null)).thenReturn(page(0, false));
        when(distributionService.runPage(VAULT, 2, 2, null)).thenReturn(page(2, true));

        job.runScheduled();

        verify(distributionService).runPage(VAULT, 2, 2, null);
    }
}
