package com.feerouter.distribution.keeper;

import com.feerouter.common.RetryPolicy;
import com.feerouter.config.AsyncConfig;
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
import com.feerouter.error.FeeRouterException;
import com.feerouter.error.SafetyViolationException;
import com.feerouter.error.SequenceViolationException;
import com.feerouter.error.WindowViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Permissionless crank keeper. Each sweep walks every vault with a registered roster from its current cursor to the
 * end of the day. Holds no state the engine depends on: a crashed or stopped keeper is resumed by any caller.
 */
@Component
@ConditionalOnProperty(prefix = "feerouter.keeper", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DistributionCrankJob {

    private final Set<String> inFlightVaults = ConcurrentHashMap.newKeySet();

    private final InvestorRosterRepository rosterRepository;
    private final DistributionQueryService queryService;
    private final DistributionService distributionService;
    private final DistributionEngine engine;
    private final KeeperProperties keeperProperties;
    @Qualifier(AsyncConfig.KEEPER_EXECUTOR)
    private final Executor keeperExecutor;

    @Scheduled(
            fixedRateString = "${feerouter.keeper.interval-ms:300000}",
            initialDelayString = "${feerouter.keeper.initial-delay-ms:30000}")
    public void runScheduled() {
        List<InvestorRoster> rosters = rosterRepository.findAll();
        if (rosters.isEmpty()) {
            return;
        }
        List<CompletableFuture<KeeperRun>> runs = new ArrayList<>(rosters.size());
        for (InvestorRoster roster : rosters) {
            String vault = roster.getVault();
            runs.add(CompletableFuture.supplyAsync(() -> crankVault(vault), keeperExecutor)
                    .exceptionally(e -> {
                        log.error("Keeper pass failed for vault {}: {}", vault, e.getMessage(), e);
                        return KeeperRun.FAILED;
                    }));
        }
        CompletableFuture.allOf(runs.toArray(new CompletableFuture[0])).join();
        log.debug("Keeper sweep finished for {} vault(s)", rosters.size());
    }

    /**
     * Cranks one vault until its day closes, the window is not due, or the pass gives up.
     */
    KeeperRun crankVault(String vault) {
        if (!inFlightVaults.add(vault)) {
            return KeeperRun.SKIPPED;
        }
        try {
            return crankUntilDone(vault);
        } finally {
            inFlightVaults.remove(vault);
        }
    }

    private KeeperRun crankUntilDone(String vault) {
        Optional<Policy> policy = queryService.findPolicy(vault);
        if (policy.isEmpty()) {
            log.warn("Keeper skipping vault {}: roster without policy", vault);
            return KeeperRun.FAILED;
        }
        int pageSize = Math.max(1, Math.min(keeperProperties.getPageSize(), engine.getMaxPageSize()));
        int pageBudget = (policy.get().getTotalInvestors() + pageSize - 1) / pageSize;
        RetryPolicy retryPolicy = new RetryPolicy(keeperProperties.getRetryBaseDelayMs(),
                keeperProperties.getRetryJitterFactor(), keeperProperties.getRetryMaxAttempts());

        int pages = 0;
        int failedAttempts = 0;
        while (pages < pageBudget) {
            int cursor = queryService.findProgress(vault).map(DistributionProgress::getCursor).orElse(0);
            try {
                CrankResult result = distributionService.runPage(vault, cursor, pageSize, null);
                pages++;
                failedAttempts = 0;
                if (result.dayClosed()) {
                    log.info("Keeper closed day for vault {} in {} page(s)", vault, pages);
                    return KeeperRun.DAY_COMPLETED;
                }
            } catch (WindowViolationException e) {
                log.debug("Keeper: vault {} not due: {}", vault, e.getMessage());
                return KeeperRun.NOT_DUE;
            } catch (SafetyViolationException e) {
                log.error("Keeper halted vault {}: {} {}", vault, e.getErrorCode(), e.getMessage());
                return KeeperRun.HALTED;
            } catch (SequenceViolationException | ConcurrentCrankException | TransientDataAccessException e) {
                if (!isResumable(e)) {
                    log.warn("Keeper rejected for vault {}: {}", vault, e.getMessage());
                    return KeeperRun.FAILED;
                }
                failedAttempts++;
                if (!retryPolicy.hasAttemptsLeft(failedAttempts)) {
                    log.warn("Keeper giving up on vault {} after {} attempt(s): {}", vault, failedAttempts, e.getMessage());
                    return KeeperRun.RETRIES_EXHAUSTED;
                }
                log.warn("Keeper page rejected for vault {} at cursor {} (attempt {}): {}; re-reading cursor",
                        vault, cursor, failedAttempts, e.getMessage());
                if (!retryPolicy.pause(failedAttempts - 1)) {
                    return KeeperRun.INTERRUPTED;
                }
            } catch (FeeRouterException e) {
                log.warn("Keeper failed for vault {}: {} {}", vault, e.getErrorCode(), e.getMessage());
                return KeeperRun.FAILED;
            }
        }
        log.warn("Keeper used its page budget ({}) for vault {} without closing the day", pageBudget, vault);
        return KeeperRun.PAGE_LIMIT;
    }

    /** Only a moved cursor or a lost race is fixed by re-reading the cursor. */
    private static boolean isResumable(RuntimeException e) {
        if (e instanceof SequenceViolationException s) {
            return ErrorCodes.INVALID_PAGINATION_SEQUENCE.equals(s.getErrorCode());
        }
        return true;
    }
}
