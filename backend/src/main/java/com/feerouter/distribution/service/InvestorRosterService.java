package com.feerouter.distribution.service;

import com.feerouter.domain.DistributionProgress;
import com.feerouter.domain.DistributionProgressRepository;
import com.feerouter.domain.InvestorRoster;
import com.feerouter.domain.InvestorRosterRepository;
import com.feerouter.domain.Policy;
import com.feerouter.error.ConfigurationException;
import com.feerouter.error.ErrorCodes;
import com.feerouter.error.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registers the ordered investor set of a vault. List position is the investor index, so the roster may only be
 * replaced between days.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvestorRosterService {

    private final DistributionQueryService queryService;
    private final DistributionProgressRepository progressRepository;
    private final InvestorRosterRepository rosterRepository;
    private final Clock clock;

    /**
     * @throws NotFoundException      POLICY_NOT_FOUND
     * @throws ConfigurationException INVALID_ROSTER, or ROSTER_LOCKED while a day is in progress
     */
    @Transactional
    public InvestorRoster register(String vault, List<InvestorRef> investors) {
        Policy policy = queryService.findPolicy(vault)
                .orElseThrow(() -> new NotFoundException(ErrorCodes.POLICY_NOT_FOUND, "No policy for vault " + vault));
        validate(policy, investors);

        Optional<DistributionProgress> progress = progressRepository.findById(vault);
        if (progress.isPresent() && !progress.get().isDayCompleted()) {
            throw new ConfigurationException(ErrorCodes.ROSTER_LOCKED,
                    "Distribution day in progress for vault " + vault + " at cursor " + progress.get().getCursor());
        }

        List<InvestorRoster.Entry> entries = new ArrayList<>(investors.size());
        for (InvestorRef ref : investors) {
            entries.add(new InvestorRoster.Entry(ref.investorId().trim(), ref.payoutAccount().trim()));
        }
        InvestorRoster roster = rosterRepository.findById(vault).orElseGet(InvestorRoster::new);
        roster.setVault(vault);
        roster.setEntries(entries);
        roster.setUpdatedAt(clock.instant());
        InvestorRoster saved = rosterRepository.save(roster);
        log.info("Investor roster registered for vault {}: {} investors", vault, entries.size());
        return saved;
    }

    public Optional<InvestorRoster> find(String vault) {
        return rosterRepository.findById(vault);
    }

    private static void validate(Policy policy, List<InvestorRef> investors) {
        if (investors == null || investors.size() != policy.getTotalInvestors()) {
            throw new ConfigurationException(ErrorCodes.INVALID_ROSTER, "Roster must list exactly "
                    + policy.getTotalInvestors() + " investors, got " + (investors == null ? 0 : investors.size()));
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < investors.size(); i++) {
            InvestorRef ref = investors.get(i);
            if (ref == null || isBlank(ref.investorId()) || isBlank(ref.payoutAccount())) {
                throw new ConfigurationException(ErrorCodes.INVALID_ROSTER,
                        "Investor at index " + i + " needs an investorId and a payoutAccount");
            }
            if (!seen.add(ref.investorId().trim())) {
                throw new ConfigurationException(ErrorCodes.INVALID_ROSTER,
                        "Duplicate investorId at index " + i + ": " + ref.investorId());
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
