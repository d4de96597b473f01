package com.feerouter.distribution.position;

import com.feerouter.distribution.event.HonoraryPositionInitializedEvent;
import com.feerouter.distribution.service.DistributionQueryService;
import com.feerouter.domain.HonoraryPosition;
import com.feerouter.domain.HonoraryPositionRepository;
import com.feerouter.error.ConfigurationException;
import com.feerouter.error.ErrorCodes;
import com.feerouter.error.NotFoundException;
import com.feerouter.integration.PoolRegistry;
import com.feerouter.integration.PoolState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Opens the vault's honorary (fee-only) position after the pool passes the quote-only guard.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionService {

    private final DistributionQueryService queryService;
    private final HonoraryPositionRepository positionRepository;
    private final PoolRegistry poolRegistry;
    private final HonoraryPositionGuard guard;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * @throws NotFoundException         POLICY_NOT_FOUND
     * @throws ConfigurationException    POSITION_ALREADY_EXISTS
     * @throws com.feerouter.error.SafetyViolationException when the pool fails the quote-only guard
     */
    @Transactional
    public HonoraryPosition initializePosition(String vault, String pool, String designatedAsset, String otherAsset) {
        queryService.findPolicy(vault)
                .orElseThrow(() -> new NotFoundException(ErrorCodes.POLICY_NOT_FOUND, "No policy for vault " + vault));
        if (positionRepository.existsById(vault)) {
            throw new ConfigurationException(ErrorCodes.POSITION_ALREADY_EXISTS,
                    "Honorary position already exists for vault " + vault);
        }

        PoolState state = poolRegistry.describePool(pool);
        String feeAsset = guard.validatePool(state, designatedAsset, otherAsset);
        String handle = poolRegistry.openPosition(pool, vault);

        Instant now = clock.instant();
        HonoraryPosition position = new HonoraryPosition();
        position.setVault(vault);
        position.setPool(pool);
        position.setDesignatedAsset(feeAsset);
        position.setOtherAsset(otherAsset);
        position.setPositionHandle(handle);
        position.setCreatedAt(now);
        try {
            positionRepository.insert(position);
        } catch (DuplicateKeyException e) {
            log.warn("Position {} opened in pool {} but vault {} already has one", handle, pool, vault);
            throw new ConfigurationException(ErrorCodes.POSITION_ALREADY_EXISTS,
                    "Honorary position already exists for vault " + vault);
        }

        applicationEventPublisher.publishEvent(
                new HonoraryPositionInitializedEvent(this, vault, now, pool, handle, feeAsset));
        log.info("Honorary position {} opened for vault {} in pool {}, fee asset {}", handle, vault, pool, feeAsset);
        return position;
    }
}
