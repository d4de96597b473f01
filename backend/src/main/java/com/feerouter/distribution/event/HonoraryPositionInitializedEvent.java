package com.feerouter.distribution.event;

import lombok.Getter;

import java.time.Instant;
import java.util.Map;

@Getter
public class HonoraryPositionInitializedEvent extends DistributionEvent {

    private final String pool;
    private final String positionHandle;
    private final String designatedAsset;

    public HonoraryPositionInitializedEvent(Object source, String vault, Instant occurredAt, String pool,
                                            String positionHandle, String designatedAsset) {
        super(source, vault, occurredAt);
        this.pool = pool;
        this.positionHandle = positionHandle;
        this.designatedAsset = designatedAsset;
    }

    @Override
    public String type() {
        return "POSITION_INITIALIZED";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("pool", pool, "positionHandle", positionHandle, "designatedAsset", designatedAsset);
    }
}
