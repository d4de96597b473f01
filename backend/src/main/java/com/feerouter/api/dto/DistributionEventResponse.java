package com.feerouter.api.dto;

import java.time.Instant;
import java.util.Map;

public record DistributionEventResponse(String type, Map<String, Object> attributes, Instant occurredAt) {
}
