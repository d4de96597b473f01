package com.feerouter.api.dto;

import java.time.Instant;

public record RosterResponse(String vault, int investorCount, Instant updatedAt) {
}
