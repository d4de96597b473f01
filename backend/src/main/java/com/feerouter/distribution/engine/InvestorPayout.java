package com.feerouter.distribution.engine;

public record InvestorPayout(int index, String investorId, String payoutAccount, long amount) {
}
