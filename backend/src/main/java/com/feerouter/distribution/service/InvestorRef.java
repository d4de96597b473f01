package com.feerouter.distribution.service;

/**
 * An investor as supplied by a caller: vesting stream id and the account payouts go to.
 */
public record InvestorRef(String investorId, String payoutAccount) {
}
