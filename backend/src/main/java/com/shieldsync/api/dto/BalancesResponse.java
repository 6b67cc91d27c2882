package com.shieldsync.api.dto;

/**
 * GET /pools/{asset}/balances. Pool units.
 */
public record BalancesResponse(String asset, long total, long account, long notes, long optimistic) {
}
