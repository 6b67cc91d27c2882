package com.shieldsync.api.dto;

import java.util.List;

/**
 * GET /pools/{asset}/history: items in log order, pending ones included.
 */
public record HistoryResponse(String asset, List<HistoryItemResponse> items) {
}
