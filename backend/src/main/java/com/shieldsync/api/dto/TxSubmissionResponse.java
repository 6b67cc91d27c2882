package com.shieldsync.api.dto;

import java.util.List;

public record TxSubmissionResponse(List<String> jobIds, List<String> txHashes) {
}
