package com.shieldsync.ingestion.relayer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One element of the POST /sendTransactions body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelayerTxRequest(String txType, String memo, JsonNode proof, String depositSignature) {
}
