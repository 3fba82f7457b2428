package com.flagship.balance_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.balance_ledger.balance.ReconciliationResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("stored_balance")
    BigDecimal storedBalance;

    @JsonProperty("history_balance")
    BigDecimal historyBalance;

    @JsonProperty("discrepancy")
    BigDecimal discrepancy;

    @JsonProperty("consistent")
    boolean consistent;

    public static ReconciliationResponse from(ReconciliationResult result) {
        return ReconciliationResponse.builder()
            .accountId(result.getAccountId())
            .storedBalance(result.getStoredBalance())
            .historyBalance(result.getHistoryBalance())
            .discrepancy(result.getDiscrepancy())
            .consistent(result.isConsistent())
            .build();
    }
}
