package com.flagship.balance_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.balance_ledger.ledger.AccountBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("last_updated_at")
    Instant lastUpdatedAt;

    public static BalanceResponse from(AccountBalance balance) {
        return BalanceResponse.builder()
            .accountId(balance.getAccountId())
            .amount(balance.getAmount())
            .lastUpdatedAt(balance.getLastUpdatedAt())
            .build();
    }
}
