package com.flagship.balance_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class BalanceAtTimeResponse {

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("amount")
    BigDecimal amount;
}
