package com.flagship.balance_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.balance_ledger.transaction.TransactionRecord;
import com.flagship.balance_ledger.transaction.TransactionStatus;
import com.flagship.balance_ledger.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("source_account_id")
    Long sourceAccountId;

    @JsonProperty("dest_account_id")
    Long destAccountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransactionResponse from(TransactionRecord record) {
        return TransactionResponse.builder()
            .id(record.getId())
            .sourceAccountId(record.getSourceAccountId())
            .destAccountId(record.getDestAccountId())
            .amount(record.getAmount())
            .type(record.getType())
            .status(record.getStatus())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .build();
    }
}
