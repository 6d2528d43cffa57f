package com.quantumskylink.orchestration.client.dto;

import java.math.BigDecimal;

/** Body of POST /api/ledger/transactions/validate. */
public record LedgerValidationRequest(
        String transactionType,
        BigDecimal amount,
        String fromAccountId,
        String toAccountId,
        String signatureValidationId
) {}
