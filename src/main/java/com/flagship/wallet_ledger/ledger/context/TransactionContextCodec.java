package com.flagship.wallet_ledger.ledger.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.ledger.LedgerTransactionType;
import com.flagship.wallet_ledger.ledger.exception.LedgerInvariantBrokenException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts transaction contexts to and from the JSONB context column.
 * The transaction type selects the concrete context class on read.
 */
@Component
@RequiredArgsConstructor
public class TransactionContextCodec {

    private final ObjectMapper objectMapper;

    public String toJson(TransactionContext context) {
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + context.type() + " context", e);
        }
    }

    public TransactionContext fromJson(LedgerTransactionType type, String json) {
        try {
            return objectMapper.readValue(json, type.getContextType());
        } catch (JsonProcessingException e) {
            throw new LedgerInvariantBrokenException(
                "Stored context for " + type.dbValue() + " transaction is unreadable", e);
        }
    }
}
