package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Customer credit balance as returned to callers.
 */
@Value
public class BalanceView {
    UUID userId;
    long balanceMinor;
    Instant updatedAt;
}
