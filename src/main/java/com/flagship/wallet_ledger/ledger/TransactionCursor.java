package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.ledger.exception.ValidationFailedException;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.UUID;

/**
 * Keyset position in a user's history: the (createdAt, id) of the last transaction returned.
 *
 * Encoded as URL-safe Base64 of {@code "<createdAt ISO-8601>|<txId>"} so callers treat it as opaque.
 */
@Value
public class TransactionCursor {

    private static final String SEPARATOR = "|";

    Instant createdAt;
    UUID txId;

    public static TransactionCursor after(LedgerTransaction transaction) {
        return new TransactionCursor(transaction.getCreatedAt(), transaction.getId());
    }

    public String encode() {
        String raw = createdAt.toString() + SEPARATOR + txId;
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static TransactionCursor decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            throw new ValidationFailedException("Cursor must not be blank");
        }
        try {
            String raw = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
            int split = raw.indexOf(SEPARATOR);
            if (split < 0) {
                throw new ValidationFailedException("Malformed cursor");
            }
            return new TransactionCursor(
                Instant.parse(raw.substring(0, split)),
                UUID.fromString(raw.substring(split + 1)));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new ValidationFailedException("Malformed cursor", e);
        }
    }
}
