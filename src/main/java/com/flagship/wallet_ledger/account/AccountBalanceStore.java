package com.flagship.wallet_ledger.account;

import com.flagship.wallet_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.wallet_ledger.ledger.exception.LedgerInvariantBrokenException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable per-(account, owner) running balances.
 *
 * Every delta is applied by a single SQL statement, so concurrent deltas on the same key are
 * serialized by PostgreSQL's row lock and never lose updates. For customer credits a negative
 * delta is applied only when the committed balance covers it; the check and the write are the
 * same statement.
 */
@Service
@Slf4j
public class AccountBalanceStore {

    private static final String UPSERT_USER_BALANCE = """
        INSERT INTO account_balances (id, account_code, user_id, balance_minor, updated_at)
        VALUES (?, ?, ?, ?, now())
        ON CONFLICT (account_code, user_id) WHERE user_id IS NOT NULL
        DO UPDATE SET balance_minor = account_balances.balance_minor + EXCLUDED.balance_minor,
                      updated_at = now()
        RETURNING balance_minor
        """;

    private static final String UPSERT_GLOBAL_BALANCE = """
        INSERT INTO account_balances (id, account_code, user_id, balance_minor, updated_at)
        VALUES (?, ?, NULL, ?, now())
        ON CONFLICT (account_code) WHERE user_id IS NULL
        DO UPDATE SET balance_minor = account_balances.balance_minor + EXCLUDED.balance_minor,
                      updated_at = now()
        RETURNING balance_minor
        """;

    private static final String DECREASE_USER_BALANCE = """
        UPDATE account_balances
        SET balance_minor = balance_minor + ?, updated_at = now()
        WHERE account_code = ? AND user_id = ? AND balance_minor + ? >= 0
        RETURNING balance_minor
        """;

    private static final String SELECT_COLUMNS =
        "SELECT account_code, user_id, balance_minor, updated_at FROM account_balances ";

    private final JdbcTemplate jdbcTemplate;

    public AccountBalanceStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Current balance, or 0 when the pair has never been posted to.
     */
    @Transactional(readOnly = true)
    public long getBalance(AccountCode accountCode, UUID userId) {
        return findBalance(accountCode, userId)
            .map(AccountBalance::getBalanceMinor)
            .orElse(0L);
    }

    @Transactional(readOnly = true)
    public Optional<AccountBalance> findBalance(AccountCode accountCode, UUID userId) {
        checkOwner(accountCode, userId);
        List<AccountBalance> rows = userId == null
            ? jdbcTemplate.query(SELECT_COLUMNS + "WHERE account_code = ? AND user_id IS NULL",
                balanceRowMapper(), accountCode.getCode())
            : jdbcTemplate.query(SELECT_COLUMNS + "WHERE account_code = ? AND user_id = ?",
                balanceRowMapper(), accountCode.getCode(), userId);
        return rows.stream().findFirst();
    }

    /**
     * All stored balances, used by reconciliation.
     */
    @Transactional(readOnly = true)
    public List<AccountBalance> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY account_code, user_id", balanceRowMapper());
    }

    /**
     * Adds delta to the balance of the pair, creating the row on first touch.
     *
     * @return the balance after the update
     * @throws InsufficientFundsException if a customer credit balance would become negative
     */
    @Transactional
    public long applyDelta(AccountCode accountCode, UUID userId, long delta) {
        checkOwner(accountCode, userId);

        long updated;
        if (accountCode == AccountCode.CUSTOMER_CREDITS && delta < 0) {
            updated = decreaseUserBalance(userId, delta);
        } else if (userId != null) {
            updated = jdbcTemplate.queryForObject(UPSERT_USER_BALANCE, Long.class,
                UUID.randomUUID(), accountCode.getCode(), userId, delta);
        } else {
            updated = jdbcTemplate.queryForObject(UPSERT_GLOBAL_BALANCE, Long.class,
                UUID.randomUUID(), accountCode.getCode(), delta);
        }

        log.debug("Applied balance delta: account={}, userId={}, delta={}, balance={}",
            accountCode, userId, delta, updated);
        return updated;
    }

    private long decreaseUserBalance(UUID userId, long delta) {
        List<Long> updated = jdbcTemplate.query(DECREASE_USER_BALANCE,
            (rs, rowNum) -> rs.getLong("balance_minor"),
            delta, AccountCode.CUSTOMER_CREDITS.getCode(), userId, delta);

        if (updated.isEmpty()) {
            long current = getBalance(AccountCode.CUSTOMER_CREDITS, userId);
            throw new InsufficientFundsException(userId, current, -delta);
        }
        return updated.get(0);
    }

    private void checkOwner(AccountCode accountCode, UUID userId) {
        if (accountCode.isUserScoped() && userId == null) {
            throw new LedgerInvariantBrokenException("Account " + accountCode + " requires an owning user");
        }
        if (!accountCode.isUserScoped() && userId != null) {
            throw new LedgerInvariantBrokenException("Account " + accountCode + " is global and cannot have a user");
        }
    }

    private RowMapper<AccountBalance> balanceRowMapper() {
        return (rs, rowNum) -> new AccountBalance(
            AccountCode.of(rs.getInt("account_code")),
            rs.getObject("user_id", UUID.class),
            rs.getLong("balance_minor"),
            rs.getObject("updated_at", OffsetDateTime.class).toInstant()
        );
    }
}
