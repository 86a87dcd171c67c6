package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.account.AccountCode;
import com.flagship.wallet_ledger.ledger.context.TransactionContext;
import com.flagship.wallet_ledger.ledger.context.TransactionContextCodec;
import com.flagship.wallet_ledger.ledger.exception.ReversalAlreadyExistsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store for transaction headers and their entries.
 *
 * Headers and entries are never updated or deleted. Writes must join the caller's
 * database transaction so a header is never visible without both of its entries.
 */
@Repository
@Slf4j
public class TransactionLog {

    private static final String TX_COLUMNS = "t.id, t.type, t.context::text AS context, t.reversal_of, t.created_at";

    private static final String ENTRY_COLUMNS = "id, tx_id, account_code, user_id, side, amount_minor";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionContextCodec contextCodec;

    public TransactionLog(JdbcTemplate jdbcTemplate, TransactionContextCodec contextCodec) {
        this.jdbcTemplate = jdbcTemplate;
        this.contextCodec = contextCodec;
    }

    /**
     * Writes a transaction header and its entries.
     *
     * @throws ReversalAlreadyExistsException if another reversal of the same original
     *         was committed first (unique index on reversal_of)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransactionWithEntries append(LedgerTransactionType type, TransactionContext context,
                                         UUID reversalOf, List<PostingLeg> legs) {
        UUID txId = UUID.randomUUID();
        OffsetDateTime createdAt;
        try {
            createdAt = jdbcTemplate.queryForObject(
                "INSERT INTO ledger_transactions (id, type, context, reversal_of) " +
                "VALUES (?, ?, CAST(? AS jsonb), ?) RETURNING created_at",
                (rs, rowNum) -> rs.getObject("created_at", OffsetDateTime.class),
                txId,
                type.dbValue(),
                contextCodec.toJson(context),
                new SqlParameterValue(Types.OTHER, reversalOf)
            );
        } catch (DuplicateKeyException e) {
            if (reversalOf != null) {
                throw new ReversalAlreadyExistsException(reversalOf, e);
            }
            throw e;
        }

        List<LedgerEntry> entries = new ArrayList<>(legs.size());
        for (PostingLeg leg : legs) {
            entries.add(insertEntry(txId, leg));
        }

        LedgerTransaction transaction = new LedgerTransaction(txId, type, context, reversalOf, createdAt.toInstant());
        log.debug("Appended {} transaction {} with {} entries", type.dbValue(), txId, entries.size());
        return new TransactionWithEntries(transaction, sortDebitFirst(entries));
    }

    private LedgerEntry insertEntry(UUID txId, PostingLeg leg) {
        UUID entryId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, tx_id, account_code, user_id, side, amount_minor) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            entryId,
            txId,
            leg.getAccountCode().getCode(),
            new SqlParameterValue(Types.OTHER, leg.getUserId()),
            leg.getSide().dbValue(),
            leg.getAmountMinor()
        );
        return new LedgerEntry(entryId, txId, leg.getAccountCode(), leg.getUserId(), leg.getSide(), leg.getAmountMinor());
    }

    @Transactional(readOnly = true)
    public Optional<TransactionWithEntries> getTransaction(UUID txId) {
        List<LedgerTransaction> headers = jdbcTemplate.query(
            "SELECT " + TX_COLUMNS + " FROM ledger_transactions t WHERE t.id = ?",
            transactionRowMapper(), txId);
        if (headers.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TransactionWithEntries(headers.get(0), getEntries(txId)));
    }

    /**
     * Entries of a transaction, debit first.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> getEntries(UUID txId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE tx_id = ? " +
            "ORDER BY CASE side WHEN 'debit' THEN 0 ELSE 1 END, id",
            entryRowMapper(), txId);
    }

    /**
     * Transactions touching the user's credit account, newest first.
     * Fetches one extra row to learn whether another page exists.
     */
    @Transactional(readOnly = true)
    public TransactionPage getTransactionsForUser(UUID userId, int limit, TransactionCursor cursor) {
        StringBuilder sql = new StringBuilder("SELECT ").append(TX_COLUMNS)
            .append(" FROM ledger_transactions t")
            .append(" WHERE EXISTS (SELECT 1 FROM ledger_entries e WHERE e.tx_id = t.id AND e.user_id = ?)");
        List<Object> args = new ArrayList<>();
        args.add(userId);
        if (cursor != null) {
            sql.append(" AND (t.created_at, t.id) < (?, ?)");
            args.add(OffsetDateTime.ofInstant(cursor.getCreatedAt(), ZoneOffset.UTC));
            args.add(cursor.getTxId());
        }
        sql.append(" ORDER BY t.created_at DESC, t.id DESC LIMIT ?");
        args.add(limit + 1);

        List<LedgerTransaction> rows = jdbcTemplate.query(sql.toString(), transactionRowMapper(), args.toArray());

        boolean hasMore = rows.size() > limit;
        List<LedgerTransaction> page = hasMore ? List.copyOf(rows.subList(0, limit)) : rows;
        String nextCursor = hasMore
            ? TransactionCursor.after(page.get(page.size() - 1)).encode()
            : null;
        return new TransactionPage(page, nextCursor, hasMore);
    }

    @Transactional(readOnly = true)
    public Optional<UUID> findReversalOf(UUID txId) {
        return jdbcTemplate.query(
                "SELECT id FROM ledger_transactions WHERE reversal_of = ?",
                (rs, rowNum) -> rs.getObject("id", UUID.class), txId)
            .stream()
            .findFirst();
    }

    /**
     * Full scan of the entry store, summed by side.
     */
    @Transactional(readOnly = true)
    public EntryTotals sumEntriesBySide() {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN side = 'debit' THEN amount_minor ELSE 0 END), 0) AS sum_debit, " +
            "       COALESCE(SUM(CASE WHEN side = 'credit' THEN amount_minor ELSE 0 END), 0) AS sum_credit " +
            "FROM ledger_entries",
            (rs, rowNum) -> new EntryTotals(rs.getLong("sum_debit"), rs.getLong("sum_credit")));
    }

    /**
     * Entry amounts grouped by account, owner and side, for replaying balances.
     */
    @Transactional(readOnly = true)
    public List<AccountSideTotal> sumEntriesByAccount() {
        return jdbcTemplate.query(
            "SELECT account_code, user_id, side, SUM(amount_minor) AS total " +
            "FROM ledger_entries GROUP BY account_code, user_id, side",
            (rs, rowNum) -> new AccountSideTotal(
                AccountCode.of(rs.getInt("account_code")),
                rs.getObject("user_id", UUID.class),
                EntrySide.fromDbValue(rs.getString("side")),
                rs.getLong("total")));
    }

    private static List<LedgerEntry> sortDebitFirst(List<LedgerEntry> entries) {
        return entries.stream()
            .sorted((a, b) -> a.getSide().compareTo(b.getSide()))
            .toList();
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> {
            LedgerTransactionType type = LedgerTransactionType.fromDbValue(rs.getString("type"));
            return new LedgerTransaction(
                rs.getObject("id", UUID.class),
                type,
                contextCodec.fromJson(type, rs.getString("context")),
                rs.getObject("reversal_of", UUID.class),
                rs.getObject("created_at", OffsetDateTime.class).toInstant()
            );
        };
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("tx_id", UUID.class),
            AccountCode.of(rs.getInt("account_code")),
            rs.getObject("user_id", UUID.class),
            EntrySide.fromDbValue(rs.getString("side")),
            rs.getLong("amount_minor")
        );
    }
}
