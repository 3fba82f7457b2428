package com.flagship.balance_ledger.transaction;

import com.flagship.balance_ledger.exception.InvalidStateTransitionException;
import com.flagship.balance_ledger.ledger.PageRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to {@code ledger_transactions}.
 *
 * Only {@code status} and {@code updated_at} are ever updated, and only along
 * an expected edge: the update names the status it moves away from, so a
 * concurrent transition makes it fail instead of overwriting.
 */
@Repository
@RequiredArgsConstructor
public class TransactionRecordRepository {

    private static final String SELECT_COLUMNS =
        "SELECT id, source_account_id, dest_account_id, amount, type, status, created_at, updated_at " +
        "FROM ledger_transactions ";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Inserts a new record and returns it with its generated id.
     */
    public TransactionRecord insert(TransactionRecord record) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO ledger_transactions " +
                "(source_account_id, dest_account_id, amount, type, status, created_at, updated_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)",
                new String[] {"id"}
            );
            setNullableLong(ps, 1, record.getSourceAccountId());
            setNullableLong(ps, 2, record.getDestAccountId());
            ps.setBigDecimal(3, record.getAmount());
            ps.setString(4, record.getType().name());
            ps.setString(5, record.getStatus().name());
            ps.setTimestamp(6, Timestamp.from(record.getCreatedAt()));
            ps.setTimestamp(7, Timestamp.from(record.getUpdatedAt()));
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for transaction record");
        }
        return record.withId(key.longValue());
    }

    /**
     * Persists a status transition.
     *
     * @param transitioned record carrying the new status
     * @param expectedCurrent status the stored row must still have
     * @throws InvalidStateTransitionException if the stored row is no longer in {@code expectedCurrent}
     */
    public void updateStatus(TransactionRecord transitioned, TransactionStatus expectedCurrent) {
        int updated = jdbcTemplate.update(
            "UPDATE ledger_transactions SET status = ?, updated_at = ? WHERE id = ? AND status = ?",
            transitioned.getStatus().name(),
            Timestamp.from(transitioned.getUpdatedAt()),
            transitioned.getId(),
            expectedCurrent.name()
        );
        if (updated != 1) {
            throw new InvalidStateTransitionException(transitioned.getId(), expectedCurrent, transitioned.getStatus());
        }
    }

    public Optional<TransactionRecord> findById(long id) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", rowMapper(), id)
            .stream()
            .findFirst();
    }

    /**
     * Reads a record holding its row lock until the surrounding unit ends.
     */
    public Optional<TransactionRecord> findByIdForUpdate(long id) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ? FOR UPDATE", rowMapper(), id)
            .stream()
            .findFirst();
    }

    /**
     * Records where the account is source or destination, newest first.
     */
    public List<TransactionRecord> findByAccount(long accountId, PageRequest page) {
        return jdbcTemplate.query(
            SELECT_COLUMNS +
            "WHERE source_account_id = ? OR dest_account_id = ? " +
            "ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?",
            rowMapper(),
            accountId,
            accountId,
            page.getLimit(),
            page.getOffset()
        );
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private RowMapper<TransactionRecord> rowMapper() {
        return (rs, rowNum) -> new TransactionRecord(
            rs.getLong("id"),
            getNullableLong(rs, "source_account_id"),
            getNullableLong(rs, "dest_account_id"),
            rs.getBigDecimal("amount"),
            TransactionType.valueOf(rs.getString("type")),
            TransactionStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
