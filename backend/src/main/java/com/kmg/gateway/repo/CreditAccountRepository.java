package com.kmg.gateway.repo;

import com.kmg.gateway.model.CreditAccount;
import com.kmg.gateway.model.CreditReservation;
import com.kmg.gateway.model.ReservationState;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class CreditAccountRepository {
    private final JdbcTemplate jdbcTemplate;

    public CreditAccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<CreditAccount> ACCOUNT_MAPPER = new RowMapper<>() {
        @Override
        public CreditAccount mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new CreditAccount(
                    rs.getString("caller_id"),
                    rs.getLong("balance"),
                    rs.getLong("version"),
                    SqlTime.parse(rs.getString("updated_at"))
            );
        }
    };

    private static final RowMapper<CreditReservation> RESERVATION_MAPPER = new RowMapper<>() {
        @Override
        public CreditReservation mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new CreditReservation(
                    rs.getString("id"),
                    rs.getString("caller_id"),
                    rs.getLong("amount"),
                    ReservationState.valueOf(rs.getString("state")),
                    SqlTime.parse(rs.getString("created_at")),
                    SqlTime.parse(rs.getString("settled_at"))
            );
        }
    };

    public Optional<CreditAccount> findAccount(String callerId) {
        List<CreditAccount> rows = jdbcTemplate.query(
                "SELECT * FROM credit_accounts WHERE caller_id = ?",
                ACCOUNT_MAPPER,
                callerId
        );
        return rows.stream().findFirst();
    }

    @Transactional
    public CreditAccount ensureAccount(String callerId) {
        jdbcTemplate.update(
                "INSERT OR IGNORE INTO credit_accounts(caller_id, balance, version, updated_at) VALUES (?, 0, 0, ?)",
                callerId,
                SqlTime.nowText()
        );
        return findAccount(callerId).orElseThrow();
    }

    /**
     * Takes {@code amount} from the balance if the account is still at {@code expectedVersion}
     * and records a PENDING reservation. Returns false when the version moved.
     */
    @Transactional
    public boolean reserve(String callerId, long expectedVersion, long amount, String reservationId) {
        String now = SqlTime.nowText();
        int updated = jdbcTemplate.update(
                """
                UPDATE credit_accounts
                   SET balance = balance - ?, version = version + 1, updated_at = ?
                 WHERE caller_id = ? AND version = ? AND balance >= ?
                """,
                amount,
                now,
                callerId,
                expectedVersion,
                amount
        );
        if (updated == 0) {
            return false;
        }
        jdbcTemplate.update(
                """
                INSERT INTO credit_reservations(id, caller_id, amount, state, created_at, settled_at)
                VALUES (?, ?, ?, ?, ?, NULL)
                """,
                reservationId,
                callerId,
                amount,
                ReservationState.PENDING.name(),
                now
        );
        return true;
    }

    @Transactional
    public boolean commitReservation(String reservationId) {
        return transition(reservationId, ReservationState.COMMITTED);
    }

    /**
     * Moves a PENDING reservation to RELEASED and refunds it in the same transaction.
     * Returns false if the reservation had already left PENDING, in which case nothing is refunded.
     */
    @Transactional
    public boolean releaseReservation(String reservationId, String reason) {
        if (!transition(reservationId, ReservationState.RELEASED)) {
            return false;
        }
        CreditReservation reservation = findReservation(reservationId).orElseThrow();
        CreditAccount before = findAccount(reservation.callerId()).orElseThrow();
        jdbcTemplate.update(
                """
                UPDATE credit_accounts
                   SET balance = balance + ?, version = version + 1, updated_at = ?
                 WHERE caller_id = ?
                """,
                reservation.amount(),
                SqlTime.nowText(),
                reservation.callerId()
        );
        addAudit(reservation.callerId(), before.balance(), before.balance() + reservation.amount(), reason);
        return true;
    }

    /**
     * Compare-and-set of the balance. {@code oldBalance} is the balance read at {@code expectedVersion}
     * and only feeds the audit row.
     */
    @Transactional
    public boolean setBalance(String callerId, long expectedVersion, long oldBalance, long newBalance, String reason) {
        int updated = jdbcTemplate.update(
                """
                UPDATE credit_accounts
                   SET balance = ?, version = version + 1, updated_at = ?
                 WHERE caller_id = ? AND version = ?
                """,
                Math.max(0, newBalance),
                SqlTime.nowText(),
                callerId,
                expectedVersion
        );
        if (updated == 0) {
            return false;
        }
        addAudit(callerId, oldBalance, Math.max(0, newBalance), reason);
        return true;
    }

    public Optional<CreditReservation> findReservation(String reservationId) {
        List<CreditReservation> rows = jdbcTemplate.query(
                "SELECT * FROM credit_reservations WHERE id = ?",
                RESERVATION_MAPPER,
                reservationId
        );
        return rows.stream().findFirst();
    }

    public List<CreditReservation> findPendingCreatedBefore(OffsetDateTime cutoff) {
        return jdbcTemplate.query(
                        "SELECT * FROM credit_reservations WHERE state = ? ORDER BY created_at ASC",
                        RESERVATION_MAPPER,
                        ReservationState.PENDING.name()
                ).stream()
                .filter(r -> r.createdAt() != null && r.createdAt().isBefore(cutoff))
                .toList();
    }

    public void addAudit(String callerId, long oldBalance, long newBalance, String reason) {
        jdbcTemplate.update(
                """
                INSERT INTO credit_audit(caller_id, old_balance, new_balance, reason, created_at)
                VALUES (?, ?, ?, ?, ?)
                """,
                callerId,
                oldBalance,
                newBalance,
                reason,
                SqlTime.nowText()
        );
    }

    private boolean transition(String reservationId, ReservationState target) {
        int updated = jdbcTemplate.update(
                "UPDATE credit_reservations SET state = ?, settled_at = ? WHERE id = ? AND state = ?",
                target.name(),
                SqlTime.nowText(),
                reservationId,
                ReservationState.PENDING.name()
        );
        return updated == 1;
    }
}
