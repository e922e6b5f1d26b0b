package com.mikov.bulkcsvvalidator.repository;

import com.mikov.bulkcsvvalidator.model.UserAccount;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Credit balances of user accounts. Every mutation is a single conditional UPDATE so
 * concurrent jobs for one user serialize on the row.
 *
 * @author zahari.mikov
 */
@Repository
public class UserRepository {
    private static final RowMapper<UserAccount> USER_MAPPER = (rs, rowNum) -> UserAccount.builder()
        .userId(rs.getString("user_id"))
        .userEmail(rs.getString("user_email"))
        .credits(rs.getLong("credits"))
        .reservedCredits(rs.getLong("reserved_credits"))
        .build();

    private final NamedParameterJdbcTemplate jdbc;

    public UserRepository(final NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<UserAccount> findByEmail(final String userEmail) {
        return jdbc.query(
            "SELECT user_id, user_email, credits, reserved_credits FROM users WHERE user_email = :email",
            new MapSqlParameterSource("email", userEmail),
            USER_MAPPER
        ).stream().findFirst();
    }

    public Optional<UserAccount> findById(final String userId) {
        return jdbc.query(
            "SELECT user_id, user_email, credits, reserved_credits FROM users WHERE user_id = :userId",
            new MapSqlParameterSource("userId", userId),
            USER_MAPPER
        ).stream().findFirst();
    }

    /**
     * Holds {@code amount} credits if at least that many are not already held.
     *
     * @return false when the balance cannot cover the hold
     */
    public boolean reserveCredits(final String userId, final long amount) {
        return jdbc.update(
            """
                UPDATE users
                SET reserved_credits = reserved_credits + :amount
                WHERE user_id = :userId AND credits - reserved_credits >= :amount
                """,
            amounts(userId, amount)
        ) == 1;
    }

    /**
     * Turns a hold into a debit.
     *
     * @return false when no hold of that size exists
     */
    public boolean debitReserved(final String userId, final long amount) {
        return jdbc.update(
            """
                UPDATE users
                SET credits = credits - :amount, reserved_credits = reserved_credits - :amount
                WHERE user_id = :userId AND reserved_credits >= :amount AND credits >= :amount
                """,
            amounts(userId, amount)
        ) == 1;
    }

    public boolean releaseReservation(final String userId, final long amount) {
        return jdbc.update(
            """
                UPDATE users
                SET reserved_credits = reserved_credits - :amount
                WHERE user_id = :userId AND reserved_credits >= :amount
                """,
            amounts(userId, amount)
        ) == 1;
    }

    private static MapSqlParameterSource amounts(final String userId, final long amount) {
        return new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("amount", amount);
    }
}
