package com.onextel.CampaignDialerApplication.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class UserAccountRepository {
    private final JdbcTemplate jdbcTemplate;

    /**
     * Prepaid balance in credits, zero for an unknown account.
     */
    public long findCredits(String userId) {
        List<Long> credits = jdbcTemplate.queryForList(
                "SELECT credits FROM user_accounts WHERE id = ?", Long.class, userId);
        return credits.isEmpty() || credits.get(0) == null ? 0L : credits.get(0);
    }

    public void insert(String userId, String email, long credits) {
        jdbcTemplate.update("INSERT INTO user_accounts (id, email, credits) VALUES (?, ?, ?)", userId, email, credits);
    }
}
