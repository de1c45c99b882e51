package com.onextel.CampaignDialerApplication.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Key/value runtime settings persisted in {@code global_settings}.
 */
@Repository
@RequiredArgsConstructor
public class GlobalSettingsRepository {
    private final JdbcTemplate jdbcTemplate;

    public Optional<String> findValue(String key) {
        List<String> values = jdbcTemplate.queryForList(
                "SELECT setting_value FROM global_settings WHERE setting_key = ?", String.class, key);
        return values.stream().findFirst();
    }

    public Optional<Integer> findInt(String key) {
        return findValue(key).map(value -> {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Setting " + key + " is not an integer: " + value, e);
            }
        });
    }
}
