package com.onextel.CampaignDialerApplication.repository;

import com.onextel.CampaignDialerApplication.model.IncomingConnection;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static com.onextel.CampaignDialerApplication.repository.JdbcColumns.instant;
import static com.onextel.CampaignDialerApplication.repository.JdbcColumns.timestamp;

@Repository
@RequiredArgsConstructor
public class IncomingConnectionRepository {
    private static final RowMapper<IncomingConnection> ROW_MAPPER = (rs, rowNum) -> IncomingConnection.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .agentId(rs.getString("agent_id"))
            .phoneNumberId(rs.getString("phone_number_id"))
            .active(rs.getBoolean("active"))
            .createdAt(instant(rs, "created_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public Optional<IncomingConnection> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM incoming_connections WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public Optional<IncomingConnection> findActiveByPhoneNumber(String phoneNumberId) {
        return jdbcTemplate.query(
                "SELECT * FROM incoming_connections WHERE phone_number_id = ? AND active = TRUE",
                ROW_MAPPER, phoneNumberId).stream().findFirst();
    }

    public void insert(IncomingConnection connection) {
        jdbcTemplate.update(
                "INSERT INTO incoming_connections (id, user_id, agent_id, phone_number_id, active, created_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?)",
                connection.getId(), connection.getUserId(), connection.getAgentId(),
                connection.getPhoneNumberId(), connection.isActive(), timestamp(connection.getCreatedAt()));
    }
}
