package com.onextel.CampaignDialerApplication.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onextel.CampaignDialerApplication.model.Call;
import com.onextel.CampaignDialerApplication.model.CallDirection;
import com.onextel.CampaignDialerApplication.model.CallStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.onextel.CampaignDialerApplication.repository.JdbcColumns.instant;
import static com.onextel.CampaignDialerApplication.repository.JdbcColumns.nullableInt;
import static com.onextel.CampaignDialerApplication.repository.JdbcColumns.timestamp;

@Repository
@RequiredArgsConstructor
public class CallRepository {
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private final RowMapper<Call> rowMapper = this::mapRow;

    public Optional<Call> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM calls WHERE id = ?", rowMapper, id).stream().findFirst();
    }

    public boolean existsById(String id) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM calls WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    public Optional<Call> findByCarrierCallSid(String callSid) {
        return jdbcTemplate.query("SELECT * FROM calls WHERE carrier_call_sid = ?", rowMapper, callSid)
                .stream().findFirst();
    }

    /**
     * Keyset page of calls that have no owning user, ordered by id.
     */
    public List<Call> findWithoutUser(String afterId, int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM calls WHERE user_id IS NULL AND id > ? ORDER BY id LIMIT ?",
                rowMapper, afterId == null ? "" : afterId, limit);
    }

    public void insert(Call call) {
        jdbcTemplate.update(
                "INSERT INTO calls (id, user_id, campaign_id, contact_id, incoming_connection_id, carrier_call_sid, "
                        + "conversation_id, phone_number, direction, status, duration_seconds, recording_url, metadata, "
                        + "started_at, ended_at, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                call.getId(), call.getUserId(), call.getCampaignId(), call.getContactId(),
                call.getIncomingConnectionId(), call.getCarrierCallSid(), call.getConversationId(),
                call.getPhoneNumber(), call.getDirection() == null ? null : call.getDirection().dbValue(),
                call.getStatus().dbValue(), call.getDurationSeconds(), call.getRecordingUrl(),
                writeMetadata(call.getMetadata()), timestamp(call.getStartedAt()), timestamp(call.getEndedAt()),
                timestamp(call.getCreatedAt() == null ? Instant.now() : call.getCreatedAt()));
    }

    /**
     * Applies a live-session or status-callback update. A terminal status is never overwritten
     * and a call never moves back to an earlier stage.
     */
    public boolean updateStatus(String id, CallStatus status, Integer durationSeconds,
                                String recordingUrl, Instant startedAt, Instant endedAt) {
        return jdbcTemplate.update(
                "UPDATE calls SET status = ?, duration_seconds = COALESCE(?, duration_seconds), "
                        + "recording_url = COALESCE(?, recording_url), started_at = COALESCE(started_at, ?), "
                        + "ended_at = COALESCE(?, ended_at) "
                        + "WHERE id = ? AND status NOT IN ('completed', 'failed', 'no-answer', 'busy') "
                        + "AND CASE status WHEN 'initiated' THEN 0 WHEN 'ringing' THEN 1 ELSE 2 END <= ?",
                status.dbValue(), durationSeconds, recordingUrl, timestamp(startedAt), timestamp(endedAt), id,
                status.rank()) == 1;
    }

    public boolean assignUser(String id, String userId) {
        return jdbcTemplate.update("UPDATE calls SET user_id = ? WHERE id = ? AND user_id IS NULL", userId, id) == 1;
    }

    public boolean replaceMetadata(String id, Map<String, Object> metadata) {
        return jdbcTemplate.update("UPDATE calls SET metadata = ? WHERE id = ? AND user_id IS NULL",
                writeMetadata(metadata), id) == 1;
    }

    private Call mapRow(ResultSet rs, int rowNum) throws SQLException {
        String direction = rs.getString("direction");
        return Call.builder()
                .id(rs.getString("id"))
                .userId(rs.getString("user_id"))
                .campaignId(rs.getString("campaign_id"))
                .contactId(rs.getString("contact_id"))
                .incomingConnectionId(rs.getString("incoming_connection_id"))
                .carrierCallSid(rs.getString("carrier_call_sid"))
                .conversationId(rs.getString("conversation_id"))
                .phoneNumber(rs.getString("phone_number"))
                .direction(direction == null ? null : CallDirection.fromString(direction))
                .status(CallStatus.fromString(rs.getString("status")))
                .durationSeconds(nullableInt(rs, "duration_seconds"))
                .transcript(rs.getString("transcript"))
                .recordingUrl(rs.getString("recording_url"))
                .metadata(readMetadata(rs.getString("metadata")))
                .startedAt(instant(rs, "started_at"))
                .endedAt(instant(rs, "ended_at"))
                .createdAt(instant(rs, "created_at"))
                .build();
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt call metadata: " + json, e);
        }
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Call metadata is not serializable", e);
        }
    }
}
