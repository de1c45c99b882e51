package com.onextel.CampaignDialerApplication.repository;

import com.onextel.CampaignDialerApplication.model.Campaign;
import com.onextel.CampaignDialerApplication.model.CampaignStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.onextel.CampaignDialerApplication.repository.JdbcColumns.instant;
import static com.onextel.CampaignDialerApplication.repository.JdbcColumns.timestamp;

/**
 * Campaign rows. Status and counter changes are single conditional statements, callers
 * learn whether they won a transition from the affected row count.
 */
@Repository
@RequiredArgsConstructor
public class CampaignRepository {
    private static final RowMapper<Campaign> ROW_MAPPER = (rs, rowNum) -> Campaign.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .name(rs.getString("name"))
            .type(rs.getString("campaign_type"))
            .agentId(rs.getString("agent_id"))
            .phoneNumberId(rs.getString("phone_number_id"))
            .status(CampaignStatus.fromString(rs.getString("status")))
            .batchJobId(rs.getString("batch_job_id"))
            .batchJobStatus(rs.getString("batch_job_status"))
            .totalContacts(rs.getInt("total_contacts"))
            .completedCalls(rs.getInt("completed_calls"))
            .successfulCalls(rs.getInt("successful_calls"))
            .failedCalls(rs.getInt("failed_calls"))
            .pauseReason(rs.getString("pause_reason"))
            .errorMessage(rs.getString("error_message"))
            .scheduledFor(instant(rs, "scheduled_for"))
            .startedAt(instant(rs, "started_at"))
            .completedAt(instant(rs, "completed_at"))
            .createdAt(instant(rs, "created_at"))
            .deletedAt(instant(rs, "deleted_at"))
            .build();

    private static final String ACTIVE_STATUSES = "('running', 'paused')";

    private final JdbcTemplate jdbcTemplate;

    // ========== Queries ========== //

    public Optional<Campaign> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM campaigns WHERE id = ? AND deleted_at IS NULL", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public Optional<Campaign> findByIdIncludingDeleted(String id) {
        return jdbcTemplate.query("SELECT * FROM campaigns WHERE id = ?", ROW_MAPPER, id).stream().findFirst();
    }

    public List<Campaign> findWithBatchJobByStatus(CampaignStatus status) {
        return jdbcTemplate.query(
                "SELECT * FROM campaigns WHERE status = ? AND batch_job_id IS NOT NULL AND deleted_at IS NULL",
                ROW_MAPPER, status.dbValue());
    }

    /**
     * Another running or paused campaign holding this phone number, if any.
     */
    public Optional<Campaign> findActiveByPhoneNumber(String phoneNumberId, String excludeCampaignId) {
        return jdbcTemplate.query(
                "SELECT * FROM campaigns WHERE phone_number_id = ? AND status IN " + ACTIVE_STATUSES
                        + " AND deleted_at IS NULL AND id <> ?",
                ROW_MAPPER, phoneNumberId, excludeCampaignId == null ? "" : excludeCampaignId)
                .stream().findFirst();
    }

    public void insert(Campaign campaign) {
        jdbcTemplate.update(
                "INSERT INTO campaigns (id, user_id, name, campaign_type, agent_id, phone_number_id, status, "
                        + "batch_job_id, batch_job_status, total_contacts, scheduled_for, created_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                campaign.getId(), campaign.getUserId(), campaign.getName(), campaign.getType(),
                campaign.getAgentId(), campaign.getPhoneNumberId(), campaign.getStatus().dbValue(),
                campaign.getBatchJobId(), campaign.getBatchJobStatus(), campaign.getTotalContacts(),
                timestamp(campaign.getScheduledFor()),
                timestamp(campaign.getCreatedAt() == null ? Instant.now() : campaign.getCreatedAt()));
    }

    // ========== Execution ========== //

    /**
     * Moves the campaign to running if it is still in {@code expected}. Returns false when another
     * request got there first.
     */
    public boolean claimForExecution(String id, CampaignStatus expected, Instant startedAt) {
        return jdbcTemplate.update(
                "UPDATE campaigns SET status = 'running', started_at = ?, completed_at = NULL, error_message = NULL "
                        + "WHERE id = ? AND status = ? AND deleted_at IS NULL",
                timestamp(startedAt), id, expected.dbValue()) == 1;
    }

    /**
     * Undoes {@link #claimForExecution} when no batch job was created, leaving the campaign executable.
     */
    public boolean releaseClaim(String id, CampaignStatus restoreTo, String errorMessage) {
        return jdbcTemplate.update(
                "UPDATE campaigns SET status = ?, started_at = NULL, error_message = ? "
                        + "WHERE id = ? AND status = 'running' AND batch_job_id IS NULL",
                restoreTo.dbValue(), errorMessage, id) == 1;
    }

    public boolean recordBatchJob(String id, String batchJobId, String batchJobStatus, int totalContacts) {
        return jdbcTemplate.update(
                "UPDATE campaigns SET batch_job_id = ?, batch_job_status = ?, "
                        + "total_contacts = GREATEST(total_contacts, ?) WHERE id = ?",
                batchJobId, batchJobStatus, totalContacts, id) == 1;
    }

    // ========== Lifecycle Transitions ========== //

    public boolean pause(String id, String reason) {
        return jdbcTemplate.update(
                "UPDATE campaigns SET status = 'paused', pause_reason = ? WHERE id = ? AND status = 'running'",
                reason, id) == 1;
    }

    public boolean resume(String id) {
        return jdbcTemplate.update(
                "UPDATE campaigns SET status = 'running', pause_reason = NULL, completed_at = NULL, error_message = NULL "
                        + "WHERE id = ? AND status IN ('paused', 'completed', 'failed')",
                id) == 1;
    }

    public boolean cancel(String id, Instant completedAt) {
        return jdbcTemplate.update(
                "UPDATE campaigns SET status = 'cancelled', completed_at = ? WHERE id = ? AND status IN " + ACTIVE_STATUSES,
                timestamp(completedAt), id) == 1;
    }

    /**
     * Terminal transition driven by the remote job. Only one concurrent caller can win it.
     */
    public boolean finish(String id, CampaignStatus terminalStatus, Instant completedAt, String errorMessage) {
        return jdbcTemplate.update(
                "UPDATE campaigns SET status = ?, completed_at = ?, error_message = COALESCE(?, error_message) "
                        + "WHERE id = ? AND status IN " + ACTIVE_STATUSES,
                terminalStatus.dbValue(), timestamp(completedAt), errorMessage, id) == 1;
    }

    /**
     * Counters only move forward; a stale poll can never roll them back.
     */
    public void applyCounters(String id, int completed, int successful, int failed, String batchJobStatus) {
        jdbcTemplate.update(
                "UPDATE campaigns SET completed_calls = GREATEST(completed_calls, ?), "
                        + "successful_calls = GREATEST(successful_calls, ?), "
                        + "failed_calls = GREATEST(failed_calls, ?), batch_job_status = ? WHERE id = ?",
                completed, successful, failed, batchJobStatus, id);
    }

    public void updateBatchJobStatus(String id, String batchJobStatus) {
        jdbcTemplate.update("UPDATE campaigns SET batch_job_status = ? WHERE id = ?", batchJobStatus, id);
    }

    public boolean assignPhoneNumber(String id, String phoneNumberId) {
        return jdbcTemplate.update(
                "UPDATE campaigns SET phone_number_id = ? WHERE id = ? AND deleted_at IS NULL",
                phoneNumberId, id) == 1;
    }

    // ========== Soft Delete ========== //

    public boolean softDelete(String id, Instant deletedAt) {
        return jdbcTemplate.update(
                "UPDATE campaigns SET deleted_at = ? WHERE id = ? AND deleted_at IS NULL AND status NOT IN " + ACTIVE_STATUSES,
                timestamp(deletedAt), id) == 1;
    }

    public boolean restore(String id) {
        return jdbcTemplate.update("UPDATE campaigns SET deleted_at = NULL WHERE id = ? AND deleted_at IS NOT NULL", id) == 1;
    }
}
