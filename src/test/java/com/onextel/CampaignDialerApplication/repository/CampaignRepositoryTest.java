package com.onextel.CampaignDialerApplication.repository;

import com.onextel.CampaignDialerApplication.model.Campaign;
import com.onextel.CampaignDialerApplication.model.CampaignStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CampaignRepositoryTest {

    private EmbeddedDatabase database;
    private CampaignRepository repository;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema.sql")
                .build();
        repository = new CampaignRepository(new JdbcTemplate(database));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private void insert(String id, CampaignStatus status, String phoneNumberId) {
        repository.insert(Campaign.builder()
                .id(id)
                .userId("user-1")
                .name("Campaign " + id)
                .agentId("agent-1")
                .phoneNumberId(phoneNumberId)
                .status(status)
                .totalContacts(3)
                .build());
    }

    @Test
    void onlyOneClaimForExecutionWins() {
        insert("c1", CampaignStatus.DRAFT, "pn-1");

        assertTrue(repository.claimForExecution("c1", CampaignStatus.DRAFT, Instant.now()));
        assertFalse(repository.claimForExecution("c1", CampaignStatus.DRAFT, Instant.now()));

        Campaign campaign = repository.findById("c1").orElseThrow();
        assertEquals(CampaignStatus.RUNNING, campaign.getStatus());
        assertNotNull(campaign.getStartedAt());
    }

    @Test
    void releaseClaimRestoresPreviousStatusWhenNoBatchJobExists() {
        insert("c1", CampaignStatus.PENDING, "pn-1");
        repository.claimForExecution("c1", CampaignStatus.PENDING, Instant.now());

        assertTrue(repository.releaseClaim("c1", CampaignStatus.PENDING, "gateway down"));

        Campaign campaign = repository.findById("c1").orElseThrow();
        assertEquals(CampaignStatus.PENDING, campaign.getStatus());
        assertNull(campaign.getStartedAt());
        assertEquals("gateway down", campaign.getErrorMessage());
    }

    @Test
    void releaseClaimIsRefusedOnceBatchJobRecorded() {
        insert("c1", CampaignStatus.DRAFT, "pn-1");
        repository.claimForExecution("c1", CampaignStatus.DRAFT, Instant.now());
        repository.recordBatchJob("c1", "job-1", "pending", 3);

        assertFalse(repository.releaseClaim("c1", CampaignStatus.DRAFT, "late failure"));
        assertEquals(CampaignStatus.RUNNING, repository.findById("c1").orElseThrow().getStatus());
    }

    @Test
    void countersNeverMoveBackwards() {
        insert("c1", CampaignStatus.RUNNING, "pn-1");

        repository.applyCounters("c1", 5, 4, 1, "in_progress");
        repository.applyCounters("c1", 3, 2, 1, "in_progress");

        Campaign campaign = repository.findById("c1").orElseThrow();
        assertEquals(5, campaign.getCompletedCalls());
        assertEquals(4, campaign.getSuccessfulCalls());
        assertEquals(1, campaign.getFailedCalls());
        assertEquals("in_progress", campaign.getBatchJobStatus());
    }

    @Test
    void finishIsWonOnlyOnceAndOnlyFromActiveStatus() {
        insert("c1", CampaignStatus.RUNNING, "pn-1");
        insert("c2", CampaignStatus.DRAFT, "pn-2");

        assertTrue(repository.finish("c1", CampaignStatus.COMPLETED, Instant.now(), null));
        assertFalse(repository.finish("c1", CampaignStatus.FAILED, Instant.now(), "boom"));
        assertFalse(repository.finish("c2", CampaignStatus.COMPLETED, Instant.now(), null));

        Campaign finished = repository.findById("c1").orElseThrow();
        assertEquals(CampaignStatus.COMPLETED, finished.getStatus());
        assertNull(finished.getErrorMessage());
    }

    @Test
    void pauseAndResumeFollowAllowedTransitions() {
        insert("c1", CampaignStatus.RUNNING, "pn-1");

        assertTrue(repository.pause("c1", "manual"));
        assertFalse(repository.pause("c1", "manual"));
        assertEquals("manual", repository.findById("c1").orElseThrow().getPauseReason());

        assertTrue(repository.resume("c1"));
        Campaign resumed = repository.findById("c1").orElseThrow();
        assertEquals(CampaignStatus.RUNNING, resumed.getStatus());
        assertNull(resumed.getPauseReason());
    }

    @Test
    void cancelIsTerminal() {
        insert("c1", CampaignStatus.PAUSED, "pn-1");

        assertTrue(repository.cancel("c1", Instant.now()));
        assertFalse(repository.cancel("c1", Instant.now()));
        assertFalse(repository.resume("c1"));
        assertEquals(CampaignStatus.CANCELLED, repository.findById("c1").orElseThrow().getStatus());
    }

    @Test
    void activeCampaignsCannotBeDeleted() {
        insert("c1", CampaignStatus.RUNNING, "pn-1");
        insert("c2", CampaignStatus.COMPLETED, "pn-1");

        assertFalse(repository.softDelete("c1", Instant.now()));
        assertTrue(repository.softDelete("c2", Instant.now()));

        assertTrue(repository.findById("c2").isEmpty());
        assertTrue(repository.findByIdIncludingDeleted("c2").isPresent());

        assertTrue(repository.restore("c2"));
        assertFalse(repository.restore("c2"));
        assertTrue(repository.findById("c2").isPresent());
    }

    @Test
    void findActiveByPhoneNumberIgnoresTheCampaignItself() {
        insert("c1", CampaignStatus.RUNNING, "pn-1");
        insert("c2", CampaignStatus.DRAFT, "pn-1");
        insert("c3", CampaignStatus.COMPLETED, "pn-2");

        assertEquals("c1", repository.findActiveByPhoneNumber("pn-1", "c2").orElseThrow().getId());
        assertTrue(repository.findActiveByPhoneNumber("pn-1", "c1").isEmpty());
        assertTrue(repository.findActiveByPhoneNumber("pn-2", null).isEmpty());
    }
}
