package com.onextel.CampaignDialerApplication.repository;

import com.onextel.CampaignDialerApplication.model.Agent;
import com.onextel.CampaignDialerApplication.model.AgentType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class AgentRepository {
    private static final RowMapper<Agent> ROW_MAPPER = (rs, rowNum) -> Agent.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .name(rs.getString("name"))
            .type(AgentType.fromString(rs.getString("agent_type")))
            .externalAgentId(rs.getString("external_agent_id"))
            .flowId(rs.getString("flow_id"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public Optional<Agent> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM agents WHERE id = ?", ROW_MAPPER, id).stream().findFirst();
    }

    public Optional<Agent> findByExternalAgentId(String externalAgentId) {
        return jdbcTemplate.query("SELECT * FROM agents WHERE external_agent_id = ?", ROW_MAPPER, externalAgentId)
                .stream().findFirst();
    }

    public void insert(Agent agent) {
        jdbcTemplate.update(
                "INSERT INTO agents (id, user_id, name, agent_type, external_agent_id, flow_id) VALUES (?, ?, ?, ?, ?, ?)",
                agent.getId(), agent.getUserId(), agent.getName(),
                agent.getType() == null ? AgentType.NATURAL.dbValue() : agent.getType().dbValue(),
                agent.getExternalAgentId(), agent.getFlowId());
    }
}
