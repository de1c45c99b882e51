package com.onextel.CampaignDialerApplication.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onextel.CampaignDialerApplication.model.Contact;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class ContactRepository {
    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public List<Contact> findByCampaignId(String campaignId) {
        return jdbcTemplate.query("SELECT * FROM contacts WHERE campaign_id = ? ORDER BY id",
                (rs, rowNum) -> Contact.builder()
                        .id(rs.getString("id"))
                        .campaignId(rs.getString("campaign_id"))
                        .firstName(rs.getString("first_name"))
                        .lastName(rs.getString("last_name"))
                        .phoneNumber(rs.getString("phone_number"))
                        .email(rs.getString("email"))
                        .customFields(readFields(rs.getString("custom_fields")))
                        .build(),
                campaignId);
    }

    public int countByCampaignId(String campaignId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM contacts WHERE campaign_id = ?", Integer.class, campaignId);
        return count == null ? 0 : count;
    }

    public void insert(Contact contact) {
        jdbcTemplate.update(
                "INSERT INTO contacts (id, campaign_id, first_name, last_name, phone_number, email, custom_fields) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                contact.getId(), contact.getCampaignId(), contact.getFirstName(), contact.getLastName(),
                contact.getPhoneNumber(), contact.getEmail(), writeFields(contact.getCustomFields()));
    }

    private Map<String, Object> readFields(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, FIELDS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt contact custom_fields: " + json, e);
        }
    }

    private String writeFields(Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Contact custom fields are not serializable", e);
        }
    }
}
