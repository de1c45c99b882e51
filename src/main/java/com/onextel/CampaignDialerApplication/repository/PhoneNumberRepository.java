package com.onextel.CampaignDialerApplication.repository;

import com.onextel.CampaignDialerApplication.model.PhoneNumber;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PhoneNumberRepository {
    private static final RowMapper<PhoneNumber> ROW_MAPPER = (rs, rowNum) -> PhoneNumber.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .phoneNumber(rs.getString("phone_number"))
            .carrierSid(rs.getString("carrier_sid"))
            .externalNumberId(rs.getString("external_number_id"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public Optional<PhoneNumber> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM phone_numbers WHERE id = ?", ROW_MAPPER, id).stream().findFirst();
    }

    public Optional<PhoneNumber> findByPhoneNumber(String phoneNumber) {
        return jdbcTemplate.query("SELECT * FROM phone_numbers WHERE phone_number = ?", ROW_MAPPER, phoneNumber)
                .stream().findFirst();
    }

    public Optional<PhoneNumber> findByCarrierSid(String carrierSid) {
        return jdbcTemplate.query("SELECT * FROM phone_numbers WHERE carrier_sid = ?", ROW_MAPPER, carrierSid)
                .stream().findFirst();
    }

    public List<PhoneNumber> findByUserId(String userId) {
        return jdbcTemplate.query("SELECT * FROM phone_numbers WHERE user_id = ? ORDER BY phone_number", ROW_MAPPER, userId);
    }

    public boolean deleteByCarrierSid(String carrierSid) {
        return jdbcTemplate.update("DELETE FROM phone_numbers WHERE carrier_sid = ?", carrierSid) == 1;
    }

    /**
     * Row lock serializing every assignment of this number until the surrounding transaction ends.
     */
    public Optional<PhoneNumber> lockById(String id) {
        return jdbcTemplate.query("SELECT * FROM phone_numbers WHERE id = ? FOR UPDATE", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public void insert(PhoneNumber number) {
        jdbcTemplate.update(
                "INSERT INTO phone_numbers (id, user_id, phone_number, carrier_sid, external_number_id) VALUES (?, ?, ?, ?, ?)",
                number.getId(), number.getUserId(), number.getPhoneNumber(),
                number.getCarrierSid(), number.getExternalNumberId());
    }
}
