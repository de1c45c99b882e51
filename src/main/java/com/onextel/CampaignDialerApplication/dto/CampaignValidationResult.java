package com.onextel.CampaignDialerApplication.dto;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Blocking errors and non-blocking warnings collected by campaign validation.
 */
@Getter
public class CampaignValidationResult {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public CampaignValidationResult error(String message) {
        errors.add(message);
        return this;
    }

    public CampaignValidationResult warning(String message) {
        warnings.add(message);
        return this;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
