package com.example.iptvcatalog.domain.model;

import lombok.Value;

@Value
public class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(true, null);

    boolean valid;

    String reason;

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason);
    }
}
