package com.complypilot.model;

/** Partial profile update; {@code null} fields are left untouched. */
public record ProfileUpdate(
        String companyName,
        String businessType,
        Integer employeeCount,
        String industry
) {}
