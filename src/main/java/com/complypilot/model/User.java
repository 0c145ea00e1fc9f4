package com.complypilot.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A subject: the business user all assessments, registers and documents are scoped to.
 * The email is the durable key used to recognise returning users.
 */
@Document(collection = "users")
public record User(
        @Id String userId,
        String email,
        String name,
        String picture,
        String companyName,
        String businessType,
        Integer employeeCount,
        String industry,
        Instant createdAt
) {
    public User withIdentity(String newName, String newPicture) {
        return new User(userId, email, newName, newPicture, companyName, businessType,
                employeeCount, industry, createdAt);
    }

    public User withBusinessProfile(String newBusinessType, String newIndustry) {
        return new User(userId, email, name, picture, companyName, newBusinessType,
                employeeCount, newIndustry, createdAt);
    }

    /** Applies the non-null fields of the update. */
    public User withProfileUpdate(ProfileUpdate update) {
        return new User(userId, email, name, picture,
                update.companyName() != null ? update.companyName() : companyName,
                update.businessType() != null ? update.businessType() : businessType,
                update.employeeCount() != null ? update.employeeCount() : employeeCount,
                update.industry() != null ? update.industry() : industry,
                createdAt);
    }
}
