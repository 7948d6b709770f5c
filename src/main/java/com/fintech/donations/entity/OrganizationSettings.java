package com.fintech.donations.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Organisation-wide settings maintained by the admin app.
 */
@Entity
@Table(name = "organization_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationSettings {

    public static final String DEFAULT_ID = "info";

    @Id
    @Column(length = 50)
    private String id;

    @Column(length = 200)
    private String name;

    /**
     * IANA zone ID, e.g. "Australia/Sydney".
     */
    @Column(length = 64)
    private String timezone;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
