package com.fintech.donations.service.settings;

import com.fintech.donations.entity.OrganizationSettings;
import com.fintech.donations.repository.OrganizationSettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Organisation timezone, read once from the settings row and cached.
 * <p>
 * Donation dates, receipt years and next payment dates are all computed in this zone.
 * The cache is only reloaded on {@link #refresh()}.
 */
@Component
@Slf4j
public class OrganizationTimezoneProvider {

    private final OrganizationSettingsRepository settingsRepository;
    private final Clock clock;
    private final ZoneId defaultZone;

    private volatile ZoneId cachedZone;

    public OrganizationTimezoneProvider(OrganizationSettingsRepository settingsRepository,
                                        Clock clock,
                                        @Value("${donations.organization.default-timezone:Australia/Sydney}")
                                        String defaultTimezone) {
        this.settingsRepository = settingsRepository;
        this.clock = clock;
        this.defaultZone = ZoneId.of(defaultTimezone);
    }

    public ZoneId getZoneId() {
        ZoneId zone = cachedZone;
        if (zone == null) {
            zone = refresh();
        }
        return zone;
    }

    /**
     * Reloads the timezone from the settings row.
     * A missing row, a blank value or an unknown zone ID falls back to the default.
     */
    public ZoneId refresh() {
        ZoneId zone = settingsRepository.findById(OrganizationSettings.DEFAULT_ID)
                .map(OrganizationSettings::getTimezone)
                .filter(tz -> !tz.isBlank())
                .map(this::parseZone)
                .orElse(defaultZone);
        cachedZone = zone;
        log.info("Organisation timezone set to {}", zone);
        return zone;
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(getZoneId()));
    }

    public int currentYear() {
        return today().getYear();
    }

    private ZoneId parseZone(String timezone) {
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("Invalid organisation timezone '{}', using {}", timezone, defaultZone);
            return defaultZone;
        }
    }
}
