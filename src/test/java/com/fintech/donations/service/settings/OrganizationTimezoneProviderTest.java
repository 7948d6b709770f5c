package com.fintech.donations.service.settings;

import com.fintech.donations.entity.OrganizationSettings;
import com.fintech.donations.repository.OrganizationSettingsRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrganizationTimezoneProviderTest {

    // 2024-12-31 14:30 UTC is already 2025-01-01 in Sydney (UTC+11)
    private static final Clock NEW_YEARS_EVE_UTC =
            Clock.fixed(Instant.parse("2024-12-31T14:30:00Z"), ZoneOffset.UTC);

    @Mock
    private OrganizationSettingsRepository settingsRepository;

    @Test
    @DisplayName("Uses the default timezone when no settings row exists")
    void defaultsWhenMissing() {
        when(settingsRepository.findById(OrganizationSettings.DEFAULT_ID)).thenReturn(Optional.empty());
        OrganizationTimezoneProvider provider =
                new OrganizationTimezoneProvider(settingsRepository, NEW_YEARS_EVE_UTC, "Australia/Sydney");

        assertThat(provider.getZoneId()).isEqualTo(ZoneId.of("Australia/Sydney"));
        assertThat(provider.today()).isEqualTo(LocalDate.of(2025, 1, 1));
        assertThat(provider.currentYear()).isEqualTo(2025);
    }

    @Test
    @DisplayName("Reads the settings row once and serves later calls from the cache")
    void cachesTimezone() {
        when(settingsRepository.findById(OrganizationSettings.DEFAULT_ID))
                .thenReturn(Optional.of(settings("UTC")));
        OrganizationTimezoneProvider provider =
                new OrganizationTimezoneProvider(settingsRepository, NEW_YEARS_EVE_UTC, "Australia/Sydney");

        provider.getZoneId();
        provider.today();
        int year = provider.currentYear();

        assertThat(year).isEqualTo(2024);
        verify(settingsRepository, times(1)).findById(OrganizationSettings.DEFAULT_ID);
    }

    @Test
    @DisplayName("Refresh picks up a changed timezone")
    void refreshReloads() {
        when(settingsRepository.findById(OrganizationSettings.DEFAULT_ID))
                .thenReturn(Optional.of(settings("UTC")))
                .thenReturn(Optional.of(settings("Pacific/Auckland")));
        OrganizationTimezoneProvider provider =
                new OrganizationTimezoneProvider(settingsRepository, NEW_YEARS_EVE_UTC, "Australia/Sydney");

        assertThat(provider.getZoneId()).isEqualTo(ZoneId.of("UTC"));
        assertThat(provider.refresh()).isEqualTo(ZoneId.of("Pacific/Auckland"));
        assertThat(provider.getZoneId()).isEqualTo(ZoneId.of("Pacific/Auckland"));
    }

    @Test
    @DisplayName("Invalid or blank timezone falls back to the default")
    void invalidFallsBack() {
        when(settingsRepository.findById(OrganizationSettings.DEFAULT_ID))
                .thenReturn(Optional.of(settings("Mars/Olympus_Mons")))
                .thenReturn(Optional.of(settings("  ")));
        OrganizationTimezoneProvider provider =
                new OrganizationTimezoneProvider(settingsRepository, NEW_YEARS_EVE_UTC, "Australia/Sydney");

        assertThat(provider.refresh()).isEqualTo(ZoneId.of("Australia/Sydney"));
        assertThat(provider.refresh()).isEqualTo(ZoneId.of("Australia/Sydney"));
    }

    private static OrganizationSettings settings(String timezone) {
        return OrganizationSettings.builder()
                .id(OrganizationSettings.DEFAULT_ID)
                .name("Test Org")
                .timezone(timezone)
                .build();
    }
}
