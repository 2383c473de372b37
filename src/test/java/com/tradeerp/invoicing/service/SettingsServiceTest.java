package com.tradeerp.invoicing.service;

import com.tradeerp.invoicing.config.ErpProperties;
import com.tradeerp.invoicing.exception.ValidationException;
import com.tradeerp.invoicing.model.AppSetting;
import com.tradeerp.invoicing.repository.AppSettingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SettingsServiceTest {

    @Mock
    private AppSettingRepository appSettingRepository;

    private SettingsService settingsService;

    @BeforeEach
    void setUp() {
        settingsService = new SettingsService(appSettingRepository, new ErpProperties(),
                Clock.fixed(Instant.parse("2026-04-01T08:00:00Z"), ZoneOffset.UTC));
    }

    private static AppSetting setting(String key, String value) {
        return new AppSetting(key, value, "admin", LocalDateTime.of(2026, 1, 1, 0, 0));
    }

    @Test
    void accountIds_ShouldFallBackToConfiguredDefaults() {
        when(appSettingRepository.findBySettingKey(any())).thenReturn(Optional.empty());

        assertEquals(1L, settingsService.getSalesAccountId());
        assertEquals(2L, settingsService.getPurchaseAccountId());
        assertEquals(3L, settingsService.getCashAccountId());
    }

    @Test
    void storedSetting_ShouldOverrideDefault() {
        when(appSettingRepository.findBySettingKey(SettingsService.KEY_SALES_ACCOUNT))
                .thenReturn(Optional.of(setting(SettingsService.KEY_SALES_ACCOUNT, " 4100 ")));

        assertEquals(4100L, settingsService.getSalesAccountId());
    }

    @Test
    void nonNumericSetting_ShouldBeIgnored() {
        when(appSettingRepository.findBySettingKey(SettingsService.KEY_CASH_ACCOUNT))
                .thenReturn(Optional.of(setting(SettingsService.KEY_CASH_ACCOUNT, "cash-box")));

        assertEquals(3L, settingsService.getCashAccountId());
    }

    @Test
    void updateAccountSetting_ShouldOverwriteExistingRow() {
        AppSetting existing = setting(SettingsService.KEY_PURCHASE_ACCOUNT, "2");
        when(appSettingRepository.findBySettingKey(SettingsService.KEY_PURCHASE_ACCOUNT))
                .thenReturn(Optional.of(existing));

        settingsService.updateAccountSetting(SettingsService.KEY_PURCHASE_ACCOUNT, 5200L);

        ArgumentCaptor<AppSetting> saved = ArgumentCaptor.forClass(AppSetting.class);
        verify(appSettingRepository).save(saved.capture());
        assertSame(existing, saved.getValue());
        assertEquals("5200", saved.getValue().getSettingValue());
        assertEquals("SYSTEM", saved.getValue().getUpdatedBy());
        assertEquals(LocalDateTime.of(2026, 4, 1, 8, 0), saved.getValue().getUpdatedAt());
    }

    @Test
    void updateAccountSetting_NonPositive_ShouldThrow() {
        assertThrows(ValidationException.class,
                () -> settingsService.updateAccountSetting(SettingsService.KEY_SALES_ACCOUNT, 0L));
        verifyNoInteractions(appSettingRepository);
    }
}
