package com.tradeerp.invoicing.service;

import com.tradeerp.invoicing.config.ErpProperties;
import com.tradeerp.invoicing.exception.ValidationException;
import com.tradeerp.invoicing.model.AppSetting;
import com.tradeerp.invoicing.repository.AppSettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Ledger account mappings. A value stored in app_settings overrides the configured default.
 */
@Service
public class SettingsService {

    public static final String KEY_SALES_ACCOUNT = "ledger.sales_account_id";
    public static final String KEY_PURCHASE_ACCOUNT = "ledger.purchase_account_id";
    public static final String KEY_CASH_ACCOUNT = "ledger.cash_account_id";

    private static final Logger logger = LoggerFactory.getLogger(SettingsService.class);

    private final AppSettingRepository appSettingRepository;
    private final ErpProperties properties;
    private final Clock clock;

    public SettingsService(AppSettingRepository appSettingRepository, ErpProperties properties, Clock clock) {
        this.appSettingRepository = appSettingRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public Long getSalesAccountId() {
        return accountId(KEY_SALES_ACCOUNT, properties.getLedger().getSalesAccountId());
    }

    public Long getPurchaseAccountId() {
        return accountId(KEY_PURCHASE_ACCOUNT, properties.getLedger().getPurchaseAccountId());
    }

    public Long getCashAccountId() {
        return accountId(KEY_CASH_ACCOUNT, properties.getLedger().getCashAccountId());
    }

    private Long accountId(String key, Long fallback) {
        return appSettingRepository.findBySettingKey(key)
                .map(AppSetting::getSettingValue)
                .filter(val -> !val.isBlank())
                .map(val -> {
                    try {
                        return Long.valueOf(val.trim());
                    } catch (NumberFormatException e) {
                        logger.warn("Ignoring non-numeric ledger account setting {}={}", key, val);
                        return fallback;
                    }
                })
                .orElse(fallback);
    }

    @Transactional
    public void updateAccountSetting(String key, Long accountId) {
        if (accountId == null || accountId <= 0) {
            throw new ValidationException("Ledger account id must be positive", key);
        }
        String value = accountId.toString();
        String user = AuditService.currentUsername();
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<AppSetting> existing = appSettingRepository.findBySettingKey(key);
        if (existing.isPresent()) {
            AppSetting setting = existing.get();
            setting.setSettingValue(value);
            setting.setUpdatedBy(user);
            setting.setUpdatedAt(now);
            appSettingRepository.save(setting);
        } else {
            appSettingRepository.save(new AppSetting(key, value, user, now));
        }
        logger.info("Ledger account setting {} set to {} by {}", key, value, user);
    }
}
