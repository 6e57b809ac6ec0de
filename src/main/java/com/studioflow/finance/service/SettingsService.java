package com.studioflow.finance.service;

import com.studioflow.finance.model.AppSetting;
import com.studioflow.finance.repository.AppSettingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

@Service
public class SettingsService {

    public static final String KEY_FIRM_NAME = "firm_name";
    public static final String KEY_RECEIPT_PREFIX = "receipt_prefix";
    public static final String KEY_AUTO_RECEIPT = "auto_receipt";

    private static final Map<String, String> DEFAULTS = Map.of(
            KEY_FIRM_NAME, "StudioFlow",
            KEY_RECEIPT_PREFIX, "RCPT",
            KEY_AUTO_RECEIPT, "true");

    private final AppSettingRepository appSettingRepository;

    public SettingsService(AppSettingRepository appSettingRepository) {
        this.appSettingRepository = appSettingRepository;
    }

    public String getFirmName() {
        return get(KEY_FIRM_NAME);
    }

    public String getReceiptPrefix() {
        String prefix = get(KEY_RECEIPT_PREFIX);
        return prefix.isBlank() ? DEFAULTS.get(KEY_RECEIPT_PREFIX) : prefix.trim();
    }

    /**
     * Whether recording an invoice payment also issues its receipt.
     */
    public boolean isAutoReceipt() {
        return Boolean.parseBoolean(get(KEY_AUTO_RECEIPT).trim());
    }

    private String get(String key) {
        return appSettingRepository.findBySettingKey(key)
                .map(AppSetting::getSettingValue)
                .orElse(DEFAULTS.getOrDefault(key, ""));
    }

    @Transactional
    public void updateSetting(String key, String value) {
        Optional<AppSetting> existing = appSettingRepository.findBySettingKey(key);
        AppSetting setting = existing.orElseGet(() -> new AppSetting(key, ""));
        setting.setSettingValue(value != null ? value : "");
        appSettingRepository.save(setting);
    }

    @Transactional
    public void ensureDefaults() {
        DEFAULTS.forEach((key, value) -> {
            if (appSettingRepository.findBySettingKey(key).isEmpty()) {
                appSettingRepository.save(new AppSetting(key, value));
            }
        });
    }
}
