package com.farmket.marketplace.service;

import com.farmket.marketplace.model.AppSetting;
import com.farmket.marketplace.repository.AppSettingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
public class SettingsService {

    private final AppSettingRepository appSettingRepository;

    public static final String KEY_CURRENCY_SYMBOL = "currency_symbol";
    public static final String KEY_MARKETPLACE_NAME = "marketplace_name";

    public static final String DEFAULT_CURRENCY_SYMBOL = "$";
    public static final String DEFAULT_MARKETPLACE_NAME = "Farmket";

    public SettingsService(AppSettingRepository appSettingRepository) {
        this.appSettingRepository = appSettingRepository;
    }

    public String getCurrencySymbol() {
        return appSettingRepository.findBySettingKey(KEY_CURRENCY_SYMBOL)
                .map(AppSetting::getSettingValue)
                .filter(s -> !s.isEmpty())
                .orElse(DEFAULT_CURRENCY_SYMBOL);
    }

    public String getMarketplaceName() {
        return appSettingRepository.findBySettingKey(KEY_MARKETPLACE_NAME)
                .map(AppSetting::getSettingValue)
                .filter(s -> !s.isEmpty())
                .orElse(DEFAULT_MARKETPLACE_NAME);
    }

    @Transactional
    public void updateSetting(String key, String value) {
        Optional<AppSetting> existing = appSettingRepository.findBySettingKey(key);
        AppSetting setting = existing.orElseGet(() -> new AppSetting(key, ""));
        setting.setSettingValue(value != null ? value : "");
        appSettingRepository.save(setting);
    }

    // Only writes keys that are missing, staff edits survive restarts
    @Transactional
    public void seedDefaults() {
        if (appSettingRepository.findBySettingKey(KEY_CURRENCY_SYMBOL).isEmpty()) {
            appSettingRepository.save(new AppSetting(KEY_CURRENCY_SYMBOL, DEFAULT_CURRENCY_SYMBOL));
        }
        if (appSettingRepository.findBySettingKey(KEY_MARKETPLACE_NAME).isEmpty()) {
            appSettingRepository.save(new AppSetting(KEY_MARKETPLACE_NAME, DEFAULT_MARKETPLACE_NAME));
        }
    }
}
