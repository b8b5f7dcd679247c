package com.farmket.marketplace.model;

import jakarta.persistence.*;
import lombok.Data;

/**
 * Key/value setting editable by staff at runtime, e.g. the currency symbol shown next to prices.
 */
@Entity
@Table(name = "app_settings")
@Data
public class AppSetting {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 100)
    private String settingKey;

    @Column(nullable = false)
    private String settingValue;

    public AppSetting() {
    }

    public AppSetting(String settingKey, String settingValue) {
        this.settingKey = settingKey;
        this.settingValue = settingValue;
    }
}
