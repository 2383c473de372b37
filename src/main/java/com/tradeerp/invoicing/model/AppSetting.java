package com.tradeerp.invoicing.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Runtime override of a {@code tradeerp.*} property, keyed by a dotted setting name.
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

    @Column(nullable = false, length = 255)
    private String settingValue;

    private String updatedBy;
    private LocalDateTime updatedAt;

    public AppSetting() {
    }

    public AppSetting(String settingKey, String settingValue, String updatedBy, LocalDateTime updatedAt) {
        this.settingKey = settingKey;
        this.settingValue = settingValue;
        this.updatedBy = updatedBy;
        this.updatedAt = updatedAt;
    }
}
