package com.guildverify.backend.bot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.role-sync")
public class RoleSyncProperties {

    private boolean enabled = false;

    /** Pause between two sweeps. */
    private long checkIntervalSeconds = 60;

    /** Audit log reason attached to each grant. */
    private String grantReason = "Verification Bot";
}
