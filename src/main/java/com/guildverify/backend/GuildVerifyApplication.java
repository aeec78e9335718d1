package com.guildverify.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class GuildVerifyApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuildVerifyApplication.class, args);
    }

    /**
     * ✅ 排程只給 bot 行程的角色同步用
     * - test profile 關閉，避免 RoleSyncWorker 跟測試搶同一筆 session
     * - web 行程雖然也會載入，但 app.role-sync.enabled=false 時沒有任何 @Scheduled bean
     */
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class RoleSyncSchedulingConfig {
    }
}
