package com.guildverify.backend.mail.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.mail")
public class MailSenderProperties {

    /** From header of verification mails. */
    private String from = "no-reply@example.com";
}
