package com.guildverify.backend.web;

import com.guildverify.backend.web.config.WebProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class EmailDomainPolicy {

    private final String requiredSuffix;

    public EmailDomainPolicy(WebProperties props) {
        String domain = props.getAllowedEmailDomain().trim().toLowerCase(Locale.ROOT);
        this.requiredSuffix = domain.startsWith("@") ? domain : "@" + domain;
    }

    /** Requires a non-empty local part and the configured domain after the {@code @}. */
    public boolean isAllowed(String email) {
        if (email == null) return false;
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        return normalized.length() > requiredSuffix.length()
                && normalized.endsWith(requiredSuffix)
                && normalized.indexOf('@') == normalized.length() - requiredSuffix.length();
    }
}
