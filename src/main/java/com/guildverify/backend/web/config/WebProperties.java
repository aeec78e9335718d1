package com.guildverify.backend.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.web")
public class WebProperties {

    /** Only addresses in this domain may receive a code, e.g. {@code uwaterloo.ca}. */
    private String allowedEmailDomain = "uwaterloo.ca";

    /** Public base URL of the web front-end, used when logging the testing session link. */
    private String baseUrl = "http://localhost:8080";
}
