package com.guildverify.backend.web;

import com.guildverify.backend.session.service.VerificationSessionService;
import com.guildverify.backend.web.config.WebProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.session.testing-session", name = "enabled", havingValue = "true")
public class TestingSessionSeeder implements ApplicationRunner {

    private final VerificationSessionService sessions;
    private final WebProperties webProps;

    @Override
    public void run(ApplicationArguments args) {
        String secondaryId = sessions.createTestingSession();
        log.info("testing session ready: {}/start/{}/{}",
                webProps.getBaseUrl(), VerificationSessionService.TESTING_USER_ID, secondaryId);
    }
}
