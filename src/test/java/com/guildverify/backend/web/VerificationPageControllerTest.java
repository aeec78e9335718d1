package com.guildverify.backend.web;

import com.guildverify.backend.mail.MailDispatchException;
import com.guildverify.backend.mail.Mailer;
import com.guildverify.backend.session.model.SessionState;
import com.guildverify.backend.session.repo.VerificationSessionRepository;
import com.guildverify.backend.session.service.VerificationSessionService;
import com.guildverify.backend.testsupport.BaseSpringTest;
import com.guildverify.backend.testsupport.MutableClock;
import com.guildverify.backend.testsupport.TestClockConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.model;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.view;

@SpringBootTest
@AutoConfigureMockMvc
class VerificationPageControllerTest extends BaseSpringTest {

    private static final long USER = 42L;

    @Autowired MockMvc mvc;
    @Autowired VerificationSessionService sessions;
    @Autowired VerificationSessionRepository repo;
    @Autowired MutableClock clock;

    @MockitoBean Mailer mailer;

    private String sid;

    @BeforeEach
    void setUp() {
        repo.deleteAll();
        clock.set(TestClockConfiguration.T0);
        sid = sessions.createOrGet(USER, 7L, "alice");
    }

    @Test
    void index_renders() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("index"));
    }

    @Test
    void start_page_for_unknown_session_is_404() throws Exception {
        mvc.perform(get("/start/{u}/{s}", USER, "wrong-" + sid))
                .andExpect(status().isNotFound())
                .andExpect(view().name("404"));
        mvc.perform(get("/start/{u}/{s}", 999L, sid))
                .andExpect(status().isNotFound());
        mvc.perform(get("/start/{u}/{s}", "not-a-number", sid))
                .andExpect(status().isNotFound());
    }

    @Test
    void start_page_renders_form_with_domain() throws Exception {
        mvc.perform(get("/start/{u}/{s}", USER, sid))
                .andExpect(status().isOk())
                .andExpect(view().name("start"))
                .andExpect(model().attribute("allowedDomain", "uwaterloo.ca"))
                .andExpect(model().attribute("action", "/start/" + USER + "/" + sid));
    }

    @Test
    void submitting_an_allowed_email_sends_code_and_redirects_to_verify() throws Exception {
        String code = repo.findById(USER).orElseThrow().getVerificationCode();

        mvc.perform(post("/start/{u}/{s}", USER, sid).param("email", "alice@uwaterloo.ca").with(csrf()))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/verify/" + USER + "/" + sid));

        verify(mailer).send("alice@uwaterloo.ca", code, "alice");
        assertThat(repo.findById(USER).orElseThrow().getState()).isEqualTo(SessionState.AWAITING_CODE);
    }

    @Test
    void email_outside_the_domain_is_refused_without_mailing() throws Exception {
        mvc.perform(post("/start/{u}/{s}", USER, sid).param("email", "alice@gmail.com").with(csrf()))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/start/" + USER + "/" + sid + "?error=domain"));

        verify(mailer, never()).send(anyString(), anyString(), anyString());
        assertThat(repo.findById(USER).orElseThrow().getState()).isEqualTo(SessionState.AWAITING_START);
    }

    @Test
    void mail_failure_leaves_session_awaiting_start() throws Exception {
        doThrow(new MailDispatchException("down", null)).when(mailer).send(anyString(), anyString(), anyString());

        mvc.perform(post("/start/{u}/{s}", USER, sid).param("email", "alice@uwaterloo.ca").with(csrf()))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/start/" + USER + "/" + sid + "?error=mail"));

        assertThat(repo.findById(USER).orElseThrow().getState()).isEqualTo(SessionState.AWAITING_START);
    }

    @Test
    void start_is_not_repeatable_once_email_was_sent() throws Exception {
        sessions.markEmailSent(USER, sid);

        mvc.perform(get("/start/{u}/{s}", USER, sid))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/verify/" + USER + "/" + sid));
        mvc.perform(post("/start/{u}/{s}", USER, sid).param("email", "alice@uwaterloo.ca").with(csrf()))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/verify/" + USER + "/" + sid));

        verify(mailer, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    void post_without_csrf_token_is_forbidden() throws Exception {
        mvc.perform(post("/start/{u}/{s}", USER, sid).param("email", "alice@uwaterloo.ca"))
                .andExpect(status().isForbidden());
    }

    @Test
    void verify_page_is_usable_while_still_awaiting_start() throws Exception {
        String code = repo.findById(USER).orElseThrow().getVerificationCode();

        mvc.perform(get("/verify/{u}/{s}", USER, sid))
                .andExpect(status().isOk())
                .andExpect(view().name("verify"))
                .andExpect(model().attribute("remainingAttempts", 5));

        mvc.perform(post("/verify/{u}/{s}", USER, sid).param("code", code).with(csrf()))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/success"));
        assertThat(repo.findById(USER).orElseThrow().getState()).isEqualTo(SessionState.VERIFIED);
    }

    @Test
    void wrong_code_returns_to_verify_with_one_attempt_less() throws Exception {
        sessions.markEmailSent(USER, sid);

        mvc.perform(post("/verify/{u}/{s}", USER, sid).param("code", wrongCode()).with(csrf()))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/verify/" + USER + "/" + sid + "?error=code"));

        mvc.perform(get("/verify/{u}/{s}", USER, sid).param("error", "code"))
                .andExpect(status().isOk())
                .andExpect(view().name("verify"))
                .andExpect(model().attribute("remainingAttempts", 4))
                .andExpect(model().attribute("error", "code"));
    }

    @Test
    void correct_code_redirects_to_success() throws Exception {
        sessions.markEmailSent(USER, sid);
        String code = repo.findById(USER).orElseThrow().getVerificationCode();

        mvc.perform(post("/verify/{u}/{s}", USER, sid).param("code", " " + code + " ").with(csrf()))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/success"));

        mvc.perform(get("/success"))
                .andExpect(status().isOk())
                .andExpect(view().name("passed_verification"));
        mvc.perform(get("/verify/{u}/{s}", USER, sid))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/success"));
    }

    @Test
    void fifth_wrong_code_redirects_to_failure() throws Exception {
        sessions.markEmailSent(USER, sid);
        String wrong = wrongCode();
        for (int i = 0; i < 4; i++) {
            mvc.perform(post("/verify/{u}/{s}", USER, sid).param("code", wrong).with(csrf()))
                    .andExpect(redirectedUrl("/verify/" + USER + "/" + sid + "?error=code"));
        }

        mvc.perform(post("/verify/{u}/{s}", USER, sid).param("code", wrong).with(csrf()))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/failure"));

        mvc.perform(get("/failure"))
                .andExpect(status().isOk())
                .andExpect(view().name("failed_verification"));
        mvc.perform(get("/start/{u}/{s}", USER, sid))
                .andExpect(redirectedUrl("/failure"));
    }

    @Test
    void verify_post_for_unknown_session_is_404() throws Exception {
        mvc.perform(post("/verify/{u}/{s}", USER, "wrong-" + sid).param("code", "123456").with(csrf()))
                .andExpect(status().isNotFound())
                .andExpect(view().name("404"));
    }

    @Test
    void expired_session_link_is_404() throws Exception {
        clock.advance(java.time.Duration.ofHours(1).plusSeconds(1));
        sessions.collectGarbage();

        mvc.perform(get("/start/{u}/{s}", USER, sid))
                .andExpect(status().isNotFound());
    }

    @Test
    void missing_form_field_is_400() throws Exception {
        mvc.perform(post("/verify/{u}/{s}", USER, sid).with(csrf()))
                .andExpect(status().isBadRequest())
                .andExpect(view().name("error"));
    }

    @Test
    void responses_carry_a_request_id() throws Exception {
        mvc.perform(get("/"))
                .andExpect(result -> assertThat(result.getResponse().getHeader("X-Request-Id")).isNotBlank());
    }

    private String wrongCode() {
        String code = repo.findById(USER).orElseThrow().getVerificationCode();
        return code.equals("100000") ? "100001" : "100000";
    }
}
