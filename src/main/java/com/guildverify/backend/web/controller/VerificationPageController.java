package com.guildverify.backend.web.controller;

import com.guildverify.backend.mail.MailDispatchException;
import com.guildverify.backend.mail.Mailer;
import com.guildverify.backend.session.model.SessionState;
import com.guildverify.backend.session.model.VerificationSession;
import com.guildverify.backend.session.model.VerifyResult;
import com.guildverify.backend.session.service.VerificationSessionService;
import com.guildverify.backend.web.EmailDomainPolicy;
import com.guildverify.backend.web.config.WebProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.view.RedirectView;

/**
 * Start and verify pages. Every POST answers with a 303 so a refresh never
 * replays a mutation.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class VerificationPageController {

    private final VerificationSessionService sessions;
    private final Mailer mailer;
    private final EmailDomainPolicy domainPolicy;
    private final WebProperties props;

    @GetMapping("/")
    public String index() {
        return "index";
    }

    @GetMapping("/start/{userId}/{secondaryId}")
    public ModelAndView startForm(@PathVariable long userId,
                                  @PathVariable String secondaryId,
                                  @RequestParam(value = "error", required = false) String error) {
        VerificationSession s = requireSession(userId, secondaryId);
        if (s.state() != SessionState.AWAITING_START) {
            return redirectForState(s);
        }
        ModelAndView mav = new ModelAndView("start");
        mav.addObject("action", startPath(s));
        mav.addObject("allowedDomain", props.getAllowedEmailDomain());
        mav.addObject("error", error);
        return mav;
    }

    @PostMapping("/start/{userId}/{secondaryId}")
    public ModelAndView start(@PathVariable long userId,
                              @PathVariable String secondaryId,
                              @RequestParam("email") String email) {
        VerificationSession s = requireSession(userId, secondaryId);
        // an address was already accepted: never mail a second time
        if (s.state() != SessionState.AWAITING_START) {
            return redirectForState(s);
        }
        if (!domainPolicy.isAllowed(email)) {
            return seeOther(startPath(s) + "?error=domain");
        }

        log.info("user {} with id {} submitted an email", s.displayName(), userId);
        try {
            mailer.send(email.trim(), s.verificationCode(), s.displayName());
        } catch (MailDispatchException e) {
            log.warn("mail dispatch failed userId={}", userId, e);
            return seeOther(startPath(s) + "?error=mail");
        }

        // the code is already in the inbox: a failed transition must not block entering it
        try {
            if (!sessions.markEmailSent(userId, secondaryId)) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session expired, start again from Discord");
            }
        } catch (DataAccessException e) {
            log.warn("email sent but state not recorded userId={}", userId, e);
        }
        return seeOther(verifyPath(s));
    }

    @GetMapping("/verify/{userId}/{secondaryId}")
    public ModelAndView verifyForm(@PathVariable long userId,
                                   @PathVariable String secondaryId,
                                   @RequestParam(value = "error", required = false) String error) {
        VerificationSession s = requireSession(userId, secondaryId);
        // AWAITING_START still gets the form: the mail may have gone out before the state was recorded
        if (s.state().isTerminal()) {
            return redirectForState(s);
        }
        ModelAndView mav = new ModelAndView("verify");
        mav.addObject("action", verifyPath(s));
        mav.addObject("remainingAttempts", s.remainingAttempts());
        mav.addObject("error", error);
        return mav;
    }

    @PostMapping("/verify/{userId}/{secondaryId}")
    public ModelAndView verify(@PathVariable long userId,
                               @PathVariable String secondaryId,
                               @RequestParam("code") String code) {
        VerifyResult result = sessions.verify(userId, secondaryId, code.trim());
        return switch (result.status()) {
            case VERIFIED -> seeOther("/success");
            case NOT_FOUND -> throw notFound();
            case ATTEMPTS_REMAINING -> result.isExhausted()
                    ? seeOther("/failure")
                    : seeOther("/verify/" + userId + "/" + secondaryId + "?error=code");
        };
    }

    @GetMapping("/success")
    public String success() {
        return "passed_verification";
    }

    @GetMapping("/failure")
    public String failure() {
        return "failed_verification";
    }

    private VerificationSession requireSession(long userId, String secondaryId) {
        return sessions.lookup(userId, secondaryId).orElseThrow(VerificationPageController::notFound);
    }

    private static ModelAndView redirectForState(VerificationSession s) {
        return switch (s.state()) {
            case AWAITING_START -> seeOther(startPath(s));
            case AWAITING_CODE -> seeOther(verifyPath(s));
            case VERIFIED -> seeOther("/success");
            case FAILED -> seeOther("/failure");
        };
    }

    private static String startPath(VerificationSession s) {
        return "/start/" + s.userId() + "/" + s.secondaryId();
    }

    private static String verifyPath(VerificationSession s) {
        return "/verify/" + s.userId() + "/" + s.secondaryId();
    }

    private static ModelAndView seeOther(String path) {
        RedirectView view = new RedirectView(path, true);
        view.setStatusCode(HttpStatus.SEE_OTHER);
        return new ModelAndView(view);
    }

    private static ResponseStatusException notFound() {
        return new ResponseStatusException(HttpStatus.NOT_FOUND);
    }
}
