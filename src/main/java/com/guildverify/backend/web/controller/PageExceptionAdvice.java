package com.guildverify.backend.web.controller;

import com.guildverify.backend.common.web.RequestLogContextFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.ModelAndView;

@Slf4j
@ControllerAdvice(basePackages = "com.guildverify.backend.web")
public class PageExceptionAdvice {

    @ExceptionHandler(ResponseStatusException.class)
    public ModelAndView handleStatus(ResponseStatusException e) {
        HttpStatusCode status = e.getStatusCode();
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            return page("404", HttpStatus.NOT_FOUND, e.getReason());
        }
        return page("error", status, e.getReason());
    }

    // a malformed user id in the path is just another unknown session
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ModelAndView handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return page("404", HttpStatus.NOT_FOUND, null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ModelAndView handleMissingParam(MissingServletRequestParameterException e) {
        return page("error", HttpStatus.BAD_REQUEST, "Missing form field " + e.getParameterName());
    }

    @ExceptionHandler(Exception.class)
    public ModelAndView handleUnknown(Exception ex, HttpServletRequest req) {
        String rid = RequestLogContextFilter.requestId(req);
        log.error("RID={} {} {} failed", rid, req.getMethod(), req.getRequestURI(), ex);
        return page("error", HttpStatus.INTERNAL_SERVER_ERROR, "Something went wrong (request " + rid + ")");
    }

    private static ModelAndView page(String view, HttpStatusCode status, String message) {
        ModelAndView mav = new ModelAndView(view);
        mav.setStatus(status);
        mav.addObject("message", message);
        return mav;
    }
}
