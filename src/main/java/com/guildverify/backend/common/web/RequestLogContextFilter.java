package com.guildverify.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ✅ 每個請求的日誌上下文
 * - rid: 請求 id，回寫到 X-Request-Id
 * - uid: /start、/verify 路徑中的 Discord 使用者 id，方便把同一個 session 的日誌串起來
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLogContextFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "rid";
    public static final String MDC_USER_ID = "uid";
    static final String ATTR = RequestLogContextFilter.class.getName() + ".rid";

    private static final Pattern SESSION_PATH = Pattern.compile("^/(?:start|verify)/(\\d{1,20})(?:/.*)?$");
    // 外部帶進來的 id 只接受安全字元，避免污染日誌
    private static final Pattern CLIENT_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = req.getHeader(HEADER);
        if (rid == null || !CLIENT_ID.matcher(rid).matches()) rid = UUID.randomUUID().toString();

        req.setAttribute(ATTR, rid);
        res.setHeader(HEADER, rid);
        MDC.put(MDC_REQUEST_ID, rid);
        String uid = sessionUserId(req.getRequestURI());
        if (uid != null) MDC.put(MDC_USER_ID, uid);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_USER_ID);
        }
    }

    /** Request id of the current request; a fresh one if the filter did not run. */
    public static String requestId(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return (v == null) ? UUID.randomUUID().toString() : String.valueOf(v);
    }

    static String sessionUserId(String path) {
        if (path == null) return null;
        Matcher m = SESSION_PATH.matcher(path);
        return m.matches() ? m.group(1) : null;
    }
}
