package com.jasmin.threatguard.engine;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.ddos.ConnectionTracker;
import com.jasmin.threatguard.extractors.ExtractUtils;
import com.jasmin.threatguard.extractors.JsonUtils;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.services.DecisionCounterService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Puts every request through the {@link AdmissionPipeline}. A verdict is written as the JSON response and the
 * handler is never reached; admitted requests carry the informational rate-limit headers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
@Slf4j
public class AdmissionFilter extends OncePerRequestFilter {

    private final AdmissionPipeline pipeline;
    private final ExtractUtils extractUtils;
    private final ConnectionTracker connectionTracker;
    private final DecisionCounterService decisionCounters;
    private final PipelineProperties props;
    private final InstantSource clock;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !props.isEnabled() || props.isExcluded(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        if (request.getContentLengthLong() > props.getMaxBodyBytes()) {
            rejectOversized(request, response);
            return;
        }
        CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(request, props.getMaxBodyBytes());
        if (cached.isOversized()) {
            rejectOversized(request, response);
            return;
        }
        SecurityEvent event = buildEvent(cached);
        String ip = event.getIp();

        boolean tracked = track(ip);
        try {
            Optional<DetectionVerdict> verdict = pipeline.evaluate(event);
            decisionCounters.record(event, verdict.orElse(null));
            if (verdict.isPresent()) {
                writeVerdict(response, verdict.get());
                return;
            }
            if (event.getRateLimit() != null) {
                response.setHeader(Constants.RATE_LIMIT_LIMIT_HEADER, String.valueOf(event.getRateLimit()));
                response.setHeader(Constants.RATE_LIMIT_REMAINING_HEADER, String.valueOf(event.getRateLimitRemaining()));
            }
            chain.doFilter(cached, response);
        } finally {
            if (tracked) connectionTracker.closed(ip);
        }
    }

    SecurityEvent buildEvent(CachedBodyHttpServletRequest request) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, new ArrayList<>(Collections.list(request.getHeaders(name))));
        }
        Map<String, List<String>> query = ExtractUtils.parseQuery(request.getQueryString());
        Map<String, String> cookies = new LinkedHashMap<>();
        if (request.getCookies() != null) {
            for (Cookie c : request.getCookies()) cookies.putIfAbsent(c.getName(), c.getValue());
        }
        byte[] body = request.getBody();

        String ip = ExtractUtils.clientAddress(
                extractUtils.getProperty("client-ip", headers, query, cookies, body, request::getAttribute));
        if (ip == null) {
            ip = ExtractUtils.clientAddress(request.getRemoteAddr());
        }

        return SecurityEvent.builder()
                .method(request.getMethod())
                .path(request.getRequestURI())
                .remoteAddr(request.getRemoteAddr())
                .contentType(request.getContentType())
                .headers(headers)
                .queryParams(query)
                .cookies(cookies)
                .body(body)
                .timestamp(clock.instant())
                .ip(ip)
                .userId(extractUtils.getProperty("user-id", headers, query, cookies, body, request::getAttribute))
                .email(extractUtils.getProperty("email", headers, query, cookies, body, request::getAttribute))
                .sessionId(extractUtils.getProperty("session-id", headers, query, cookies, body, request::getAttribute))
                .userAgent(extractUtils.getProperty("user-agent", headers, query, cookies, body, request::getAttribute))
                .country(extractUtils.getProperty("country", headers, query, cookies, body, request::getAttribute))
                .build();
    }

    private void rejectOversized(HttpServletRequest request, HttpServletResponse response) throws IOException {
        String ip = ExtractUtils.clientAddress(request.getRemoteAddr());
        log.warn("Request body too large: ip={} path={} limitBytes={}", ip, request.getRequestURI(), props.getMaxBodyBytes());
        DetectionVerdict verdict = DetectionVerdict.deny(413, Constants.PAYLOAD_TOO_LARGE, "Request body too large");
        decisionCounters.record(SecurityEvent.builder()
                .method(request.getMethod())
                .path(request.getRequestURI())
                .ip(ip)
                .timestamp(clock.instant())
                .build(), verdict);
        writeVerdict(response, verdict);
    }

    private boolean track(String ip) {
        if (ip == null) return false;
        try {
            connectionTracker.opened(ip);
            return true;
        } catch (Exception e) {
            log.error("Failed to track connection: ip={}", ip, e);
            return false;
        }
    }

    private void writeVerdict(HttpServletResponse response, DetectionVerdict verdict) throws IOException {
        response.setStatus(verdict.getStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        if (verdict.getRetryAfter() != null) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(verdict.getRetryAfter()));
        }
        response.getWriter().write(JsonUtils.toJson(verdict));
    }
}
