package com.jasmin.threatguard.controllers;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.controllers.dto.ApiErrorResponse;
import com.jasmin.threatguard.extractors.JsonUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Admits operator API calls only for an authenticated admin. Identity and role are read from the request
 * attributes of the authentication layer; headers are never trusted. The admitted user id is exposed as the
 * {@link Constants#OPERATOR_ATTRIBUTE} attribute for audit trails.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OperatorAccessInterceptor implements HandlerInterceptor {

    private final OperatorProperties props;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        String userId = attribute(request, props.getUserAttribute());
        if (userId == null) {
            log.warn("Operator API call without authentication: path={} remoteAddr={}",
                    request.getRequestURI(), request.getRemoteAddr());
            deny(response, HttpStatus.UNAUTHORIZED, "Authentication required", "UNAUTHENTICATED");
            return false;
        }
        String role = attribute(request, props.getRoleAttribute());
        if (role == null || !props.getAdminRoles().contains(role.toLowerCase(Locale.ROOT))) {
            log.warn("Operator API call without admin role: userId={} role={} path={}", userId, role, request.getRequestURI());
            deny(response, HttpStatus.FORBIDDEN, "Admin role required", "FORBIDDEN");
            return false;
        }
        request.setAttribute(Constants.OPERATOR_ATTRIBUTE, userId);
        return true;
    }

    private static String attribute(HttpServletRequest request, String name) {
        Object value = request.getAttribute(name);
        if (value == null) return null;
        String s = value.toString();
        return s.isBlank() ? null : s;
    }

    private static void deny(HttpServletResponse response, HttpStatus status, String error, String code) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(JsonUtils.toJson(new ApiErrorResponse(error, code)));
    }
}
