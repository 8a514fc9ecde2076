package com.myancamp.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

public final class ClientAddressResolver {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private ClientAddressResolver() {
    }

    /**
     * First hop of {@code X-Forwarded-For} when present, otherwise the socket address.
     */
    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (StringUtils.hasText(forwarded)) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return request.getRemoteAddr();
    }

    public static String userAgent(HttpServletRequest request) {
        return request.getHeader(HttpHeaders.USER_AGENT);
    }
}
