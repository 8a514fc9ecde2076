package com.myancamp.backend.modules.auth.presentation;

import com.myancamp.backend.global.web.ClientAddressResolver;
import com.myancamp.backend.modules.auth.application.RequestMetadata;

import jakarta.servlet.http.HttpServletRequest;

final class RequestMetadataResolver {

    private RequestMetadataResolver() {
    }

    static RequestMetadata from(HttpServletRequest request) {
        return new RequestMetadata(ClientAddressResolver.resolve(request), ClientAddressResolver.userAgent(request));
    }
}
