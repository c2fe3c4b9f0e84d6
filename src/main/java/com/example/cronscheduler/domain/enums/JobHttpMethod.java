package com.example.cronscheduler.domain.enums;

import org.springframework.http.HttpMethod;

/**
 * HTTP methods a job may use for its callback.
 */
public enum JobHttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    /**
     * Whether a request payload is sent with this method
     */
    public boolean supportsBody() {
        return this == POST || this == PUT || this == PATCH;
    }

    public HttpMethod toHttpMethod() {
        return HttpMethod.valueOf(name());
    }
}
