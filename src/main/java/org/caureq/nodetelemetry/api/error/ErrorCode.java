package org.caureq.nodetelemetry.api.error;

public enum ErrorCode {
    BAD_REQUEST, AUTH_REQUIRED, FORBIDDEN, STORE_UNAVAILABLE, INTERNAL_ERROR
}
