package com.stablecore.error;

import org.springframework.http.HttpStatus;

/**
 * Failure categories surfaced by the core. Each maps to one HTTP status at the API edge.
 */
public enum ErrorCode {
    STALE_PRICE(HttpStatus.SERVICE_UNAVAILABLE),
    UNKNOWN_ASSET(HttpStatus.NOT_FOUND),
    ASSET_DISABLED(HttpStatus.CONFLICT),
    SLIPPAGE_EXCEEDED(HttpStatus.CONFLICT),
    BELOW_MINIMUM_EXCHANGE(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_BALANCE(HttpStatus.CONFLICT),
    INSUFFICIENT_COLLATERAL(HttpStatus.CONFLICT),
    NOT_LIQUIDATABLE(HttpStatus.CONFLICT),
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    INVALID_CONFIGURATION(HttpStatus.BAD_REQUEST),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    EXTERNAL_CALL_FAILED(HttpStatus.BAD_GATEWAY);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
