package com.stablecore.web3.exception;

import lombok.Getter;

/**
 * Marker exception: the oracle read failed in a way another RPC endpoint may not.
 * Carries the endpoint that produced it so the failover loop can penalize it.
 */
@Getter
public class RetryableRpcException extends RuntimeException {
    private final String endpoint;

    public RetryableRpcException(String endpoint, String message) {
        super(message);
        this.endpoint = endpoint;
    }

    public RetryableRpcException(String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }
}
