package com.zenith.backend.service.ai;

/**
 * Why a call to the AI gateway, or the worker running it, did not produce a usable reply.
 */
public enum RemoteFailure {
    NOT_CONFIGURED,
    HTTP_ERROR,
    TRANSPORT,
    MALFORMED_RESPONSE,
    CIRCUIT_OPEN,
    SESSION_UNAVAILABLE,
    TIMEOUT,
    REJECTED
}
