package com.adlanda.phoneadvisor.generation;

/**
 * Why a generation attempt produced no answer.
 */
public enum GenerationFailureReason {
    TIMEOUT,
    QUOTA_EXCEEDED,
    TRANSPORT_ERROR,
    EMPTY_RESPONSE,
    INTERRUPTED,
    REJECTED
}
