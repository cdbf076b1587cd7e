package com.hydrokb.embedding;

public enum DegradationReason {
    NO_CREDENTIAL,
    MODEL_NOT_FOUND,
    BACKEND_ERROR,
    EMPTY_RESPONSE,
    /** The backend answered with a vector whose length differs from the provider's dimension. */
    DIMENSION_MISMATCH,
    FALLBACK_ACTIVE
}
