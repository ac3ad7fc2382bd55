package com.idgate.auth;

/**
 * Why a token was not accepted. Reported through logs and metrics only; the public
 * {@code authenticate} contract collapses every reason into an empty result.
 */
public enum RejectionReason {

    /** Token was null or empty. */
    MISSING_TOKEN,

    /** Token did not have three segments or a segment could not be decoded. */
    MALFORMED_TOKEN,

    /** A standard, header or caller-supplied claim check failed. */
    CLAIM_VALIDATION_FAILED,

    /** No provider key matches the token's {@code kid}, or the key set was unavailable. */
    KEY_NOT_FOUND,

    /** The signature does not match the signing input. */
    SIGNATURE_INVALID,

    /** The provider key could not be turned into an RSA public key. */
    KEY_IMPORT_FAILED,

    /** An unexpected failure inside the verification pipeline. */
    INTERNAL_ERROR
}
