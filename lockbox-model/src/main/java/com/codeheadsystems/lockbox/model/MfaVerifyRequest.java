package com.codeheadsystems.lockbox.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /mfa/verify}
 *
 * @param username the username
 * @param code     the code to check
 */
public record MfaVerifyRequest(
    @JsonProperty("username") String username,
    @JsonProperty("code") String code) {
}
