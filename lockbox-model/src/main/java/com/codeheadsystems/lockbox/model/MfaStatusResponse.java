package com.codeheadsystems.lockbox.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code GET /mfa/status/{username}} response
 *
 * @param mfaEnabled whether the account has a confirmed second factor
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MfaStatusResponse(@JsonProperty("mfa_enabled") boolean mfaEnabled) {
}
