package com.codeheadsystems.lockbox.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successful login.
 * <p>
 * Used by: {@code POST /login} and {@code POST /login/mfa} responses
 *
 * @param token opaque bearer token, sent back verbatim in the {@code Authorization} header
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(@JsonProperty("token") String token) {

  @Override
  public String toString() {
    return "TokenResponse[REDACTED]";
  }
}
