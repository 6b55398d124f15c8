package com.codeheadsystems.lockbox.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the lockbox remote authority.
 * <p>
 * For production, supply {@code tokenSecretHex} (a hex-encoded random value of at least 32
 * bytes) so that issued tokens survive restarts. Omitting it causes a random secret to be
 * generated on each startup (dev/test only).
 * <p>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class LockboxConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for bearer tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String tokenSecretHex = "";

  /**
   * Token issuer claim.
   */
  @NotEmpty
  private String tokenIssuer = "lockbox";

  /**
   * Token time-to-live in seconds.
   */
  @Min(1)
  private long tokenTtlSeconds = 3600;

  /**
   * Failed logins (or second-factor codes) allowed per username within the window.
   */
  @Min(1)
  private int maxFailedAttempts = 5;

  /**
   * Window over which failures are counted, in seconds.
   */
  @Min(1)
  private long attemptWindowSeconds = 60;

  /**
   * How long a username stays locked out once the limit is reached, in seconds.
   */
  @Min(1)
  private long lockoutSeconds = 60;

  /**
   * Issuer shown by authenticator apps for enrolled second factors.
   */
  @NotEmpty
  private String totpIssuer = "Lockbox";

  @JsonProperty
  public String getTokenSecretHex() {
    return tokenSecretHex;
  }

  @JsonProperty
  public void setTokenSecretHex(String tokenSecretHex) {
    this.tokenSecretHex = tokenSecretHex;
  }

  @JsonProperty
  public String getTokenIssuer() {
    return tokenIssuer;
  }

  @JsonProperty
  public void setTokenIssuer(String tokenIssuer) {
    this.tokenIssuer = tokenIssuer;
  }

  @JsonProperty
  public long getTokenTtlSeconds() {
    return tokenTtlSeconds;
  }

  @JsonProperty
  public void setTokenTtlSeconds(long tokenTtlSeconds) {
    this.tokenTtlSeconds = tokenTtlSeconds;
  }

  @JsonProperty
  public int getMaxFailedAttempts() {
    return maxFailedAttempts;
  }

  @JsonProperty
  public void setMaxFailedAttempts(int maxFailedAttempts) {
    this.maxFailedAttempts = maxFailedAttempts;
  }

  @JsonProperty
  public long getAttemptWindowSeconds() {
    return attemptWindowSeconds;
  }

  @JsonProperty
  public void setAttemptWindowSeconds(long attemptWindowSeconds) {
    this.attemptWindowSeconds = attemptWindowSeconds;
  }

  @JsonProperty
  public long getLockoutSeconds() {
    return lockoutSeconds;
  }

  @JsonProperty
  public void setLockoutSeconds(long lockoutSeconds) {
    this.lockoutSeconds = lockoutSeconds;
  }

  @JsonProperty
  public String getTotpIssuer() {
    return totpIssuer;
  }

  @JsonProperty
  public void setTotpIssuer(String totpIssuer) {
    this.totpIssuer = totpIssuer;
  }
}
