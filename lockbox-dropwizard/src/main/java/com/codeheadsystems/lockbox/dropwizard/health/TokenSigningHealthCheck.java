package com.codeheadsystems.lockbox.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.lockbox.server.auth.TokenManager;
import com.codeheadsystems.lockbox.server.auth.TokenStage;

/**
 * Health check that issues, verifies and revokes a throwaway token, exercising the signing secret
 * and the session store.
 */
public class TokenSigningHealthCheck extends HealthCheck {

  private static final String HEALTH_USER = "__health__";

  private final TokenManager tokenManager;

  public TokenSigningHealthCheck(TokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  protected Result check() {
    String token = tokenManager.issueToken(HEALTH_USER, TokenStage.PASSWORD);
    return tokenManager.verify(token)
        .map(result -> {
          tokenManager.revoke(result.jti());
          return Result.healthy("token round trip ok");
        })
        .orElseGet(() -> Result.unhealthy("Issued token did not verify"));
  }
}
