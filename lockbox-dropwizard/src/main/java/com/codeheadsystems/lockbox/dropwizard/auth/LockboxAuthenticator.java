package com.codeheadsystems.lockbox.dropwizard.auth;

import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import com.codeheadsystems.lockbox.server.auth.TokenManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates bearer tokens using {@link TokenManager}.
 */
public class LockboxAuthenticator implements Authenticator<String, LockboxPrincipal> {

  private final TokenManager tokenManager;

  /**
   * Instantiates a new Lockbox authenticator.
   *
   * @param tokenManager the token manager
   */
  public LockboxAuthenticator(TokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  public Optional<LockboxPrincipal> authenticate(String token) throws AuthenticationException {
    return tokenManager.verify(token).map(LockboxPrincipal::from);
  }
}
