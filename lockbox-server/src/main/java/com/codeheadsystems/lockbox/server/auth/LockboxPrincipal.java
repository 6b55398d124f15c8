package com.codeheadsystems.lockbox.server.auth;

import java.security.Principal;

/**
 * Principal representing the holder of a verified bearer token.
 *
 * @param username the account, from the token subject
 * @param jti      token ID, used to revoke the session
 * @param stage    the stage the token grants
 */
public record LockboxPrincipal(String username, String jti, TokenStage stage) implements Principal {

  /**
   * Principal for a verified token.
   *
   * @param result the verify result
   * @return the principal
   */
  public static LockboxPrincipal from(final TokenManager.VerifyResult result) {
    return new LockboxPrincipal(result.username(), result.jti(), result.stage());
  }

  @Override
  public String getName() {
    return username;
  }

  /**
   * Requires a full token. Password-stage tokens only prove the secret of an account that also has
   * a second factor.
   *
   * @return this principal
   * @throws SecurityException for a password-stage token
   */
  public LockboxPrincipal requireFull() {
    if (stage != TokenStage.FULL) {
      throw new SecurityException("Second factor required");
    }
    return this;
  }
}
