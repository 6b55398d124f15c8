package com.codeheadsystems.lockbox.server.auth;

/**
 * How far a bearer token's holder got through login.
 */
public enum TokenStage {
  /**
   * Verifier accepted, second factor still outstanding. Only good for logout.
   */
  PASSWORD,
  /**
   * Fully authenticated.
   */
  FULL
}
