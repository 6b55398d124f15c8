package com.codeheadsystems.lockbox.dropwizard.auth;

import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import io.dropwizard.auth.AuthFilter;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.SecurityContext;

/**
 * Reads the token from the {@code Authorization} header. Clients send the bare token; a
 * {@code Bearer} scheme is accepted as well.
 */
@Priority(Priorities.AUTHENTICATION)
public class TokenAuthFilter extends AuthFilter<String, LockboxPrincipal> {

  private static final String BEARER = "Bearer ";

  private TokenAuthFilter() {
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    String credentials = credentials(requestContext.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
    if (!authenticate(requestContext, credentials, SecurityContext.BASIC_AUTH)) {
      throw new WebApplicationException(unauthorizedHandler.buildResponse(prefix, realm));
    }
  }

  /**
   * The token in an {@code Authorization} header value.
   *
   * @param header the header value, may be null
   * @return the token, or null if there is none
   */
  static String credentials(String header) {
    if (header == null) {
      return null;
    }
    String value = header.trim();
    if (value.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
      value = value.substring(BEARER.length()).trim();
    }
    return value.isEmpty() ? null : value;
  }

  /**
   * Builder for {@link TokenAuthFilter}.
   */
  public static class Builder extends AuthFilterBuilder<String, LockboxPrincipal, TokenAuthFilter> {

    @Override
    protected TokenAuthFilter newInstance() {
      return new TokenAuthFilter();
    }
  }
}
