package com.codeheadsystems.lockbox.server.resource;

import com.codeheadsystems.lockbox.model.AuthSaltResponse;
import com.codeheadsystems.lockbox.model.LoginRequest;
import com.codeheadsystems.lockbox.model.MfaLoginRequest;
import com.codeheadsystems.lockbox.model.RegisterRequest;
import com.codeheadsystems.lockbox.model.TokenResponse;
import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import com.codeheadsystems.lockbox.server.manager.AccountManager;
import io.dropwizard.auth.Auth;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registration, login and logout.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code GET /auth_salt/{username}}: the public auth salt, 404 for unknown accounts</li>
 *   <li>{@code POST /register}: create an account, 409 if the username is taken</li>
 *   <li>{@code POST /login}: verifier login</li>
 *   <li>{@code POST /login/mfa}: verifier plus second-factor login</li>
 *   <li>{@code POST /logout}: revoke the presented token</li>
 * </ul>
 * {@code /logout} takes an {@link Auth} principal, supplied by the bearer-token filter the
 * hosting application registers. Failures surface as exceptions and are translated by the
 * mappers in {@code com.codeheadsystems.lockbox.server.mapper}.
 */
@Singleton
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final AccountManager accountManager;

  @Inject
  public AuthResource(final AccountManager accountManager) {
    this.accountManager = accountManager;
    log.info("AuthResource({})", accountManager);
  }

  @GET
  @Path("auth_salt/{username}")
  public AuthSaltResponse authSalt(@PathParam("username") final String username) {
    return accountManager.authSalt(username)
        .map(AuthSaltResponse::new)
        .orElseThrow(() -> new NotFoundException("Unknown user"));
  }

  @POST
  @Path("register")
  public Response register(final RegisterRequest request, @Context final HttpServletRequest servletRequest) {
    accountManager.register(requireBody(request), servletRequest.getRemoteAddr());
    return Response.status(Response.Status.CREATED).build();
  }

  @POST
  @Path("login")
  public TokenResponse login(final LoginRequest request) {
    return new TokenResponse(accountManager.login(requireBody(request)));
  }

  @POST
  @Path("login/mfa")
  public TokenResponse loginMfa(final MfaLoginRequest request) {
    return new TokenResponse(accountManager.loginWithSecondFactor(requireBody(request)));
  }

  @POST
  @Path("logout")
  public Response logout(@Auth final LockboxPrincipal principal) {
    accountManager.logout(principal);
    return Response.noContent().build();
  }

  static <T> T requireBody(final T body) {
    if (body == null) {
      throw new IllegalArgumentException("Missing request body");
    }
    return body;
  }
}
