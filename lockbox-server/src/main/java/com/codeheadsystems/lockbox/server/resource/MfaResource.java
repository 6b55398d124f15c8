package com.codeheadsystems.lockbox.server.resource;

import com.codeheadsystems.lockbox.model.MfaSetupResponse;
import com.codeheadsystems.lockbox.model.MfaStatusResponse;
import com.codeheadsystems.lockbox.model.MfaVerifyRequest;
import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import com.codeheadsystems.lockbox.server.manager.MfaManager;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second-factor endpoints under {@code /mfa}.
 */
@Singleton
@Path("/mfa")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class MfaResource {

  private static final Logger log = LoggerFactory.getLogger(MfaResource.class);

  private final MfaManager mfaManager;

  @Inject
  public MfaResource(final MfaManager mfaManager) {
    this.mfaManager = mfaManager;
    log.info("MfaResource({})", mfaManager);
  }

  @GET
  @Path("/status/{username}")
  public MfaStatusResponse status(@PathParam("username") final String username) {
    return new MfaStatusResponse(mfaManager.status(username));
  }

  @POST
  @Path("/setup")
  public MfaSetupResponse setup(@Auth final LockboxPrincipal principal) {
    return mfaManager.setup(principal);
  }

  @POST
  @Path("/verify")
  public Response verify(final MfaVerifyRequest request) {
    AuthResource.requireBody(request);
    mfaManager.verify(request.username(), request.code());
    return Response.ok().build();
  }

  @POST
  @Path("/disable")
  public Response disable(@Auth final LockboxPrincipal principal) {
    mfaManager.disable(principal);
    return Response.ok().build();
  }
}
