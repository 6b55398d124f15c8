package com.codeheadsystems.lockbox.server.resource;

import com.codeheadsystems.lockbox.model.VaultEnvelope;
import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import com.codeheadsystems.lockbox.server.manager.VaultStorageManager;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code GET /vault} and {@code POST /vault}. Both need a full token.
 */
@Singleton
@Path("/vault")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class VaultResource {

  private static final Logger log = LoggerFactory.getLogger(VaultResource.class);

  private final VaultStorageManager vaultStorageManager;

  @Inject
  public VaultResource(final VaultStorageManager vaultStorageManager) {
    this.vaultStorageManager = vaultStorageManager;
    log.info("VaultResource({})", vaultStorageManager);
  }

  @GET
  public VaultEnvelope fetch(@Auth final LockboxPrincipal principal) {
    return vaultStorageManager.fetch(principal);
  }

  @POST
  public Response store(@Auth final LockboxPrincipal principal, final VaultEnvelope envelope) {
    vaultStorageManager.store(principal, envelope);
    return Response.ok().build();
  }
}
