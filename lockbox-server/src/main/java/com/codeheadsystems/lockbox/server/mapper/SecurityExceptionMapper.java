package com.codeheadsystems.lockbox.server.mapper;

import com.codeheadsystems.lockbox.model.ErrorDetail;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@link SecurityException} to 401. The body never says which check failed.
 */
@Provider
public class SecurityExceptionMapper implements ExceptionMapper<SecurityException> {

  private static final Logger log = LoggerFactory.getLogger(SecurityExceptionMapper.class);

  @Override
  public Response toResponse(final SecurityException exception) {
    log.debug("Unauthorized: {}", exception.getMessage());
    return Response.status(Response.Status.UNAUTHORIZED)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorDetail("Invalid credentials"))
        .build();
  }
}
