package com.codeheadsystems.lockbox.server.mapper;

import com.codeheadsystems.lockbox.model.ErrorDetail;
import com.codeheadsystems.lockbox.server.exceptions.RateLimitExceededException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps {@link RateLimitExceededException} to 429 with a {@code Retry-After} header and the
 * wait repeated in the detail.
 */
@Provider
public class RateLimitExceededExceptionMapper implements ExceptionMapper<RateLimitExceededException> {

  @Override
  public Response toResponse(final RateLimitExceededException exception) {
    return Response.status(Response.Status.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, exception.retryAfterSeconds())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorDetail(exception.getMessage()))
        .build();
  }
}
