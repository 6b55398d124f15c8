package com.codeheadsystems.lockbox.server.mapper;

import com.codeheadsystems.lockbox.model.ErrorDetail;
import com.codeheadsystems.lockbox.server.exceptions.UsernameTakenException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps {@link UsernameTakenException} to 409.
 */
@Provider
public class UsernameTakenExceptionMapper implements ExceptionMapper<UsernameTakenException> {

  @Override
  public Response toResponse(final UsernameTakenException exception) {
    return Response.status(Response.Status.CONFLICT)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorDetail("Username already registered"))
        .build();
  }
}
