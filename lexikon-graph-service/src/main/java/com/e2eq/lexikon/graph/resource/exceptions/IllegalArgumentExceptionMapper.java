package com.e2eq.lexikon.graph.resource.exceptions;

import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class IllegalArgumentExceptionMapper implements ExceptionMapper<IllegalArgumentException> {
    @Override
    public Response toResponse(IllegalArgumentException exception) {
        Log.debugf("Bad request: %s", exception.getMessage());
        return ErrorResponses.of(Response.Status.BAD_REQUEST, "BAD_REQUEST",
                String.format("Bad request: %s", exception.getMessage()), exception);
    }
}
