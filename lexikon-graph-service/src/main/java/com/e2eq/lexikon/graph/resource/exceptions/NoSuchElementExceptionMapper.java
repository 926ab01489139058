package com.e2eq.lexikon.graph.resource.exceptions;

import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.NoSuchElementException;

@Provider
public class NoSuchElementExceptionMapper implements ExceptionMapper<NoSuchElementException> {
    @Override
    public Response toResponse(NoSuchElementException exception) {
        Log.debugf("Not found: %s", exception.getMessage());
        return ErrorResponses.of(Response.Status.NOT_FOUND, "NOT_FOUND", exception.getMessage(), exception);
    }
}
