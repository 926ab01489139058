package com.e2eq.lexikon.graph.resource.exceptions;

import com.e2eq.lexikon.graph.resource.models.RestError;
import jakarta.ws.rs.core.Response;

import java.io.PrintWriter;
import java.io.StringWriter;

final class ErrorResponses {
    private ErrorResponses() {}

    static Response of(Response.Status status, String reasonCode, String reasonMessage, Throwable exception) {
        RestError error = RestError.builder()
                .status(status.getStatusCode())
                .reasonCode(reasonCode)
                .statusMessage(exception.getMessage())
                .reasonMessage(reasonMessage)
                .debugMessage(stackTrace(exception))
                .build();
        return Response.status(status).entity(error).build();
    }

    static String stackTrace(Throwable exception) {
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
