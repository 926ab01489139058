package com.e2eq.lexikon.graph.resource.exceptions;

import com.e2eq.lexikon.graph.exceptions.RelationGraphException;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps every graph failure to an HTTP status by its {@link RelationGraphException.ErrorCode}.
 */
@Provider
public class RelationGraphExceptionMapper implements ExceptionMapper<RelationGraphException> {

    @Override
    public Response toResponse(RelationGraphException exception) {
        Response.Status status = statusOf(exception.getCode());
        if (status == Response.Status.SERVICE_UNAVAILABLE) {
            Log.errorf(exception, "Relation store unavailable: %s", exception.getMessage());
        } else {
            Log.debugf("Request rejected with %s: %s", exception.getCode(), exception.getMessage());
        }
        return ErrorResponses.of(status, exception.getCode().name(), reasonOf(exception.getCode()), exception);
    }

    static Response.Status statusOf(RelationGraphException.ErrorCode code) {
        switch (code) {
            case INVALID_TYPE:
                return Response.Status.BAD_REQUEST;
            case NOT_FOUND:
            case UNKNOWN_TERM:
                return Response.Status.NOT_FOUND;
            case ALREADY_RESOLVED:
            case CANCELLED:
                return Response.Status.CONFLICT;
            case STORE_UNAVAILABLE:
            default:
                return Response.Status.SERVICE_UNAVAILABLE;
        }
    }

    private static String reasonOf(RelationGraphException.ErrorCode code) {
        switch (code) {
            case INVALID_TYPE:
                return "The relation is not valid for its relation type";
            case NOT_FOUND:
                return "No relation exists with the given id";
            case UNKNOWN_TERM:
                return "The term is not known to the term directory";
            case ALREADY_RESOLVED:
                return "The relation has already been reviewed";
            case CANCELLED:
                return "The inference run was cancelled";
            case STORE_UNAVAILABLE:
            default:
                return "The relation store is unavailable, retry later";
        }
    }
}
