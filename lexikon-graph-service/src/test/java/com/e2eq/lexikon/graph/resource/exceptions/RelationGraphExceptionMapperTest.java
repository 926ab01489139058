package com.e2eq.lexikon.graph.resource.exceptions;

import com.e2eq.lexikon.graph.exceptions.*;
import com.e2eq.lexikon.graph.resource.models.RestError;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class RelationGraphExceptionMapperTest {

    private final RelationGraphExceptionMapper mapper = new RelationGraphExceptionMapper();

    private RestError body(RelationGraphException e, int expectedStatus) {
        Response response = mapper.toResponse(e);
        assertEquals(expectedStatus, response.getStatus());
        return (RestError) response.getEntity();
    }

    @Test
    public void errorCodesMapToStatuses() {
        assertEquals(400, body(InvalidRelationTypeException.unknown("likes"), 400).getStatus());
        assertEquals("NOT_FOUND", body(new RelationNotFoundException("r1"), 404).getReasonCode());
        assertEquals("UNKNOWN_TERM", body(new UnknownTermException("Cat"), 404).getReasonCode());
        assertEquals("ALREADY_RESOLVED", body(new AlreadyResolvedException("r1"), 409).getReasonCode());
        assertEquals("CANCELLED", body(new InferenceCancelledException("Cat", 2), 409).getReasonCode());
        assertEquals("STORE_UNAVAILABLE", body(new StoreUnavailableException("down"), 503).getReasonCode());
    }

    @Test
    public void bodyCarriesMessageAndTrace() {
        RestError error = body(new RelationNotFoundException("r42"), 404);

        assertTrue(error.getStatusMessage().contains("r42"));
        assertNotNull(error.getReasonMessage());
        assertTrue(error.getDebugMessage().contains("RelationNotFoundException"));
    }

    @Test
    public void everyCodeHasAStatus() {
        for (RelationGraphException.ErrorCode code : RelationGraphException.ErrorCode.values()) {
            assertNotNull(RelationGraphExceptionMapper.statusOf(code));
        }
    }

    @Test
    public void genericClientErrors() {
        assertEquals(400, new IllegalArgumentExceptionMapper()
                .toResponse(new IllegalArgumentException("bad")).getStatus());
        assertEquals(404, new NoSuchElementExceptionMapper()
                .toResponse(new NoSuchElementException("Unknown re-inference job x")).getStatus());
    }
}
