package com.e2eq.lexikon.graph.resource;

import com.e2eq.lexikon.graph.core.Relation;
import com.e2eq.lexikon.graph.core.ReviewQueue;
import com.e2eq.lexikon.graph.resource.models.ReviewResolutionRequest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;
import java.util.Optional;

@Path("/review")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "review", description = "Human review of inferred relations")
public class ReviewResource {

    @Inject
    ReviewQueue reviewQueue;

    @GET
    @Path("/pending")
    @Operation(summary = "Provisional relations awaiting review")
    public List<Relation> pending(@QueryParam("limit") @DefaultValue("50") int limit) {
        return reviewQueue.getPending(limit);
    }

    @POST
    @Path("/{id}/resolve")
    @Operation(summary = "Approve or reject a provisional relation")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Approved; the confirmed relation is returned"),
            @APIResponse(responseCode = "204", description = "Rejected; the relation was deleted"),
            @APIResponse(responseCode = "409", description = "The relation is already confirmed")
    })
    public Response resolve(@PathParam("id") String id, ReviewResolutionRequest request) {
        if (request == null || request.getDecision() == null) {
            throw new IllegalArgumentException("decision is required");
        }
        Optional<Relation> approved = reviewQueue.resolve(id, request.getDecision(), request.getConfidence());
        return approved.map(r -> Response.ok(r).build())
                .orElseGet(() -> Response.noContent().build());
    }
}
