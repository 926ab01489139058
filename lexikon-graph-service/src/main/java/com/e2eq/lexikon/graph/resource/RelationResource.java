package com.e2eq.lexikon.graph.resource;

import com.e2eq.lexikon.graph.core.*;
import com.e2eq.lexikon.graph.resource.models.CreateRelationRequest;
import com.e2eq.lexikon.graph.resource.models.CreateRelationResponse;
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
import java.util.Locale;

@Path("/relations")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "relations", description = "Asserted relations and the confirmed relation graph")
public class RelationResource {

    @Inject
    RelationService relationService;

    @POST
    @Operation(summary = "Assert a relation",
            description = "Creates a confirmed relation, or merges it into the existing relation with the same key.")
    @APIResponses({
            @APIResponse(responseCode = "201", description = "Relation created"),
            @APIResponse(responseCode = "200", description = "Merged into an existing relation"),
            @APIResponse(responseCode = "400", description = "Unknown type, confidence out of range or self-loop"),
            @APIResponse(responseCode = "404", description = "Unknown term")
    })
    public Response create(CreateRelationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("A relation body is required");
        }
        PutResult result = relationService.createRelation(request.getSourceId(), request.getTargetId(),
                request.getRelationType(), request.getConfidence(), request.getCreatedBy(), request.getMetadata());
        CreateRelationResponse body = CreateRelationResponse.builder()
                .id(result.id())
                .outcome(result.outcome())
                .relation(relationService.getRelation(result.id()))
                .build();
        return Response.status(result.isCreated() ? Response.Status.CREATED : Response.Status.OK)
                .entity(body).build();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get a relation by id")
    public Relation get(@PathParam("id") String id) {
        return relationService.getRelation(id);
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete a relation",
            description = "Deletes the relation and re-derives or retracts every inferred relation that depended on it.")
    public InvalidationReport delete(@PathParam("id") String id) {
        return relationService.deleteRelation(id);
    }

    @GET
    @Path("/terms/{termId}")
    @Operation(summary = "Confirmed relations of a term")
    public List<Relation> relations(@PathParam("termId") String termId,
                                    @QueryParam("direction") @DefaultValue("BOTH") String direction,
                                    @QueryParam("type") String type) {
        Direction d = Direction.valueOf(direction.trim().toUpperCase(Locale.ROOT));
        return relationService.getRelations(termId, d, type == null || type.isBlank() ? null : type);
    }

    @GET
    @Path("/terms/{termId}/neighborhood")
    @Operation(summary = "Confirmed relations within a number of hops of a term")
    public List<Relation> neighborhood(@PathParam("termId") String termId,
                                       @QueryParam("depth") @DefaultValue("1") int depth) {
        return relationService.neighborhood(termId, depth);
    }
}
