package com.e2eq.lexikon.graph.resource;

import com.e2eq.lexikon.graph.backend.BackendDecision;
import com.e2eq.lexikon.graph.backend.MigrationReport;
import com.e2eq.lexikon.graph.core.InferenceSettings;
import com.e2eq.lexikon.graph.core.ReinferenceCheckpoint;
import com.e2eq.lexikon.graph.resource.models.ReinferenceRequest;
import com.e2eq.lexikon.graph.runtime.GraphBackendService;
import com.e2eq.lexikon.graph.runtime.ReinferenceRunner;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@Path("/graph")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "graph-admin", description = "Backend selection, replica migration and bulk re-inference")
public class GraphAdminResource {

    @Inject
    GraphBackendService backendService;

    @Inject
    ReinferenceRunner reinference;

    @Inject
    InferenceSettings settings;

    @GET
    @Path("/backend")
    @Operation(summary = "Current backend decision")
    public BackendDecision backend() {
        return backendService.current();
    }

    @POST
    @Path("/backend/evaluate")
    @Operation(summary = "Re-evaluate the backend",
            description = "Counts relations and, above the edge threshold, benchmarks neighborhood reads on both backends.")
    public BackendDecision evaluate() {
        return backendService.evaluate();
    }

    @POST
    @Path("/migrations")
    @Operation(summary = "Copy the primary store into the graph replica",
            description = "Pass the lastId of an interrupted migration as afterId to resume it.")
    public MigrationReport migrate(@QueryParam("afterId") String afterId) {
        return backendService.migrate(afterId == null || afterId.isBlank() ? null : afterId);
    }

    @POST
    @Path("/rollback")
    @Operation(summary = "Roll back to the relational backend",
            description = "Switches reads to the primary store and imports graph replica rows it does not hold. "
                    + "Pass the lastId of an interrupted rollback as afterId to resume it.")
    public MigrationReport rollback(@QueryParam("afterId") String afterId) {
        return backendService.rollback(afterId == null || afterId.isBlank() ? null : afterId);
    }

    @POST
    @Path("/reinference")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Start a bulk re-inference job")
    public Response startReinference(ReinferenceRequest request) {
        ReinferenceRequest r = request != null ? request : new ReinferenceRequest();
        int depth = r.getMaxDepth() != null ? r.getMaxDepth() : settings.defaultMaxDepth();
        ReinferenceCheckpoint cp = reinference.submit(InferenceResource.parseRules(r.getRules()), depth);
        return Response.accepted(cp).build();
    }

    @GET
    @Path("/reinference/{jobId}")
    @Operation(summary = "Progress of a bulk re-inference job")
    public ReinferenceCheckpoint reinferenceStatus(@PathParam("jobId") String jobId) {
        return reinference.status(jobId);
    }

    @POST
    @Path("/reinference/{jobId}/resume")
    @Operation(summary = "Resume a failed bulk re-inference job after its last completed term")
    public Response resumeReinference(@PathParam("jobId") String jobId) {
        return Response.accepted(reinference.resume(jobId)).build();
    }
}
