package com.e2eq.lexikon.graph.resource;

import com.e2eq.lexikon.graph.core.CandidateRelation;
import com.e2eq.lexikon.graph.core.InferenceOrchestrator;
import com.e2eq.lexikon.graph.core.InferenceRule;
import com.e2eq.lexikon.graph.resource.models.InferenceRequest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.ArrayList;
import java.util.List;

@Path("/inference")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "inference", description = "Rule-based inference of provisional relations")
public class InferenceResource {

    @Inject
    InferenceOrchestrator orchestrator;

    @POST
    @Operation(summary = "Infer relations from a term",
            description = "Runs the requested rules from the source term and stores the results as provisional "
                    + "relations awaiting review.")
    public List<CandidateRelation> infer(InferenceRequest request) {
        if (request == null || request.getSourceTermId() == null || request.getSourceTermId().isBlank()) {
            throw new IllegalArgumentException("sourceTermId is required");
        }
        int depth = request.getMaxDepth() != null ? request.getMaxDepth() : orchestrator.settings().defaultMaxDepth();
        return orchestrator.infer(request.getSourceTermId(), parseRules(request.getRules()), depth);
    }

    static List<InferenceRule> parseRules(List<String> names) {
        List<InferenceRule> rules = new ArrayList<>();
        if (names == null) return rules;
        for (String name : names) rules.add(InferenceRule.parse(name));
        return rules;
    }
}
