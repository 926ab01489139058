package com.e2eq.lexikon.graph.resource;

import com.e2eq.lexikon.graph.core.RelationTypeRegistry;
import com.e2eq.lexikon.graph.resource.models.RelationTypeView;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Path("/relation-types")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class RelationTypeResource {

    @Inject
    RelationTypeRegistry registry;

    @GET
    @Operation(summary = "Registered relation types and their properties")
    public List<RelationTypeView> list() {
        List<RelationTypeView> out = new ArrayList<>();
        for (RelationTypeRegistry.RelationTypeDef t : registry.types().values()) {
            out.add(RelationTypeView.builder()
                    .name(t.name())
                    .symmetric(t.symmetric())
                    .transitive(t.transitive())
                    .reflexive(t.reflexive())
                    .equivalence(t.equivalence())
                    .inverseOf(registry.inverseOf(t.name()).orElse(null))
                    .build());
        }
        out.sort(Comparator.comparing(RelationTypeView::getName));
        return out;
    }
}
