package com.e2eq.lexikon.graph.resource.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@RegisterForReflection
public class CreateRelationRequest {
   protected String sourceId;
   protected String targetId;
   protected String relationType;
   /** Defaults to 1.0 when absent. */
   protected Double confidence;
   protected String createdBy;
   protected Map<String, Object> metadata;
}
