package com.e2eq.lexikon.graph.resource.models;

import com.e2eq.lexikon.graph.core.ReviewDecision;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@RegisterForReflection
public class ReviewResolutionRequest {
   protected ReviewDecision decision;
   /** Optional confidence override applied on approval. */
   protected Double confidence;
}
