package com.e2eq.lexikon.graph.resource.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@RegisterForReflection
public class InferenceRequest {
   protected String sourceTermId;
   /** Rule names, case-insensitive; empty means all rules. */
   protected List<String> rules;
   /** Falls back to the configured default depth when absent. */
   protected Integer maxDepth;
}
