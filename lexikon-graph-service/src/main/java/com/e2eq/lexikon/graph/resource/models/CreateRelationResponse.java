package com.e2eq.lexikon.graph.resource.models;

import com.e2eq.lexikon.graph.core.PutResult;
import com.e2eq.lexikon.graph.core.Relation;
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
public class CreateRelationResponse {
   protected String id;
   protected PutResult.Outcome outcome;
   protected Relation relation;
}
