package com.e2eq.lexikon.graph.resource.models;

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
public class RelationTypeView {
   protected String name;
   protected boolean symmetric;
   protected boolean transitive;
   protected boolean reflexive;
   protected boolean equivalence;
   protected String inverseOf;
}
