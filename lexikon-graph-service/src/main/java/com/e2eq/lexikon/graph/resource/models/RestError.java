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
public class RestError {
   protected int status;
   protected String reasonCode;
   protected String statusMessage;
   protected String reasonMessage;
   protected String debugMessage;
}
