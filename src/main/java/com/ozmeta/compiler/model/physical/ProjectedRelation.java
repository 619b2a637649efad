package com.ozmeta.compiler.model.physical;

import java.util.UUID;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProjectedRelation {
    UUID relationId;
    String constraintName;
    String roleName;
    String cardinality;
    PhysicalObject fromObject;
    String fromColumn;
    PhysicalObject toObject;
    String toColumn;
    FkEnforcement enforcement;
}
