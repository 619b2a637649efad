package com.ozmeta.compiler.model.physical;

import java.util.List;

import com.ozmeta.compiler.policy.PolicyExpression;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The row-level security of one table: every enabled policy applied to it,
 * combined into a read filter and a write check. Either may be null when no
 * policy applies in that mode.
 */
@Value
@Builder
public class ProjectedRowPolicy {
    String physicalName;
    PhysicalObject object;
    @Singular
    List<String> policyCodes;
    PolicyExpression filter;
    PolicyExpression check;
    /** Physical columns the filter and check read, in first-use order. */
    @Singular
    List<String> columns;
}
