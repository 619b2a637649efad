package com.ozmeta.compiler.policy;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.policy.PolicyExpression.ColumnRef;
import com.ozmeta.compiler.policy.PolicyExpression.Operation;

/**
 * Points the column references of a guard at the physical columns of the
 * table it secures.
 */
public class PolicyBinder {

    private final PhysicalObject object;
    private final Set<String> columns = new LinkedHashSet<>();

    public PolicyBinder(PhysicalObject object) {
        this.object = object;
    }

    /**
     * @throws CompilationException when a reference names no field of the table
     */
    public PolicyExpression bind(String policyCode, PolicyExpression node) {
        if (node instanceof ColumnRef ref) {
            PhysicalField field = object.findFieldByCanonicalName(ref.getField())
                    .orElseThrow(() -> new CompilationException("Policy '" + policyCode + "' references unknown field "
                            + object.getCanonicalName() + "." + ref.getField()));
            columns.add(field.getPhysicalName());
            return new ColumnRef(ref.getField(), field.getPhysicalName(), field.getPhysicalType());
        } else if (node instanceof Operation op) {
            List<PolicyExpression> args = new ArrayList<>();
            for (PolicyExpression arg : op.getArguments()) {
                args.add(bind(policyCode, arg));
            }
            return new Operation(op.getOperator(), List.copyOf(args));
        }
        return node;
    }

    /**
     * Physical columns referenced by every guard bound so far, in first-use order.
     */
    public List<String> referencedColumns() {
        return List.copyOf(columns);
    }
}
