package org.Aayush.blt.decomposition;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered unit of the BLT plan.
 *
 * <p>Loop members keep declaration order for display; they are solved together, so the order
 * carries no evaluation meaning.</p>
 */
@Value
@Builder
public class Block {
    /** Scalar or algebraic loop. */
    BlockKind kind;
    /** Matched pairs of this block. */
    @Singular
    List<BlockAssignment> assignments;

    /**
     * Returns equation ids in member order.
     */
    public List<String> equations() {
        List<String> equations = new ArrayList<>(assignments.size());
        for (BlockAssignment assignment : assignments) {
            equations.add(assignment.equation());
        }
        return List.copyOf(equations);
    }

    /**
     * Returns unknown labels in member order.
     */
    public List<String> variables() {
        List<String> variables = new ArrayList<>(assignments.size());
        for (BlockAssignment assignment : assignments) {
            variables.add(assignment.unknown());
        }
        return List.copyOf(variables);
    }

    public int size() {
        return assignments.size();
    }

    public boolean isAlgebraicLoop() {
        return kind == BlockKind.ALGEBRAIC_LOOP;
    }

    @Override
    public String toString() {
        return kind + assignments.toString();
    }
}
