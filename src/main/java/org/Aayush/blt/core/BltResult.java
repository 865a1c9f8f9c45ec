package org.Aayush.blt.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.blt.check.AnalysisDiagnostic;
import org.Aayush.blt.decomposition.Block;
import org.Aayush.blt.decomposition.BlockAssignment;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable outcome of one structural analysis run.
 *
 * <p>Callers should inspect {@code wellPosed} and {@code diagnostics} before handing
 * {@code blocks} to code generation. For an ill-posed model the blocks cover only the matched
 * part of the system.</p>
 */
@Value
@Builder
public class BltResult {
    /** Blocks in evaluation order. */
    @Singular
    List<Block> blocks;
    /** True when the matching is total and every consistency check passed. */
    boolean wellPosed;
    /** Ordered findings; identical across runs for identical input. */
    @Singular
    List<AnalysisDiagnostic> diagnostics;
    /** Number of analyzed equation rows. */
    int equationCount;
    /** Number of unknown slots. */
    int unknownCount;

    /**
     * Returns true if any block is an algebraic loop.
     */
    public boolean hasAlgebraicLoops() {
        for (Block block : blocks) {
            if (block.isAlgebraicLoop()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns diagnostic messages as {@code [CODE] message} strings.
     */
    public List<String> diagnosticMessages() {
        List<String> messages = new ArrayList<>(diagnostics.size());
        for (AnalysisDiagnostic diagnostic : diagnostics) {
            messages.add(diagnostic.toString());
        }
        return List.copyOf(messages);
    }

    /**
     * Renders a stable, line-oriented listing of the plan.
     */
    public String describe() {
        StringBuilder out = new StringBuilder();
        out.append("BLT plan: ").append(blocks.size()).append(" blocks, ")
                .append(equationCount).append(" equations, ")
                .append(unknownCount).append(" unknowns, ")
                .append(wellPosed ? "well-posed" : "ill-posed")
                .append(hasAlgebraicLoops() ? ", algebraic loops" : "")
                .append('\n');
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            out.append("  #").append(i).append(' ').append(block.getKind());
            for (BlockAssignment assignment : block.getAssignments()) {
                out.append(' ').append(assignment.equation()).append("->").append(assignment.unknown());
            }
            out.append('\n');
        }
        for (AnalysisDiagnostic diagnostic : diagnostics) {
            out.append("  ").append(diagnostic).append('\n');
        }
        return out.toString();
    }
}
