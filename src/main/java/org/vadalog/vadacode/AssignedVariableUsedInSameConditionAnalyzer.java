package org.vadalog.vadacode;

import java.util.*;

/**
 * Flags a variable that is both assigned and read by the same equality
 * condition, as in {@code X = X + 1}. Only the tokens inside that condition
 * are reported.
 */
public class AssignedVariableUsedInSameConditionAnalyzer extends AbstractProgramGraphAnalyzer {

    @Override
    protected void doAnalyze() {
        // condition id -> variable id -> [lhs, rhs]
        Map<String, Map<String, boolean[]>> sides = new LinkedHashMap<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_CONDITION, (edge, variable, condition) -> {
            boolean[] flags = sides.computeIfAbsent(condition.getId(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(variable.getId(), k -> new boolean[2]);
            flags[edge.getBoolean(ProgramGraph.LEFT_HAND_SIDE) ? 0 : 1] = true;
        });

        sides.forEach((conditionId, variables) -> variables.forEach((variableId, flags) -> {
            if (!(flags[0] && flags[1])) {
                return;
            }
            for (ProgramGraphEdge edge : programGraph.edgesTo(variableId, ProgramGraph.EdgeType.TOKEN_OF)) {
                ProgramGraphNode tokenNode = programGraph.getNode(edge.getSource());
                if (conditionId.equals(tokenNode.getString(ProgramGraph.CONDITION))) {
                    report(VadalogDiagnostic.of(tokenNode.getToken(),
                            DiagnosticCode.ERR_VARIABLE_USED_IN_SAME_CONDITION_AS_ASSIGNED));
                }
            }
        }));
    }
}
