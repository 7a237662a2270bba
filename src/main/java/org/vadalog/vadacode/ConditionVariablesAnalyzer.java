package org.vadalog.vadacode;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Detects cyclic dependencies between assignments, e.g.
 * {@code X = Y + 1, Y = X - 1}. Each assigned variable depends on the
 * variables read on the right-hand side of its condition.
 */
public class ConditionVariablesAnalyzer extends AbstractProgramGraphAnalyzer {

    @Override
    protected void doAnalyze() {
        Map<String, String> lhsByCondition = new LinkedHashMap<>();
        Map<String, Set<String>> rhsByCondition = new LinkedHashMap<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_CONDITION, (edge, variable, condition) -> {
            if (edge.getBoolean(ProgramGraph.LEFT_HAND_SIDE)) {
                lhsByCondition.put(condition.getId(), variable.getId());
            } else {
                rhsByCondition.computeIfAbsent(condition.getId(), k -> new LinkedHashSet<>()).add(variable.getId());
            }
        });

        DependencyGraph dependencies = new DependencyGraph();
        lhsByCondition.forEach((conditionId, lhs) -> {
            dependencies.addNode(lhs);
            for (String rhs : rhsByCondition.getOrDefault(conditionId, Collections.emptySet())) {
                dependencies.addDependency(lhs, rhs);
            }
        });

        for (List<String> component : dependencies.getConnectedComponents()) {
            if (!dependencies.hasCycle(component)) {
                continue;
            }
            Map<String, List<VadalogToken>> tokens = programGraph.getTokensOfVariables(component);
            String names = tokens.values().stream()
                    .map(variableTokens -> variableTokens.get(0).getText())
                    .collect(Collectors.joining(", "));
            for (String variableId : component) {
                for (VadalogToken token : tokens.getOrDefault(variableId, Collections.emptyList())) {
                    report(VadalogDiagnostic.of(token, DiagnosticCode.ERR_CYCLE_IN_CONDITION_VARIABLES,
                            Map.of("variables", names)));
                }
            }
        }
    }
}
