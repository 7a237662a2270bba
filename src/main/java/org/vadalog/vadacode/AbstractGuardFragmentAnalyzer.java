package org.vadalog.vadacode;

import java.util.*;

/**
 * Shared algorithm of the guard-based fragments. A body atom is a guard of
 * its rule when it contains every relevant body variable of the rule; a rule
 * violates the fragment when some body atom is not a guard and no other body
 * atom is. Subclasses choose which variables are relevant.
 */
public abstract class AbstractGuardFragmentAnalyzer extends AbstractProgramGraphAnalyzer {
    private final String guardAttribute;
    private final DiagnosticCode code;
    private final Fragment fragment;

    protected AbstractGuardFragmentAnalyzer(String guardAttribute, DiagnosticCode code, Fragment fragment) {
        this.guardAttribute = guardAttribute;
        this.code = code;
        this.fragment = fragment;
    }

    /** Whether the variable takes part in the guard condition at all. */
    protected abstract boolean isCandidate(ProgramGraphNode variable);

    /** Whether only variables also occurring in the head must be guarded. */
    protected abstract boolean frontierOnly();

    @Override
    protected void doAnalyze() {
        markGuardAtomTokens();
        reportUnguardedRules();
    }

    private void markGuardAtomTokens() {
        Map<String, Set<String>> variablesPerRule = new LinkedHashMap<>();
        Map<String, Map<String, Set<String>>> atomTokenVariablesPerRule = new LinkedHashMap<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_ATOM_TOKEN, (edge, variable, atomToken) -> {
            if (edge.isHead() || !isCandidate(variable)) {
                return;
            }
            String ruleId = variable.getString(ProgramGraph.RULE);
            variablesPerRule.computeIfAbsent(ruleId, k -> new LinkedHashSet<>()).add(variable.getId());
            atomTokenVariablesPerRule.computeIfAbsent(ruleId, k -> new LinkedHashMap<>())
                    .computeIfAbsent(atomToken.getId(), k -> new LinkedHashSet<>())
                    .add(variable.getId());
        });

        if (frontierOnly()) {
            variablesPerRule.replaceAll((ruleId, variables) -> {
                Set<String> headVariables = new LinkedHashSet<>();
                for (String variableId : variables) {
                    boolean inHead = programGraph.edgesFrom(variableId, ProgramGraph.EdgeType.VARIABLE_AT_POSITION)
                            .stream().anyMatch(ProgramGraphEdge::isHead);
                    if (inHead) {
                        headVariables.add(variableId);
                    }
                }
                return headVariables;
            });
        }

        atomTokenVariablesPerRule.forEach((ruleId, atomTokens) -> {
            Set<String> ruleVariables = variablesPerRule.get(ruleId);
            atomTokens.forEach((atomTokenId, atomVariables) -> programGraph.updateNode(atomTokenId,
                    node -> node.setAttribute(guardAttribute, includes(atomVariables, ruleVariables))));
        });
    }

    /**
     * An empty atom includes nothing; an empty requirement is always met.
     */
    static boolean includes(Set<String> container, Set<String> required) {
        if (container.isEmpty()) {
            return false;
        }
        return container.containsAll(required);
    }

    private void reportUnguardedRules() {
        Map<String, boolean[]> guardsPerRule = new LinkedHashMap<>();
        // [has guard, has non guard]
        programGraph.forEachEdge(ProgramGraph.EdgeType.TOKEN_OF, (edge, tokenNode, atom) -> {
            if (atom.getType() != ProgramGraph.NodeType.ATOM
                    || edge.getLocation() != ProgramGraph.AtomLocation.BODY
                    || !tokenNode.hasAttribute(guardAttribute)) {
                return;
            }
            boolean[] flags = guardsPerRule.computeIfAbsent(tokenNode.getString(ProgramGraph.RULE), k -> new boolean[2]);
            flags[tokenNode.getBoolean(guardAttribute) ? 0 : 1] = true;
        });

        guardsPerRule.forEach((ruleId, flags) -> {
            if (flags[1] && !flags[0]) {
                ProgramGraphNode rule = programGraph.getNode(ruleId);
                if (rule != null) {
                    reportRule(rule, code, fragment);
                }
            }
        });
    }
}
