package org.vadalog.vadacode;

import java.util.*;

/**
 * Checks the Shy conditions. Head positions of existential variables are
 * <em>invaded</em> by those variables, and invasion propagates through
 * variables whose body positions are all invaded. A body variable is
 * <em>attacked</em> by an invader present in every one of its body positions,
 * and <em>protected</em> when nothing attacks it.
 *
 * <ul>
 *   <li>S1: an attacked variable may not occur in more than one body atom.</li>
 *   <li>S2: two distinct attacked variables sharing an attacker may not both
 *   occur in the head and in different body atoms.</li>
 * </ul>
 */
public class ShyFragmentAnalyzer extends AbstractProgramGraphAnalyzer {

    private final Map<String, Set<String>> invadedBy = new LinkedHashMap<>();

    @Override
    protected void doAnalyze() {
        invadedBy.clear();
        markInvadedPositions();
        propagateInvasion();
        Map<String, Set<String>> attackers = markAttackedVariables();
        reportS1(attackers);
        reportS2(attackers);
    }

    /** Existential variable ids invading each position. */
    public Map<String, Set<String>> getInvadedPositions() { return Collections.unmodifiableMap(invadedBy); }

    private void markInvadedPositions() {
        Set<String> existential = programGraph.getExistentialVariableNodes();
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_POSITION, (edge, variable, position) -> {
            if (edge.isHead() && existential.contains(variable.getId())) {
                invadedBy.computeIfAbsent(position.getId(), k -> new LinkedHashSet<>()).add(variable.getId());
            }
        });
    }

    private void propagateInvasion() {
        boolean changed = true;
        while (changed) {
            changed = false;
            Map<String, Set<String>> bodyInvaders = new LinkedHashMap<>();
            Set<String> partiallyInvaded = new HashSet<>();
            programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_POSITION, (edge, variable, position) -> {
                if (edge.isHead()) {
                    return;
                }
                Set<String> invaders = bodyInvaders.computeIfAbsent(variable.getId(), k -> new LinkedHashSet<>());
                Set<String> positionInvaders = invadedBy.get(position.getId());
                if (positionInvaders != null && !positionInvaders.isEmpty()) {
                    invaders.addAll(positionInvaders);
                } else {
                    partiallyInvaded.add(variable.getId());
                }
            });

            List<ProgramGraphEdge> headOccurrences = new ArrayList<>();
            programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_POSITION, (edge, variable, position) -> {
                if (edge.isHead()) {
                    headOccurrences.add(edge);
                }
            });
            for (ProgramGraphEdge edge : headOccurrences) {
                Set<String> invaders = bodyInvaders.get(edge.getSource());
                if (invaders == null || invaders.isEmpty() || partiallyInvaded.contains(edge.getSource())) {
                    continue;
                }
                if (invadedBy.computeIfAbsent(edge.getTarget(), k -> new LinkedHashSet<>()).addAll(invaders)) {
                    changed = true;
                }
            }
        }

        invadedBy.forEach((positionId, invaders) -> programGraph.updateNode(positionId,
                node -> node.setAttribute("invadedBy", new ArrayList<>(invaders))));
    }

    /**
     * Sets {@code attackedBy} and {@code protected_} on every variable with a
     * body occurrence and returns the attackers per variable.
     */
    private Map<String, Set<String>> markAttackedVariables() {
        Map<String, Integer> bodyPositions = new LinkedHashMap<>();
        Map<String, Map<String, Integer>> invasionCounts = new LinkedHashMap<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_POSITION, (edge, variable, position) -> {
            if (edge.isHead()) {
                return;
            }
            bodyPositions.merge(variable.getId(), 1, Integer::sum);
            Map<String, Integer> counts = invasionCounts.computeIfAbsent(variable.getId(), k -> new LinkedHashMap<>());
            for (String invader : invadedBy.getOrDefault(position.getId(), Collections.emptySet())) {
                counts.merge(invader, 1, Integer::sum);
            }
        });

        Map<String, Set<String>> attackers = new LinkedHashMap<>();
        bodyPositions.forEach((variableId, positions) -> {
            Set<String> attackedBy = new LinkedHashSet<>();
            invasionCounts.get(variableId).forEach((invader, count) -> {
                if (count.equals(positions)) {
                    attackedBy.add(invader);
                }
            });
            attackers.put(variableId, attackedBy);
            programGraph.updateNode(variableId, node -> {
                node.setAttribute(ProgramGraph.ATTACKED_BY, new ArrayList<>(attackedBy));
                node.setAttribute(ProgramGraph.PROTECTED, attackedBy.isEmpty());
            });
        });
        return attackers;
    }

    private void reportS1(Map<String, Set<String>> attackers) {
        Map<String, Set<String>> bodyAtomTokens = new LinkedHashMap<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_ATOM_TOKEN, (edge, variable, atomToken) -> {
            if (!edge.isHead()) {
                bodyAtomTokens.computeIfAbsent(variable.getId(), k -> new LinkedHashSet<>()).add(atomToken.getId());
            }
        });

        List<String> violating = new ArrayList<>();
        bodyAtomTokens.forEach((variableId, atomTokens) -> {
            Set<String> attackedBy = attackers.getOrDefault(variableId, Collections.emptySet());
            if (atomTokens.size() >= 2 && !attackedBy.isEmpty()) {
                violating.add(variableId);
            }
        });

        for (VadalogToken token : ProgramGraph.flatten(programGraph.getTokensOfVariables(violating))) {
            report(VadalogDiagnostic.of(token, DiagnosticCode.ERR_ATOM_NOT_VIOLATING_SHY_S1_CONDITION,
                    Map.of("variable", token.getText()), Fragment.SHY));
        }
    }

    private void reportS2(Map<String, Set<String>> attackers) {
        Map<String, List<String>> attackedByRule = new LinkedHashMap<>();
        attackers.forEach((variableId, attackedBy) -> {
            if (!attackedBy.isEmpty()) {
                attackedByRule.computeIfAbsent(programGraph.getNode(variableId).getString(ProgramGraph.RULE),
                        k -> new ArrayList<>()).add(variableId);
            }
        });

        Set<String> violating = new LinkedHashSet<>();
        attackedByRule.forEach((ruleId, variables) -> {
            for (int i = 0; i < variables.size(); i++) {
                for (int j = i + 1; j < variables.size(); j++) {
                    String first = variables.get(i);
                    String second = variables.get(j);
                    if (Collections.disjoint(attackers.get(first), attackers.get(second))) {
                        continue;
                    }
                    if (violatesS2(first, second)) {
                        violating.add(first);
                        violating.add(second);
                    }
                }
            }
        });

        for (VadalogToken token : ProgramGraph.flatten(programGraph.getTokensOfVariables(violating))) {
            report(VadalogDiagnostic.of(token, DiagnosticCode.ERR_ATOM_NOT_VIOLATING_SHY_S2_CONDITION,
                    Map.of("variable", token.getText()), Fragment.SHY));
        }
    }

    private boolean violatesS2(String first, String second) {
        Set<String> firstHead = atomTokensOf(first, ProgramGraph.AtomLocation.HEAD);
        Set<String> secondHead = atomTokensOf(second, ProgramGraph.AtomLocation.HEAD);
        Set<String> firstBody = atomTokensOf(first, ProgramGraph.AtomLocation.BODY);
        Set<String> secondBody = atomTokensOf(second, ProgramGraph.AtomLocation.BODY);
        return !firstHead.isEmpty() && !secondHead.isEmpty()
                && !firstBody.isEmpty() && !secondBody.isEmpty()
                && !firstBody.equals(secondBody);
    }

    private Set<String> atomTokensOf(String variableId, ProgramGraph.AtomLocation location) {
        Set<String> atomTokens = new LinkedHashSet<>();
        for (ProgramGraphEdge edge : programGraph.edgesFrom(variableId, ProgramGraph.EdgeType.VARIABLE_AT_ATOM_TOKEN)) {
            if (programGraph.getNode(edge.getTarget()).getLocation() == location) {
                atomTokens.add(edge.getTarget());
            }
        }
        return atomTokens;
    }
}
