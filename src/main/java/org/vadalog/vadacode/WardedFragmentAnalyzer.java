package org.vadalog.vadacode;

import java.util.*;

/**
 * Variable-safety analysis of Warded Datalog±.
 *
 * <p>Positions reachable by marked nulls are <em>affected</em>; a universal
 * variable occurring only in affected positions is <em>harmful</em>, and a
 * harmful variable exported to the head is <em>dangerous</em>. A rule is
 * warded when all of its dangerous variables sit in a single body atom.
 *
 * <p>The same pass computes the positions <em>tainted</em> by EGDs over
 * harmful variables and flags the operations which are unsafe on them:
 * joins, filters and constants.
 */
public class WardedFragmentAnalyzer extends AbstractProgramGraphAnalyzer {

    private final Set<String> affectedPositions = new LinkedHashSet<>();
    private final Set<String> taintedPositions = new LinkedHashSet<>();

    @Override
    protected void doAnalyze() {
        affectedPositions.clear();
        taintedPositions.clear();

        markAffectedPositions();
        markHarmfulAndDangerousVariables();
        markTaintedPositions();

        reportUnwardedVariables();
        Map<String, Set<String>> taintedVariablesByRule = taintedVariablesByRule();
        reportTaintedJoins(taintedVariablesByRule);
        reportTaintedFilters(taintedVariablesByRule);
        reportTaintedLiterals();
        reportConstantsInTaintedEGDRules();
    }

    public Set<String> getAffectedPositions() { return Collections.unmodifiableSet(affectedPositions); }
    public Set<String> getTaintedPositions() { return Collections.unmodifiableSet(taintedPositions); }

    // =====================================================================
    // AFFECTED POSITIONS
    // =====================================================================

    private void markAffectedPositions() {
        Set<String> existential = programGraph.getExistentialVariableNodes();
        affectedPositions.addAll(programGraph.getPositionsOfVariables(existential));
        List<ProgramGraphNode> universal = programGraph.filterNodes(node ->
                node.getType() == ProgramGraph.NodeType.VARIABLE && !existential.contains(node.getId()));

        boolean changed = true;
        while (changed) {
            changed = false;
            for (ProgramGraphNode variable : universal) {
                List<ProgramGraphEdge> occurrences =
                        programGraph.edgesFrom(variable.getId(), ProgramGraph.EdgeType.VARIABLE_AT_POSITION);
                boolean inBody = false;
                boolean onlyAffectedInBody = true;
                for (ProgramGraphEdge occurrence : occurrences) {
                    if (!occurrence.isHead()) {
                        inBody = true;
                        onlyAffectedInBody &= affectedPositions.contains(occurrence.getTarget());
                    }
                }
                if (!inBody || !onlyAffectedInBody) {
                    continue;
                }
                for (ProgramGraphEdge occurrence : occurrences) {
                    if (occurrence.isHead() && affectedPositions.add(occurrence.getTarget())) {
                        changed = true;
                    }
                }
            }
        }

        for (String positionId : affectedPositions) {
            programGraph.updateNode(positionId, node -> node.setAttribute(ProgramGraph.AFFECTED, true));
        }
    }

    private void markHarmfulAndDangerousVariables() {
        Set<String> existential = programGraph.getExistentialVariableNodes();
        programGraph.forEachNode(ProgramGraph.NodeType.VARIABLE, variable -> {
            if (existential.contains(variable.getId())) {
                return;
            }
            List<ProgramGraphEdge> occurrences =
                    programGraph.edgesFrom(variable.getId(), ProgramGraph.EdgeType.VARIABLE_AT_POSITION);
            boolean harmful = !occurrences.isEmpty() && occurrences.stream()
                    .allMatch(occurrence -> affectedPositions.contains(occurrence.getTarget()));
            boolean dangerous = harmful && occurrences.stream().anyMatch(ProgramGraphEdge::isHead);
            variable.setAttribute(ProgramGraph.HARMFUL, harmful);
            variable.setAttribute(ProgramGraph.HARMLESS, !harmful);
            variable.setAttribute(ProgramGraph.DANGEROUS, dangerous);
        });
    }

    // =====================================================================
    // TAINTED POSITIONS
    // =====================================================================

    private void markTaintedPositions() {
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_EGD, (edge, variable, egd) -> {
            if (variable.getBoolean(ProgramGraph.HARMFUL)) {
                for (ProgramGraphEdge occurrence :
                        programGraph.edgesFrom(variable.getId(), ProgramGraph.EdgeType.VARIABLE_AT_POSITION)) {
                    taintedPositions.add(occurrence.getTarget());
                }
            }
        });

        // Taint flows from head to body and back within each rule, never into extensional atoms
        boolean changed = true;
        while (changed) {
            changed = false;
            List<ProgramGraphNode> variables = new ArrayList<>();
            programGraph.forEachNode(ProgramGraph.NodeType.VARIABLE, variables::add);
            for (ProgramGraphNode variable : variables) {
                List<ProgramGraphEdge> occurrences =
                        programGraph.edgesFrom(variable.getId(), ProgramGraph.EdgeType.VARIABLE_AT_POSITION);
                boolean taintedInHead = false;
                boolean taintedInBody = false;
                for (ProgramGraphEdge occurrence : occurrences) {
                    if (taintedPositions.contains(occurrence.getTarget())) {
                        if (occurrence.isHead()) {
                            taintedInHead = true;
                        } else {
                            taintedInBody = true;
                        }
                    }
                }
                for (ProgramGraphEdge occurrence : occurrences) {
                    boolean reached = occurrence.isHead() ? taintedInBody : taintedInHead;
                    if (reached && !taintedPositions.contains(occurrence.getTarget())
                            && !isExtensionalPosition(occurrence.getTarget())) {
                        taintedPositions.add(occurrence.getTarget());
                        changed = true;
                    }
                }
            }
        }

        for (String positionId : taintedPositions) {
            programGraph.updateNode(positionId, node -> node.setAttribute(ProgramGraph.TAINTED, true));
        }
    }

    private boolean isExtensionalPosition(String positionId) {
        for (ProgramGraphEdge edge : programGraph.edgesTo(positionId, ProgramGraph.EdgeType.POSITION_OF)) {
            if (programGraph.getNode(edge.getSource()).getBoolean(ProgramGraph.IS_EDB)) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Set<String>> taintedVariablesByRule() {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_POSITION, (edge, variable, position) -> {
            if (taintedPositions.contains(position.getId())) {
                result.computeIfAbsent(variable.getString(ProgramGraph.RULE), k -> new LinkedHashSet<>())
                        .add(variable.getId());
            }
        });
        return result;
    }

    // =====================================================================
    // DIAGNOSTICS
    // =====================================================================

    private void reportUnwardedVariables() {
        Map<String, Set<String>> wardAtomTokensByRule = new LinkedHashMap<>();
        Map<String, Set<String>> dangerousVariablesByRule = new LinkedHashMap<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_ATOM_TOKEN, (edge, variable, atomToken) -> {
            if (edge.isHead() || !variable.getBoolean(ProgramGraph.DANGEROUS)) {
                return;
            }
            String ruleId = variable.getString(ProgramGraph.RULE);
            wardAtomTokensByRule.computeIfAbsent(ruleId, k -> new LinkedHashSet<>()).add(atomToken.getId());
            dangerousVariablesByRule.computeIfAbsent(ruleId, k -> new LinkedHashSet<>()).add(variable.getId());
        });

        wardAtomTokensByRule.forEach((ruleId, atomTokens) -> {
            if (atomTokens.size() <= 1) {
                return;
            }
            programGraph.getTokensOfVariables(dangerousVariablesByRule.get(ruleId), ProgramGraph.RulePart.BODY)
                    .forEach((variableId, tokens) -> {
                        for (VadalogToken token : tokens) {
                            report(VadalogDiagnostic.of(token, DiagnosticCode.ERR_VARIABLE_IS_UNWARDED_0,
                                    Map.of("variable", token.getText()), Fragment.WARDED));
                        }
                    });
        });
    }

    private void reportTaintedJoins(Map<String, Set<String>> taintedVariablesByRule) {
        taintedVariablesByRule.forEach((ruleId, variables) -> {
            Map<String, List<VadalogToken>> joinTokens = new LinkedHashMap<>();
            boolean egdRule = false;
            for (String variableId : variables) {
                for (ProgramGraphEdge edge : programGraph.edgesTo(variableId, ProgramGraph.EdgeType.TOKEN_OF)) {
                    ProgramGraphNode tokenNode = programGraph.getNode(edge.getSource());
                    if (tokenNode.getBoolean(ProgramGraph.EGD)) {
                        egdRule = true;
                    }
                    // Only atom occurrences in the body carry an explicit head=false
                    if (tokenNode.hasAttribute(ProgramGraph.HEAD) && !tokenNode.getBoolean(ProgramGraph.HEAD)) {
                        joinTokens.computeIfAbsent(variableId, k -> new ArrayList<>()).add(tokenNode.getToken());
                    }
                }
            }
            if (egdRule) {
                return;
            }
            joinTokens.forEach((variableId, tokens) -> {
                if (tokens.size() > 1) {
                    for (VadalogToken token : tokens) {
                        report(VadalogDiagnostic.of(token, DiagnosticCode.ERR_VARIABLE_IS_EGD_HARMFUL_0,
                                Map.of("variable", token.getText()), Fragment.WARDED));
                    }
                }
            });
        });
    }

    private void reportTaintedFilters(Map<String, Set<String>> taintedVariablesByRule) {
        Set<String> filtered = new LinkedHashSet<>();
        for (Set<String> variables : taintedVariablesByRule.values()) {
            for (String variableId : variables) {
                if (!programGraph.edgesFrom(variableId, ProgramGraph.EdgeType.VARIABLE_AT_CONDITION).isEmpty()) {
                    filtered.add(variableId);
                }
            }
        }
        for (VadalogToken token : ProgramGraph.flatten(programGraph.getTokensOfVariables(filtered))) {
            report(VadalogDiagnostic.of(token, DiagnosticCode.ERR_VARIABLE_IN_TAINTED_POSITION_IS_USED_IN_FILTER_0,
                    Map.of("variable", token.getText()), Fragment.WARDED));
        }
    }

    private void reportTaintedLiterals() {
        programGraph.forEachEdge(ProgramGraph.EdgeType.TOKEN_AT_POSITION, (edge, tokenNode, position) -> {
            if (taintedPositions.contains(position.getId()) && tokenNode.getBoolean(ProgramGraph.IS_LITERAL)) {
                report(VadalogDiagnostic.of(tokenNode.getToken(), DiagnosticCode.ERR_LITERAL_IN_TAINTED_POSITION,
                        Map.of("literal", tokenNode.getToken().getText()), Fragment.WARDED));
            }
        });
    }

    private void reportConstantsInTaintedEGDRules() {
        Set<String> egdRules = new HashSet<>();
        programGraph.forEachNode(ProgramGraph.NodeType.TOKEN, tokenNode -> {
            if (tokenNode.getBoolean(ProgramGraph.EGD)) {
                egdRules.add(tokenNode.getString(ProgramGraph.RULE));
            }
        });
        programGraph.forEachEdge(ProgramGraph.EdgeType.TOKEN_AT_POSITION, (edge, tokenNode, position) -> {
            if (taintedPositions.contains(position.getId()) && egdRules.contains(tokenNode.getString(ProgramGraph.RULE))) {
                report(VadalogDiagnostic.of(tokenNode.getToken(), DiagnosticCode.ERR_CONSTANT_USED_IN_TAINTED_POSITION,
                        Collections.emptyMap(), Fragment.WARDED));
            }
        });
    }
}
