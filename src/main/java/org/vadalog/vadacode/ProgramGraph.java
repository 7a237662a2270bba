package org.vadalog.vadacode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Typed, attributed graph of a Vadalog program.
 *
 * <p>Nodes and edges live in flat lists; nodes are addressed by interned string
 * ids derived from source positions and names (rules are {@code R<n>}, variables
 * {@code <name>_R<n>}, positions {@code atom[i]}, tokens {@code L<line>C<col>L<len>}),
 * so repeated builds of the same program produce the same ids. The walker
 * builds the topology; analyzers only read it and update node attributes.</p>
 */
public class ProgramGraph {
    private static final Logger log = LoggerFactory.getLogger(ProgramGraph.class);

    public enum NodeType {
        RULE,
        ATOM,
        TOKEN,
        VARIABLE,
        POSITION,
        EGD,
        CONDITION,
        AGGREGATION
    }

    public enum EdgeType {
        ATOM_OF,
        TOKEN_OF,
        VARIABLE_AT_POSITION,
        VARIABLE_AT_EGD,
        VARIABLE_AT_CONDITION,
        VARIABLE_AT_TEMPORAL_ANNOTATION,
        POSITION_OF,
        VARIABLE_AT_ATOM_TOKEN,
        EGD_OF,
        TOKEN_AT_POSITION,
        AGGREGATION_OF_RULE,
        CONTRIBUTOR_OF_AGGREGATION
    }

    /** Where an atom token occurs. */
    public enum AtomLocation {
        HEAD,
        BODY,
        FACT,
        INPUT,
        OUTPUT,
        BINDING,
        MAPPING,
        POST
    }

    public enum RulePart {
        HEAD,
        BODY,
        ALL
    }

    @FunctionalInterface
    public interface EdgeVisitor {
        void visit(ProgramGraphEdge edge, ProgramGraphNode source, ProgramGraphNode target);
    }

    // Attribute keys shared by the walker and the analyzers
    public static final String TOKEN = "token";
    public static final String RULE = "rule";
    public static final String RANGE = "range";
    public static final String URI = "uri";
    public static final String LOCATION = "location";
    public static final String HEAD = "head";
    public static final String NEGATED = "negated";
    public static final String NAME = "name";
    public static final String ATOM = "atom";
    public static final String INDEX = "index";
    public static final String POSITION = "position";
    public static final String ATOM_INDEX = "atomIndex";
    public static final String TERM_INDEX = "termIndex";
    public static final String BODY_CONJUNCTIVE_QUERY_TERM = "bodyConjunctiveQueryTerm";
    public static final String LEFT_HAND_SIDE = "leftHandSideOfAnEqCondition";
    public static final String CONDITION = "condition";
    public static final String TEXT = "text";
    public static final String EQUALITY = "equality";
    public static final String EGD = "egd";
    public static final String TEMPORAL = "temporal";
    public static final String IS_LITERAL = "isLiteral";
    public static final String AGGREGATION_TYPE = "aggregationType";
    public static final String EXISTENTIAL = "existential";
    public static final String EXISTENTIAL_VARIABLES = "existentialVariables";
    public static final String UNDECLARED = "undeclared";
    public static final String IS_EDB = "isEDB";
    public static final String IS_IDB = "isIDB";
    public static final String HARMLESS = "harmless";
    public static final String HARMFUL = "harmful";
    public static final String DANGEROUS = "dangerous";
    public static final String PROTECTED = "protected_";
    public static final String ATTACKED_BY = "attackedBy";
    public static final String AFFECTED = "affected";
    public static final String TAINTED = "tainted";
    public static final String GUARD = "guard";
    public static final String FRONTIER_GUARD = "frontierGuard";
    public static final String WEAK_GUARD = "weakGuard";
    public static final String WEAK_FRONTIER_GUARD = "weakFrontierGuard";

    // Same shape as the ID lexer rule; no generated node id matches it
    private static final Pattern ATOM_NAME = Pattern.compile("[a-z][a-zA-Z0-9_]*");

    private final List<ProgramGraphNode> nodes = new ArrayList<>();
    private final Map<String, Integer> nodeIndex = new HashMap<>();
    private final List<ProgramGraphEdge> edges = new ArrayList<>();

    private boolean analyzed = false;
    private List<VadalogToken> existentialVariableTokens = Collections.emptyList();
    private List<VadalogToken> undeclaredVariableTokens = Collections.emptyList();

    // =====================================================================
    // ARENA PRIMITIVES
    // =====================================================================

    /**
     * Returns the node with the given id, creating it when missing.
     */
    ProgramGraphNode mergeNode(String id, NodeType type) {
        Integer index = nodeIndex.get(id);
        if (index != null) {
            return nodes.get(index);
        }
        ProgramGraphNode node = new ProgramGraphNode(nodes.size(), id, type);
        nodes.add(node);
        nodeIndex.put(id, node.getIndex());
        return node;
    }

    ProgramGraphEdge addEdge(EdgeType type, String source, String target, Map<String, Object> attributes) {
        ProgramGraphNode sourceNode = getNode(source);
        ProgramGraphNode targetNode = getNode(target);
        if (sourceNode == null || targetNode == null) {
            throw new IllegalStateException("Edge " + type + " between unknown nodes " + source + " and " + target);
        }
        ProgramGraphEdge edge = new ProgramGraphEdge(edges.size(), type, source, target, new LinkedHashMap<>(attributes));
        edges.add(edge);
        sourceNode.outEdges.add(edge.getIndex());
        targetNode.inEdges.add(edge.getIndex());
        return edge;
    }

    boolean hasEdge(EdgeType type, String source, String target) {
        ProgramGraphNode sourceNode = getNode(source);
        if (sourceNode == null) {
            return false;
        }
        for (int edgeIndex : sourceNode.outEdges) {
            ProgramGraphEdge edge = edges.get(edgeIndex);
            if (edge.getType() == type && edge.getTarget().equals(target)) {
                return true;
            }
        }
        return false;
    }

    public ProgramGraphNode getNode(String id) {
        Integer index = nodeIndex.get(id);
        return index != null ? nodes.get(index) : null;
    }

    public boolean hasNode(String id) {
        return nodeIndex.containsKey(id);
    }

    public int getNodeCount() { return nodes.size(); }
    public int getEdgeCount() { return edges.size(); }

    /**
     * Visits every edge in insertion order.
     */
    public void forEachEdge(EdgeVisitor visitor) {
        for (ProgramGraphEdge edge : edges) {
            visitor.visit(edge, nodes.get(nodeIndex.get(edge.getSource())), nodes.get(nodeIndex.get(edge.getTarget())));
        }
    }

    public void forEachEdge(EdgeType type, EdgeVisitor visitor) {
        forEachEdge((edge, source, target) -> {
            if (edge.getType() == type) {
                visitor.visit(edge, source, target);
            }
        });
    }

    public void forEachNode(NodeType type, Consumer<ProgramGraphNode> consumer) {
        for (ProgramGraphNode node : nodes) {
            if (node.getType() == type) {
                consumer.accept(node);
            }
        }
    }

    public List<ProgramGraphNode> filterNodes(Predicate<ProgramGraphNode> predicate) {
        List<ProgramGraphNode> result = new ArrayList<>();
        for (ProgramGraphNode node : nodes) {
            if (predicate.test(node)) {
                result.add(node);
            }
        }
        return result;
    }

    public List<ProgramGraphEdge> edgesFrom(String id, EdgeType type) {
        return collectEdges(id, type, true);
    }

    public List<ProgramGraphEdge> edgesTo(String id, EdgeType type) {
        return collectEdges(id, type, false);
    }

    private List<ProgramGraphEdge> collectEdges(String id, EdgeType type, boolean outgoing) {
        ProgramGraphNode node = getNode(id);
        if (node == null) {
            return Collections.emptyList();
        }
        List<ProgramGraphEdge> result = new ArrayList<>();
        for (int edgeIndex : outgoing ? node.outEdges : node.inEdges) {
            ProgramGraphEdge edge = edges.get(edgeIndex);
            if (type == null || edge.getType() == type) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * Applies an attribute update to an existing node.
     */
    public void updateNode(String id, Consumer<ProgramGraphNode> update) {
        ProgramGraphNode node = getNode(id);
        if (node == null) {
            throw new IllegalArgumentException("No node " + id + " in program graph");
        }
        update.accept(node);
    }

    // =====================================================================
    // CONSTRUCTION (used by the tree walker)
    // =====================================================================

    public static String tokenId(VadalogToken token) {
        return "L" + token.getLine() + "C" + token.getColumn() + "L" + token.getLength();
    }

    public static String variableId(String variableName, String ruleId) {
        return variableName + "_" + ruleId;
    }

    public static String positionId(String atomName, int index) {
        return atomName + "[" + index + "]";
    }

    public void addRule(String ruleId, VadalogRange range, String uri) {
        if (hasNode(ruleId)) {
            log.warn("Rule {} already exists in program graph", ruleId);
            return;
        }
        ProgramGraphNode rule = mergeNode(ruleId, NodeType.RULE);
        rule.setAttribute(RANGE, range);
        rule.setAttribute(URI, uri);
    }

    public void addEGDToken(VadalogToken egdToken, String ruleId, int egdPosition) {
        String egdId = "egd" + egdPosition + "@" + ruleId;
        if (!hasNode(egdId)) {
            mergeNode(egdId, NodeType.EGD);
            addEdge(EdgeType.EGD_OF, egdId, ruleId, Collections.emptyMap());
        }
        String tokenId = tokenId(egdToken);
        ProgramGraphNode tokenNode = mergeNode(tokenId, NodeType.TOKEN);
        tokenNode.setAttribute(TOKEN, egdToken);
        tokenNode.setAttribute(RULE, ruleId);
        addEdge(EdgeType.TOKEN_OF, tokenId, egdId, Collections.emptyMap());
    }

    public String addCondition(String text, String ruleId, int conditionPosition, boolean equality) {
        String conditionId = "condition" + conditionPosition + "@" + ruleId;
        if (!hasNode(conditionId)) {
            ProgramGraphNode condition = mergeNode(conditionId, NodeType.CONDITION);
            condition.setAttribute(TEXT, text);
            condition.setAttribute(EQUALITY, equality);
            condition.setAttribute(RULE, ruleId);
            addEdge(EdgeType.ATOM_OF, conditionId, ruleId, Collections.emptyMap());
        }
        return conditionId;
    }

    /**
     * Registers the quoted atom name of an annotation as an atom token. The
     * stored token covers the name without its quotes.
     */
    public VadalogToken addAnnotationAtomToken(VadalogToken termToken, String ruleId, AtomLocation location) {
        String atomName = termToken.getText().replace("\"", "");
        VadalogToken atomToken = new VadalogToken(termToken.getLine(), termToken.getColumn() + 1,
                termToken.getLength() - 2, termToken.getUri(), atomName, TokenKind.ATOM);
        if (ATOM_NAME.matcher(atomName).matches()) {
            addAtomToken(atomName, atomToken, 0, ruleId, location, false);
        } else {
            log.debug("'{}' is not an atom name, not added to the program graph", atomName);
        }
        return atomToken;
    }

    public VadalogToken addInputAtomToken(VadalogToken termToken, String ruleId) {
        return addAnnotationAtomToken(termToken, ruleId, AtomLocation.INPUT);
    }

    public VadalogToken addOutputAtomToken(VadalogToken termToken, String ruleId) {
        return addAnnotationAtomToken(termToken, ruleId, AtomLocation.OUTPUT);
    }

    public VadalogToken addBindingAtomToken(VadalogToken termToken, String ruleId) {
        return addAnnotationAtomToken(termToken, ruleId, AtomLocation.BINDING);
    }

    public VadalogToken addMappingAtomToken(VadalogToken termToken, String ruleId) {
        return addAnnotationAtomToken(termToken, ruleId, AtomLocation.MAPPING);
    }

    public VadalogToken addPostAtomToken(VadalogToken termToken, String ruleId) {
        return addAnnotationAtomToken(termToken, ruleId, AtomLocation.POST);
    }

    public void addAtomToken(String atomId, VadalogToken atomToken, int bodyConjunctiveQueryTerm, String ruleId,
                             AtomLocation location, boolean negated) {
        ProgramGraphNode existing = getNode(atomId);
        if (existing != null && existing.getType() != NodeType.ATOM) {
            log.warn("Atom id {} clashes with a {} node, token not added", atomId, existing.getType());
            return;
        }
        if (existing == null) {
            mergeNode(atomId, NodeType.ATOM);
            addEdge(EdgeType.ATOM_OF, atomId, ruleId, Collections.emptyMap());
        }
        String tokenId = tokenId(atomToken);
        ProgramGraphNode tokenNode = mergeNode(tokenId, NodeType.TOKEN);
        tokenNode.setAttribute(TOKEN, atomToken);
        tokenNode.setAttribute(RULE, ruleId);
        tokenNode.setAttribute(LOCATION, location);
        tokenNode.setAttribute(ATOM_INDEX, bodyConjunctiveQueryTerm);
        tokenNode.setAttribute(NEGATED, negated);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(LOCATION, location);
        attributes.put(HEAD, location == AtomLocation.HEAD);
        addEdge(EdgeType.TOKEN_OF, tokenId, atomId, attributes);
    }

    private String mergePosition(String atomName, int index) {
        String positionId = positionId(atomName, index);
        if (!hasNode(positionId)) {
            ProgramGraphNode position = mergeNode(positionId, NodeType.POSITION);
            position.setAttribute(INDEX, index);
            position.setAttribute(ATOM, atomName);
        }
        if (hasNode(atomName) && !hasEdge(EdgeType.POSITION_OF, atomName, positionId)) {
            addEdge(EdgeType.POSITION_OF, atomName, positionId, Collections.emptyMap());
        }
        return positionId;
    }

    private String mergeVariable(String variableName, String ruleId) {
        String variableId = variableId(variableName, ruleId);
        if (!hasNode(variableId)) {
            ProgramGraphNode variable = mergeNode(variableId, NodeType.VARIABLE);
            variable.setAttribute(NAME, variableName);
            variable.setAttribute(RULE, ruleId);
        }
        return variableId;
    }

    public void addConstantToken(VadalogToken constantToken, String ruleId, VadalogToken atomToken,
                                 int bodyConjunctiveQueryTerm, int termPosition, boolean head) {
        String positionId = mergePosition(atomToken.getText(), termPosition);
        String tokenId = tokenId(constantToken);
        ProgramGraphNode tokenNode = mergeNode(tokenId, NodeType.TOKEN);
        tokenNode.setAttribute(TOKEN, constantToken);
        tokenNode.setAttribute(RULE, ruleId);
        tokenNode.setAttribute(HEAD, head);
        tokenNode.setAttribute(ATOM_INDEX, bodyConjunctiveQueryTerm);
        tokenNode.setAttribute(TERM_INDEX, termPosition);
        tokenNode.setAttribute(IS_LITERAL, true);
        tokenNode.setAttribute(POSITION, positionId);
        addEdge(EdgeType.TOKEN_AT_POSITION, tokenId, positionId, Map.of(HEAD, head));
    }

    public void addVariableToken(VadalogToken variableToken, String ruleId, VadalogToken atomToken,
                                 int bodyConjunctiveQueryTerm, int termPosition, boolean head, boolean negated) {
        String atomName = atomToken.getText();
        String positionId = mergePosition(atomName, termPosition);
        String variableId = mergeVariable(variableToken.getText(), ruleId);

        Map<String, Object> occurrence = new LinkedHashMap<>();
        occurrence.put(HEAD, head);
        occurrence.put(BODY_CONJUNCTIVE_QUERY_TERM, bodyConjunctiveQueryTerm);
        occurrence.put(NEGATED, negated);
        addEdge(EdgeType.VARIABLE_AT_POSITION, variableId, positionId, occurrence);

        // Variables sharing an atom token are joined by that atom
        String atomTokenId = tokenId(atomToken);
        if (hasNode(atomTokenId)) {
            addEdge(EdgeType.VARIABLE_AT_ATOM_TOKEN, variableId, atomTokenId, occurrence);
        }

        String tokenId = tokenId(variableToken);
        ProgramGraphNode tokenNode = mergeNode(tokenId, NodeType.TOKEN);
        tokenNode.setAttribute(TOKEN, variableToken);
        tokenNode.setAttribute(RULE, ruleId);
        tokenNode.setAttribute(HEAD, head);
        tokenNode.setAttribute(ATOM_INDEX, bodyConjunctiveQueryTerm);
        tokenNode.setAttribute(TERM_INDEX, termPosition);
        tokenNode.setAttribute(ATOM, atomName);
        tokenNode.setAttribute(POSITION, positionId);
        addEdge(EdgeType.TOKEN_OF, tokenId, variableId, Map.of(HEAD, head));
    }

    public void addEGDVariableToken(VadalogToken variableToken, String ruleId, int egdPosition) {
        String egdId = "egd" + egdPosition + "@" + ruleId;
        if (!hasNode(egdId)) {
            // The parser took an incomplete clause for an EGD
            return;
        }
        String variableId = mergeVariable(variableToken.getText(), ruleId);
        addEdge(EdgeType.VARIABLE_AT_EGD, variableId, egdId, Collections.emptyMap());

        String tokenId = tokenId(variableToken);
        ProgramGraphNode tokenNode = mergeNode(tokenId, NodeType.TOKEN);
        tokenNode.setAttribute(TOKEN, variableToken);
        tokenNode.setAttribute(RULE, ruleId);
        tokenNode.setAttribute(EGD, true);
        addEdge(EdgeType.TOKEN_OF, tokenId, variableId, Collections.emptyMap());
    }

    public void addConditionVariableToken(VadalogToken variableToken, String ruleId, int conditionPosition,
                                          boolean leftHandSideOfAnEqCondition) {
        String conditionId = "condition" + conditionPosition + "@" + ruleId;
        if (!hasNode(conditionId)) {
            return;
        }
        String variableId = mergeVariable(variableToken.getText(), ruleId);
        addEdge(EdgeType.VARIABLE_AT_CONDITION, variableId, conditionId,
                Map.of(LEFT_HAND_SIDE, leftHandSideOfAnEqCondition));

        String tokenId = tokenId(variableToken);
        ProgramGraphNode tokenNode = mergeNode(tokenId, NodeType.TOKEN);
        tokenNode.setAttribute(TOKEN, variableToken);
        tokenNode.setAttribute(RULE, ruleId);
        tokenNode.setAttribute(CONDITION, conditionId);
        tokenNode.setAttribute(LEFT_HAND_SIDE, leftHandSideOfAnEqCondition);
        addEdge(EdgeType.TOKEN_OF, tokenId, variableId, Collections.emptyMap());
    }

    /**
     * Registers a variable of the {@code @[start, end]} interval annotating an
     * atom. Only head occurrences carry a {@code head} flag, so body intervals
     * never count as joins.
     */
    public void addTemporalVariableToken(VadalogToken variableToken, String ruleId, VadalogToken atomToken,
                                         boolean head) {
        String variableId = mergeVariable(variableToken.getText(), ruleId);
        String atomTokenId = tokenId(atomToken);
        if (hasNode(atomTokenId)) {
            addEdge(EdgeType.VARIABLE_AT_TEMPORAL_ANNOTATION, variableId, atomTokenId, Map.of(HEAD, head));
        }

        String tokenId = tokenId(variableToken);
        ProgramGraphNode tokenNode = mergeNode(tokenId, NodeType.TOKEN);
        tokenNode.setAttribute(TOKEN, variableToken);
        tokenNode.setAttribute(RULE, ruleId);
        tokenNode.setAttribute(TEMPORAL, true);
        if (head) {
            tokenNode.setAttribute(HEAD, true);
        }
        addEdge(EdgeType.TOKEN_OF, tokenId, variableId, Map.of(HEAD, head));
    }

    public void addAggregation(String text, String ruleId, String aggregationType, int aggregationPosition) {
        String aggregationId = "aggregation" + aggregationPosition + "@" + ruleId;
        if (!hasNode(aggregationId)) {
            ProgramGraphNode aggregation = mergeNode(aggregationId, NodeType.AGGREGATION);
            aggregation.setAttribute(TEXT, text);
            aggregation.setAttribute(AGGREGATION_TYPE, aggregationType);
            addEdge(EdgeType.AGGREGATION_OF_RULE, aggregationId, ruleId, Collections.emptyMap());
        }
    }

    public void addContributorVariable(VadalogToken variableToken, String ruleId, int aggregationPosition,
                                       int contributorIndex) {
        String aggregationId = "aggregation" + aggregationPosition + "@" + ruleId;
        if (!hasNode(aggregationId)) {
            return;
        }
        String variableId = mergeVariable(variableToken.getText(), ruleId);
        addEdge(EdgeType.CONTRIBUTOR_OF_AGGREGATION, variableId, aggregationId, Map.of(INDEX, contributorIndex));
    }

    // =====================================================================
    // QUERIES
    // =====================================================================

    private static boolean inRulePart(RulePart rulePart, boolean head) {
        switch (rulePart) {
            case HEAD:
                return head;
            case BODY:
                return !head;
            default:
                return true;
        }
    }

    /**
     * Tokens of each given variable node, keyed by variable id, in edge order.
     * The rule part filter reads the {@code head} flag of the occurrence, so
     * condition and EGD tokens count as body tokens.
     */
    public Map<String, List<VadalogToken>> getTokensOfVariables(Collection<String> variableIds, RulePart rulePart) {
        Map<String, List<VadalogToken>> tokens = new LinkedHashMap<>();
        for (String variableId : variableIds) {
            for (ProgramGraphEdge edge : edgesTo(variableId, EdgeType.TOKEN_OF)) {
                ProgramGraphNode tokenNode = getNode(edge.getSource());
                if (tokenNode.getType() == NodeType.TOKEN && inRulePart(rulePart, edge.isHead())) {
                    tokens.computeIfAbsent(variableId, k -> new ArrayList<>()).add(tokenNode.getToken());
                }
            }
        }
        return tokens;
    }

    public Map<String, List<VadalogToken>> getTokensOfVariables(Collection<String> variableIds) {
        return getTokensOfVariables(variableIds, RulePart.ALL);
    }

    /**
     * Token nodes of each given atom, keyed by atom id.
     */
    public Map<String, List<ProgramGraphNode>> getTokenNodesOfAtoms(Collection<String> atomIds, RulePart rulePart) {
        Map<String, List<ProgramGraphNode>> tokens = new LinkedHashMap<>();
        for (String atomId : atomIds) {
            for (ProgramGraphEdge edge : edgesTo(atomId, EdgeType.TOKEN_OF)) {
                ProgramGraphNode tokenNode = getNode(edge.getSource());
                if (tokenNode.getType() == NodeType.TOKEN && inRulePart(rulePart, edge.isHead())) {
                    tokens.computeIfAbsent(atomId, k -> new ArrayList<>()).add(tokenNode);
                }
            }
        }
        return tokens;
    }

    /**
     * Variables with an occurrence in a head position and no token outside
     * rule heads.
     */
    public Set<String> getExistentialVariableNodes() {
        Set<String> existential = new LinkedHashSet<>();
        forEachNode(NodeType.VARIABLE, variable -> {
            boolean inHead = edgesFrom(variable.getId(), EdgeType.VARIABLE_AT_POSITION).stream()
                    .anyMatch(ProgramGraphEdge::isHead);
            if (!inHead) {
                return;
            }
            boolean outsideHead = edgesTo(variable.getId(), EdgeType.TOKEN_OF).stream()
                    .anyMatch(edge -> !getNode(edge.getSource()).getBoolean(HEAD));
            if (!outsideHead) {
                existential.add(variable.getId());
            }
        });
        return existential;
    }

    /**
     * Positions occupied by the given variables.
     */
    public Set<String> getPositionsOfVariables(Collection<String> variableIds) {
        Set<String> positions = new LinkedHashSet<>();
        for (String variableId : variableIds) {
            for (ProgramGraphEdge edge : edgesFrom(variableId, EdgeType.VARIABLE_AT_POSITION)) {
                positions.add(edge.getTarget());
            }
        }
        return positions;
    }

    // =====================================================================
    // ANALYSIS
    // =====================================================================

    /**
     * Marks existential variables, records them on atom tokens and marks the
     * variables of conditions which are never bound.
     */
    public void analyze() {
        Set<String> existentialVariables = getExistentialVariableNodes();
        for (String variableId : existentialVariables) {
            updateNode(variableId, node -> node.setAttribute(EXISTENTIAL, true));
        }

        Map<String, List<String>> existentialAtomTokenVariables = new LinkedHashMap<>();
        forEachEdge(EdgeType.VARIABLE_AT_ATOM_TOKEN, (edge, variable, atomToken) -> {
            if (variable.getBoolean(EXISTENTIAL)) {
                existentialAtomTokenVariables.computeIfAbsent(atomToken.getId(), k -> new ArrayList<>())
                        .add(variable.getString(NAME));
            }
        });
        existentialAtomTokenVariables.forEach((atomTokenId, names) ->
                updateNode(atomTokenId, node -> node.setAttribute(EXISTENTIAL_VARIABLES, names)));

        markUndeclaredVariablesInConditions();

        existentialVariableTokens = flatten(getTokensOfVariables(existentialVariables));
        List<String> undeclared = new ArrayList<>();
        forEachNode(NodeType.VARIABLE, node -> {
            if (node.getBoolean(UNDECLARED)) {
                undeclared.add(node.getId());
            }
        });
        undeclaredVariableTokens = flatten(getTokensOfVariables(undeclared));
        analyzed = true;
        log.debug("Program graph analyzed: {} nodes, {} edges, {} existential variables",
                nodes.size(), edges.size(), existentialVariables.size());
    }

    private void markUndeclaredVariablesInConditions() {
        forEachNode(NodeType.VARIABLE, variable -> {
            List<ProgramGraphEdge> conditionEdges = edgesFrom(variable.getId(), EdgeType.VARIABLE_AT_CONDITION);
            if (conditionEdges.isEmpty()) {
                return;
            }
            boolean boundInBody = edgesFrom(variable.getId(), EdgeType.VARIABLE_AT_POSITION).stream()
                    .anyMatch(edge -> !edge.isHead() && !edge.isNegated());
            boolean assigned = conditionEdges.stream().anyMatch(edge -> edge.getBoolean(LEFT_HAND_SIDE));
            if (!boundInBody && !assigned) {
                variable.setAttribute(UNDECLARED, true);
            }
        });
    }

    public boolean isAnalyzed() { return analyzed; }

    private void checkAnalyzed() {
        if (!analyzed) {
            throw new IllegalStateException("Program graph not analyzed yet");
        }
    }

    public List<VadalogToken> getExistentialVariableTokens() {
        checkAnalyzed();
        return existentialVariableTokens;
    }

    public List<VadalogToken> getUndeclaredVariableTokens() {
        checkAnalyzed();
        return undeclaredVariableTokens;
    }

    /**
     * Variable tokens sitting in a position that can receive a marked null.
     */
    public List<VadalogToken> getMarkedNullVariableTokens() {
        checkAnalyzed();
        List<VadalogToken> tokens = new ArrayList<>();
        forEachEdge(EdgeType.TOKEN_OF, (edge, tokenNode, variable) -> {
            if (variable.getType() != NodeType.VARIABLE) {
                return;
            }
            String positionId = tokenNode.getString(POSITION);
            ProgramGraphNode position = positionId != null ? getNode(positionId) : null;
            if (position != null && position.getBoolean(AFFECTED)) {
                tokens.add(tokenNode.getToken());
            }
        });
        return tokens;
    }

    /**
     * Variable tokens carrying the attributes computed by the analyzers.
     */
    public List<VadalogVariableToken> getVariableTokens() {
        List<VadalogVariableToken> result = new ArrayList<>();
        forEachEdge(EdgeType.TOKEN_OF, (edge, tokenNode, variable) -> {
            if (variable.getType() == NodeType.VARIABLE && tokenNode.getType() == NodeType.TOKEN) {
                result.add(new VadalogVariableToken(tokenNode.getToken(), variable));
            }
        });
        return result;
    }

    /**
     * Atom tokens carrying EDB/IDB and guard attributes.
     */
    public List<VadalogAtomToken> getAtomTokens() {
        List<VadalogAtomToken> result = new ArrayList<>();
        forEachEdge(EdgeType.TOKEN_OF, (edge, tokenNode, atom) -> {
            if (atom.getType() == NodeType.ATOM && tokenNode.getType() == NodeType.TOKEN) {
                result.add(new VadalogAtomToken(tokenNode.getToken(), atom, tokenNode));
            }
        });
        return result;
    }

    static List<VadalogToken> flatten(Map<String, List<VadalogToken>> tokens) {
        List<VadalogToken> result = new ArrayList<>();
        tokens.values().forEach(result::addAll);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ProgramGraph:\n  Nodes:\n");
        for (ProgramGraphNode node : nodes) {
            sb.append("   - ").append(node.getId()).append(": ").append(node.getType())
                    .append(' ').append(node.getAttributes()).append('\n');
        }
        sb.append("  Edges:\n");
        for (ProgramGraphEdge edge : edges) {
            sb.append("   - ").append(edge).append(' ').append(edge.getAttributes()).append('\n');
        }
        return sb.toString();
    }
}
