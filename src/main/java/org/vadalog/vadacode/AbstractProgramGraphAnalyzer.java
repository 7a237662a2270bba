package org.vadalog.vadacode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Base class holding the analyze-then-report lifecycle shared by analyzers.
 */
public abstract class AbstractProgramGraphAnalyzer implements ProgramGraphAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(AbstractProgramGraphAnalyzer.class);

    protected ProgramGraph programGraph;
    private final List<VadalogDiagnostic> diagnostics = new ArrayList<>();
    private boolean analyzed = false;

    @Override
    public final void analyze(ProgramGraph programGraph) {
        this.programGraph = programGraph;
        diagnostics.clear();
        doAnalyze();
        analyzed = true;
        log.debug("{} reported {} diagnostics", getClass().getSimpleName(), diagnostics.size());
    }

    protected abstract void doAnalyze();

    @Override
    public final List<VadalogDiagnostic> getDiagnostics() {
        if (!analyzed) {
            throw new IllegalStateException(getClass().getSimpleName() + " has not analyzed any program yet");
        }
        return Collections.unmodifiableList(diagnostics);
    }

    protected void report(VadalogDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    protected void reportAll(Collection<VadalogToken> tokens, DiagnosticCode code, Map<String, String> parameters,
                             Fragment fragment) {
        for (VadalogToken token : tokens) {
            report(VadalogDiagnostic.of(token, code, parameters, fragment));
        }
    }

    /**
     * Reports a diagnostic spanning the whole rule.
     */
    protected void reportRule(ProgramGraphNode rule, DiagnosticCode code, Fragment fragment) {
        VadalogRange range = (VadalogRange) rule.getAttribute(ProgramGraph.RANGE);
        report(VadalogDiagnostic.of(range, rule.getString(ProgramGraph.URI), code, Collections.emptyMap(), fragment));
    }

    /**
     * Variable ids grouped by the rule they belong to.
     */
    protected Map<String, List<String>> variablesByRule() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        programGraph.forEachNode(ProgramGraph.NodeType.VARIABLE, variable ->
                result.computeIfAbsent(variable.getString(ProgramGraph.RULE), k -> new ArrayList<>())
                        .add(variable.getId()));
        return result;
    }

    /**
     * Atom token nodes, grouped by rule, whose location is one of the given ones.
     */
    protected Map<String, List<ProgramGraphNode>> atomTokensByRule(ProgramGraph.AtomLocation... locations) {
        Set<ProgramGraph.AtomLocation> wanted = EnumSet.noneOf(ProgramGraph.AtomLocation.class);
        wanted.addAll(Arrays.asList(locations));
        Map<String, List<ProgramGraphNode>> result = new LinkedHashMap<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.TOKEN_OF, (edge, tokenNode, atom) -> {
            if (atom.getType() == ProgramGraph.NodeType.ATOM && wanted.contains(tokenNode.getLocation())) {
                result.computeIfAbsent(tokenNode.getString(ProgramGraph.RULE), k -> new ArrayList<>()).add(tokenNode);
            }
        });
        return result;
    }
}
