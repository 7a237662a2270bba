package org.vadalog.vadacode;

import java.util.*;

/**
 * Aggregation and collection keywords cannot name atoms.
 */
public class NoKeywordInAtomNamesAnalyzer extends AbstractProgramGraphAnalyzer {

    static final Set<String> RESERVED_KEYWORDS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "sum", "count", "avg", "min", "max", "list", "set", "union",
            "msum", "mprod", "mcount", "munion", "mmax", "mmin", "prod")));

    @Override
    protected void doAnalyze() {
        programGraph.forEachEdge(ProgramGraph.EdgeType.TOKEN_OF, (edge, tokenNode, atom) -> {
            if (atom.getType() != ProgramGraph.NodeType.ATOM) {
                return;
            }
            VadalogToken token = tokenNode.getToken();
            if (RESERVED_KEYWORDS.contains(token.getText())) {
                report(VadalogDiagnostic.of(token, DiagnosticCode.ERR_NO_KEYWORD_IN_ATOM_NAME,
                        Map.of("keyword", token.getText())));
            }
        });
    }
}
