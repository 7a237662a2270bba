package org.vadalog.vadacode;

import java.util.List;

/**
 * A pass over the {@link ProgramGraph}. Analyzers read the graph, may update
 * node attributes or token modifiers, and report diagnostics.
 */
public interface ProgramGraphAnalyzer {

    void analyze(ProgramGraph programGraph);

    /**
     * @throws IllegalStateException if {@link #analyze(ProgramGraph)} has not run
     */
    List<VadalogDiagnostic> getDiagnostics();
}
