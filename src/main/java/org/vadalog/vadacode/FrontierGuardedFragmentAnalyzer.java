package org.vadalog.vadacode;

/**
 * Frontier Guarded: some body atom contains all the body variables shared with the head.
 */
public class FrontierGuardedFragmentAnalyzer extends AbstractGuardFragmentAnalyzer {

    public FrontierGuardedFragmentAnalyzer() {
        super(ProgramGraph.FRONTIER_GUARD, DiagnosticCode.ERR_ATOM_NOT_IN_FRONTIER_GUARDED_RULE,
                Fragment.FRONTIER_GUARDED);
    }

    @Override
    protected boolean isCandidate(ProgramGraphNode variable) {
        return true;
    }

    @Override
    protected boolean frontierOnly() {
        return true;
    }
}
