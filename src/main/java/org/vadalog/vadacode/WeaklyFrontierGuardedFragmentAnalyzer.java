package org.vadalog.vadacode;

public class WeaklyFrontierGuardedFragmentAnalyzer extends AbstractGuardFragmentAnalyzer {

    public WeaklyFrontierGuardedFragmentAnalyzer() {
        super(ProgramGraph.WEAK_FRONTIER_GUARD, DiagnosticCode.ERR_ATOM_NOT_IN_WEAKLY_FRONTIER_GUARDED_RULE,
                Fragment.WEAKLY_FRONTIER_GUARDED);
    }

    @Override
    protected boolean isCandidate(ProgramGraphNode variable) {
        return variable.getBoolean(ProgramGraph.DANGEROUS);
    }

    @Override
    protected boolean frontierOnly() {
        return true;
    }
}
