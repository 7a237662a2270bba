package org.vadalog.vadacode;

/**
 * Guarded: some body atom contains all universally quantified variables.
 */
public class GuardedFragmentAnalyzer extends AbstractGuardFragmentAnalyzer {

    public GuardedFragmentAnalyzer() {
        super(ProgramGraph.GUARD, DiagnosticCode.ERR_ATOM_NOT_IN_GUARDED_RULE, Fragment.GUARDED);
    }

    @Override
    protected boolean isCandidate(ProgramGraphNode variable) {
        return true;
    }

    @Override
    protected boolean frontierOnly() {
        return false;
    }
}
