package org.vadalog.vadacode;

/**
 * Weakly Guarded: some body atom contains all dangerous variables. Reads the
 * {@code dangerous} flag set by {@link WardedFragmentAnalyzer}.
 */
public class WeaklyGuardedFragmentAnalyzer extends AbstractGuardFragmentAnalyzer {

    public WeaklyGuardedFragmentAnalyzer() {
        super(ProgramGraph.WEAK_GUARD, DiagnosticCode.ERR_ATOM_NOT_IN_WEAKLY_GUARDED_RULE, Fragment.WEAKLY_GUARDED);
    }

    @Override
    protected boolean isCandidate(ProgramGraphNode variable) {
        return variable.getBoolean(ProgramGraph.DANGEROUS);
    }

    @Override
    protected boolean frontierOnly() {
        return false;
    }
}
