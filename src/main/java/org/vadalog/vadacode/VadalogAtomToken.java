package org.vadalog.vadacode;

import java.util.*;

/**
 * An atom token enriched with EDB/IDB and guard information.
 */
public class VadalogAtomToken extends VadalogToken {
    private final boolean edb;
    private final boolean idb;
    private final boolean guard;
    private final boolean frontierGuard;
    private final boolean weakGuard;
    private final boolean weakFrontierGuard;
    private final List<String> existentialVariables;

    VadalogAtomToken(VadalogToken token, ProgramGraphNode atom, ProgramGraphNode tokenNode) {
        super(token);
        this.edb = atom != null && atom.getBoolean(ProgramGraph.IS_EDB);
        this.idb = atom != null && atom.getBoolean(ProgramGraph.IS_IDB);
        this.guard = tokenNode.getBoolean(ProgramGraph.GUARD);
        this.frontierGuard = tokenNode.getBoolean(ProgramGraph.FRONTIER_GUARD);
        this.weakGuard = tokenNode.getBoolean(ProgramGraph.WEAK_GUARD);
        this.weakFrontierGuard = tokenNode.getBoolean(ProgramGraph.WEAK_FRONTIER_GUARD);
        this.existentialVariables = List.copyOf(tokenNode.getStrings(ProgramGraph.EXISTENTIAL_VARIABLES));
    }

    public boolean isEDB() { return edb; }
    public boolean isIDB() { return idb; }

    public boolean isGuard() { return guard; }
    public boolean isFrontierGuard() { return frontierGuard; }
    public boolean isWeakGuard() { return weakGuard; }
    public boolean isWeakFrontierGuard() { return weakFrontierGuard; }

    public List<String> getExistentialVariables() { return existentialVariables; }
}
