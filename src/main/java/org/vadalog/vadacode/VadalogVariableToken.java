package org.vadalog.vadacode;

import java.util.*;

/**
 * A variable token enriched with the results of the variable-safety analysis.
 */
public class VadalogVariableToken extends VadalogToken {
    private final String name;
    private final String rule;
    private final boolean existential;
    private final boolean harmless;
    private final boolean harmful;
    private final boolean dangerous;
    private final boolean protected_;
    private final List<String> attackedBy;

    VadalogVariableToken(VadalogToken token, ProgramGraphNode variable) {
        super(token);
        this.name = variable.getString(ProgramGraph.NAME);
        this.rule = variable.getString(ProgramGraph.RULE);
        this.existential = variable.getBoolean(ProgramGraph.EXISTENTIAL);
        this.harmless = variable.getBoolean(ProgramGraph.HARMLESS);
        this.harmful = variable.getBoolean(ProgramGraph.HARMFUL);
        this.dangerous = variable.getBoolean(ProgramGraph.DANGEROUS);
        this.protected_ = variable.getBoolean(ProgramGraph.PROTECTED);
        this.attackedBy = List.copyOf(variable.getStrings(ProgramGraph.ATTACKED_BY));
    }

    public String getName() { return name; }
    public String getRule() { return rule; }
    public boolean isExistential() { return existential; }
    public boolean isHarmless() { return harmless; }
    public boolean isHarmful() { return harmful; }
    public boolean isDangerous() { return dangerous; }
    public boolean isProtected() { return protected_; }

    /** Ids of the existential variables whose marked nulls reach every body position of this one. */
    public List<String> getAttackedBy() { return attackedBy; }
}
