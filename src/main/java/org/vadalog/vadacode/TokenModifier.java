package org.vadalog.vadacode;

/**
 * Facts attached to tokens by the analyzers. Modifiers only accumulate.
 */
public enum TokenModifier {
    /** Atom or variable that does not contribute to any result. */
    UNUSED("unused"),
    /** Atom whose facts come from the extensional database. */
    GROUND("ground"),
    /** Atom which is, or depends on, a temporal atom. */
    TEMPORAL("temporal"),
    /** Variable that may receive a marked null. */
    EXISTENTIAL("existential");

    private final String label;

    TokenModifier(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }
}
