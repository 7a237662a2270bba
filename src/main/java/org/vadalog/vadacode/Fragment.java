package org.vadalog.vadacode;

/**
 * Named Datalog+/- fragments. Declaration order is the order the containment
 * lattice enumerates them in.
 */
public enum Fragment {
    SHOW_ALL_VIOLATIONS("Show all violations"),
    LINEAR("Linear"),
    AFRATI_LINEAR("Afrati Linear"),
    PLAIN_DATALOG("Plain Datalog"),
    WARDED("Warded"),
    SHY("Shy"),
    GUARDED("Guarded"),
    FRONTIER_GUARDED("Frontier Guarded"),
    WEAKLY_GUARDED("Weakly Guarded"),
    WEAKLY_FRONTIER_GUARDED("Weakly Frontier Guarded"),
    DATALOG_EXISTENTIAL("Datalog ∃");

    private final String label;

    Fragment(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /**
     * Looks a fragment up by label, ignoring case and blanks, so that both
     * "Datalog ∃" and "Datalog∃" resolve.
     */
    public static Fragment fromLabel(String label) {
        String wanted = normalize(label);
        for (Fragment fragment : values()) {
            if (normalize(fragment.label).equals(wanted) || fragment.name().equalsIgnoreCase(label.trim())) {
                return fragment;
            }
        }
        throw new IllegalArgumentException("Unknown fragment: " + label);
    }

    private static String normalize(String label) {
        return label.replaceAll("\\s+", "").toLowerCase();
    }

    @Override
    public String toString() {
        return label;
    }
}
