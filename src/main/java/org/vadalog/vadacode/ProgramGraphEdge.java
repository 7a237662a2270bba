package org.vadalog.vadacode;

import java.util.*;

/**
 * A directed, typed edge of the {@link ProgramGraph}, stored by node id.
 */
public class ProgramGraphEdge {
    private final int index;
    private final ProgramGraph.EdgeType type;
    private final String source;
    private final String target;
    private final Map<String, Object> attributes;

    ProgramGraphEdge(int index, ProgramGraph.EdgeType type, String source, String target, Map<String, Object> attributes) {
        this.index = index;
        this.type = type;
        this.source = source;
        this.target = target;
        this.attributes = attributes;
    }

    public int getIndex() { return index; }
    public ProgramGraph.EdgeType getType() { return type; }
    public String getSource() { return source; }
    public String getTarget() { return target; }
    public Map<String, Object> getAttributes() { return Collections.unmodifiableMap(attributes); }

    public Object getAttribute(String key) { return attributes.get(key); }

    public boolean getBoolean(String key) {
        return Boolean.TRUE.equals(attributes.get(key));
    }

    public boolean isHead() { return getBoolean(ProgramGraph.HEAD); }
    public boolean isNegated() { return getBoolean(ProgramGraph.NEGATED); }

    public ProgramGraph.AtomLocation getLocation() {
        return (ProgramGraph.AtomLocation) attributes.get(ProgramGraph.LOCATION);
    }

    @Override
    public String toString() {
        return source + " -[" + type + "]-> " + target;
    }
}
