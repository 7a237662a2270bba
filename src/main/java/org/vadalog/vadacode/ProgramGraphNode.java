package org.vadalog.vadacode;

import java.util.*;

/**
 * A node of the {@link ProgramGraph}: an interned id, a type and a bag of
 * attributes. Nodes reference tokens, they never reference other nodes.
 */
public class ProgramGraphNode {
    private final int index;
    private final String id;
    private final ProgramGraph.NodeType type;
    private final Map<String, Object> attributes;
    final List<Integer> outEdges = new ArrayList<>();
    final List<Integer> inEdges = new ArrayList<>();

    ProgramGraphNode(int index, String id, ProgramGraph.NodeType type) {
        this.index = index;
        this.id = id;
        this.type = type;
        this.attributes = new LinkedHashMap<>();
    }

    public int getIndex() { return index; }
    public String getId() { return id; }
    public ProgramGraph.NodeType getType() { return type; }
    public Map<String, Object> getAttributes() { return Collections.unmodifiableMap(attributes); }

    public Object getAttribute(String key) { return attributes.get(key); }

    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    public boolean hasAttribute(String key) { return attributes.containsKey(key); }

    /** Absent attributes read as {@code false}. */
    public boolean getBoolean(String key) {
        return Boolean.TRUE.equals(attributes.get(key));
    }

    public String getString(String key) {
        Object value = attributes.get(key);
        return value != null ? value.toString() : null;
    }

    public int getInt(String key, int defaultValue) {
        Object value = attributes.get(key);
        return value instanceof Integer ? (Integer) value : defaultValue;
    }

    @SuppressWarnings("unchecked")
    public List<String> getStrings(String key) {
        Object value = attributes.get(key);
        return value instanceof List ? (List<String>) value : Collections.emptyList();
    }

    public VadalogToken getToken() {
        return (VadalogToken) attributes.get(ProgramGraph.TOKEN);
    }

    public ProgramGraph.AtomLocation getLocation() {
        return (ProgramGraph.AtomLocation) attributes.get(ProgramGraph.LOCATION);
    }

    @Override
    public String toString() {
        return type + "(" + id + ")" + attributes.keySet();
    }
}
