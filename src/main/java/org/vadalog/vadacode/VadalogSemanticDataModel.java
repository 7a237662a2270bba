package org.vadalog.vadacode;

import java.util.*;

// =====================================================================
// CALL SITES
// =====================================================================

/**
 * Syntactic position of an atom occurrence.
 */
enum AtomCallType {
    HEAD,
    BODY,
    FACT,
    INPUT,
    OUTPUT
}

/**
 * One occurrence of an atom together with the tokens of its terms.
 * Collections and sets count as a single term.
 */
class AtomCall {
    private final String name;
    private final VadalogToken atom;
    private final AtomCallType callType;
    private final List<VadalogToken> terms = new ArrayList<>();

    public AtomCall(String name, VadalogToken atom, AtomCallType callType) {
        this.name = name;
        this.atom = atom;
        this.callType = callType;
    }

    public String getName() { return name; }
    public VadalogToken getAtom() { return atom; }
    public AtomCallType getCallType() { return callType; }
    public List<VadalogToken> getTerms() { return Collections.unmodifiableList(terms); }

    void addTerm(VadalogToken term) {
        terms.add(term);
    }

    @Override
    public String toString() {
        return String.format("AtomCall{name='%s', type=%s, terms=%d}", name, callType, terms.size());
    }
}

/**
 * One occurrence of an annotation such as {@code @input("a")}.
 */
class AnnotationCall {
    private final VadalogToken atom;
    private final List<VadalogToken> terms = new ArrayList<>();

    public AnnotationCall(VadalogToken atom) {
        this.atom = atom;
    }

    /** The annotation name token, {@code null} when the parser could not find it. */
    public VadalogToken getAtom() { return atom; }
    public List<VadalogToken> getTerms() { return Collections.unmodifiableList(terms); }

    void addTerm(VadalogToken term) {
        terms.add(term);
    }

    @Override
    public String toString() {
        return String.format("AnnotationCall{name='%s', terms=%d}", atom != null ? atom.getText() : null, terms.size());
    }
}

enum AggregationType {
    MSUM, MPROD, MCOUNT, MUNION, MMAX, MMIN, UNION, LIST, SET, MIN, MAX, SUM, PROD, AVG, COUNT;

    public String getLabel() {
        return name().toLowerCase();
    }
}

// =====================================================================
// BINDINGS AND MAPPINGS
// =====================================================================

/**
 * Where the facts of an atom come from or go to.
 */
abstract class VadalogGenericBinding {
    private final VadalogToken token;
    private final String atomName;
    private final String dataSource;
    private final String outermostContainer;
    private boolean input;
    private VadalogToken inputToken;

    protected VadalogGenericBinding(VadalogToken token, String atomName, String dataSource, String outermostContainer) {
        this.token = token;
        this.atomName = atomName;
        this.dataSource = dataSource;
        this.outermostContainer = outermostContainer;
    }

    public VadalogToken getToken() { return token; }
    public String getAtomName() { return atomName; }
    public String getDataSource() { return dataSource; }
    public String getOutermostContainer() { return outermostContainer; }

    public boolean isInput() { return input; }
    void setInput(boolean input) { this.input = input; }

    public VadalogToken getInputToken() { return inputToken; }
    void setInputToken(VadalogToken inputToken) { this.inputToken = inputToken; }
}

/** {@code @bind("atom", "source", "outermost", "innermost").} */
class VadalogBinding extends VadalogGenericBinding {
    private final String innermostContainer;

    public VadalogBinding(VadalogToken token, String atomName, String dataSource, String outermostContainer,
                          String innermostContainer) {
        super(token, atomName, dataSource, outermostContainer);
        this.innermostContainer = innermostContainer;
    }

    public String getInnermostContainer() { return innermostContainer; }

    @Override
    public String toString() {
        return String.format("VadalogBinding{atom='%s', source='%s', container='%s/%s'}",
                getAtomName(), getDataSource(), getOutermostContainer(), innermostContainer);
    }
}

/** {@code @qbind("atom", "source", "outermost", "query").} */
class VadalogQueryBinding extends VadalogGenericBinding {
    private final String query;

    public VadalogQueryBinding(VadalogToken token, String atomName, String dataSource, String outermostContainer,
                               String query) {
        super(token, atomName, dataSource, outermostContainer);
        this.query = query;
    }

    public String getQuery() { return query; }

    @Override
    public String toString() {
        return String.format("VadalogQueryBinding{atom='%s', source='%s', query='%s'}",
                getAtomName(), getDataSource(), query);
    }
}

/**
 * {@code @mapping("atom", position, "column", "type").} A position that is
 * not a number reads as -1.
 */
class VadalogMapping {
    private final VadalogToken token;
    private final String atomName;
    private final int position;
    private final String columnName;
    private final TokenKind columnType;

    public VadalogMapping(VadalogToken token, String atomName, int position, String columnName, TokenKind columnType) {
        this.token = token;
        this.atomName = atomName;
        this.position = position;
        this.columnName = columnName;
        this.columnType = columnType;
    }

    public VadalogToken getToken() { return token; }
    public String getAtomName() { return atomName; }
    public int getPosition() { return position; }
    public String getColumnName() { return columnName; }
    public TokenKind getColumnType() { return columnType; }
}

// =====================================================================
// SIGNATURES
// =====================================================================

enum SignatureSource {
    DOCUMENTATION,
    USAGE,
    FACT,
    INPUT,
    BUILTIN
}

class SignatureTermHelp {
    private String label;
    private String documentation;
    private VadalogToken token;
    private TokenKind type;

    public SignatureTermHelp(String label, String documentation) {
        this.label = label;
        this.documentation = documentation;
    }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public String getDocumentation() { return documentation; }
    public void setDocumentation(String documentation) { this.documentation = documentation; }

    public VadalogToken getToken() { return token; }
    public void setToken(VadalogToken token) { this.token = token; }

    public TokenKind getType() { return type; }
    public void setType(TokenKind type) { this.type = type; }

    /** Optional annotation terms are labelled with a trailing {@code ?}. */
    public boolean isOptional() {
        return label != null && label.endsWith("?");
    }
}

/**
 * Signature of an atom or builtin annotation, used for signature help and
 * arity checks.
 */
class SignatureHelp {
    private final String name;
    private String signature;
    private String documentation;
    private VadalogToken token;
    private final List<SignatureTermHelp> terms;
    private final SignatureSource source;

    public SignatureHelp(String name, String signature, String documentation, List<SignatureTermHelp> terms,
                         SignatureSource source) {
        this.name = name;
        this.signature = signature;
        this.documentation = documentation;
        this.terms = new ArrayList<>(terms);
        this.source = source;
    }

    public String getName() { return name; }

    public String getSignature() { return signature; }
    public void setSignature(String signature) { this.signature = signature; }

    public String getDocumentation() { return documentation; }
    public void setDocumentation(String documentation) { this.documentation = documentation; }

    public VadalogToken getToken() { return token; }
    public void setToken(VadalogToken token) { this.token = token; }

    public List<SignatureTermHelp> getTerms() { return terms; }
    public SignatureSource getSource() { return source; }

    public int getRequiredTermCount() {
        int required = 0;
        for (SignatureTermHelp term : terms) {
            if (!term.isOptional()) {
                required++;
            }
        }
        return required;
    }

    @Override
    public String toString() {
        return String.format("SignatureHelp{name='%s', terms=%d, source=%s}", name, terms.size(), source);
    }
}

// =====================================================================
// DOCUMENTATION COMMENTS
// =====================================================================

/**
 * A {@code @tag {type} name description} line of a vaDoc block.
 */
class VadocTag {
    private final String tag;
    private final String type;
    private final String name;
    private final String description;

    public VadocTag(String tag, String type, String name, String description) {
        this.tag = tag;
        this.type = type;
        this.name = name;
        this.description = description;
    }

    public String getTag() { return tag; }
    public String getType() { return type; }
    public String getName() { return name; }
    public String getDescription() { return description; }
}

class VadocBlock {
    private final String description;
    private final List<VadocTag> tags;

    public VadocBlock(String description, List<VadocTag> tags) {
        this.description = description;
        this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
    }

    public String getDescription() { return description; }
    public List<VadocTag> getTags() { return tags; }

    public VadocTag findTag(String tag) {
        for (VadocTag candidate : tags) {
            if (candidate.getTag().equals(tag)) {
                return candidate;
            }
        }
        return null;
    }
}
