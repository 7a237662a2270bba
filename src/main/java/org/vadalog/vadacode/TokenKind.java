package org.vadalog.vadacode;

/**
 * Kinds of semantic tokens produced from a Vadalog source.
 */
public enum TokenKind {
    COMMENT("comment"),
    ATOM("atom"),
    INT("int"),
    DOUBLE("double"),
    DATE("date"),
    STRING("string"),
    BOOLEAN("boolean"),
    VARIABLE("variable"),
    ANNOTATION("annotation"),
    AT("at"),
    ID("id"),
    ANON_VAR("anon_var"),
    IMPLICATION("implication"),
    EQ("eq"),
    DOT("dot"),
    LIST("list"),
    SET("set"),
    UNKNOWN("unknown");

    private final String label;

    TokenKind(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /**
     * Literal kinds, i.e. tokens that denote a constant value.
     */
    public boolean isLiteral() {
        switch (this) {
            case INT:
            case DOUBLE:
            case DATE:
            case STRING:
            case BOOLEAN:
            case LIST:
            case SET:
                return true;
            default:
                return false;
        }
    }
}
