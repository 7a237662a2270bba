package org.vadalog.vadacode;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Every diagnostic the engine can report. Code values are stable and shared
 * with the online manual.
 */
public enum DiagnosticCode {
    ERR_UNUSED_ATOM("1000", DiagnosticSeverity.WARNING,
            "Unused atom '{atom}'.",
            "This atom is created but not used in any rule or query. Consider removing it if it's not needed."),
    ERR_UNEXPECTED_TOKEN_0("1001", DiagnosticSeverity.ERROR,
            "Unexpected symbol '{token}'.",
            "This symbol is not expected in this context. Check the syntax of the rule or query."),
    ERR_UNEXPECTED_EOF("1002", DiagnosticSeverity.ERROR,
            "Unexpected end of file.",
            "The parser reached the end of the file while expecting more input. Check for missing symbols or incomplete rules."),
    ERR_UNEXPECTED_TOKEN("1003", DiagnosticSeverity.ERROR,
            "Unexpected symbol.",
            "This symbol is not expected in this context. Check the syntax of the rule or query."),
    ERR_PARSING_ERROR_EXPECTED_0("1004", DiagnosticSeverity.ERROR,
            "Parsing error: '{token}' expected.",
            "The parser expected a different symbol or token. Check the syntax of the rule or query."),
    ERR_UNRECOGNIZED_TOKEN_0("1005", DiagnosticSeverity.ERROR,
            "Unexpected symbol.",
            "This symbol is not recognized by the parser. Check for typos or unsupported syntax."),
    ERR_UNRECOGNIZED_TOKEN("1006", DiagnosticSeverity.ERROR,
            "Unexpected symbol.",
            "This symbol is not recognized by the parser. Check for typos or unsupported syntax."),
    MISSING_0_AT_EOF("1007", DiagnosticSeverity.ERROR,
            "Missing '{missing}' at the end of file.",
            "The parser expected a specific symbol at the end of the file. Check for missing symbols or incomplete rules."),
    MISSING_0_AT("1008", DiagnosticSeverity.ERROR,
            "Missing '{expectedToken}' before '{currentToken}'.",
            "The parser expected a specific symbol before the current position. Check for missing symbols or incomplete rules."),
    EXTRANEOUS_INPUT_AT_0_EXPECTING_1("1009", DiagnosticSeverity.ERROR,
            "Unexpected symbol '{extraneous}' (expecting '{expecting}').",
            "The parser encountered an unexpected symbol while expecting another one. Check for typos or unsupported syntax."),
    UNKNOWN_PARSING_ERROR_0("1010", DiagnosticSeverity.ERROR,
            "Unknown parsing error: {message}.",
            "An unknown error occurred during parsing."),
    ERR_UNDECLARED_ATOM_0("1011", DiagnosticSeverity.ERROR,
            "Undeclared atom: {atom}.",
            "This atom is used in a rule but has not been declared. Declare it as a fact or import it with `@input`."),
    ERR_INPUT_ATOM_IN_HEAD_0("1012", DiagnosticSeverity.WARNING,
            "Atom '{atom}' is used in rule head and as an input. Do you want to create a new atom instead?",
            "This atom is used in the head of a rule and as an input. Consider creating a new atom instead."),
    ERR_ATOM_0_ALREADY_OUTPUT("1014", DiagnosticSeverity.ERROR,
            "Duplicate @output for atom '{atom}'.",
            "This atom is already declared as an output. Remove the duplicate declaration."),
    ERR_NON_EXISTING_OUTPUT_0("1015", DiagnosticSeverity.ERROR,
            "Atom '{atom}' has not been declared but is being used as an output.",
            "Check the spelling of the atom name or declare it in the head of a rule to output it."),
    ERR_VARIABLE_IS_UNWARDED_0("1016", DiagnosticSeverity.ERROR,
            "Variable '{variable}' is dangerous and involved in a join; the program is not Warded Datalog±.",
            "The program violates wardedness, the key safety condition of Warded Datalog±."),
    ERR_NO_BINDINGS_FOR_INPUT_0("1017", DiagnosticSeverity.WARNING,
            "Input '{atom}' has no bindings. Add @bind and @mapping rules.",
            "This `@input` atom has no bindings. Add `@bind` and `@mapping` annotations to read it from a data source."),
    NO_BINDINGS_FOR_OUTPUT_0("1018", DiagnosticSeverity.HINT,
            "Output '{atom}' has no bindings, output will be sent with the response.",
            "This `@output` atom has no bindings. The output will be sent with the response."),
    ERR_VARIABLE_IS_EGD_HARMFUL_0("1019", DiagnosticSeverity.ERROR,
            "Variable '{variable}' is in a tainted position and used in join or filter operation. The program does not satisfy the EGDs harmless sufficient condition.",
            "The program violates the safe taintedness condition for equality-generating dependencies."),
    HINT_EGD_0_1("1020", DiagnosticSeverity.HINT,
            "Equality-generating dependency: existential variables are made equal in the reasoning process.",
            "The head of the rule is an equality-generating dependency."),
    ERR_EMPTY_DEFINITION("1021", DiagnosticSeverity.ERROR,
            "Definition can't be empty.",
            "The annotation requires at least one term."),
    UNDECLARED_VARIABLE("1022", DiagnosticSeverity.ERROR,
            "Variable '{variable}' is not bound. Bind it either in a positive atom or in an assignment.",
            "Variables used in conditions must be bound in a positive atom or in an assignment."),
    INVALID_NEGATION_POSITIVE_BODY_0("1023", DiagnosticSeverity.ERROR,
            "Variable '{variable}' does not occur in a non-negated body atom. Every variable that occurs in the head and in a body negation must have a binding in a non-negated atom.",
            "A head variable used in a negated body atom must also be bound by a non-negated body atom."),
    ANNOTATION_PARAMETERS("1024", DiagnosticSeverity.ERROR,
            "Expected {expected} arguments, but got {received}.",
            "The number of arguments of the annotation must match its definition."),
    ANONYMOUS_VARIABLE("1025", DiagnosticSeverity.WARNING,
            "Variable {variable} is not used in the head. You should make it anonymous (replacing it with an `_`).",
            "A variable that is used only once should be replaced with the anonymous variable `_`."),
    ATOM_SIGNATURE_TERMS("1026", DiagnosticSeverity.ERROR,
            "Expected {expected} terms, but got {received}.",
            "The number of terms of the atom must match its signature. Use `_` for terms that are not needed."),
    MAPPING_POSITION_MUST_BE_INDEX("1027", DiagnosticSeverity.ERROR,
            "Mapping position must be an index (0-based) (instead it's '{position}').",
            "The mapping position is the 0-based index of the term in the atom signature."),
    NON_AFRATI_LINEAR_JOIN("1028", DiagnosticSeverity.ERROR,
            "Rule is not AfratiLienar: predicate '{atom}' is intensional and appears in the body of a rule with another intensional predicate.",
            "A linear program has at most one intensional atom in the body of every rule."),
    EXISTENTIAL_VARIABLE_IN_DATALOG("1029", DiagnosticSeverity.ERROR,
            "Existential variable '{variable}' is used in a Datalog rule. This is not allowed.",
            "Existential variables are not allowed in plain Datalog."),
    ERR_ATOM_NOT_IN_GUARDED_RULE("1030", DiagnosticSeverity.ERROR,
            "Rule is not Guarded, as there is no atom in the body including all universally quantified variables.",
            "A guard is a body atom that contains all the universally quantified variables of the rule."),
    ERR_ATOM_NOT_IN_FRONTIER_GUARDED_RULE("1031", DiagnosticSeverity.ERROR,
            "Rule is not Frontier Guarded, as there is no atom in the body including all universally quantified variables of the head.",
            "A frontier guard is a body atom that contains all the universally quantified variables of the head."),
    NON_LINEAR_RULE("1032", DiagnosticSeverity.ERROR,
            "Rule is not linear, since there are multiple atoms in the body.",
            "Linear rules have at most one atom in the body."),
    ERR_ATOM_NOT_IN_WEAKLY_GUARDED_RULE("1033", DiagnosticSeverity.ERROR,
            "Rule is not Weakly Guarded, as there is no atom in the body including all dangerous variables.",
            "A weak guard is a body atom that contains all the dangerous variables of the rule."),
    ERR_ATOM_NOT_IN_WEAKLY_FRONTIER_GUARDED_RULE("1034", DiagnosticSeverity.ERROR,
            "Rule is not Weakly Frontier Guarded, as there is no atom in the body including all dangerous variables in the head.",
            "A weak frontier guard is a body atom that contains all the dangerous variables of the head."),
    ERR_ATOM_NOT_VIOLATING_SHY_S1_CONDITION("1035", DiagnosticSeverity.ERROR,
            "Rule is not Shy: Variable '{variable}' occurs in more than one body atom and is not protected in the body of the rule.",
            null),
    ERR_ATOM_NOT_VIOLATING_SHY_S2_CONDITION("1036", DiagnosticSeverity.ERROR,
            "Rule is not Shy: Two distinct ∀-variables, that are not protected in the body of the rule and occur both in head and in two different body atoms, are attacked by the same invading variable.",
            null),
    ERR_CONSTANT_USED_IN_TAINTED_POSITION("1037", DiagnosticSeverity.ERROR,
            "No constants are allowed in tainted positions to guarantee Safe taintedness condition.",
            null),
    ERR_NO_EXTENSIONAL_ATOM_AS_OUTPUT("1039", DiagnosticSeverity.ERROR,
            "Extensional atoms cannot be used as outputs.",
            "To output extensional data, copy it into an intensional atom with a rule."),
    ERR_BINDING_ON_UNKNOWN_ATOM("1040", DiagnosticSeverity.ERROR,
            "Bindings must be specified for either @input or @output atoms. Check if you mispelled the atom name, or add the missing @input or @output annotation.",
            null),
    ERR_NO_VARIABLES_IN_FACT("1041", DiagnosticSeverity.ERROR,
            "Variables are not allowed in facts.",
            "Facts cannot contain variables. Replace variables with constants."),
    ERR_UNKNOWN_MAPPING_COLUMN_TYPE("1042", DiagnosticSeverity.ERROR,
            "Column type '{columnType}' is not recognized. Use one of the supported types: string, integer, double, date, boolean, set, list, unknown.",
            null),
    ERR_NO_KEYWORD_IN_ATOM_NAME("1043", DiagnosticSeverity.ERROR,
            "Atom name contains reserved keyword {keyword}.",
            null),
    ERR_VARIABLE_USED_IN_SAME_CONDITION_AS_ASSIGNED("1044", DiagnosticSeverity.ERROR,
            "Variable is used in the same condition where it is assigned.",
            null),
    ERR_VARIABLE_IN_TAINTED_POSITION_IS_USED_IN_FILTER_0("1045", DiagnosticSeverity.ERROR,
            "Variable '{variable}' is in a tainted position and used in a filter operation.",
            null),
    ERR_LITERAL_IN_TAINTED_POSITION("1046", DiagnosticSeverity.ERROR,
            "Literal '{literal}' is used in a tainted position.",
            null),
    ERR_CYCLE_IN_CONDITION_VARIABLES("1047", DiagnosticSeverity.ERROR,
            "Cycle detected in condition variables dependencies ({variables}).",
            null);

    static final String HREF_TEMPLATE = "https://www.vadalog.org/vadacode-manual/latest/diagnostic-codes.html#%s";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    private final String code;
    private final DiagnosticSeverity severity;
    private final String message;
    private final String description;

    DiagnosticCode(String code, DiagnosticSeverity severity, String message, String description) {
        this.code = code;
        this.severity = severity;
        this.message = message;
        this.description = description;
    }

    public String getCode() { return code; }
    public DiagnosticSeverity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public String getDescription() { return description; }

    public String getHref() {
        return String.format(HREF_TEMPLATE, code);
    }

    /**
     * Renders the message template. Placeholders without a value are kept.
     */
    public String format(Map<String, String> parameters) {
        Matcher matcher = PLACEHOLDER.matcher(message);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = parameters.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public static DiagnosticCode fromCode(String code) {
        for (DiagnosticCode value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown diagnostic code " + code);
    }
}
