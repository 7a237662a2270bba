package org.vadalog.vadacode;

import org.antlr.v4.runtime.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Classifies parser errors by the recognition exception or, when ANTLR
 * reports them without one, by the message it produced.
 */
public class VadalogParserErrorListener extends BaseErrorListener {
    private static final Logger log = LoggerFactory.getLogger(VadalogParserErrorListener.class);

    private final String uri;
    private final List<VadalogDiagnostic> diagnostics = new ArrayList<>();

    public VadalogParserErrorListener(String uri) {
        this.uri = uri;
    }

    public List<VadalogDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        log.debug("Parser error at {}:{} - {}", line, charPositionInLine, msg);
        Token offending = offendingSymbol instanceof Token ? (Token) offendingSymbol : null;
        String expected = "";
        Token current = offending;
        if (recognizer instanceof Parser) {
            Parser parser = (Parser) recognizer;
            expected = parser.getExpectedTokens().toString(parser.getVocabulary());
            current = parser.getCurrentToken();
        }

        int zeroBasedLine = line - 1;
        if (e instanceof NoViableAltException) {
            diagnostics.add(noViableAlternative(offending, zeroBasedLine, charPositionInLine));
        } else if (msg != null && msg.contains("mismatched input")) {
            diagnostics.add(diagnostic(zeroBasedLine, charPositionInLine, textLength(offending),
                    DiagnosticCode.ERR_PARSING_ERROR_EXPECTED_0, Map.of("token", expected)));
        } else if (msg != null && msg.contains("extraneous input")) {
            String extraneous = textOf(current);
            diagnostics.add(diagnostic(zeroBasedLine, charPositionInLine, extraneous.length(),
                    DiagnosticCode.EXTRANEOUS_INPUT_AT_0_EXPECTING_1,
                    Map.of("extraneous", extraneous, "expecting", expected)));
        } else if (msg != null && msg.contains("missing")) {
            if (current == null || current.getType() == Token.EOF) {
                diagnostics.add(diagnostic(zeroBasedLine, charPositionInLine, 1,
                        DiagnosticCode.MISSING_0_AT_EOF, Map.of("missing", expected)));
            } else {
                diagnostics.add(diagnostic(zeroBasedLine, charPositionInLine, textLength(current),
                        DiagnosticCode.MISSING_0_AT,
                        Map.of("expectedToken", expected, "currentToken", textOf(current))));
            }
        } else {
            diagnostics.add(diagnostic(zeroBasedLine, charPositionInLine, 1,
                    DiagnosticCode.UNKNOWN_PARSING_ERROR_0,
                    Map.of("message", msg != null ? msg : "<unknown error>")));
        }
    }

    private VadalogDiagnostic noViableAlternative(Token offending, int line, int column) {
        if (offending == null) {
            return diagnostic(line, column, 1, DiagnosticCode.ERR_UNEXPECTED_TOKEN, Collections.emptyMap());
        }
        if (offending.getType() == Token.EOF) {
            return diagnostic(line, column, textLength(offending), DiagnosticCode.ERR_UNEXPECTED_EOF,
                    Collections.emptyMap());
        }
        return diagnostic(line, column, textLength(offending), DiagnosticCode.ERR_UNEXPECTED_TOKEN_0,
                Map.of("token", VadalogLexerErrorListener.escape(textOf(offending))));
    }

    private VadalogDiagnostic diagnostic(int line, int column, int length, DiagnosticCode code,
                                         Map<String, String> parameters) {
        VadalogRange range = new VadalogRange(line, column, line, column + length);
        return VadalogDiagnostic.of(range, uri, code, parameters, null);
    }

    private static String textOf(Token token) {
        return token != null && token.getText() != null ? token.getText() : "";
    }

    private static int textLength(Token token) {
        return Math.max(1, textOf(token).length());
    }
}
