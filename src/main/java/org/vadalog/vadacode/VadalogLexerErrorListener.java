package org.vadalog.vadacode;

import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.misc.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Collects lexer errors as diagnostics instead of printing them.
 */
public class VadalogLexerErrorListener extends BaseErrorListener {
    private static final Logger log = LoggerFactory.getLogger(VadalogLexerErrorListener.class);

    private final String uri;
    private final List<VadalogDiagnostic> diagnostics = new ArrayList<>();

    public VadalogLexerErrorListener(String uri) {
        this.uri = uri;
    }

    public List<VadalogDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        log.debug("Lexer error at {}:{} - {}", line, charPositionInLine, msg);
        String unexpected = "";
        if (recognizer instanceof Lexer) {
            Lexer lexer = (Lexer) recognizer;
            CharStream input = lexer.getInputStream();
            int start = lexer._tokenStartCharIndex;
            int stop = Math.min(input.index(), input.size() - 1);
            if (start >= 0 && stop >= start) {
                unexpected = input.getText(Interval.of(start, stop));
            }
        }

        if (!unexpected.isEmpty()) {
            VadalogRange range = new VadalogRange(line - 1, charPositionInLine, line - 1,
                    charPositionInLine + unexpected.length());
            diagnostics.add(VadalogDiagnostic.of(range, uri, DiagnosticCode.ERR_UNRECOGNIZED_TOKEN_0,
                    Map.of("token", escape(unexpected)), null));
        } else {
            VadalogRange range = new VadalogRange(line - 1, charPositionInLine, line - 1, charPositionInLine + 1);
            diagnostics.add(VadalogDiagnostic.of(range, uri, DiagnosticCode.ERR_UNRECOGNIZED_TOKEN,
                    Collections.emptyMap(), null));
        }
    }

    static String escape(String text) {
        return text.replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
    }
}
