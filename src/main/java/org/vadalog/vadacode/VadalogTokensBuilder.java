package org.vadalog.vadacode;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

import java.util.*;

/**
 * Turns the lexer token stream into {@link VadalogToken}s. Comments and
 * punctuation produce no token.
 */
public class VadalogTokensBuilder {

    /**
     * Builds the tokens of a fully lexed stream, keyed by the ANTLR token
     * index so that the tree walker can find the token of a terminal node.
     */
    public Map<Integer, VadalogToken> buildFrom(CommonTokenStream tokenStream, String uri) {
        tokenStream.fill();
        Map<Integer, VadalogToken> tokens = new LinkedHashMap<>();
        for (Token token : tokenStream.getTokens()) {
            TokenKind kind = kindOf(token.getType());
            if (kind == null) {
                continue;
            }
            int length = token.getStopIndex() - token.getStartIndex() + 1;
            tokens.put(token.getTokenIndex(), new VadalogToken(token.getLine() - 1, token.getCharPositionInLine(),
                    length, uri, token.getText(), kind));
        }
        return tokens;
    }

    static TokenKind kindOf(int tokenType) {
        switch (tokenType) {
            case VadalogLexer.AT:
                return TokenKind.AT;
            case VadalogLexer.ID:
            case VadalogLexer.NOT:
            case VadalogLexer.MSUM:
            case VadalogLexer.MPROD:
            case VadalogLexer.MCOUNT:
            case VadalogLexer.MUNION:
            case VadalogLexer.MMAX:
            case VadalogLexer.MMIN:
            case VadalogLexer.UNION:
            case VadalogLexer.LIST:
            case VadalogLexer.SET:
            case VadalogLexer.SUM:
            case VadalogLexer.PROD:
            case VadalogLexer.AVG:
            case VadalogLexer.COUNT:
            case VadalogLexer.MIN:
            case VadalogLexer.MAX:
                return TokenKind.ID;
            case VadalogLexer.VAR:
                return TokenKind.VARIABLE;
            case VadalogLexer.ANON_VAR:
                return TokenKind.ANON_VAR;
            case VadalogLexer.INTEGER:
                return TokenKind.INT;
            case VadalogLexer.DOUBLE:
                return TokenKind.DOUBLE;
            case VadalogLexer.DATE:
                return TokenKind.DATE;
            case VadalogLexer.STRING:
                return TokenKind.STRING;
            case VadalogLexer.TRUE:
            case VadalogLexer.FALSE:
                return TokenKind.BOOLEAN;
            case VadalogLexer.IMPLICATION:
                return TokenKind.IMPLICATION;
            case VadalogLexer.EQ:
                return TokenKind.EQ;
            case VadalogLexer.DOT:
                return TokenKind.DOT;
            default:
                return null;
        }
    }
}
