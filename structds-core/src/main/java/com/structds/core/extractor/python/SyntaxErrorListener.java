package com.structds.core.extractor.python;

import com.structds.parser.Python3Parser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.IntervalSet;

/**
 * Error listener that stops lexing or parsing at the first error.
 *
 * <p>ANTLR reports are translated to the diagnostics a Python interpreter prints for the same
 * input, so a failure reads {@code invalid syntax} rather than {@code mismatched input}.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        String diagnostic = recognizer instanceof Lexer
            ? lexerDiagnostic((Lexer) recognizer, msg, e)
            : parserDiagnostic((Parser) recognizer, (Token) offendingSymbol, e);
        throw new SyntaxAbort(line, charPositionInLine + 1, diagnostic);
    }

    private static String lexerDiagnostic(Lexer lexer, String msg, RecognitionException e) {
        if (e == null) {
            return msg;
        }
        int start = lexer._tokenStartCharIndex;
        String head = lexer._input.getText(Interval.of(start, start + 2));
        if (head.startsWith("\\")) {
            return "unexpected character after line continuation character";
        }
        if (head.matches("(?s)[rRuUbBfF]{0,2}['\"].*")) {
            return "unterminated string literal";
        }
        return "invalid character '" + head.substring(0, head.offsetByCodePoints(0, 1)) + "'";
    }

    private static String parserDiagnostic(Parser parser, Token offending, RecognitionException e) {
        if (offending != null && offending.getType() == Python3Parser.INDENT) {
            return "unexpected indent";
        }
        IntervalSet expected = e != null ? e.getExpectedTokens() : parser.getExpectedTokens();
        if (expected != null && expected.contains(Python3Parser.INDENT)) {
            return "expected an indented block";
        }
        return "invalid syntax";
    }

    /**
     * Unchecked carrier for the first error, converted to a checked exception by the caller.
     */
    static final class SyntaxAbort extends RuntimeException {

        private final int line;
        private final int column;
        private final String diagnostic;

        SyntaxAbort(int line, int column, String diagnostic) {
            super(line + ":" + column + ": " + diagnostic, null, false, false);
            this.line = line;
            this.column = column;
            this.diagnostic = diagnostic;
        }

        int line() {
            return line;
        }

        int column() {
            return column;
        }

        String diagnostic() {
            return diagnostic;
        }
    }
}
