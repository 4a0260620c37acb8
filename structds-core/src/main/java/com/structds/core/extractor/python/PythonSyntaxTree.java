package com.structds.core.extractor.python;

import com.structds.core.extractor.SourceSyntaxException;
import com.structds.parser.Python3Lexer;
import com.structds.parser.Python3Parser;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Parse tree of one Python file together with the character and token streams it was built from.
 *
 * <p>Parsing runs in SLL mode first and falls back to full LL prediction only when SLL fails,
 * which is the usual two-stage setup for ANTLR grammars of this size.
 */
final class PythonSyntaxTree {

    private final CharStream input;
    private final CommonTokenStream tokens;
    private final Python3Parser.File_inputContext root;

    private PythonSyntaxTree(CharStream input, CommonTokenStream tokens, Python3Parser.File_inputContext root) {
        this.input = input;
        this.tokens = tokens;
        this.root = root;
    }

    /**
     * Parses normalized source text.
     *
     * @param filePath path used in diagnostics
     * @param text source with LF line endings
     * @return the parse tree
     * @throws SourceSyntaxException at the first lexical or syntax error
     */
    static PythonSyntaxTree parse(String filePath, String text) throws SourceSyntaxException {
        SyntaxErrorListener listener = new SyntaxErrorListener();
        CharStream input = CharStreams.fromString(text, filePath);
        Python3Lexer lexer = new Python3Lexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        try {
            tokens.fill();

            Python3Parser parser = new Python3Parser(tokens);
            parser.removeErrorListeners();
            parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
            parser.setErrorHandler(new BailErrorStrategy());
            Python3Parser.File_inputContext root;
            try {
                root = parser.file_input();
            } catch (ParseCancellationException e) {
                tokens.seek(0);
                parser.reset();
                parser.addErrorListener(listener);
                parser.setErrorHandler(new DefaultErrorStrategy());
                parser.getInterpreter().setPredictionMode(PredictionMode.LL);
                root = parser.file_input();
            }
            return new PythonSyntaxTree(input, tokens, root);
        } catch (SyntaxErrorListener.SyntaxAbort e) {
            throw new SourceSyntaxException(filePath, e.line(), e.column(), e.diagnostic());
        }
    }

    Python3Parser.File_inputContext root() {
        return root;
    }

    int length() {
        return input.size();
    }

    /**
     * Returns the source text between two character indexes, both inclusive.
     */
    String text(int start, int stop) {
        if (stop < start) {
            return "";
        }
        return input.getText(Interval.of(start, stop));
    }

    /**
     * Returns the source text a rule matched.
     */
    String text(ParserRuleContext context) {
        return text(context.getStart().getStartIndex(), context.getStop().getStopIndex());
    }

    /**
     * Returns the last token of a rule that is not a NEWLINE, INDENT or DEDENT.
     */
    Token lastSignificant(ParserRuleContext context) {
        int index = context.getStop().getTokenIndex();
        Token token = tokens.get(index);
        while (index > 0 && isLayout(token)) {
            token = tokens.get(--index);
        }
        return token;
    }

    private static boolean isLayout(Token token) {
        int type = token.getType();
        return type == Python3Parser.NEWLINE || type == Python3Parser.INDENT || type == Python3Parser.DEDENT;
    }
}
