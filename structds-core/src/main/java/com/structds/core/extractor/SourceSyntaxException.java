package com.structds.core.extractor;

/**
 * Thrown when a source file cannot be parsed.
 *
 * <p>A syntax error is local to one file. Callers record it and continue with the remaining
 * files of the repository.
 */
public class SourceSyntaxException extends Exception {

    private final String filePath;
    private final int line;
    private final int column;
    private final String diagnostic;

    /**
     * Creates a syntax error.
     *
     * @param filePath path of the offending file, relative to the repository root
     * @param line 1-based line of the error
     * @param column 1-based column of the error
     * @param diagnostic parser message
     */
    public SourceSyntaxException(String filePath, int line, int column, String diagnostic) {
        super(filePath + ":" + line + ":" + column + ": " + diagnostic);
        this.filePath = filePath;
        this.line = line;
        this.column = column;
        this.diagnostic = diagnostic;
    }

    public String getFilePath() {
        return filePath;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getDiagnostic() {
        return diagnostic;
    }
}
