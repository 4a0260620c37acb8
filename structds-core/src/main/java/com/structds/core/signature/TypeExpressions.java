package com.structds.core.signature;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical rendering of type annotation expressions.
 *
 * <p>Two annotations that differ only in layout render identically:
 * <pre>{@code
 * TypeExpressions.normalize("Dict[ str ,\n    int ]")   // "Dict[str, int]"
 * TypeExpressions.normalize("int|None  # optional")     // "int | None"
 * }</pre>
 *
 * <p>String literals (forward references, {@code Literal["a"]}) are copied verbatim. Comments are
 * dropped, whitespace runs collapse, commas are followed by exactly one space unless a closing
 * bracket follows, {@code |} gets one space on each side, {@code :} is followed by one space,
 * and brackets hug their contents.
 */
public final class TypeExpressions {

    private enum AtomType { WORD, STRING, PUNCT }

    private record Atom(AtomType type, String text) {
        boolean is(String punct) {
            return type == AtomType.PUNCT && text.equals(punct);
        }

        boolean isCloser() {
            return is(")") || is("]") || is("}");
        }
    }

    private TypeExpressions() {
        // Utility class - no instantiation
    }

    /**
     * Normalizes an annotation expression.
     *
     * @param expression annotation source text, may be {@code null}
     * @return normalized text, or {@code null} if the input was {@code null}
     */
    public static String normalize(String expression) {
        if (expression == null) {
            return null;
        }
        return render(atoms(expression));
    }

    private static List<Atom> atoms(String text) {
        List<Atom> atoms = new ArrayList<>();
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '\\') {
                i++;
            } else if (c == '#') {
                while (i < length && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (startsString(text, i)) {
                int end = stringEnd(text, i);
                atoms.add(new Atom(AtomType.STRING, text.substring(i, end)));
                i = end;
            } else if (isWordChar(c)) {
                int start = i;
                while (i < length && isWordChar(text.charAt(i))) {
                    i++;
                }
                atoms.add(new Atom(AtomType.WORD, text.substring(start, i)));
            } else {
                atoms.add(new Atom(AtomType.PUNCT, String.valueOf(c)));
                i++;
            }
        }
        return atoms;
    }

    private static String render(List<Atom> atoms) {
        StringBuilder out = new StringBuilder();
        Atom previous = null;
        for (Atom atom : atoms) {
            if (previous != null) {
                out.append(separator(previous, atom));
            }
            out.append(atom.text());
            previous = atom;
        }
        return out.toString();
    }

    private static String separator(Atom previous, Atom current) {
        if (current.is(",") || current.is(":") || current.isCloser()) {
            return "";
        }
        if (current.is("|") || previous.is("|")) {
            return " ";
        }
        if (previous.is(",") || previous.is(":")) {
            return " ";
        }
        boolean previousIsOperand = previous.type() != AtomType.PUNCT;
        boolean currentIsOperand = current.type() != AtomType.PUNCT;
        return previousIsOperand && currentIsOperand ? " " : "";
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean startsString(String text, int index) {
        int i = index;
        while (i < text.length() && i - index < 2 && "rRbBuUfF".indexOf(text.charAt(i)) >= 0) {
            i++;
        }
        if (i >= text.length()) {
            return false;
        }
        char quote = text.charAt(i);
        if (quote != '\'' && quote != '"') {
            return false;
        }
        // a prefix must not be the tail of a longer identifier
        return i == index || index == 0 || !isWordChar(text.charAt(index - 1));
    }

    private static int stringEnd(String text, int index) {
        int i = index;
        while ("rRbBuUfF".indexOf(text.charAt(i)) >= 0) {
            i++;
        }
        char quote = text.charAt(i);
        boolean triple = text.startsWith(String.valueOf(quote).repeat(3), i);
        String terminator = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
        i += terminator.length();
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (text.startsWith(terminator, i)) {
                return i + terminator.length();
            } else {
                i++;
            }
        }
        return text.length();
    }
}
