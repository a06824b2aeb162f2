package dumb.wkrq;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the textual formula syntax:
 * <pre>
 *   P(a) &amp; ~Q(b) -&gt; R(a, X)          connectives ~ ¬  &amp; ∧  | ∨  -&gt; →  &lt;-&gt; ↔
 *   [forall X Human(X)]Mortal(X)       also [exists X ...], [∀X ...], [∃X ...]
 *   Human*(socrates)                   bilateral dual, ACrQ only
 * </pre>
 * Implication is right-associative and binds loosest after {@code <->}, which is expanded into two
 * implications. In term position an identifier starting with an upper-case letter is a variable.
 */
public class FormulaParser {
    private final String text;
    @Nullable
    private final SyntaxMode mode;
    private int pos;

    private FormulaParser(String text, @Nullable SyntaxMode mode) {
        this.text = text;
        this.mode = mode;
    }

    /** Parses a wKrQ formula; the dual marker {@code *} is not part of wKrQ. */
    public static Formula parse(String text) throws ParseException {
        return parse(text, null);
    }

    /**
     * @param mode ACrQ syntax mode, or {@code null} for plain wKrQ
     */
    public static Formula parse(String text, @Nullable SyntaxMode mode) throws ParseException {
        var p = new FormulaParser(text, mode);
        var f = p.formula();
        p.skipWhitespace();
        if (!p.atEnd()) throw p.error("Unexpected '" + p.text.charAt(p.pos) + "'");
        return f;
    }

    public static Inference parseInference(String text) throws ParseException {
        return parseInference(text, null);
    }

    /** Parses {@code A, B |- C}. The premise list may be empty. */
    public static Inference parseInference(String text, @Nullable SyntaxMode mode) throws ParseException {
        var turnstile = text.indexOf("|-");
        if (turnstile < 0)
            throw new ParseException("Missing '|-' in inference", 1, text);
        var conclusionText = text.substring(turnstile + 2);
        if (conclusionText.contains("|-"))
            throw new ParseException("More than one '|-' in inference", turnstile + text.substring(turnstile + 2).indexOf("|-") + 3, text);

        List<Formula> premises = new ArrayList<>();
        var depth = 0;
        var start = 0;
        for (var i = 0; i <= turnstile; i++) {
            var c = i < turnstile ? text.charAt(i) : ',';
            if (c == '(' || c == '[') depth++;
            else if (c == ')' || c == ']') depth--;
            else if (c == ',' && depth == 0) {
                var piece = text.substring(start, i);
                if (!piece.isBlank()) premises.add(parseAt(piece, mode, start, text));
                else if (i < turnstile) throw new ParseException("Empty premise", start + 1, text);
                start = i + 1;
            }
        }
        return new Inference(premises, parseAt(conclusionText, mode, turnstile + 2, text));
    }

    /** Parses a fragment and reports errors at their column in the whole input. */
    private static Formula parseAt(String fragment, @Nullable SyntaxMode mode, int offset, String whole) throws ParseException {
        try {
            return parse(fragment, mode);
        } catch (ParseException e) {
            throw new ParseException(e.reason, e.column + offset, whole);
        }
    }

    private Formula formula() throws ParseException {
        var left = implication();
        while (consume("<->") || consume("↔")) {
            var right = implication();
            left = Formula.and(Formula.implies(left, right), Formula.implies(right, left));
        }
        return left;
    }

    private Formula implication() throws ParseException {
        var left = disjunction();
        if (consume("->") || consume("→")) return Formula.implies(left, implication());
        return left;
    }

    private Formula disjunction() throws ParseException {
        var left = conjunction();
        while (peekOr()) {
            pos++;
            left = Formula.or(left, conjunction());
        }
        return left;
    }

    private boolean peekOr() {
        skipWhitespace();
        if (atEnd()) return false;
        var c = text.charAt(pos);
        if (c == '∨') return true;
        return c == '|' && !text.startsWith("|-", pos);
    }

    private Formula conjunction() throws ParseException {
        var left = unary();
        while (consume("&") || consume("∧")) left = Formula.and(left, unary());
        return left;
    }

    private Formula unary() throws ParseException {
        skipWhitespace();
        var start = pos;
        if (consume("~") || consume("¬")) {
            var operand = unary();
            if (mode != null && operand.isAtomic()) {
                if (mode == SyntaxMode.BILATERAL)
                    throw new ParseException("Negated atom " + operand + " in bilateral mode, write the dual with '*'", start + 1, text);
                return Bilateral.star(Formula.not(operand));
            }
            return Formula.not(operand);
        }
        if (peek('[')) return quantified();
        if (consume("(")) {
            var f = formula();
            expect(")");
            return f;
        }
        return atomic();
    }

    private Formula quantified() throws ParseException {
        expect("[");
        skipWhitespace();
        Formula.Quantifier kind;
        if (consume("∀")) kind = Formula.Quantifier.FORALL;
        else if (consume("∃")) kind = Formula.Quantifier.EXISTS;
        else {
            var start = pos;
            var word = identifier("quantifier");
            kind = switch (word) {
                case "forall" -> Formula.Quantifier.FORALL;
                case "exists" -> Formula.Quantifier.EXISTS;
                default -> throw new ParseException("Unknown quantifier '" + word + "'", start + 1, text);
            };
        }
        skipWhitespace();
        var varStart = pos;
        var name = identifier("variable");
        if (!name.matches("[A-Z][A-Za-z0-9_]*"))
            throw new ParseException("Quantified variable must start with an upper-case letter: " + name, varStart + 1, text);
        var restriction = formula();
        expect("]");
        var matrix = unary();
        return new Formula.Quantified(kind, new Term.Var(name), restriction, matrix);
    }

    private Formula atomic() throws ParseException {
        var name = identifier("formula");
        var dual = false;
        if (peek('*')) {
            if (mode == null || mode == SyntaxMode.TRANSPARENT)
                throw new ParseException("Dual predicate " + name + "* is not allowed " + (mode == null ? "in wKrQ" : "in transparent mode"), pos + 1, text);
            pos++;
            dual = true;
        }
        List<Term> terms = new ArrayList<>();
        var parens = consume("(");
        if (parens) {
            do {
                skipWhitespace();
                var start = pos;
                var term = identifier("term");
                try {
                    terms.add(Term.of(term));
                } catch (IllegalArgumentException e) {
                    throw new ParseException(e.getMessage(), start + 1, text);
                }
            } while (consume(","));
            expect(")");
        }
        if (dual) return new Formula.Bilateral(name, terms, true);
        return parens ? new Formula.Predicate(name, terms) : Formula.atom(name);
    }

    private String identifier(String what) throws ParseException {
        skipWhitespace();
        var start = pos;
        while (!atEnd() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) pos++;
        if (start == pos)
            throw error(atEnd() ? "Expected " + what + " but input ended" : "Expected " + what + " at '" + text.charAt(pos) + "'");
        return text.substring(start, pos);
    }

    private void expect(String s) throws ParseException {
        if (!consume(s))
            throw error("Expected '" + s + "'" + (atEnd() ? " but input ended" : " at '" + text.charAt(pos) + "'"));
    }

    private boolean consume(String s) {
        skipWhitespace();
        if (!text.startsWith(s, pos)) return false;
        pos += s.length();
        return true;
    }

    private boolean peek(char c) {
        skipWhitespace();
        return !atEnd() && text.charAt(pos) == c;
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(pos))) pos++;
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private ParseException error(String message) {
        return new ParseException(message, pos + 1, text);
    }

    /** How ACrQ input spells negative evidence. */
    public enum SyntaxMode {
        /** {@code ~R(a)} is read as {@code R*(a)}; the {@code *} marker is rejected. */
        TRANSPARENT,
        /** Duals must be written {@code R*(a)}; negating an atom is rejected. */
        BILATERAL,
        /** Both spellings are accepted. */
        MIXED
    }

    public record Inference(List<Formula> premises, Formula conclusion) {
        public Inference {
            premises = List.copyOf(premises);
        }

        @Override
        public String toString() {
            var sb = new StringBuilder();
            for (var i = 0; i < premises.size(); i++) sb.append(i > 0 ? ", " : "").append(premises.get(i));
            return sb.append(premises.isEmpty() ? "|- " : " |- ").append(conclusion).toString();
        }
    }

    public static class ParseException extends Exception {
        private final String reason;
        private final int column;
        private final String input;

        public ParseException(String reason, int column, String input) {
            super(reason + " at column " + column + ": " + input);
            this.reason = reason;
            this.column = column;
            this.input = input;
        }

        /** 1-based position in the input. */
        public int column() {
            return column;
        }

        public String reason() {
            return reason;
        }

        public String input() {
            return input;
        }
    }
}
