package dumb.deduce.prop;

import dumb.deduce.Names;
import org.jetbrains.annotations.Nullable;

/**
 * Recursive descent parser for the standard propositional notation. Failures
 * are reported as values: a {@link Prefix} without a formula carries the
 * reason instead.
 */
public class FormulaParser {
    private final String input;
    private int pos;

    private FormulaParser(String input) {
        this.input = input;
    }

    /**
     * Parses the longest formula at the start of {@code s}. A variable name
     * is always consumed whole, so {@code x12} never parses as {@code x1}.
     */
    public static Prefix parsePrefix(String s) {
        var parser = new FormulaParser(s);
        try {
            var f = parser.parseFormula();
            return Prefix.of(f, s.substring(parser.pos));
        } catch (Failure e) {
            return Prefix.error(e.getMessage());
        }
    }

    public static boolean isFormula(String s) {
        var p = parsePrefix(s);
        return p.formula() != null && p.remainder().isEmpty();
    }

    public static Formula parse(String s) {
        var p = parsePrefix(s);
        if (p.formula() == null)
            throw new MalformedFormulaException(p.error(), s);
        if (!p.remainder().isEmpty())
            throw new MalformedFormulaException("Unexpected trailing text '" + p.remainder() + "'", s);
        return p.formula();
    }

    private int peek() {
        return pos < input.length() ? input.charAt(pos) : -1;
    }

    private Formula parseFormula() {
        var c = peek();
        if (c == -1) throw new Failure(pos == 0 ? "Empty string" : "Unexpected end of input at " + pos);
        if (c == '~') {
            pos++;
            return new Formula.Not(parseFormula());
        }
        if (c == 'T' || c == 'F') {
            pos++;
            return c == 'T' ? Formula.Const.T : Formula.Const.F;
        }
        if (c >= 'p' && c <= 'z') return parseVariable();
        if (c == '(') return parseBinary();
        throw new Failure("Unexpected '" + (char) c + "' at " + pos);
    }

    private Formula.Var parseVariable() {
        var start = pos++;
        while (peek() != -1 && Names.isDigit((char) peek())) pos++;
        return new Formula.Var(input.substring(start, pos));
    }

    /** {@code (A op B)}; the root operator is the one right after the whole left operand. */
    private Formula.Bin parseBinary() {
        var open = pos++;
        var first = parseFormula();
        var op = Op.prefixOf(input.substring(pos))
                .orElseThrow(() -> new Failure("Expected a binary operator at " + pos + " for '(' at " + open));
        pos += op.symbol.length();
        var second = parseFormula();
        if (peek() != ')')
            throw new Failure("Expected ')' at " + pos + " to close '(' at " + open);
        pos++;
        return new Formula.Bin(op, first, second);
    }

    /**
     * Result of {@link #parsePrefix(String)}: either a formula and the
     * unparsed suffix, or no formula and an error message.
     */
    public record Prefix(@Nullable Formula formula, String remainder, @Nullable String error) {
        static Prefix of(Formula f, String remainder) {
            return new Prefix(f, remainder, null);
        }

        static Prefix error(String message) {
            return new Prefix(null, "", message);
        }

        public boolean ok() {
            return formula != null;
        }
    }

    private static final class Failure extends RuntimeException {
        Failure(String message) {
            super(message, null, false, false);
        }
    }
}
