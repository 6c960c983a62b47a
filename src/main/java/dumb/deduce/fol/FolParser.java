package dumb.deduce.fol;

import dumb.deduce.Names;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for first-order terms and formulas. Input is
 * expected to be well formed; anything else fails with an
 * {@link IllegalArgumentException} naming the offending position.
 */
public class FolParser {
    private final String input;
    private int pos;

    private FolParser(String input) {
        this.input = input;
    }

    public record Parsed<T>(T value, String rest) {
    }

    public static Parsed<Term> parseTermPrefix(String s) {
        var p = new FolParser(s);
        var t = p.term();
        return new Parsed<>(t, s.substring(p.pos));
    }

    public static Parsed<Formula> parseFormulaPrefix(String s) {
        var p = new FolParser(s);
        var f = p.formula();
        return new Parsed<>(f, s.substring(p.pos));
    }

    public static Term parseTerm(String s) {
        return whole(parseTermPrefix(s), s);
    }

    public static Formula parseFormula(String s) {
        return whole(parseFormulaPrefix(s), s);
    }

    private static <T> T whole(Parsed<T> p, String s) {
        if (!p.rest().isEmpty())
            throw new IllegalArgumentException("Unexpected trailing text '" + p.rest() + "' in '" + s + "'");
        return p.value();
    }

    private int peek() {
        return pos < input.length() ? input.charAt(pos) : -1;
    }

    private IllegalArgumentException fail(String what) {
        var at = pos < input.length() ? "'" + input.charAt(pos) + "' at " + pos : "end of input";
        return new IllegalArgumentException("Expected " + what + " but found " + at + " in '" + input + "'");
    }

    private void expect(char c) {
        if (peek() != c) throw fail("'" + c + "'");
        pos++;
    }

    private String name() {
        var start = pos;
        while (peek() != -1 && Names.isAlnum((char) peek())) pos++;
        return input.substring(start, pos);
    }

    private Term term() {
        var c = peek();
        if (c == '_') {
            pos++;
            return new Term.Const("_");
        }
        if (c == -1 || !Names.isAlnum((char) c)) throw fail("a term");
        var start = pos;
        var name = name();
        if (Names.isConstant(name)) return new Term.Const(name);
        if (Names.isVariable(name)) return new Term.Var(name);
        if (Names.isFunction(name)) return new Term.App(name, arguments(false));
        pos = start;
        throw fail("a term");
    }

    /** {@code (t1,...,tn)}, at least one argument unless {@code allowEmpty}. */
    private List<Term> arguments(boolean allowEmpty) {
        expect('(');
        var args = new ArrayList<Term>();
        if (allowEmpty && peek() == ')') {
            pos++;
            return args;
        }
        args.add(term());
        while (peek() == ',') {
            pos++;
            args.add(term());
        }
        expect(')');
        return args;
    }

    private Formula formula() {
        var c = peek();
        if (c == '~') {
            pos++;
            return new Formula.Not(formula());
        }
        if (c == '(') {
            pos++;
            var first = formula();
            var op = binaryOperator();
            var second = formula();
            expect(')');
            return new Formula.Bin(op, first, second);
        }
        if (c == 'A' || c == 'E') {
            pos++;
            var variable = name();
            if (!Names.isVariable(variable)) throw fail("a quantified variable");
            expect('[');
            var body = formula();
            expect(']');
            return new Formula.Quant(String.valueOf((char) c), variable, body);
        }
        if (c != -1 && Names.isRelationStart((char) c)) {
            var name = name();
            return new Formula.Rel(name, arguments(true));
        }
        var left = term();
        expect('=');
        return new Formula.Eq(left, term());
    }

    private String binaryOperator() {
        if (input.startsWith(Names.IMPLIES, pos)) {
            pos += 2;
            return Names.IMPLIES;
        }
        var c = peek();
        if (c == '&' || c == '|') {
            pos++;
            return String.valueOf((char) c);
        }
        throw fail("one of & | ->");
    }
}
