package dumb.deduce;

import java.util.Set;

/**
 * Character-class predicates for the tokens of the propositional and
 * first-order notations.
 */
public enum Names {
    ;

    public static final String NOT = "~";
    public static final String AND = "&", OR = "|", IMPLIES = "->", IFF = "<->", XOR = "+", NAND = "-&", NOR = "-|";
    public static final String TRUE = "T", FALSE = "F";
    public static final String EQUALS = "=";
    public static final String FORALL = "A", EXISTS = "E";

    private static final Set<String> PROPOSITIONAL_BINARY = Set.of(AND, OR, IMPLIES, IFF, XOR, NAND, NOR);
    private static final Set<String> FIRST_ORDER_BINARY = Set.of(AND, OR, IMPLIES);

    /** {@code [p-z][0-9]*} */
    public static boolean isPropVariable(String s) {
        if (s.isEmpty() || s.charAt(0) < 'p' || s.charAt(0) > 'z') return false;
        for (var i = 1; i < s.length(); i++)
            if (!isDigit(s.charAt(i))) return false;
        return true;
    }

    public static boolean isPropConstant(String s) {
        return TRUE.equals(s) || FALSE.equals(s);
    }

    public static boolean isUnary(String s) {
        return NOT.equals(s);
    }

    public static boolean isPropBinary(String s) {
        return PROPOSITIONAL_BINARY.contains(s);
    }

    public static boolean isFolBinary(String s) {
        return FIRST_ORDER_BINARY.contains(s);
    }

    /** {@code [u-z][0-9a-zA-Z]*} */
    public static boolean isVariable(String s) {
        return !s.isEmpty() && isVariableStart(s.charAt(0)) && isAlnum(s);
    }

    /** {@code [0-9a-d][0-9a-zA-Z]*} or {@code _} */
    public static boolean isConstant(String s) {
        return "_".equals(s) || (!s.isEmpty() && isConstantStart(s.charAt(0)) && isAlnum(s));
    }

    /** {@code [f-t][0-9a-zA-Z]*} */
    public static boolean isFunction(String s) {
        return !s.isEmpty() && isFunctionStart(s.charAt(0)) && isAlnum(s);
    }

    /** {@code [F-T][0-9a-zA-Z]*} */
    public static boolean isRelation(String s) {
        return !s.isEmpty() && isRelationStart(s.charAt(0)) && isAlnum(s);
    }

    public static boolean isQuantifier(String s) {
        return FORALL.equals(s) || EXISTS.equals(s);
    }

    public static boolean isEquality(String s) {
        return EQUALS.equals(s);
    }

    static boolean isVariableStart(char c) {
        return c >= 'u' && c <= 'z';
    }

    static boolean isConstantStart(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'd');
    }

    static boolean isFunctionStart(char c) {
        return c >= 'f' && c <= 't';
    }

    public static boolean isRelationStart(char c) {
        return c >= 'F' && c <= 'T';
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isAlnum(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlnum(String s) {
        for (var i = 0; i < s.length(); i++)
            if (!isAlnum(s.charAt(i))) return false;
        return true;
    }
}
