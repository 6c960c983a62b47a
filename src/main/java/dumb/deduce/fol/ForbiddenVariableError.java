package dumb.deduce.fol;

import dumb.deduce.Names;

/**
 * A term to be substituted contains a variable that is forbidden where it
 * would land, either explicitly or because a quantifier would capture it.
 */
public class ForbiddenVariableError extends RuntimeException {
    private final String variableName;

    public ForbiddenVariableError(String variableName) {
        super(variableName);
        if (!Names.isVariable(variableName))
            throw new IllegalArgumentException("Not a variable: " + variableName);
        this.variableName = variableName;
    }

    public String variableName() {
        return variableName;
    }
}
