package dumb.deduce.prop;

/** The text is not the standard representation of a propositional formula. */
public class MalformedFormulaException extends IllegalArgumentException {
    private final String text;

    public MalformedFormulaException(String message, String text) {
        super(message + ": '" + text + "'");
        this.text = text;
    }

    public String text() {
        return text;
    }
}
