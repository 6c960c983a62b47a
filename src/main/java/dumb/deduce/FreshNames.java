package dumb.deduce;

/**
 * Sequence of fresh propositional variable names ({@code z1, z2, ...}).
 * One instance never repeats a name.
 */
public class FreshNames {
    private final String prefix;
    private int next = 1;

    public FreshNames() {
        this("z");
    }

    public FreshNames(String prefix) {
        if (!Names.isPropVariable(prefix) || prefix.length() != 1)
            throw new IllegalArgumentException("Fresh name prefix must be a single letter in [p-z]: " + prefix);
        this.prefix = prefix;
    }

    public String next() {
        return prefix + next++;
    }
}
