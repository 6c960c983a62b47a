package dumb.deduce.fol;

/** A function or relation name with its number of arguments. */
public record Arity(String name, int arity) {
    @Override
    public String toString() {
        return name + "/" + arity;
    }
}
