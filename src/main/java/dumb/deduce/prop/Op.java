package dumb.deduce.prop;

import dumb.deduce.Names;

import java.util.Optional;

public enum Op {
    AND(Names.AND) {
        @Override
        public boolean apply(boolean a, boolean b) {
            return a && b;
        }
    },
    OR(Names.OR) {
        @Override
        public boolean apply(boolean a, boolean b) {
            return a || b;
        }
    },
    IMPLIES(Names.IMPLIES) {
        @Override
        public boolean apply(boolean a, boolean b) {
            return !a || b;
        }
    },
    IFF(Names.IFF) {
        @Override
        public boolean apply(boolean a, boolean b) {
            return a == b;
        }
    },
    XOR(Names.XOR) {
        @Override
        public boolean apply(boolean a, boolean b) {
            return a != b;
        }
    },
    NAND(Names.NAND) {
        @Override
        public boolean apply(boolean a, boolean b) {
            return !(a && b);
        }
    },
    NOR(Names.NOR) {
        @Override
        public boolean apply(boolean a, boolean b) {
            return !(a || b);
        }
    };

    public final String symbol;

    Op(String symbol) {
        this.symbol = symbol;
    }

    public abstract boolean apply(boolean a, boolean b);

    public static Optional<Op> of(String symbol) {
        for (var op : values())
            if (op.symbol.equals(symbol)) return Optional.of(op);
        return Optional.empty();
    }

    /** The operator spelled at the start of {@code s}, longest match first. */
    static Optional<Op> prefixOf(String s) {
        if (s.startsWith(IFF.symbol)) return Optional.of(IFF);
        for (var op : new Op[]{IMPLIES, NAND, NOR, AND, OR, XOR})
            if (s.startsWith(op.symbol)) return Optional.of(op);
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
