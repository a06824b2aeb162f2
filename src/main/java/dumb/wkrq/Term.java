package dumb.wkrq;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

sealed public interface Term permits Term.Const, Term.Var {

    static Term of(String name) {
        return Character.isUpperCase(name.charAt(0)) ? new Var(name) : new Const(name);
    }

    String name();

    default boolean isGround() {
        return this instanceof Const;
    }

    record Const(String name) implements Term {
        public Const {
            requireNonNull(name);
            if (name.isEmpty() || Character.isUpperCase(name.charAt(0)))
                throw new IllegalArgumentException("Constant name must not start with an upper-case letter: " + name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Var(String name) implements Term {
        private static final Pattern NAME = Pattern.compile("^[A-Z][A-Za-z0-9_]*$");

        public Var {
            requireNonNull(name);
            if (!NAME.matcher(name).matches())
                throw new IllegalArgumentException("Variable name must start with an upper-case letter: " + name);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
