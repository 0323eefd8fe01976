package io.github.cyfko.boolexpr.sexpr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic immutable symbolic-expression tree made of nil, atom and pair nodes.
 * <p>
 * Sequences are built as right-nested {@link SCons} chains terminated by {@link #NIL}.
 * Heads may themselves be sequences, so {@code (AND T (NOT F))} is a three element list
 * whose last element is a two element list.
 * </p>
 *
 * <pre>{@code
 * SExpr tree = SExpr.list(SExpr.AND, SExpr.T, SExpr.list(SExpr.NOT, SExpr.F));
 * tree.toString();   // "(AND T (NOT F))"
 * tree.elements();   // Optional[[AND, T, (NOT F)]]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface SExpr {

    /** The empty tree. */
    SExpr NIL = new SNil();

    SAtom T = new SAtom("T");
    SAtom F = new SAtom("F");
    SAtom AND = new SAtom("AND");
    SAtom OR = new SAtom("OR");
    SAtom NOT = new SAtom("NOT");
    SAtom IF = new SAtom("IF");

    static SAtom atom(String name) {
        return new SAtom(name);
    }

    static SExpr cons(SExpr head, SExpr tail) {
        return new SCons(head, tail);
    }

    static SExpr list(SExpr... items) {
        return list(List.of(items));
    }

    /**
     * Builds a nil-terminated sequence holding the given items in order.
     *
     * @param items the elements, none of them null
     * @return {@link #NIL} for an empty list, a {@link SCons} chain otherwise
     */
    static SExpr list(List<? extends SExpr> items) {
        SExpr result = NIL;
        for (int i = items.size() - 1; i >= 0; i--) {
            result = new SCons(items.get(i), result);
        }
        return result;
    }

    /**
     * Returns the elements of a proper list.
     *
     * @return the elements in order, an empty list for {@link #NIL}, or {@link Optional#empty()}
     *         when this tree is an atom or a sequence whose last tail is not {@link #NIL}
     */
    default Optional<List<SExpr>> elements() {
        List<SExpr> items = new ArrayList<>();
        SExpr current = this;
        while (current instanceof SCons cons) {
            items.add(cons.head());
            current = cons.tail();
        }
        return current instanceof SNil ? Optional.of(List.copyOf(items)) : Optional.empty();
    }

    /**
     * Replaces one-element sequences by their single element, repeatedly.
     * <p>
     * {@code (T)} becomes {@code T} and {@code ((AND T F))} becomes {@code (AND T F)}.
     * Any other tree is returned unchanged.
     * </p>
     *
     * @return the innermost tree that is not a one-element sequence
     */
    default SExpr unwrapSingleton() {
        SExpr current = this;
        while (current instanceof SCons cons && cons.tail() instanceof SNil) {
            current = cons.head();
        }
        return current;
    }

    /**
     * Renders a tree in canonical form, keeping at most {@code maxLength} characters.
     * <p>
     * Nested lists are expanded with an explicit work stack, so arbitrarily deep trees render without
     * growing the call stack. A rendering cut at {@code maxLength} ends with {@code ...}.
     * </p>
     *
     * <pre>{@code
     * SExpr.render(SExpr.list(SExpr.AND, SExpr.T, SExpr.F), 100); // "(AND T F)"
     * SExpr.render(SExpr.list(SExpr.AND, SExpr.T, SExpr.F), 4);   // "(AND..."
     * }</pre>
     *
     * @param tree      the tree to render, {@code null} renders as {@code "null"}
     * @param maxLength the character budget, must be positive
     * @return the canonical rendering, possibly truncated
     */
    static String render(SExpr tree, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
        }
        if (tree == null) {
            return "null";
        }

        StringBuilder out = new StringBuilder();
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(tree);

        while (!pending.isEmpty() && out.length() <= maxLength) {
            Object next = pending.pop();
            if (!(next instanceof SCons cons)) {
                out.append(next);
                continue;
            }

            // pushed in reverse: "(" head " " head ... [" . " tail] ")"
            List<Object> parts = new ArrayList<>();
            parts.add("(");
            SExpr current = cons;
            while (current instanceof SCons link) {
                if (current != cons) parts.add(" ");
                parts.add(link.head());
                current = link.tail();
            }
            if (!(current instanceof SNil)) {
                parts.add(" . ");
                parts.add(current);
            }
            parts.add(")");
            for (int i = parts.size() - 1; i >= 0; i--) {
                pending.push(parts.get(i));
            }
        }

        if (out.length() > maxLength) {
            out.setLength(maxLength);
            out.append("...");
        }
        return out.toString();
    }

    record SNil() implements SExpr {
        @Override
        public String toString() {
            return "()";
        }
    }

    record SAtom(String name) implements SExpr {
        public SAtom {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Atom name is required");
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record SCons(SExpr head, SExpr tail) implements SExpr {
        public SCons {
            Objects.requireNonNull(head, "head cannot be null");
            Objects.requireNonNull(tail, "tail cannot be null");
        }

        @Override
        public String toString() {
            return SExpr.render(this, Integer.MAX_VALUE);
        }
    }
}
