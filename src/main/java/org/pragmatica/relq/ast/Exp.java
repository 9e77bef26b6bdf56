package org.pragmatica.relq.ast;

import java.util.List;

/**
 * Relq expression tree. Nodes are immutable and compare by value.
 */
public sealed interface Exp {

    // === Leaves ===

    /**
     * Identifier reference: name
     */
    record Var(String name) implements Exp {}

    /**
     * Signed 64-bit integer literal: 42, -7
     */
    record Int(long value) implements Exp {}

    /**
     * Boolean literal: true, false
     */
    record Bool(boolean value) implements Exp {}

    /**
     * Quoted string literal, kept verbatim: 'text'
     */
    record Str(String value) implements Exp {}

    // === Binding ===

    /**
     * Sequential binding: binder = bound body
     */
    record Let(Var binder, Exp bound, Exp body) implements Exp {}

    // === Queries ===

    /**
     * Column projection: a, b <- source
     */
    record Select(List<Var> vars, Exp source) implements Exp {
        public Select {
            if (vars.isEmpty()) {
                throw new IllegalArgumentException("Select requires at least one variable");
            }
            vars = List.copyOf(vars);
        }
    }

    /**
     * Filter: source ? predicate
     */
    record Where(Exp source, Exp predicate) implements Exp {}

    /**
     * Set union: left + right
     */
    record Union(Exp left, Exp right) implements Exp {}

    /**
     * Set difference: left - right
     */
    record Difference(Exp left, Exp right) implements Exp {}

    /**
     * Cartesian product: left * right
     */
    record Product(Exp left, Exp right) implements Exp {}

    // === Table literals ===

    /**
     * Rows of a table: left ; right
     */
    record Table(Exp left, Exp right) implements Exp {}

    /**
     * Cells of a row: left , right
     */
    record Row(Exp left, Exp right) implements Exp {}

    /**
     * One field: key : value
     */
    record Cell(Var key, Exp value) implements Exp {}

    // === Boolean operators ===

    record Equals(Exp left, Exp right) implements Exp {}

    record Or(Exp left, Exp right) implements Exp {}

    record And(Exp left, Exp right) implements Exp {}

    record Not(Exp operand) implements Exp {}
}
