package org.pragmatica.relq.ast;

import java.util.List;

/**
 * Short constructors for expected trees in tests.
 */
public final class Nodes {
    private Nodes() {}

    public static Exp.Var ref(String name) {
        return new Exp.Var(name);
    }

    public static Exp.Int num(long value) {
        return new Exp.Int(value);
    }

    public static Exp.Bool bool(boolean value) {
        return new Exp.Bool(value);
    }

    public static Exp.Str str(String value) {
        return new Exp.Str(value);
    }

    public static Exp.Let let(String binder, Exp bound, Exp body) {
        return new Exp.Let(ref(binder), bound, body);
    }

    public static Exp.Select select(List<String> vars, Exp source) {
        return new Exp.Select(vars.stream().map(Exp.Var::new).toList(), source);
    }

    public static Exp.Where where(Exp source, Exp predicate) {
        return new Exp.Where(source, predicate);
    }

    public static Exp.Union union(Exp left, Exp right) {
        return new Exp.Union(left, right);
    }

    public static Exp.Difference difference(Exp left, Exp right) {
        return new Exp.Difference(left, right);
    }

    public static Exp.Product product(Exp left, Exp right) {
        return new Exp.Product(left, right);
    }

    public static Exp.Table table(Exp left, Exp right) {
        return new Exp.Table(left, right);
    }

    public static Exp.Row row(Exp left, Exp right) {
        return new Exp.Row(left, right);
    }

    public static Exp.Cell cell(String key, Exp value) {
        return new Exp.Cell(ref(key), value);
    }

    public static Exp.Equals eq(Exp left, Exp right) {
        return new Exp.Equals(left, right);
    }

    public static Exp.Or or(Exp left, Exp right) {
        return new Exp.Or(left, right);
    }

    public static Exp.And and(Exp left, Exp right) {
        return new Exp.And(left, right);
    }

    public static Exp.Not not(Exp operand) {
        return new Exp.Not(operand);
    }

    /**
     * Tree of the two-row staff table followed by a query selecting Bob.
     */
    public static Exp staffProgram() {
        return let("Staff",
                   table(row(cell("name", str("Alice")), cell("id", num(1))),
                         row(cell("name", str("Bob")), cell("id", num(2)))),
                   let("bob",
                       select(List.of("name"), where(ref("Staff"), eq(ref("name"), str("Bob")))),
                       ref("bob")));
    }
}
