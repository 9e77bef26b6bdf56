package org.pragmatica.relq.parser;

/**
 * Layers of the expression grammar, loosest binding first.
 */
public enum Precedence {
    LET("Let"),
    SELECT("Select"),
    WHERE("Where"),
    UNION("Union"),
    DIFFERENCE("Difference"),
    PRODUCT("Product"),
    TABLE("Table"),
    ROW("Row"),
    CELL("Cell"),
    EQUALS("Equals"),
    OR("Or"),
    AND("And"),
    NOT("Not"),
    ATOM("Atom");

    private final String ruleName;

    Precedence(String ruleName) {
        this.ruleName = ruleName;
    }

    /**
     * Name used for logging and as the packrat cache key of the layer.
     */
    public String ruleName() {
        return ruleName;
    }
}
