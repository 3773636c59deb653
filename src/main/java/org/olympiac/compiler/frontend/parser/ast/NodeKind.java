package org.olympiac.compiler.frontend.parser.ast;

/**
 * The closed set of node tags of the Abstract Syntax Tree.
 * The display name is the label used when a tree is printed or exported.
 */
public enum NodeKind {
    PROGRAM("Program"),
    COMMENT("Comment"),
    ATHLETE_DECL("AthleteDecl"),
    LIST_DECL("ListDecl"),
    BULK_LOAD("BulkLoad"),
    CONDITIONAL("Conditional"),
    ELSE("Else"),
    LOOP("Loop"),
    LOOP_UNTIL("LoopUntil"),
    INVOCATION("Invocation"),
    NARRATE("Narrate"),
    DIRECT("Direct"),
    BINARY_OP("BinaryOp"),
    UNARY_OP("UnaryOp"),
    NUMBER("Number"),
    TEXT("Text"),
    BOOLEAN("Boolean"),
    /** An identifier inside an expression. */
    NAME("Name"),
    /** An identifier standing on its own as a command. */
    IDENTIFIER("Identifier"),
    /** A punctuation symbol standing on its own as a command. */
    SYMBOL("Symbol"),
    /** A stray closing keyword, such as an endif without its si. */
    CLOSE("Close"),
    MATCH("Match"),
    RACE("Race"),
    ROUTINE("Routine"),
    COMBAT("Combat"),
    RESULT("Result"),
    RESULT_EXTRA("ResultExtra"),
    TIE("Tie"),
    ACTION_STUB("ActionStub"),
    SYNTAX_ERROR("SyntaxError"),
    UNKNOWN("Unknown");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The label used when printing or exporting the tree.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * @return true for the four competition constructs.
     */
    public boolean isCompetition() {
        return this == MATCH || this == RACE || this == ROUTINE || this == COMBAT;
    }
}
