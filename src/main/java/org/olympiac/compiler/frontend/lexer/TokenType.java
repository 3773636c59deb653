package org.olympiac.compiler.frontend.lexer;

/**
 * Defines the token categories that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A line comment starting with ';'. */
    COMMENT,
    /** An entity declaration keyword: Deportista, Lista. */
    ENTITY_DECLARATION,
    /** A domain data type: Pais, Deporte, Resultado. */
    DOMAIN_TYPE,
    /** A control-flow keyword, such as si, entonces, Repetir or FinRep. */
    CONTROL_FLOW,
    /** A built-in call including its opening parenthesis, such as narrar( or Comparar(. */
    FUNCTION_INVOCATION,
    /** A domain keyword, such as InicioCarrera, finact or preparacion. */
    DOMAIN_KEYWORD,
    /** The additional result marker listaRes. */
    RESULT_MARKER,
    /** The tie marker empate. */
    TIE_MARKER,
    /** A comparison operator: == != >= <= > <. */
    COMPARISON_OPERATOR,
    /** The special operator vs. */
    SPECIAL_OPERATOR,
    /** An arithmetic operator: + - * / %. */
    ARITHMETIC_OPERATOR,
    /** A non-negative integer literal. */
    INTEGER_LITERAL,
    /** A double-quoted text literal. */
    STRING_LITERAL,
    /** True or False. */
    BOOLEAN_LITERAL,
    /** A user name, such as an athlete, country or list name. */
    IDENTIFIER,
    /** A punctuation symbol or delimiter. */
    PUNCTUATION
}
