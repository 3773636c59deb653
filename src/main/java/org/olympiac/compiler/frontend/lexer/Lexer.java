package org.olympiac.compiler.frontend.lexer;

import org.olympiac.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * the source lines of a program into a flat sequence of classified tokens.
 * <p>
 * Each line is scanned independently. At every position the patterns are tried in
 * declaration order and the first one that matches wins, so keywords must precede the
 * generic identifier pattern. Whitespace is skipped and characters that no pattern accepts
 * are reported as lexical errors and skipped.
 */
public class Lexer {

    private record Rule(TokenType type, Pattern pattern) {}

    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<Rule> RULES = List.of(
            rule(TokenType.COMMENT, ";.*"),
            rule(TokenType.STRING_LITERAL, "\"[^\"]*\""),
            rule(TokenType.ENTITY_DECLARATION, "(?:Deportista|Lista)\\b"),
            rule(TokenType.DOMAIN_TYPE, "(?:Pais|Deporte|Resultado)\\b"),
            rule(TokenType.CONTROL_FLOW,
                    "(?:RepetirHasta|FinRepHasta|FinRepHast|Repetir|FinRep|si|entonces|sino|endif)\\b"),
            rule(TokenType.FUNCTION_INVOCATION, "(?:narrar|Comparar|input)\\("),
            rule(TokenType.DOMAIN_KEYWORD,
                    "(?:preparacion|finprep|InicioCarrera|correr|finCarr|InicioRutina|ejecutar|finRuti|finact"
                            + "|ceremonia_medallas|competencia_oficial|partido_clasificatorio)\\b"),
            rule(TokenType.RESULT_MARKER, "listaRes\\b"),
            rule(TokenType.TIE_MARKER, "empate\\b"),
            rule(TokenType.COMPARISON_OPERATOR, "==|!=|>=|<=|>|<"),
            rule(TokenType.SPECIAL_OPERATOR, "vs\\b"),
            rule(TokenType.ARITHMETIC_OPERATOR, "[+\\-*/%]"),
            rule(TokenType.INTEGER_LITERAL, "[0-9]+"),
            rule(TokenType.BOOLEAN_LITERAL, "(?:True|False)\\b"),
            rule(TokenType.IDENTIFIER, "\\w+"),
            rule(TokenType.PUNCTUATION, "[(),;:{}\\[\\].]")
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", FLAGS);

    private final List<String> lines;
    private final DiagnosticsEngine diagnostics;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string; it is split into lines.
     * @param diagnostics The engine for reporting lexical errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(Arrays.asList(source.split("\\R", -1)), diagnostics);
    }

    /**
     * Creates a new Lexer.
     * @param lines The source lines, without line terminators.
     * @param diagnostics The engine for reporting lexical errors.
     */
    public Lexer(List<String> lines, DiagnosticsEngine diagnostics) {
        this.lines = List.copyOf(lines);
        this.diagnostics = diagnostics;
    }

    private static Rule rule(TokenType type, String regex) {
        return new Rule(type, Pattern.compile(regex, FLAGS));
    }

    /**
     * Performs the tokenization of all source lines.
     * @return An immutable list of the recognized tokens, in source order.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            scanLine(lines.get(i).stripTrailing(), i + 1, tokens);
        }
        return List.copyOf(tokens);
    }

    private void scanLine(String line, int lineNumber, List<Token> out) {
        int position = 0;
        while (position < line.length()) {
            Matcher ws = WHITESPACE.matcher(line).region(position, line.length());
            if (ws.lookingAt()) {
                position = ws.end();
                continue;
            }
            boolean matched = false;
            for (Rule rule : RULES) {
                Matcher m = rule.pattern().matcher(line).region(position, line.length());
                if (m.lookingAt()) {
                    out.add(new Token(rule.type(), m.group(), lineNumber, position + 1));
                    position = m.end();
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                int cp = line.codePointAt(position);
                diagnostics.reportError("Unrecognized character '" + new String(Character.toChars(cp)) + "'",
                        lineNumber, position + 1);
                position += Character.charCount(cp);
            }
        }
    }
}
