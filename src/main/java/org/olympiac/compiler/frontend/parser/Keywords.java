package org.olympiac.compiler.frontend.parser;

import java.util.Locale;
import java.util.Set;

/**
 * Keyword texts the parser reasons about. Comparisons are case-insensitive, so the
 * sets hold lower-case spellings.
 */
public final class Keywords {

    public static final String ATHLETE = "deportista";
    public static final String LIST = "lista";
    public static final String IF = "si";
    public static final String THEN = "entonces";
    public static final String ELSE = "sino";
    public static final String END_IF = "endif";
    public static final String LOOP = "repetir";
    public static final String END_LOOP = "finrep";
    public static final String LOOP_UNTIL = "repetirhasta";
    public static final String END_LOOP_UNTIL = "finrephasta";
    public static final String END_LOOP_UNTIL_LEGACY = "finrephast";
    public static final String RESULT = "resultado";
    public static final String RESULT_EXTRA = "listares";
    public static final String TIE = "empate";
    public static final String VERSUS = "vs";

    public static final String MATCH_END = "finact";
    public static final String RACE_START = "iniciocarrera";
    public static final String RACE_END = "fincarr";
    public static final String ROUTINE_START = "iniciorutina";
    public static final String ROUTINE_END = "finruti";
    public static final String COMBAT_START = "preparacion";
    public static final String COMBAT_END = "finprep";

    public static final String NARRATE = "narrar(";
    public static final String DIRECT = "input(";

    /** Closing keywords of the four competition constructs. */
    public static final Set<String> COMPETITION_TERMINATORS = Set.of(MATCH_END, RACE_END, ROUTINE_END, COMBAT_END);

    /** Words that end a competition's action list. */
    public static final Set<String> RESULT_BOUNDARIES = Set.of(RESULT, RESULT_EXTRA, TIE);

    /** Keywords that close a control-flow construct or one of its branches. */
    public static final Set<String> CONTROL_CLOSERS = Set.of(ELSE, END_IF, END_LOOP, END_LOOP_UNTIL, END_LOOP_UNTIL_LEGACY);

    /** Punctuation that closes a block or a parenthesized group. */
    public static final Set<String> BLOCK_CLOSERS = Set.of("}", "]", ")");

    private Keywords() {}

    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
