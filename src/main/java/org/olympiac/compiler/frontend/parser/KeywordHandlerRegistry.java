package org.olympiac.compiler.frontend.parser;

import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.parser.features.athlete.AthleteDeclarationHandler;
import org.olympiac.compiler.frontend.parser.features.competition.CompetitionHandler;
import org.olympiac.compiler.frontend.parser.features.competition.ResultExtraHandler;
import org.olympiac.compiler.frontend.parser.features.competition.ResultHandler;
import org.olympiac.compiler.frontend.parser.features.competition.TieHandler;
import org.olympiac.compiler.frontend.parser.features.control.ConditionalHandler;
import org.olympiac.compiler.frontend.parser.features.control.LoopHandler;
import org.olympiac.compiler.frontend.parser.features.control.LoopUntilHandler;
import org.olympiac.compiler.frontend.parser.features.invocation.InvocationHandler;
import org.olympiac.compiler.frontend.parser.features.roster.RosterHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for keyword handlers. This class holds a map of keyword texts
 * to the handlers that parse the construct they introduce.
 */
public class KeywordHandlerRegistry {
    private final Map<String, IKeywordHandler> handlers = new HashMap<>();

    /**
     * Registers a new keyword handler.
     * @param keyword The keyword text (e.g., "Deportista"), matched ignoring case.
     * @param handler The handler for the keyword.
     */
    public void register(String keyword, IKeywordHandler handler) {
        handlers.put(Keywords.normalize(keyword), handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The keyword text.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IKeywordHandler> get(String keyword) {
        return Optional.ofNullable(handlers.get(Keywords.normalize(keyword)));
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link KeywordHandlerRegistry} with all handlers registered.
     */
    public static KeywordHandlerRegistry initialize() {
        KeywordHandlerRegistry registry = new KeywordHandlerRegistry();
        registry.register(Keywords.ATHLETE, new AthleteDeclarationHandler());
        registry.register(Keywords.LIST, new RosterHandler());

        registry.register(Keywords.IF, new ConditionalHandler());
        registry.register(Keywords.LOOP, new LoopHandler());
        registry.register(Keywords.LOOP_UNTIL, new LoopUntilHandler());

        InvocationHandler invocationHandler = new InvocationHandler();
        registry.register(Keywords.NARRATE, invocationHandler);
        registry.register(Keywords.DIRECT, invocationHandler);
        registry.register("comparar(", invocationHandler);

        registry.register(Keywords.RACE_START, new CompetitionHandler(NodeKind.RACE, "finCarr"));
        registry.register(Keywords.ROUTINE_START, new CompetitionHandler(NodeKind.ROUTINE, "finRuti"));
        registry.register(Keywords.COMBAT_START, new CompetitionHandler(NodeKind.COMBAT, "finprep"));
        registry.register(Keywords.RESULT, new ResultHandler());
        registry.register(Keywords.RESULT_EXTRA, new ResultExtraHandler());
        registry.register(Keywords.TIE, new TieHandler());
        return registry;
    }
}
