package org.olympiac.compiler.frontend.semantics;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The signature of a built-in invocation.
 *
 * @param name The lower-case name.
 * @param arity The required number of arguments, or {@code null} for any.
 * @param entityArguments Whether every argument must be an {@code entity:*}.
 * @param returnType The type of the invocation.
 */
public record BuiltinSignature(String name, Integer arity, boolean entityArguments, TypeTag returnType) {

    private static final Map<String, BuiltinSignature> BUILTINS = Map.of(
            "comparar", new BuiltinSignature("comparar", 2, true, TypeTag.INT),
            "narrar", new BuiltinSignature("narrar", null, false, TypeTag.VOID),
            "input", new BuiltinSignature("input", 1, false, TypeTag.VOID));

    /**
     * @param name An invocation name, in any case.
     * @return The built-in signature, or empty for unknown names.
     */
    public static Optional<BuiltinSignature> find(String name) {
        return Optional.ofNullable(BUILTINS.get(name.toLowerCase(Locale.ROOT)));
    }
}
