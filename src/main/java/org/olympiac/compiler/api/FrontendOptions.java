package org.olympiac.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Map;

/**
 * Tunables of the parser and the verifier, read from the {@code olympiac.frontend} config block.
 *
 * @param maxRecoverySteps Tokens a single error recovery may skip before the rest of the stream is discarded.
 * @param deduplicateDiagnostics Whether syntax diagnostics with the same (message, line, column) are reported once.
 * @param recordSnapshots Whether the verifier records a symbol table snapshot after each declaration.
 */
public record FrontendOptions(
        int maxRecoverySteps,
        boolean deduplicateDiagnostics,
        boolean recordSnapshots
) {
    /** The contract values: 500 recovery steps, deduplication on, snapshots on. */
    public static final FrontendOptions DEFAULTS = new FrontendOptions(500, true, true);

    private static final String PREFIX = "olympiac.frontend.";

    public FrontendOptions {
        if (maxRecoverySteps < 1) {
            throw new IllegalArgumentException("maxRecoverySteps must be positive, was " + maxRecoverySteps);
        }
    }

    /**
     * Reads the options from a configuration. Missing keys fall back to {@link #DEFAULTS}.
     * @param config The resolved configuration.
     * @return The options.
     */
    public static FrontendOptions fromConfig(Config config) {
        Config merged = config.withFallback(ConfigFactory.parseMap(Map.of(
                PREFIX + "recovery.max-steps", DEFAULTS.maxRecoverySteps(),
                PREFIX + "diagnostics.deduplicate", DEFAULTS.deduplicateDiagnostics(),
                PREFIX + "verifier.record-snapshots", DEFAULTS.recordSnapshots())));
        return new FrontendOptions(
                merged.getInt(PREFIX + "recovery.max-steps"),
                merged.getBoolean(PREFIX + "diagnostics.deduplicate"),
                merged.getBoolean(PREFIX + "verifier.record-snapshots"));
    }

    /**
     * Loads the options from the default configuration stack ({@code application.conf},
     * {@code reference.conf}, system properties).
     * @return The options.
     */
    public static FrontendOptions load() {
        return fromConfig(ConfigFactory.load());
    }
}
