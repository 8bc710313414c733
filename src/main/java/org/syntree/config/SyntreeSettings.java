package org.syntree.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.util.List;
import java.util.Set;

/**
 * The typed view of the {@code syntree} configuration section.
 *
 * @param maxDepth The maximum tree depth accepted by traversals ({@code syntree.traversal.max-depth}).
 * @param builtins Names never reported as undefined ({@code syntree.analysis.builtins}).
 * @param validateBetweenPasses Whether pipelines validate every pass output ({@code syntree.pipeline.validate-between-passes}).
 * @param passes The pass names of the configured pipeline ({@code syntree.pipeline.passes}).
 */
public record SyntreeSettings(int maxDepth, Set<String> builtins, boolean validateBetweenPasses, List<String> passes) {

    private static final String MAX_DEPTH = "syntree.traversal.max-depth";
    private static final String BUILTINS = "syntree.analysis.builtins";
    private static final String VALIDATE = "syntree.pipeline.validate-between-passes";
    private static final String PASSES = "syntree.pipeline.passes";

    public SyntreeSettings {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("max-depth must be positive but was " + maxDepth);
        }
        builtins = Set.copyOf(builtins);
        passes = List.copyOf(passes);
    }

    /**
     * Reads the settings from a resolved configuration.
     * @param config The configuration, normally from {@link SyntreeConfig#load()}.
     * @return The settings.
     * @throws ConfigException if a key is missing or has the wrong type.
     */
    public static SyntreeSettings from(Config config) {
        return new SyntreeSettings(
                config.getInt(MAX_DEPTH),
                Set.copyOf(config.getStringList(BUILTINS)),
                config.getBoolean(VALIDATE),
                config.getStringList(PASSES));
    }

    /**
     * @return The settings of {@code reference.conf} alone.
     */
    public static SyntreeSettings defaults() {
        return from(ConfigFactory.defaultReference());
    }
}
