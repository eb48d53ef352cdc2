package org.circuitry.qasm3;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings of an {@link Exporter}.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * circuitry.qasm3 {
 *   includes = ["stdgates.inc"]   # include directives, in output order
 *   fold-constants = true         # render multiples of pi symbolically
 *   include-vocabulary {          # gate names each include file provides
 *     "stdgates.inc" = [p, x, y, z, h, ...]
 *   }
 * }
 * </pre>
 * Defaults live in {@code reference.conf}.
 */
public final class ExporterOptions {

    /** Root path of the exporter settings. */
    public static final String CONFIG_PATH = "circuitry.qasm3";

    private static final String INCLUDES_KEY = "includes";
    private static final String FOLD_CONSTANTS_KEY = "fold-constants";
    private static final String VOCABULARY_KEY = "include-vocabulary";

    private final List<String> includes;
    private final boolean foldConstants;
    private final Map<String, List<String>> includeVocabulary;

    private ExporterOptions(Builder builder) {
        this.includes = List.copyOf(builder.includes);
        this.foldConstants = builder.foldConstants;
        Map<String, List<String>> vocabulary = new LinkedHashMap<>();
        builder.includeVocabulary.forEach((file, gates) -> vocabulary.put(file, List.copyOf(gates)));
        this.includeVocabulary = Collections.unmodifiableMap(vocabulary);
    }

    /**
     * Loads the options from the application configuration ({@code application.conf}, system
     * properties and the bundled {@code reference.conf}).
     *
     * @return The default options.
     */
    public static ExporterOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads the options below {@value #CONFIG_PATH}.
     *
     * @param config A resolved configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a setting is missing or has the wrong type.
     */
    public static ExporterOptions fromConfig(Config config) {
        Config exporterConfig = config.getConfig(CONFIG_PATH);
        Builder builder = builder()
                .includes(exporterConfig.getStringList(INCLUDES_KEY))
                .foldConstants(exporterConfig.getBoolean(FOLD_CONSTANTS_KEY));
        if (exporterConfig.hasPath(VOCABULARY_KEY)) {
            Config vocabulary = exporterConfig.getConfig(VOCABULARY_KEY);
            // keys contain dots, so iterate the root object instead of entrySet() paths
            for (String file : vocabulary.root().keySet()) {
                builder.includeVocabulary(file, vocabulary.getStringList(ConfigUtil.joinPath(file)));
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return A builder initialised with this instance's settings.
     */
    public Builder toBuilder() {
        Builder builder = builder().includes(includes).foldConstants(foldConstants);
        includeVocabulary.forEach(builder::includeVocabulary);
        return builder;
    }

    public List<String> includes() {
        return includes;
    }

    public boolean foldConstants() {
        return foldConstants;
    }

    /**
     * @return Gate names provided by each known include file.
     */
    public Map<String, List<String>> includeVocabulary() {
        return includeVocabulary;
    }

    @Override
    public String toString() {
        return "ExporterOptions{includes=" + includes + ", foldConstants=" + foldConstants
                + ", knownIncludes=" + includeVocabulary.keySet() + '}';
    }

    /**
     * Builder for {@link ExporterOptions}. Starts with no includes, folding enabled and an empty
     * vocabulary.
     */
    public static final class Builder {
        private final List<String> includes = new ArrayList<>();
        private boolean foldConstants = true;
        private final Map<String, List<String>> includeVocabulary = new LinkedHashMap<>();

        private Builder() {}

        public Builder includes(List<String> files) {
            includes.clear();
            includes.addAll(files);
            return this;
        }

        public Builder foldConstants(boolean fold) {
            this.foldConstants = fold;
            return this;
        }

        public Builder includeVocabulary(String file, List<String> gateNames) {
            includeVocabulary.put(Objects.requireNonNull(file, "file"), List.copyOf(gateNames));
            return this;
        }

        public ExporterOptions build() {
            return new ExporterOptions(this);
        }
    }
}
