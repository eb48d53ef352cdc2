package org.circuitry.qasm3.namespace;

import org.circuitry.qasm3.ExporterOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the gate names made available by the configured include files.
 */
public final class StandardGateVocabulary {

    private static final Logger LOGGER = LoggerFactory.getLogger(StandardGateVocabulary.class);

    private StandardGateVocabulary() {}

    /**
     * @param options The exporter options holding the include list and the per-file vocabulary.
     * @return The union of the gate names of all included files, in include order.
     */
    public static Set<String> resolve(ExporterOptions options) {
        Set<String> names = new LinkedHashSet<>();
        for (String include : options.includes()) {
            List<String> gates = options.includeVocabulary().get(include);
            if (gates == null) {
                LOGGER.warn("Include file '{}' has no known gate vocabulary; its gates will be treated as opaque.", include);
                continue;
            }
            names.addAll(gates);
        }
        return Collections.unmodifiableSet(names);
    }
}
