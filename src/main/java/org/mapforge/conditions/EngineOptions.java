package org.mapforge.conditions;

import com.typesafe.config.Config;

/**
 * Engine settings, read from the {@code mapforge.conditions} configuration section.
 *
 * @param strict Whether configuration errors in rule sets are fatal instead of warnings.
 */
public record EngineOptions(boolean strict) {

    private static final String STRICT_PATH = "mapforge.conditions.strict";

    public static EngineOptions defaults() {
        return new EngineOptions(false);
    }

    public static EngineOptions fromConfig(Config config) {
        return new EngineOptions(config.hasPath(STRICT_PATH) && config.getBoolean(STRICT_PATH));
    }

    public EngineOptions withStrict(boolean value) {
        return new EngineOptions(value);
    }
}
