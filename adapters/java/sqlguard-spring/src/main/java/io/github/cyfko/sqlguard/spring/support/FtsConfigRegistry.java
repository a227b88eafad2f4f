package io.github.cyfko.sqlguard.spring.support;

import io.github.cyfko.sqlguard.core.fts.FtsConfig;
import io.github.cyfko.sqlguard.core.fts.FtsSearchCondition;
import io.github.cyfko.sqlguard.spring.autoconfigure.SqlGuardProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Named {@link FtsConfig} instances declared under {@code sqlguard.fts}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FtsConfigRegistry {
    private static final Logger logger = Logger.getLogger(FtsConfigRegistry.class.getName());

    private final Map<String, FtsConfig> configs;

    public FtsConfigRegistry(Map<String, FtsConfig> configs) {
        this.configs = Collections.unmodifiableMap(new LinkedHashMap<>(configs));
    }

    public static FtsConfigRegistry from(SqlGuardProperties properties) {
        Map<String, FtsConfig> built = new LinkedHashMap<>();
        properties.getFts().forEach((name, declared) -> {
            FtsConfig config = new FtsConfig(declared.getIndexTable(), declared.getBaseTable(),
                    declared.getIdField(), declared.getFallbackFields());
            built.put(name, config);
            logger.info(() -> "Registered full-text search '" + name + "' on index '" + config.indexTable() + "'");
        });
        return new FtsConfigRegistry(built);
    }

    /**
     * @throws IllegalArgumentException if no configuration has that name
     */
    public FtsConfig get(String name) {
        FtsConfig config = configs.get(name);
        if (config == null) {
            throw new IllegalArgumentException("No full-text search registered under '" + name + "'. Known: " + configs.keySet());
        }
        return config;
    }

    /**
     * Shortcut for {@code FtsSearchCondition.of(get(name))}.
     */
    public FtsSearchCondition condition(String name) {
        return FtsSearchCondition.of(get(name));
    }

    public boolean contains(String name) {
        return configs.containsKey(name);
    }

    public Set<String> names() {
        return configs.keySet();
    }
}
