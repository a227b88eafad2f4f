package io.github.cyfko.sqlguard.spring.support;

import io.github.cyfko.sqlguard.core.config.IdentifierPolicy;
import io.github.cyfko.sqlguard.core.utils.SqlIdentifiers;
import io.github.cyfko.sqlguard.core.whitelist.FieldWhitelist;
import io.github.cyfko.sqlguard.spring.autoconfigure.SqlGuardProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Named {@link FieldWhitelist} instances declared under {@code sqlguard.whitelists}.
 * <p>
 * Built once at startup and read-only afterwards, so it is safe for concurrent lookups.
 * An invalid table name in the configuration fails the startup with
 * {@link io.github.cyfko.sqlguard.core.exception.InvalidIdentifierException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class WhitelistRegistry {
    private static final Logger logger = Logger.getLogger(WhitelistRegistry.class.getName());

    private final Map<String, FieldWhitelist> whitelists;

    public WhitelistRegistry(Map<String, FieldWhitelist> whitelists) {
        this.whitelists = Collections.unmodifiableMap(new LinkedHashMap<>(whitelists));
    }

    /**
     * Builds every whitelist declared in {@code properties}.
     */
    public static WhitelistRegistry from(SqlGuardProperties properties) {
        Map<String, FieldWhitelist> built = new LinkedHashMap<>();
        properties.getWhitelists().forEach((name, declared) -> {
            String table = SqlIdentifiers.requireValid(declared.getTable() != null ? declared.getTable() : name,
                    IdentifierPolicy.forTableNames());
            FieldWhitelist whitelist = FieldWhitelist.forTable(table)
                    .allow(declared.getFields())
                    .qualifiedOnly(declared.isQualifiedOnly())
                    .build();
            built.put(name, whitelist);
            logger.info(() -> "Registered whitelist '" + name + "' for table '" + table + "' with "
                    + whitelist.allowedFields().size() + " field(s)");
        });
        return new WhitelistRegistry(built);
    }

    /**
     * @param name whitelist name as declared in configuration
     * @return the whitelist
     * @throws IllegalArgumentException if no whitelist has that name
     */
    public FieldWhitelist get(String name) {
        FieldWhitelist whitelist = whitelists.get(name);
        if (whitelist == null) {
            throw new IllegalArgumentException("No whitelist registered under '" + name + "'. Known: " + whitelists.keySet());
        }
        return whitelist;
    }

    public boolean contains(String name) {
        return whitelists.containsKey(name);
    }

    public Set<String> names() {
        return whitelists.keySet();
    }
}
