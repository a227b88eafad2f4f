package io.github.cyfko.sqlguard.spring.autoconfigure;

import io.github.cyfko.sqlguard.core.pagination.Pagination;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative whitelists and full-text search settings, bound from {@code sqlguard.*}.
 *
 * <pre>
 * sqlguard:
 *   whitelists:
 *     batches:
 *       fields: [status, quantity, expiry_date, b.status]
 *     inventory:
 *       table: batches
 *       qualified-only: true
 *       fields: [b.status, r.name]
 *   fts:
 *     reagents:
 *       index-table: reagents_fts
 *       base-table: reagents
 *       fallback-fields: [name, formula, cas_number]
 *   pagination:
 *     default-per-page: 20
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "sqlguard")
public class SqlGuardProperties {
    private Map<String, Whitelist> whitelists = new LinkedHashMap<>();
    private Map<String, Fts> fts = new LinkedHashMap<>();
    private Paging pagination = new Paging();

    public static class Whitelist {
        /** Table the fields belong to; defaults to the whitelist name. */
        private String table;
        private List<String> fields = new ArrayList<>();
        private boolean qualifiedOnly = false;

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public List<String> getFields() {
            return fields;
        }

        public void setFields(List<String> fields) {
            this.fields = fields;
        }

        public boolean isQualifiedOnly() {
            return qualifiedOnly;
        }

        public void setQualifiedOnly(boolean qualifiedOnly) {
            this.qualifiedOnly = qualifiedOnly;
        }
    }

    public static class Fts {
        private String indexTable;
        private String baseTable;
        private String idField = "id";
        private List<String> fallbackFields = new ArrayList<>();

        public String getIndexTable() {
            return indexTable;
        }

        public void setIndexTable(String indexTable) {
            this.indexTable = indexTable;
        }

        public String getBaseTable() {
            return baseTable;
        }

        public void setBaseTable(String baseTable) {
            this.baseTable = baseTable;
        }

        public String getIdField() {
            return idField;
        }

        public void setIdField(String idField) {
            this.idField = idField;
        }

        public List<String> getFallbackFields() {
            return fallbackFields;
        }

        public void setFallbackFields(List<String> fallbackFields) {
            this.fallbackFields = fallbackFields;
        }
    }

    public static class Paging {
        private int defaultPerPage = Pagination.DEFAULT_PER_PAGE;

        public int getDefaultPerPage() {
            return defaultPerPage;
        }

        public void setDefaultPerPage(int defaultPerPage) {
            this.defaultPerPage = (int) Pagination.clampPerPage(defaultPerPage);
        }
    }

    public Map<String, Whitelist> getWhitelists() {
        return whitelists;
    }

    public void setWhitelists(Map<String, Whitelist> whitelists) {
        this.whitelists = whitelists;
    }

    public Map<String, Fts> getFts() {
        return fts;
    }

    public void setFts(Map<String, Fts> fts) {
        this.fts = fts;
    }

    public Paging getPagination() {
        return pagination;
    }

    public void setPagination(Paging pagination) {
        this.pagination = pagination;
    }
}
