package io.github.cyfko.sqlguard.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.sqlguard.core.spi.FtsAvailability;
import io.github.cyfko.sqlguard.jdbc.PagedQueryExecutor;
import io.github.cyfko.sqlguard.jdbc.SqliteFtsAvailabilityProbe;
import io.github.cyfko.sqlguard.spring.support.FilterGroupReader;
import io.github.cyfko.sqlguard.spring.support.FtsConfigRegistry;
import io.github.cyfko.sqlguard.spring.support.WhitelistRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Registers the configured whitelists and full-text search settings, the JSON filter reader
 * and, when a {@link JdbcTemplate} is available, the JDBC collaborators.
 * <p>
 * Every bean backs off when the application defines its own.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@AutoConfiguration(after = {JacksonAutoConfiguration.class, JdbcTemplateAutoConfiguration.class})
@EnableConfigurationProperties(SqlGuardProperties.class)
public class SqlGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WhitelistRegistry whitelistRegistry(SqlGuardProperties properties) {
        return WhitelistRegistry.from(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public FtsConfigRegistry ftsConfigRegistry(SqlGuardProperties properties) {
        return FtsConfigRegistry.from(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterGroupReader filterGroupReader(ObjectProvider<ObjectMapper> objectMapper) {
        return new FilterGroupReader(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JdbcTemplate.class)
    @ConditionalOnBean(JdbcTemplate.class)
    static class JdbcConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public FtsAvailability ftsAvailability(JdbcTemplate jdbcTemplate) {
            return new SqliteFtsAvailabilityProbe(jdbcTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        public PagedQueryExecutor pagedQueryExecutor(JdbcTemplate jdbcTemplate) {
            return new PagedQueryExecutor(jdbcTemplate);
        }
    }
}
