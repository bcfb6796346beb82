package com.williamcallahan.ratchet.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.ratchet.jobs.JdbcJobQueue;
import com.williamcallahan.ratchet.jobs.JobQueue;
import com.williamcallahan.ratchet.store.JdbcMessageStore;
import com.williamcallahan.ratchet.store.MessageStore;
import com.williamcallahan.ratchet.store.SqlDialect;
import java.time.Clock;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Persistence wiring: the message store and the job queue share one datasource so their writes can
 * commit together.
 */
@Configuration
public class StoreConfig {
    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SqlDialect sqlDialect(DataSource dataSource) {
        SqlDialect dialect = SqlDialect.detect(dataSource);
        log.info("[STORE] Using {} SQL dialect", dialect);
        return dialect;
    }

    @Bean
    public MessageStore messageStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, SqlDialect sqlDialect) {
        return new JdbcMessageStore(jdbcTemplate, objectMapper, sqlDialect);
    }

    @Bean
    public JobQueue jobQueue(
            JdbcTemplate jdbcTemplate,
            ObjectMapper objectMapper,
            SqlDialect sqlDialect,
            Clock clock,
            AppProperties appProperties) {
        return new JdbcJobQueue(jdbcTemplate, objectMapper, sqlDialect, clock, appProperties.getJobs().getMaxAttempts());
    }
}
