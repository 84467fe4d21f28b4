package com.arkive.store;

import com.arkive.spi.AuditTrail;
import com.arkive.spi.repositories.ActivityRepository;
import com.arkive.spi.repositories.DocumentRepository;
import com.arkive.spi.repositories.UserRepository;
import com.arkive.store.audit.SqliteAuditTrail;
import com.arkive.store.backup.BackupManager;
import com.arkive.store.records.SqliteActivityRepository;
import com.arkive.store.records.SqliteDocumentIndexer;
import com.arkive.store.records.SqliteDocumentRepository;
import com.arkive.store.records.SqliteUserRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@ConfigurationPropertiesScan
public class StoreConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ContentionPolicy contentionPolicy(StoreProperties storeProperties, MeterRegistry meterRegistry) {
        return new ContentionPolicy(storeProperties.getMaxAttempts(), storeProperties.getRetryBackoff(), meterRegistry);
    }

    @Bean(destroyMethod = "close")
    public SqliteStore sqliteStore(StoreProperties storeProperties, ContentionPolicy contentionPolicy) {
        SqliteStore store = new SqliteStore(storeProperties, contentionPolicy);
        store.initialize(Path.of(storeProperties.getPath()));
        return store;
    }

    @Bean
    public AuditTrail auditTrail(SqliteStore sqliteStore, Clock clock, MeterRegistry meterRegistry) {
        return new SqliteAuditTrail(sqliteStore, clock, meterRegistry);
    }

    @Bean
    public UserRepository userRepository(SqliteStore sqliteStore, Clock clock) {
        return new SqliteUserRepository(sqliteStore, clock);
    }

    @Bean
    public DocumentRepository documentRepository(SqliteStore sqliteStore, Clock clock) {
        return new SqliteDocumentRepository(sqliteStore, clock);
    }

    @Bean
    public ActivityRepository activityRepository(SqliteStore sqliteStore, Clock clock) {
        return new SqliteActivityRepository(sqliteStore, clock);
    }

    @Bean
    public SqliteDocumentIndexer documentIndexer(SqliteStore sqliteStore, ObjectMapper objectMapper, Clock clock) {
        return new SqliteDocumentIndexer(sqliteStore, objectMapper, clock);
    }

    @Bean
    public BackupManager backupManager(BackupProperties backupProperties, Clock clock, MeterRegistry meterRegistry) {
        return new BackupManager(backupProperties.getProducerVersion(), clock, meterRegistry);
    }
}
