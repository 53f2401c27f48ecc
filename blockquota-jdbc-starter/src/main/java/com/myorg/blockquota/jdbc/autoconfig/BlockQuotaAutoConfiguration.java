package com.myorg.blockquota.jdbc.autoconfig;

import com.myorg.blockquota.jdbc.BlockQuotaProperties;
import com.myorg.blockquota.jdbc.JdbcLedgerTransactions;
import com.myorg.blockquota.jdbc.QuotaLedgerMetrics;
import com.myorg.blockquota.jdbc.expiry.ExpirerScheduleValues;
import com.myorg.blockquota.jdbc.expiry.ReservationExpirer;
import com.myorg.blockquota.jdbc.ledger.JdbcQuotaLedger;
import com.myorg.blockquota.jdbc.ledger.JdbcQuotaRepository;
import com.myorg.blockquota.jdbc.ledger.JdbcQuotaStore;
import com.myorg.blockquota.jdbc.retry.DefaultStoreErrorClassifier;
import com.myorg.blockquota.jdbc.retry.Sleeper;
import com.myorg.blockquota.jdbc.retry.StoreErrorClassifier;
import com.myorg.blockquota.jdbc.retry.StoreRetry;
import com.myorg.blockquota.jdbc.sync.JdbcResourceSyncFunctions;
import com.myorg.blockquota.jdbc.update.JdbcConditionalUpdater;
import com.myorg.blockquota.ledger.LedgerTransactions;
import com.myorg.blockquota.ledger.QuotaLedger;
import com.myorg.blockquota.ledger.QuotaStore;
import com.myorg.blockquota.ledger.sync.ResourceSyncRegistry;
import com.myorg.blockquota.ledger.update.ConditionalUpdater;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        JdbcTemplateAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class
}, afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(BlockQuotaProperties.class)
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnBean(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "blockquota", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BlockQuotaAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock blockQuotaClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerTransactions ledgerTransactions(PlatformTransactionManager txManager, JdbcTemplate jdbc, Clock clock) {
        return new JdbcLedgerTransactions(txManager, jdbc, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public StoreErrorClassifier storeErrorClassifier() {
        return new DefaultStoreErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper blockQuotaSleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public JdbcQuotaRepository jdbcQuotaRepository(JdbcTemplate jdbc) {
        return new JdbcQuotaRepository(jdbc);
    }

    @Bean
    public StoreRetry storeRetry(BlockQuotaProperties props,
                                 StoreErrorClassifier classifier,
                                 Sleeper blockQuotaSleeper,
                                 ObjectProvider<QuotaLedgerMetrics> metricsProvider) {
        return new StoreRetry(props.getRetry(), classifier, blockQuotaSleeper, metricsProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionalUpdater conditionalUpdater(LedgerTransactions transactions, StoreRetry retry) {
        return new JdbcConditionalUpdater(transactions, retry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceSyncRegistry resourceSyncRegistry(BlockQuotaProperties props) {
        return new JdbcResourceSyncFunctions(props.isNoSnapshotGbQuota()).registry();
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaStore quotaStore(JdbcTemplate jdbc,
                                 LedgerTransactions transactions,
                                 JdbcQuotaRepository repo,
                                 ConditionalUpdater updater,
                                 StoreRetry retry,
                                 Clock clock) {
        return new JdbcQuotaStore(jdbc, transactions, repo, updater, retry, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaLedger quotaLedger(BlockQuotaProperties props,
                                   LedgerTransactions transactions,
                                   JdbcQuotaRepository repo,
                                   ConditionalUpdater updater,
                                   ResourceSyncRegistry syncRegistry,
                                   QuotaStore quotaStore,
                                   StoreRetry retry,
                                   ObjectProvider<QuotaLedgerMetrics> metricsProvider,
                                   Clock clock) {
        return new JdbcQuotaLedger(props, transactions, repo, updater, syncRegistry, quotaStore, retry,
                metricsProvider.getIfAvailable(), clock);
    }

    @Bean(name = "blockQuotaExpirerSchedule")
    public ExpirerScheduleValues blockQuotaExpirerSchedule(BlockQuotaProperties props) {
        return new ExpirerScheduleValues(props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "blockquota.expirer", name = "enabled", havingValue = "true")
    public ReservationExpirer reservationExpirer(BlockQuotaProperties props, QuotaLedger ledger, Clock clock) {
        return new ReservationExpirer(props, ledger, clock);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfig {

        @Bean
        @ConditionalOnProperty(prefix = "blockquota.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
        @ConditionalOnBean(MeterRegistry.class)
        public QuotaLedgerMetrics quotaLedgerMetrics(MeterRegistry registry, JdbcQuotaRepository repo) {
            QuotaLedgerMetrics m = new QuotaLedgerMetrics(registry, repo);
            m.preRegister();
            return m;
        }
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "blockquota.expirer", name = "enabled", havingValue = "true")
    static class SchedulingConfig {}
}
