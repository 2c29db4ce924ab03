package com.labelloop.core.store;

import com.labelloop.core.store.memory.InMemoryAnnotatorStore;
import com.labelloop.core.store.memory.InMemoryConsensusStore;
import com.labelloop.core.store.memory.InMemoryLedgerStore;
import com.labelloop.core.store.memory.InMemoryRetrainingStore;
import com.labelloop.core.store.memory.InMemoryTaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring {@link Configuration} that provides the engine's state stores.
 * <p>
 * Every store is declared {@link ConditionalOnMissingBean}, so a deployment that registers a
 * durable implementation of a store interface replaces the in-memory fallback for that
 * store only. The in-memory stores are cleared when the context closes.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(TaskStore.class)
    public InMemoryTaskStore taskStore() {
        log.info("No durable TaskStore configured; using in-memory store (state will not persist across restarts)");
        return new InMemoryTaskStore();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(AnnotatorStore.class)
    public InMemoryAnnotatorStore annotatorStore() {
        log.info("No durable AnnotatorStore configured; using in-memory store");
        return new InMemoryAnnotatorStore();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(LedgerStore.class)
    public InMemoryLedgerStore ledgerStore() {
        log.info("No durable LedgerStore configured; using in-memory store");
        return new InMemoryLedgerStore();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(ConsensusStore.class)
    public InMemoryConsensusStore consensusStore() {
        log.info("No durable ConsensusStore configured; using in-memory store");
        return new InMemoryConsensusStore();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(RetrainingStore.class)
    public InMemoryRetrainingStore retrainingStore() {
        log.info("No durable RetrainingStore configured; using in-memory store");
        return new InMemoryRetrainingStore();
    }
}
