package com.id.chrono.config;

import com.id.chrono.modules.collection.substrate.CollectionSubstrate;
import com.id.chrono.modules.collection.substrate.ExecutorCollectionSubstrate;
import com.id.chrono.modules.collection.substrate.SequentialCollectionSubstrate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class SubstrateConfig {

    @Bean(destroyMethod = "close")
    public CollectionSubstrate collectionSubstrate(ChronoConfig chronoConfig) {
        String kind = chronoConfig.getCollectSubstrate();
        if (ChronoConfig.SUBSTRATE_SEQUENTIAL.equalsIgnoreCase(kind)) {
            log.info("Using sequential collection substrate");
            return new SequentialCollectionSubstrate();
        }
        if (!ChronoConfig.SUBSTRATE_EXECUTOR.equalsIgnoreCase(kind)) {
            throw new IllegalArgumentException("Unknown collection substrate: " + kind);
        }
        return new ExecutorCollectionSubstrate(
                chronoConfig.getCollectWorkerThreads(),
                chronoConfig.getCollectTimeoutMs()
        );
    }
}
