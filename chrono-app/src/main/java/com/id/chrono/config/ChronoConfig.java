package com.id.chrono.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class ChronoConfig {

    public static final String SUBSTRATE_EXECUTOR = "executor";
    public static final String SUBSTRATE_SEQUENTIAL = "sequential";

    @Value("${chrono.collect.worker-threads:8}")
    private int collectWorkerThreads;

    @Value("${chrono.collect.timeout-ms:300000}")
    private long collectTimeoutMs;

    @Value("${chrono.collect.substrate:executor}")
    private String collectSubstrate;

    @Value("${chrono.csv.separator:,}")
    private char csvSeparator;

    @Value("${chrono.csv.date-format:auto}")
    private String csvDateFormat;
}
