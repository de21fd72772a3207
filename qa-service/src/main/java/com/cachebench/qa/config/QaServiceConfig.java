package com.cachebench.qa.config;

import com.cachebench.common.knowledge.KnowledgeBase;
import com.cachebench.common.knowledge.KnowledgeBaseLoader;
import com.cachebench.common.latency.LatencySimulator;
import com.cachebench.qa.cache.AnswerCacheStore;
import com.cachebench.qa.cache.RedisAnswerCacheStore;
import com.cachebench.qa.service.CacheAsideAnswerService;
import com.cachebench.qa.service.CacheAsideSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class QaServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(QaServiceConfig.class);

    @Value("${qa.knowledge-base.path:data/qa.jsonl}")
    private String knowledgeBasePath;

    @Value("${qa.cache.enabled:1}")
    private String cacheEnabledFlag;

    @Value("${qa.cache.ttl-seconds:3600}")
    private long cacheTtlSeconds;

    @Value("${qa.cache.single-flight:false}")
    private boolean singleFlight;

    @Value("${qa.latency.base-ms:600}")
    private long simulatedLatencyMs;

    @Value("${qa.latency.jitter-ms:200}")
    private long simulatedJitterMs;

    @Bean
    public KnowledgeBase knowledgeBase(ObjectMapper objectMapper) {
        return new KnowledgeBaseLoader(objectMapper).load(Path.of(knowledgeBasePath));
    }

    @Bean
    public LatencySimulator latencySimulator() {
        return new LatencySimulator(simulatedLatencyMs, simulatedJitterMs);
    }

    @Bean
    public AnswerCacheStore answerCacheStore(ReactiveStringRedisTemplate redisTemplate) {
        return new RedisAnswerCacheStore(redisTemplate);
    }

    @Bean
    public CacheAsideSettings cacheAsideSettings() {
        return new CacheAsideSettings(
            CacheAsideSettings.isCacheEnabledFlag(cacheEnabledFlag),
            Duration.ofSeconds(cacheTtlSeconds),
            singleFlight);
    }

    @Bean
    public CacheAsideAnswerService cacheAsideAnswerService(AnswerCacheStore answerCacheStore,
                                                           KnowledgeBase knowledgeBase,
                                                           LatencySimulator latencySimulator,
                                                           CacheAsideSettings cacheAsideSettings) {
        log.info("QA service configured. cacheEnabled={} ttlSeconds={} singleFlight={} latencyMs={}+[0..{}] kbSize={}",
                 cacheAsideSettings.enabled(), cacheAsideSettings.ttl().toSeconds(), cacheAsideSettings.singleFlight(),
                 latencySimulator.baseMillis(), latencySimulator.jitterMillis(), knowledgeBase.size());
        return new CacheAsideAnswerService(answerCacheStore, knowledgeBase, latencySimulator, cacheAsideSettings);
    }
}
