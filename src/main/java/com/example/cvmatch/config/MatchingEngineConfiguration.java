package com.example.cvmatch.config;

import com.example.cvmatch.inference.NoOpSkillInferenceClient;
import com.example.cvmatch.inference.ResilientSkillInference;
import com.example.cvmatch.inference.SkillInferenceClient;
import com.example.cvmatch.text.SkillDictionary;
import com.example.cvmatch.text.SkillDictionaryLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

/** Engine infrastructure: dictionary, worker pools, clock and the inference collaborator. */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(MatchingProperties.class)
public class MatchingEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngineConfiguration.class);

    @Bean
    public SkillDictionary skillDictionary(MatchingProperties properties, ResourceLoader resourceLoader) {
        return SkillDictionaryLoader.load(
                resourceLoader.getResource(properties.getDictionaryLocation()), new ObjectMapper());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public MdcPropagatingExecutor matchingExecutor(MatchingProperties properties) {
        int threads = properties.getWorkerThreads() > 0
                ? properties.getWorkerThreads()
                : Runtime.getRuntime().availableProcessors();
        log.info("Matching worker pool started with {} threads", threads);
        return new MdcPropagatingExecutor(threads, "matching");
    }

    /** Separate pool so a blocked collaborator call never starves extraction work. */
    @Bean(destroyMethod = "shutdown")
    public MdcPropagatingExecutor inferenceExecutor(MatchingProperties properties) {
        return new MdcPropagatingExecutor(Math.max(2, properties.getWorkerThreads()), "inference");
    }

    @Bean
    @ConditionalOnMissingBean
    public SkillInferenceClient skillInferenceClient() {
        return new NoOpSkillInferenceClient();
    }

    @Bean
    public ResilientSkillInference resilientSkillInference(SkillInferenceClient client,
                                                           MatchingProperties properties,
                                                           @Qualifier("inferenceExecutor") MdcPropagatingExecutor executor) {
        return new ResilientSkillInference(client, properties, executor);
    }
}
