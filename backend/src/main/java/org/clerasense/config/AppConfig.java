package org.clerasense.config;

import org.clerasense.application.port.CandidateSourcePort;
import org.clerasense.application.port.DrugSourcePort;
import org.clerasense.application.port.DrugStorePort;
import org.clerasense.application.port.EmbeddingPort;
import org.clerasense.application.port.ProviderCachePort;
import org.clerasense.domain.service.verification.VerificationEngine;
import org.clerasense.infrastructure.adapter.out.cache.CaffeineProviderCache;
import org.clerasense.infrastructure.adapter.out.dailymed.DailyMedSourceAdapter;
import org.clerasense.infrastructure.adapter.out.dailymed.SplSectionExtractor;
import org.clerasense.infrastructure.adapter.out.http.PacedHttpClient;
import org.clerasense.infrastructure.adapter.out.nadac.NadacSourceAdapter;
import org.clerasense.infrastructure.adapter.out.ollama.OllamaEmbeddingAdapter;
import org.clerasense.infrastructure.adapter.out.openfda.OpenFdaSourceAdapter;
import org.clerasense.infrastructure.adapter.out.postgres.PostgresDrugStoreAdapter;
import org.clerasense.infrastructure.adapter.out.rxnorm.RxNormSourceAdapter;
import org.clerasense.infrastructure.adapter.out.seed.CuratedCandidateSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import javax.sql.DataSource;
import java.time.Duration;

@Configuration
public class AppConfig {

    //provider adapters, registered in merge order: FDA label, DailyMed, RxNorm, NADAC
    @Bean
    @Order(1)
    DrugSourcePort openFdaSource(@Value("${clerasense.sources.openfda.base-url}") String url,
                                 @Value("${clerasense.sources.openfda.delay:1500ms}") Duration delay,
                                 IngestionProperties props) {
        return new OpenFdaSourceAdapter(new PacedHttpClient("OpenFDA", delay, props.getAdapterTimeout()), url);
    }

    @Bean
    @Order(2)
    DrugSourcePort dailyMedSource(@Value("${clerasense.sources.dailymed.base-url}") String url,
                                  @Value("${clerasense.sources.dailymed.delay:1000ms}") Duration delay,
                                  IngestionProperties props) {
        return new DailyMedSourceAdapter(new PacedHttpClient("DailyMed", delay, props.getAdapterTimeout()),
                new SplSectionExtractor(), url);
    }

    @Bean
    @Order(3)
    DrugSourcePort rxNormSource(@Value("${clerasense.sources.rxnorm.base-url}") String url,
                                @Value("${clerasense.sources.rxnorm.delay:500ms}") Duration delay,
                                IngestionProperties props) {
        return new RxNormSourceAdapter(new PacedHttpClient("RxNorm", delay, props.getAdapterTimeout()), url);
    }

    @Bean
    @Order(4)
    DrugSourcePort nadacSource(@Value("${clerasense.sources.nadac.base-url}") String url,
                               @Value("${clerasense.sources.nadac.delay:500ms}") Duration delay,
                               ProviderCachePort providerCache,
                               IngestionProperties props) {
        return new NadacSourceAdapter(new PacedHttpClient("NADAC", delay, props.getAdapterTimeout()),
                providerCache, url);
    }

    @Bean
    ProviderCachePort providerCache(IngestionProperties props) {
        return new CaffeineProviderCache(props.getProviderCacheTtl(), props.getProviderCacheMaxEntries());
    }

    @Bean
    VerificationEngine verificationEngine(IngestionProperties props) {
        return new VerificationEngine(props.isAcceptSingleSource());
    }

    @Bean
    DrugStorePort drugStore(DataSource dataSource) {
        return new PostgresDrugStoreAdapter(dataSource);
    }

    @Bean
    EmbeddingPort embedding(@Value("${clerasense.ollama.url}") String url,
                            @Value("${clerasense.ollama.embedding-model}") String model) {
        return new OllamaEmbeddingAdapter(url, model);
    }

    @Bean
    CandidateSourcePort candidateSource(@Value("${clerasense.discovery.seed-resource:seed/curated-drugs.txt}") String resource) {
        return new CuratedCandidateSource(resource);
    }
}
