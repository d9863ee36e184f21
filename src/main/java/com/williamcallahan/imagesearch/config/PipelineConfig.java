package com.williamcallahan.imagesearch.config;

import com.williamcallahan.imagesearch.support.RetryPolicy;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Shared collaborators of both pipelines.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public RetryPolicy retryPolicy(AppProperties appProperties) {
        AppProperties.Retry retry = appProperties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff());
    }

    /**
     * HTTP client for downloading matches by their payload URL.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder restTemplateBuilder, AppProperties appProperties) {
        return restTemplateBuilder
                .connectTimeout(appProperties.getQdrant().getTimeout())
                .readTimeout(appProperties.getQdrant().getTimeout())
                .build();
    }
}
