package com.dayloop.timeline.config;

import com.dayloop.timeline.service.BatchBuilder;
import com.dayloop.timeline.util.LogicalDay;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(CategoryProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${dayloop.provider.connect-timeout-seconds:10}") long connectTimeout,
                                     @Value("${dayloop.provider.read-timeout-seconds:300}") long readTimeout) {
        // No mid-flight cancellation: the read timeout is what bounds a hung provider call
        return builder
                .setConnectTimeout(Duration.ofSeconds(connectTimeout))
                .setReadTimeout(Duration.ofSeconds(readTimeout))
                .build();
    }

    @Bean
    public LogicalDay logicalDay(@Value("${dayloop.day.boundary-hour:4}") int boundaryHour,
                                 @Value("${dayloop.day.zone:}") String zone) {
        return new LogicalDay(boundaryHour, zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone));
    }

    @Bean
    public BatchBuilder batchBuilder(@Value("${dayloop.analysis.max-gap-seconds:120}") long maxGapSeconds,
                                     @Value("${dayloop.analysis.target-batch-seconds:900}") long targetBatchSeconds,
                                     @Value("${dayloop.analysis.min-batch-seconds:300}") long minBatchSeconds) {
        return new BatchBuilder(maxGapSeconds, targetBatchSeconds, minBatchSeconds);
    }
}
