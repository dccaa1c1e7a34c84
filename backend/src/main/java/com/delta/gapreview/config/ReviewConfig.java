package com.delta.gapreview.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ReviewConfig {

    @Bean(name = "fanOutExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor fanOutExecutor(ReviewProperties properties) {
        return new MdcAwareExecutor(Executors.newFixedThreadPool(properties.getFanOut().getMaxConcurrency()));
    }

    @Bean(name = "runExecutor", destroyMethod = "shutdown")
    public ExecutorService runExecutor(ReviewProperties properties) {
        return Executors.newFixedThreadPool(properties.getRuns().getExecutorThreads());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient reviewHttpClient(ReviewProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getIngestion().getFetchTimeoutSeconds()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
