package com.chattrix.websocket.config;

import com.chattrix.websocket.infrastructure.KeyedSerialExecutor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared JSON mapper and the worker pools used off the socket threads.
 */
@Configuration
public class RealtimeConfig {

    public static final String DISPATCH_EXECUTOR = "chatDispatchExecutor";
    public static final String PUSH_EXECUTOR = "pushExecutor";

    /**
     * ObjectMapper for JSON serialization with Java 8 time support
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = DISPATCH_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService chatDispatchExecutor(
            @Value("${chat.dispatch.worker-threads:8}") int threads) {
        return Executors.newFixedThreadPool(threads, namedThreads("chat-dispatch"));
    }

    @Bean(name = PUSH_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService pushExecutor(
            @Value("${chat.notifications.push-threads:4}") int threads) {
        return Executors.newFixedThreadPool(threads, namedThreads("push-sender"));
    }

    @Bean
    public KeyedSerialExecutor keyedSerialExecutor(@Qualifier(DISPATCH_EXECUTOR) ExecutorService executor) {
        return new KeyedSerialExecutor(executor);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
