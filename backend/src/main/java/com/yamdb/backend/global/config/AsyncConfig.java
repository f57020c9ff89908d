package com.yamdb.backend.global.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Confirmation-code delivery runs on Spring Boot's {@code applicationTaskExecutor}
 * so a slow mail server never holds a request thread.
 */
@Configuration(proxyBeanMethods = false)
@EnableAsync
public class AsyncConfig {
}
