package com.example.console_relay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class RelayExecutorConfig {

    // One task per live session; the ceiling is enforced by ConsoleSessionRegistry.
    // Shut down by ConsoleRelayService, not by the container.
    @Bean(destroyMethod = "")
    public ExecutorService relayExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("console-relay-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
