package com.basketgov.api;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class StreamConfiguration {

    /**
     * Single sender thread for all timeline streams: writes to slow clients
     * happen here, never on the thread that appended the event, and events
     * keep their append order.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService timelineStreamExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "timeline-stream");
            thread.setDaemon(true);
            return thread;
        });
    }
}
