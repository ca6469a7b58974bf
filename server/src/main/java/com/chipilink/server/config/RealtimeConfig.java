package com.chipilink.server.config;

import com.chipilink.server.events.EventBus;
import com.chipilink.server.push.HttpPushNotifier;
import com.chipilink.server.push.NoopPushNotifier;
import com.chipilink.server.push.PushNotifier;
import com.chipilink.server.ws.ConnectionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * One bus, one registry and one push notifier per process, injected wherever needed.
 */
@Configuration
public class RealtimeConfig {
    private static final Logger log = LoggerFactory.getLogger(RealtimeConfig.class);

    @Bean(destroyMethod = "close")
    public EventBus eventBus(@Value("${realtime.event-history-capacity:1000}") int historyCapacity,
                             @Value("${realtime.dispatch-threads:8}") int dispatchThreads,
                             @Value("${realtime.dispatch-threads-max:256}") int maxDispatchThreads,
                             @Value("${realtime.handler-timeout-ms:10000}") long handlerTimeoutMs) {
        return new EventBus(historyCapacity, dispatchThreads, maxDispatchThreads, Duration.ofMillis(handlerTimeoutMs));
    }

    @Bean(destroyMethod = "close")
    public ConnectionRegistry connectionRegistry(ObjectMapper mapper,
                                                 @Value("${realtime.send-threads:8}") int sendThreads,
                                                 @Value("${realtime.send-threads-max:256}") int maxSendThreads,
                                                 @Value("${realtime.send-timeout-ms:5000}") long sendTimeoutMs) {
        return new ConnectionRegistry(mapper, sendThreads, maxSendThreads, Duration.ofMillis(sendTimeoutMs));
    }

    @Bean
    public PushNotifier pushNotifier(ObjectMapper mapper,
                                     @Value("${push.enabled:false}") boolean enabled,
                                     @Value("${push.url:}") String url,
                                     @Value("${push.token:}") String token,
                                     @Value("${push.timeout-ms:3000}") int timeoutMs,
                                     @Value("${push.retry-max:2}") int retryMax,
                                     @Value("${push.queue-capacity:1000}") int queueCapacity) {
        if (!enabled || url.isBlank()) {
            log.info("[BOOT] push notifications disabled");
            return new NoopPushNotifier();
        }
        log.info("[BOOT] push notifications via {} timeout={}ms retries={}", url, timeoutMs, retryMax);
        return new HttpPushNotifier(mapper, url, token, timeoutMs, retryMax, queueCapacity);
    }
}
