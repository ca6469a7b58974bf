package com.chipilink.server.push;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Posts notifications to the push gateway with a per-request timeout and per-notification retries.
 * <p>
 * Contract:
 * - {@link #send} returns immediately; delivery runs on the notifier's own pool.
 * - A notification counts as delivered on any 2xx answer.
 * - After {@code retryMax} extra attempts the failure is logged and the future completes with false.
 * - At most {@code queueCapacity} notifications wait for a worker; beyond that they are dropped,
 *   logged, and completed with false.
 */
public class HttpPushNotifier implements PushNotifier, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HttpPushNotifier.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 1000;

    private final URI endpoint;
    private final String token;       // Bearer token for the gateway
    private final int timeoutMs;      // per-request timeout
    private final int retryMax;       // extra attempts (total attempts = retryMax + 1)

    private final ObjectMapper mapper;
    private final HttpClient client;
    private final ThreadPoolExecutor pool;

    public HttpPushNotifier(ObjectMapper mapper, String url, String token, int timeoutMs, int retryMax) {
        this(mapper, url, token, timeoutMs, retryMax, DEFAULT_QUEUE_CAPACITY);
    }

    public HttpPushNotifier(ObjectMapper mapper, String url, String token, int timeoutMs, int retryMax,
                            int queueCapacity) {
        this.mapper = mapper;
        this.endpoint = URI.create(url);
        this.token = token;
        this.timeoutMs = Math.max(1, timeoutMs);
        this.retryMax = Math.max(0, retryMax);
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(this.timeoutMs))
                .build();
        AtomicInteger seq = new AtomicInteger();
        this.pool = new ThreadPoolExecutor(2, 2, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)), r -> {
            Thread t = new Thread(r, "push-sender-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<Boolean> send(PushNotification notification) {
        try {
            return CompletableFuture.supplyAsync(() -> deliver(notification), pool);
        } catch (RejectedExecutionException e) {
            log.warn("[PUSH] queue full or notifier closed, dropped user={} category={} queued={}",
                    notification.userId(), notification.category(), pool.getQueue().size());
            return CompletableFuture.completedFuture(false);
        }
    }

    boolean deliver(PushNotification notification) {
        final String json;
        try {
            json = mapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            log.error("[PUSH] cannot serialize notification user={}", notification.userId(), e);
            return false;
        }

        Exception last = null;
        int attempts = retryMax + 1;
        for (int i = 0; i < attempts; i++) {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(Duration.ofMillis(timeoutMs))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json));
            if (token != null && !token.isBlank()) {
                req.header("Authorization", "Bearer " + token);
            }
            try {
                HttpResponse<Void> res = client.send(req.build(), HttpResponse.BodyHandlers.discarding());
                int code = res.statusCode();
                if (code >= 200 && code < 300) {
                    log.info("[PUSH] delivered user={} category={} attempt={}", notification.userId(), notification.category(), i + 1);
                    return true;
                }
                last = new IllegalStateException("non-2xx: " + code);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                last = e;
                break;
            } catch (Exception e) {
                last = e; // timeout / connection error
            }
        }
        log.warn("[PUSH] failed user={} category={} after {} attempt(s): {}",
                notification.userId(), notification.category(), attempts, String.valueOf(last));
        return false;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
