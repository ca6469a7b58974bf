package com.chipilink.server.push;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Used when {@code push.enabled=false}.
 */
public class NoopPushNotifier implements PushNotifier {
    private static final Logger log = LoggerFactory.getLogger(NoopPushNotifier.class);

    @Override
    public CompletableFuture<Boolean> send(PushNotification notification) {
        log.debug("[PUSH] disabled, skipped user={} category={}", notification.userId(), notification.category());
        return CompletableFuture.completedFuture(false);
    }
}
