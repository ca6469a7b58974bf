package com.chipilink.server.push;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound device push. Implementations never throw; the future completes with
 * {@code false} when the notification could not be delivered.
 */
public interface PushNotifier {

    CompletableFuture<Boolean> send(PushNotification notification);
}
