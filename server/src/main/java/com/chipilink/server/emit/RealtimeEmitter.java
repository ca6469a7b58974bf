package com.chipilink.server.emit;

import com.chipilink.server.model.LocalizedText;
import com.chipilink.server.model.RealtimeMessage;
import com.chipilink.server.push.PushNotification;
import com.chipilink.server.push.PushNotifier;
import com.chipilink.server.ws.ConnectionRegistry;
import com.chipilink.server.ws.RoomCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates domain actions into room broadcasts, user messages and device pushes.
 * <p>
 * Routing only: admins see store, request and wallet activity in the {@code admin} room,
 * affected users get their own copy. Every method swallows and logs failures so a
 * notification can never fail the request that triggered it.
 */
@Component
public class RealtimeEmitter {
    private static final Logger log = LoggerFactory.getLogger(RealtimeEmitter.class);

    static final String ADMIN = RoomCatalog.ADMIN.roomName();
    static final String RAPIDPIN = RoomCatalog.RAPIDPIN.roomName();

    private final ConnectionRegistry registry;
    private final PushNotifier push;

    public RealtimeEmitter(ConnectionRegistry registry, PushNotifier push) {
        this.registry = registry;
        this.push = push;
    }

    // ---------------------------------------------------------------- store

    public void orderSubmitted(String orderId, String studentName, BigDecimal totalAmount, int itemCount, String userId) {
        guard("order_submitted", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("order_id", orderId);
            payload.put("student_name", studentName);
            payload.put("total_amount", totalAmount);
            payload.put("item_count", itemCount);
            payload.put("user_id", userId);
            registry.broadcastToRoom(ADMIN, RealtimeMessage.of("order_submitted", payload, LocalizedText.of(
                    "Nuevo pedido de " + studentName + " (" + itemCount + " artículos)",
                    "New order from " + studentName + " (" + itemCount + " items)",
                    studentName + " 的新订单（" + itemCount + " 件）")));
        });
    }

    public void orderStatusChanged(String orderId, String userId, String status) {
        guard("order_status_changed", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("order_id", orderId);
            payload.put("status", status);
            RealtimeMessage msg = RealtimeMessage.of("order_status_changed", payload, LocalizedText.of(
                    "Tu pedido " + orderId + " ahora está: " + status,
                    "Your order " + orderId + " is now: " + status,
                    "您的订单 " + orderId + " 状态：" + status));
            registry.sendToUser(userId, msg);
            registry.broadcastToRoom(ADMIN, msg);
        });
    }

    // ---------------------------------------------------------------- access requests

    public void accessRequestUpdated(String requestId, String userId, String studentName, String status) {
        guard("access_request_updated", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("request_id", requestId);
            payload.put("user_id", userId);
            payload.put("student_name", studentName);
            payload.put("status", status);
            LocalizedText text = accessRequestText(studentName, status);
            RealtimeMessage msg = RealtimeMessage.of("access_request_updated", payload, text);

            registry.broadcastToRoom(ADMIN, msg);
            registry.sendToUser(userId, msg);
            push.send(new PushNotification(userId, "access_request",
                    LocalizedText.of("Solicitud de acceso", "Access request", "访问请求"), text,
                    Map.of("request_id", requestId, "status", status)));
        });
    }

    private static LocalizedText accessRequestText(String studentName, String status) {
        return switch (status) {
            case "approved" -> LocalizedText.of(
                    "Solicitud aprobada para " + studentName,
                    "Request approved for " + studentName,
                    studentName + " 的请求已批准");
            case "rejected" -> LocalizedText.of(
                    "Solicitud rechazada para " + studentName,
                    "Request rejected for " + studentName,
                    studentName + " 的请求已拒绝");
            default -> LocalizedText.of(
                    "Solicitud de " + studentName + ": " + status,
                    "Request for " + studentName + ": " + status,
                    studentName + " 的请求：" + status);
        };
    }

    // ---------------------------------------------------------------- wallet

    /**
     * Admins see every top-up; the user only gets their own transaction.
     */
    public void walletTopup(String transactionId, String userId, String userName, BigDecimal amount, String currency) {
        guard("wallet_topup", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("transaction_id", transactionId);
            payload.put("user_id", userId);
            payload.put("user_name", userName);
            payload.put("amount", amount);
            payload.put("currency", currency);
            String amountText = amount.toPlainString() + " " + currency;

            registry.broadcastToRoom(ADMIN, RealtimeMessage.of("wallet_topup", payload, LocalizedText.of(
                    userName + " recargó " + amountText,
                    userName + " topped up " + amountText,
                    userName + " 充值了 " + amountText)));

            LocalizedText personal = LocalizedText.of(
                    "Tu recarga de " + amountText + " fue acreditada",
                    "Your top-up of " + amountText + " was credited",
                    "您的 " + amountText + " 充值已到账");
            registry.sendToUser(userId, RealtimeMessage.of("personal_wallet_topup", payload, personal));
            push.send(new PushNotification(userId, "wallet",
                    LocalizedText.of("Billetera", "Wallet", "钱包"), personal,
                    Map.of("transaction_id", transactionId)));
        });
    }

    // ---------------------------------------------------------------- rapid pin

    public void likeUpdate(String queueId, String userId, String userName, boolean liked, int likesCount) {
        guard("like_update", () -> {
            Map<String, Object> user = new LinkedHashMap<>();
            user.put("user_id", userId);
            user.put("name", userName);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("queue_id", queueId);
            payload.put("action", liked ? "liked" : "unliked");
            payload.put("likes_count", likesCount);
            payload.put("user", user);
            registry.broadcastToRoom(RAPIDPIN, RealtimeMessage.of("like_update", payload, LocalizedText.of(
                    userName + (liked ? " dio like" : " quitó su like") + " al reto",
                    userName + (liked ? " liked" : " unliked") + " the challenge",
                    userName + (liked ? " 点赞了" : " 取消点赞") + " 挑战")));
        });
    }

    public void commentAdded(String queueId, String commentId, String userId, String userName, String content, int commentsCount) {
        guard("comment_added", () -> {
            Map<String, Object> comment = new LinkedHashMap<>();
            comment.put("user_id", userId);
            comment.put("user_name", userName);
            comment.put("content", content);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("queue_id", queueId);
            payload.put("comment_id", commentId);
            payload.put("comments_count", commentsCount);
            payload.put("comment", comment);
            registry.broadcastToRoom(RAPIDPIN, RealtimeMessage.of("comment_added", payload, LocalizedText.of(
                    userName + " comentó en el reto",
                    userName + " commented on the challenge",
                    userName + " 评论了挑战")));
        });
    }

    /**
     * Broadcasts a challenge step to the {@code rapidpin} room and sends {@code personal_<kind>}
     * to each player.
     */
    public void challengeEvent(ChallengeKind kind, String queueId, String player1Name, String player2Name,
                               Collection<String> playerIds, Map<String, ?> extra) {
        guard(kind.type(), () -> {
            LocalizedText text = kind.text(player1Name, player2Name);
            Map<String, Object> players = new LinkedHashMap<>();
            players.put("player1", player1Name);
            players.put("player2", player2Name);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("queue_id", queueId);
            payload.put("players", players);
            if (extra != null) {
                payload.putAll(extra);
            }
            registry.broadcastToRoom(RAPIDPIN, RealtimeMessage.of(kind.type(), payload, text));

            Map<String, Object> personal = new LinkedHashMap<>();
            personal.put("queue_id", queueId);
            registry.sendToUsers(playerIds == null ? List.of() : playerIds,
                    RealtimeMessage.of("personal_" + kind.type(), personal, text));
        });
    }

    // ---------------------------------------------------------------- crm

    /**
     * Staff replies go to the user; user messages go to the {@code admin} room.
     */
    public void crmMessage(String userId, String conversationId, String preview, boolean fromStaff) {
        guard("crm_message", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("conversation_id", conversationId);
            payload.put("user_id", userId);
            payload.put("preview", preview);
            payload.put("from_staff", fromStaff);
            if (fromStaff) {
                LocalizedText text = LocalizedText.of("Nuevo mensaje del equipo", "New message from staff", "来自工作人员的新消息");
                registry.sendToUser(userId, RealtimeMessage.of("crm_message", payload, text));
                push.send(new PushNotification(userId, "crm", text,
                        LocalizedText.of(preview, preview, preview),
                        Map.of("conversation_id", conversationId)));
            } else {
                registry.broadcastToRoom(ADMIN, RealtimeMessage.of("crm_message", payload, LocalizedText.of(
                        "Nuevo mensaje de cliente", "New customer message", "新客户消息")));
            }
        });
    }

    private void guard(String action, Runnable emit) {
        try {
            emit.run();
        } catch (RuntimeException e) {
            log.error("[EMIT] {} failed", action, e);
        }
    }
}
