package com.chipilink.server.emit;

import com.chipilink.server.model.LocalizedText;

/**
 * Steps of a Rapid Pin challenge that are announced live.
 */
public enum ChallengeKind {
    CHALLENGE_CREATED("challenge_created"),
    DATE_PROPOSED("date_proposed"),
    DATE_ACCEPTED("date_accepted"),
    REFEREE_ASSIGNED("referee_assigned"),
    WAITING_REFEREE("waiting_referee");

    private final String type;

    ChallengeKind(String type) {
        this.type = type;
    }

    public String type() {
        return type;
    }

    LocalizedText text(String p1, String p2) {
        return switch (this) {
            case CHALLENGE_CREATED -> LocalizedText.of(
                    p1 + " desafió a " + p2,
                    p1 + " challenged " + p2,
                    p1 + " 挑战了 " + p2);
            case DATE_PROPOSED -> LocalizedText.of(
                    "Nueva propuesta de fecha para " + p1 + " vs " + p2,
                    "New date proposal for " + p1 + " vs " + p2,
                    p1 + " vs " + p2 + " 的新日期提议");
            case DATE_ACCEPTED -> LocalizedText.of(
                    "¡Fecha acordada! " + p1 + " vs " + p2,
                    "Date agreed! " + p1 + " vs " + p2,
                    "日期已确认！" + p1 + " vs " + p2);
            case REFEREE_ASSIGNED -> LocalizedText.of(
                    "Árbitro asignado para " + p1 + " vs " + p2,
                    "Referee assigned for " + p1 + " vs " + p2,
                    p1 + " vs " + p2 + " 已分配裁判");
            case WAITING_REFEREE -> LocalizedText.of(
                    p1 + " vs " + p2 + " esperan árbitro",
                    p1 + " vs " + p2 + " waiting for referee",
                    p1 + " vs " + p2 + " 等待裁判");
        };
    }
}
