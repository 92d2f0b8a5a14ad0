package com.airgate.autoreply.attention;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How much focus the responder currently has on one user of a session.
 * Mutable; only {@link AttentionStore} touches live instances.
 */
@Data
@NoArgsConstructor
public class AttentionProfile {

    private String userId;
    private String userName;
    /** In [0,1]. */
    private double attentionScore;
    /** In [-1,1]. */
    private double emotion;
    /** Epoch ms of the last direct interaction. */
    private long lastInteraction;
    /** Epoch ms up to which decay has been applied. */
    private long lastDecayAt;
    private int interactionCount;
    private String lastMessagePreview = "";

    public AttentionProfile(String userId, String userName, long nowMs) {
        this.userId = userId;
        this.userName = userName;
        this.lastInteraction = nowMs;
        this.lastDecayAt = nowMs;
    }

    AttentionProfile copy() {
        AttentionProfile c = new AttentionProfile();
        c.userId = userId;
        c.userName = userName;
        c.attentionScore = attentionScore;
        c.emotion = emotion;
        c.lastInteraction = lastInteraction;
        c.lastDecayAt = lastDecayAt;
        c.interactionCount = interactionCount;
        c.lastMessagePreview = lastMessagePreview;
        return c;
    }
}
