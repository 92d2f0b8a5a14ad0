package com.airgate.autoreply.proactive;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-session bookkeeping for proactive origination. All times are epoch ms.
 */
@Data
public class ProactiveSessionState {

    private long lastBotReplyTime;
    private long lastUserMessageTime;
    private long lastProactiveTime;
    private int consecutiveFailures;
    /** 0 when not cooling down. */
    private long cooldownUntil;
    /** User messages since the last bot turn. */
    private int userMessageCount;
    /** User message times, pruned to the last 24 hours. */
    private List<Long> userMessageTimestamps = new ArrayList<>();

    /** Additive admission bonus after a proactive turn; 0 when disarmed. */
    private double tempBoostValue;
    private long tempBoostUntil;
    /** A proactive turn is waiting for any user to answer. */
    private boolean awaitingReply;

    public boolean tempBoostArmed() {
        return awaitingReply || tempBoostUntil > 0;
    }

    void disarmTempBoost() {
        tempBoostValue = 0;
        tempBoostUntil = 0;
        awaitingReply = false;
    }

    long lastActivity() {
        return Math.max(lastBotReplyTime, Math.max(lastUserMessageTime, lastProactiveTime));
    }

    ProactiveSessionState copy() {
        ProactiveSessionState c = new ProactiveSessionState();
        c.lastBotReplyTime = lastBotReplyTime;
        c.lastUserMessageTime = lastUserMessageTime;
        c.lastProactiveTime = lastProactiveTime;
        c.consecutiveFailures = consecutiveFailures;
        c.cooldownUntil = cooldownUntil;
        c.userMessageCount = userMessageCount;
        if (userMessageTimestamps != null) {
            for (Long ts : userMessageTimestamps) {
                if (ts != null) {
                    c.userMessageTimestamps.add(ts);
                }
            }
        }
        c.tempBoostValue = tempBoostValue;
        c.tempBoostUntil = tempBoostUntil;
        c.awaitingReply = awaitingReply;
        return c;
    }
}
