package com.airgate.autoreply.proactive;

import com.airgate.autoreply.SessionKey;
import com.airgate.common.config.AirGateConfig.ProactiveConfig;
import com.airgate.common.infra.Decay;
import com.airgate.common.infra.IntervalRunner;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalTime;
import java.util.function.DoubleSupplier;

/**
 * Starts conversations in sessions that have gone quiet.
 * <p>
 * One background pass per check interval walks every known session: allow
 * list, cooldown, silence, user activity, then a single draw against the
 * base probability scaled by quiet hours and the time-of-day factor. After a
 * successful proactive turn a temporary admission bonus stays armed until a
 * user speaks or it expires; an expiry without any reply counts as a failure.
 * Repeated failures put the session into cooldown.
 */
@Slf4j
public class ProactiveScheduler implements AutoCloseable {

    static final long ACTIVITY_RETENTION_MS = 24L * 3600 * 1000;

    private final ProactiveConfig config;
    private final ProactiveStateTable table;
    private final QuietHours quietHours;
    private final TimePeriodFactor timeFactor;
    private final Clock clock;
    private final DoubleSupplier random;
    private final Runnable stateChanged;
    private ProactiveOriginator originator;
    private IntervalRunner runner;

    public ProactiveScheduler(ProactiveConfig config, ProactiveStateTable table, Clock clock, DoubleSupplier random,
            Runnable stateChanged) {
        this.config = config;
        this.table = table;
        this.quietHours = new QuietHours(config.getQuietHours());
        this.timeFactor = new TimePeriodFactor(config.getTimePeriods());
        this.clock = clock;
        this.random = random;
        this.stateChanged = stateChanged;
    }

    public synchronized void setOriginator(ProactiveOriginator originator) {
        this.originator = originator;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Start the background loop. Does nothing when proactive origination is
     * disabled or no originator is available.
     */
    public synchronized boolean start() {
        if (!config.isEnabled()) {
            log.info("Proactive origination disabled");
            return false;
        }
        if (originator == null) {
            log.warn("Proactive origination enabled but no generator/transport is available");
            return false;
        }
        if (runner == null) {
            runner = new IntervalRunner("airgate-proactive", config.getCheckIntervalSeconds() * 1000L,
                    this::runPass);
        }
        runner.start();
        return true;
    }

    public synchronized boolean isRunning() {
        return runner != null && runner.isRunning();
    }

    @Override
    public synchronized void close() {
        if (runner != null) {
            runner.close();
            runner = null;
        }
    }

    // =========================================================================
    // Event path
    // =========================================================================

    /** A user spoke: count activity and disarm any pending temporary boost. */
    public void onUserMessage(SessionKey session) {
        long now = clock.millis();
        boolean disarmed = table.withState(session.id(), s -> {
            s.setLastUserMessageTime(now);
            s.setUserMessageCount(s.getUserMessageCount() + 1);
            s.getUserMessageTimestamps().add(now);
            s.getUserMessageTimestamps().removeIf(ts -> now - ts > ACTIVITY_RETENTION_MS);
            if (s.tempBoostArmed()) {
                s.disarmTempBoost();
                s.setConsecutiveFailures(0);
                return true;
            }
            return false;
        });
        if (disarmed) {
            log.info("User replied in {} after proactive turn; temporary boost disarmed", session);
        }
    }

    /** The responder spoke; restarts the silence timer and the activity count. */
    public void recordBotReply(SessionKey session, boolean proactive) {
        long now = clock.millis();
        table.withState(session.id(), s -> {
            s.setLastBotReplyTime(now);
            if (proactive) {
                s.setLastProactiveTime(now);
            }
            s.setUserMessageCount(0);
            s.getUserMessageTimestamps().clear();
            return null;
        });
    }

    /** Additive admission bonus currently armed for the session, else 0. */
    public double tempBoost(String session) {
        if (!table.contains(session)) {
            return 0.0;
        }
        long now = clock.millis();
        return table.withState(session, s -> now < s.getTempBoostUntil() ? s.getTempBoostValue() : 0.0);
    }

    // =========================================================================
    // Loop
    // =========================================================================

    /** One pass over every known session. Never throws. */
    public void runPass(String reason) {
        ProactiveOriginator current;
        synchronized (this) {
            current = originator;
        }
        int triggered = 0;
        for (String key : table.sessions()) {
            try {
                SessionKey session = SessionKey.parse(key);
                expireUnansweredBoost(session);
                ProactiveCheck check = evaluate(session);
                if (!check.trigger() || current == null) {
                    continue;
                }
                triggered++;
                log.info("Proactive turn triggered in {} (p={})", session,
                        String.format("%.3f", check.probability()));
                if (current.originate(session, config.getPrompt())) {
                    onOriginated(session);
                } else {
                    recordFailure(session);
                }
            } catch (Exception e) {
                log.error("Proactive check failed for {}: {}", key, e.getMessage(), e);
            }
        }
        log.debug("Proactive pass ({}) done, {} triggered", reason, triggered);
        stateChanged.run();
    }

    /** Evaluate the rules for one session at the current time. */
    public ProactiveCheck evaluate(SessionKey session) {
        long now = clock.millis();
        if (!config.isEnabled() || !session.isListedIn(config.getEnabledSessions())) {
            return ProactiveCheck.skip(ProactiveCheck.Reason.NOT_ALLOWED);
        }
        ProactiveCheck.Reason gate = table.withState(session.id(), s -> {
            if (s.getCooldownUntil() > 0) {
                if (now < s.getCooldownUntil()) {
                    return ProactiveCheck.Reason.COOLDOWN;
                }
                s.setCooldownUntil(0);
                log.info("Proactive cooldown over for {}", session);
            }
            if (now - s.getLastBotReplyTime() < config.getSilenceThresholdSeconds() * 1000L) {
                return ProactiveCheck.Reason.SILENCE;
            }
            if (config.isRequireUserActivity() && !isActive(s, now)) {
                return ProactiveCheck.Reason.INACTIVE;
            }
            return null;
        });
        if (gate != null) {
            return ProactiveCheck.skip(gate);
        }

        LocalTime time = LocalTime.now(clock);
        double quiet = quietHours.factor(time);
        if (quiet == 0.0) {
            return ProactiveCheck.skip(ProactiveCheck.Reason.QUIET_HOURS);
        }
        double p = Decay.clamp(config.getProbability() * quiet * timeFactor.factor(time), 0.0, 1.0);
        double roll = random.getAsDouble();
        if (roll < p) {
            return new ProactiveCheck(true, ProactiveCheck.Reason.TRIGGERED, p);
        }
        // A miss restarts the silence timer so the next attempt waits a full threshold.
        table.withState(session.id(), s -> {
            s.setLastBotReplyTime(now);
            return null;
        });
        return new ProactiveCheck(false, ProactiveCheck.Reason.PROBABILITY_MISS, p);
    }

    /**
     * Count a failed or unanswered proactive turn; enough in a row start a
     * cooldown and reset the count.
     */
    public void recordFailure(SessionKey session) {
        long now = clock.millis();
        table.withState(session.id(), s -> {
            s.setConsecutiveFailures(s.getConsecutiveFailures() + 1);
            s.setUserMessageCount(0);
            s.getUserMessageTimestamps().clear();
            if (s.getConsecutiveFailures() >= config.getMaxFailures()) {
                log.info("Proactive turns failed {} times in {}; cooling down for {}s",
                        s.getConsecutiveFailures(), session, config.getCooldownSeconds());
                s.setCooldownUntil(now + config.getCooldownSeconds() * 1000L);
                s.setConsecutiveFailures(0);
            }
            return null;
        });
    }

    /** Bookkeeping after a delivered proactive turn. */
    public void onOriginated(SessionKey session) {
        recordBotReply(session, true);
        long now = clock.millis();
        table.withState(session.id(), s -> {
            s.setConsecutiveFailures(0);
            s.setTempBoostValue(config.getTempBoostProbability());
            s.setTempBoostUntil(now + config.getTempBoostDurationSeconds() * 1000L);
            s.setAwaitingReply(true);
            return null;
        });
        log.info("Temporary boost +{} armed in {} for {}s", config.getTempBoostProbability(), session,
                config.getTempBoostDurationSeconds());
    }

    private void expireUnansweredBoost(SessionKey session) {
        long now = clock.millis();
        boolean unanswered = table.withState(session.id(), s -> {
            if (s.isAwaitingReply() && now >= s.getTempBoostUntil()) {
                s.disarmTempBoost();
                return true;
            }
            return false;
        });
        if (unanswered) {
            log.info("Proactive turn in {} got no reply", session);
            recordFailure(session);
        }
    }

    private boolean isActive(ProactiveSessionState s, long now) {
        int min = config.getMinUserMessages();
        if (s.getUserMessageCount() == 0 || s.getUserMessageCount() < min) {
            return false;
        }
        long window = config.getUserActivityWindowSeconds() * 1000L;
        long recent = s.getUserMessageTimestamps().stream().filter(ts -> now - ts <= window).count();
        return recent >= min;
    }
}
