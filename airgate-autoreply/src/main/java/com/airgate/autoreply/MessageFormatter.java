package com.airgate.autoreply;

import com.airgate.autoreply.buffer.BufferedTurn;
import com.airgate.autoreply.spi.ConversationTurn;
import com.airgate.common.config.AirGateConfig.MessageConfig;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds turn text and generation context.
 * <p>
 * User turns carry a {@code [time: ...] [sender: name (id: id)]} prefix so
 * the generator can tell speakers apart in a group.
 */
public final class MessageFormatter {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final MessageConfig config;
    private final ZoneId zone;

    public MessageFormatter(MessageConfig config, ZoneId zone) {
        this.config = config;
        this.zone = zone;
    }

    public String format(InboundEvent event) {
        StringBuilder prefix = new StringBuilder();
        if (config.isIncludeTimestamp()) {
            prefix.append("[time: ")
                    .append(TIME.format(Instant.ofEpochMilli(event.timestamp()).atZone(zone)))
                    .append(']');
        }
        if (config.isIncludeSenderInfo()) {
            if (prefix.length() > 0) {
                prefix.append(' ');
            }
            String name = event.senderName() == null || event.senderName().isBlank() ? event.senderId()
                    : event.senderName();
            prefix.append("[sender: ").append(name).append(" (id: ").append(event.senderId()).append(")]");
        }
        String text = event.text() == null ? "" : event.text();
        return prefix.length() == 0 ? text : prefix + "\n" + text;
    }

    /**
     * Durable turns followed by pending turns not already in them, trimmed to
     * the newest {@code maxContextTurns}.
     */
    public List<ConversationTurn> mergeContext(List<ConversationTurn> durable, List<BufferedTurn> pending) {
        List<ConversationTurn> merged = new ArrayList<>(durable);
        Set<String> seen = new HashSet<>();
        durable.forEach(t -> seen.add(t.content()));
        for (BufferedTurn b : pending) {
            String content = b.effectiveContent();
            if (content != null && seen.add(content)) {
                merged.add(new ConversationTurn(b.role(), content));
            }
        }
        int max = Math.max(1, config.getMaxContextTurns());
        return merged.size() <= max ? merged : List.copyOf(merged.subList(merged.size() - max, merged.size()));
    }

    /** Plain-text transcript, one {@code role: content} block per turn. */
    public static String render(List<ConversationTurn> turns) {
        StringBuilder sb = new StringBuilder();
        for (ConversationTurn t : turns) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(t.role()).append(": ").append(t.content());
        }
        return sb.toString();
    }
}
