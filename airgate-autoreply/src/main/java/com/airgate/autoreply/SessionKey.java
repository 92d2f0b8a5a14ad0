package com.airgate.autoreply;

import java.util.Collection;
import java.util.Locale;

/**
 * Identity of one conversation: platform + kind + conversation id.
 * <p>
 * The string form {@code platform_kind_conversationId} (kind lower-cased) is
 * what every engine table is keyed by, e.g. {@code qq_group_123456}.
 */
public record SessionKey(String platform, Kind kind, String conversationId) {

    public enum Kind {
        PRIVATE, GROUP
    }

    public SessionKey {
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("platform is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId is required");
        }
    }

    public static SessionKey group(String platform, String conversationId) {
        return new SessionKey(platform, Kind.GROUP, conversationId);
    }

    public static SessionKey direct(String platform, String conversationId) {
        return new SessionKey(platform, Kind.PRIVATE, conversationId);
    }

    /** Table key, {@code platform_kind_conversationId}. */
    public String id() {
        return platform + "_" + kind.name().toLowerCase(Locale.ROOT) + "_" + conversationId;
    }

    public boolean isGroup() {
        return kind == Kind.GROUP;
    }

    /**
     * Parse either {@code platform_kind_id} or {@code platform:kind:id}.
     *
     * @throws IllegalArgumentException when neither form matches
     */
    public static SessionKey parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("empty session key");
        }
        String value = raw.trim();
        String[] colon = value.split(":", 3);
        if (colon.length == 3) {
            return new SessionKey(colon[0], parseKind(colon[1], raw), colon[2]);
        }
        // The platform may itself contain underscores, so anchor on the kind token.
        for (Kind kind : Kind.values()) {
            String token = "_" + kind.name().toLowerCase(Locale.ROOT) + "_";
            int idx = value.indexOf(token);
            if (idx > 0 && idx + token.length() < value.length()) {
                return new SessionKey(value.substring(0, idx), kind, value.substring(idx + token.length()));
            }
        }
        throw new IllegalArgumentException("unrecognised session key: " + raw);
    }

    private static Kind parseKind(String token, String raw) {
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "group" -> Kind.GROUP;
            case "private", "direct", "dm" -> Kind.PRIVATE;
            default -> throw new IllegalArgumentException("unrecognised session kind in: " + raw);
        };
    }

    /**
     * Whether this session is listed in an allow-list of conversation ids or
     * full keys. An empty list allows everything.
     */
    public boolean isListedIn(Collection<String> allowList) {
        if (allowList == null || allowList.isEmpty()) {
            return true;
        }
        String id = id();
        for (String entry : allowList) {
            if (entry == null) {
                continue;
            }
            String e = entry.trim();
            if (e.equals(conversationId) || e.equals(id)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return id();
    }
}
