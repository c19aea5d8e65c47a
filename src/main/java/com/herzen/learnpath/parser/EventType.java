package com.herzen.learnpath.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum EventType {
    LOGIN("login", EventCategory.LOGIN),
    LOGOUT("logout", EventCategory.LOGIN),
    ASSIGNMENT_SUBMIT("assignment_submit", EventCategory.ASSESSMENT),
    QUIZ_ATTEMPT("quiz_attempt", EventCategory.ASSESSMENT),
    EXAM_START("exam_start", EventCategory.ASSESSMENT),
    FORUM_POST("forum_post", EventCategory.SOCIAL),
    FORUM_REPLY("forum_reply", EventCategory.SOCIAL),
    CONTENT_VIEW("content_view", EventCategory.CONTENT),
    DOWNLOAD("download", EventCategory.CONTENT);

    private static final Map<String, EventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(EventType::wireName, Function.identity()));

    private final String wireName;
    private final EventCategory category;

    EventType(String wireName, EventCategory category) {
        this.wireName = wireName;
        this.category = category;
    }

    public String wireName() {
        return wireName;
    }

    public EventCategory category() {
        return category;
    }

    /** Case-insensitive, trimmed lookup. */
    public static Optional<EventType> fromWireName(String raw) {
        if (raw == null) return Optional.empty();
        return Optional.ofNullable(BY_WIRE_NAME.get(raw.trim().toLowerCase(Locale.ROOT)));
    }

    public enum EventCategory { LOGIN, CONTENT, ASSESSMENT, SOCIAL }
}
