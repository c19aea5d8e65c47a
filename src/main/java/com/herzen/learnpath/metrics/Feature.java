package com.herzen.learnpath.metrics;

import java.util.Arrays;
import java.util.List;

/**
 * Behavioural features of a student, in the fixed order used for every vector of a run.
 * Rates are per day of the student's observation window.
 */
public enum Feature {
    TOTAL_EVENTS("total_events", "total activity", "events",
            "log in and work through the course a little every day"),
    ACTIVE_DAYS("active_days", "number of active days", "days",
            "spread your study over more days of the week"),
    EVENTS_PER_DAY("events_per_day", "daily activity", "events/day",
            "plan a short study block on each course day"),
    LOGIN_RATE("login_rate", "login frequency", "logins/day",
            "check into the course at least once a day"),
    CONTENT_RATE("content_rate", "content engagement", "views/day",
            "review the lecture materials and downloads before each assessment"),
    ASSESSMENT_RATE("assessment_rate", "assessment activity", "attempts/day",
            "attempt assignments and practice quizzes as soon as they open"),
    QUIZ_FREQUENCY("quiz_frequency", "quiz frequency", "quizzes/day",
            "take the practice quizzes for each module, more than once if allowed"),
    FORUM_PARTICIPATION_RATE("forum_participation_rate", "forum activity", "posts/day",
            "post or reply in the course forum at least twice a week"),
    SESSION_COUNT("session_count", "number of study sessions", "sessions",
            "split your work into more, shorter study sessions"),
    AVG_SESSION_DURATION("avg_session_duration", "session length", "s",
            "aim for focused sessions of 30 to 60 minutes"),
    AVG_EVENTS_PER_SESSION("avg_events_per_session", "activities per session", "events/session",
            "complete several related activities in each session"),
    TOTAL_ACTIVITY_DURATION("total_activity_duration", "total time on task", "s",
            "increase the time you spend on course activities"),
    EARLY_SUBMISSION_RATE("early_submission_rate", "early submissions", "share",
            "start assignments earlier and submit ahead of most of your peers"),
    ACTIVITY_REGULARITY("activity_regularity", "study regularity", "index",
            "keep a steady rhythm instead of studying in bursts"),
    NIGHT_ACTIVITY_SHARE("night_activity_share", "late-night activity", "share",
            "move some study time to daylight hours"),
    WEEKEND_ACTIVITY_SHARE("weekend_activity_share", "weekend activity", "share",
            "add a short weekend review session");

    public static final List<Feature> ORDERED = Arrays.asList(values());

    private final String key;
    private final String displayName;
    private final String unit;
    private final String advice;

    Feature(String key, String displayName, String unit, String advice) {
        this.key = key;
        this.displayName = displayName;
        this.unit = unit;
        this.advice = advice;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public String unit() {
        return unit;
    }

    public String advice() {
        return advice;
    }

    public static Feature fromKey(String key) {
        for (Feature f : values()) {
            if (f.key.equals(key)) return f;
        }
        throw new IllegalArgumentException("Unknown feature: " + key);
    }
}
