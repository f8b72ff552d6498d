package dev.queuectl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public class Models {
    // fixed width so that text comparison in SQL is chronological
    public static final DateTimeFormatter ISO = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public static String nowIso(Clock clock) {
        return ISO.format(clock.instant());
    }

    public static String iso(Instant instant) {
        return instant == null ? null : ISO.format(instant);
    }

    public static Instant parse(String iso) {
        return iso == null ? null : Instant.from(ISO.parse(iso));
    }

    public enum JobState {
        PENDING, PROCESSING, COMPLETED, FAILED, DEAD;

        @JsonValue
        public String dbValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static JobState of(String value) {
            if (value == null) throw new IllegalArgumentException("state is required");
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown job state: " + value);
            }
        }
    }

    public static class Job {
        public String id;
        public String command;
        public JobState state = JobState.PENDING;
        public int attempts = 0;
        public int max_retries = 3;
        public int timeout = 20; // seconds
        public int backoff_base = 2;
        public int priority = 5;
        public int waiting_time = 0;
        public String created_at;
        public String updated_at;
        public String next_retry_at;
        public String error_message;
        public String output;
        public Double execution_time;
        public String locked_by;
        public String locked_at;

        public Job() {}

        public Job(String id, String command) {
            this.id = id;
            this.command = command;
        }

        @JsonProperty("effective_priority")
        public int effectivePriority() {
            return Scheduler.effectivePriority(this);
        }

        @Override
        public String toString() {
            return "Job{id='" + id + "', state=" + state + ", attempts=" + attempts + "/" + max_retries
                + ", priority=" + priority + ", waiting_time=" + waiting_time + "}";
        }
    }

    public static class Counts {
        public int total;
        public int pending;
        public int processing;
        public int completed;
        public int failed;
        public int dead;
        public int active_workers;

        public void set(JobState state, int v) {
            switch (state) {
                case PENDING -> pending = v;
                case PROCESSING -> processing = v;
                case COMPLETED -> completed = v;
                case FAILED -> failed = v;
                case DEAD -> dead = v;
            }
            total = pending + processing + completed + failed + dead;
        }
    }
}
