package com.questrail.push.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The standard {@code aps} dictionary, plus any custom top-level keys.
 *
 * <pre>
 *   ApsPayload.builder()
 *       .alert("Hello")
 *       .badge(3)
 *       .sound("default")
 *       .build()
 *       .toMap()                → {"aps": {"alert": "Hello", "badge": 3, "sound": "default"}}
 * </pre>
 *
 * Keys that were not set are omitted.
 */
public final class ApsPayload
{
    private final Map<String, Object> aps;
    private final Map<String, Object> custom;

    private ApsPayload(Map<String, Object> aps, Map<String, Object> custom)
    {
        this.aps = Collections.unmodifiableMap(new LinkedHashMap<>(aps));
        this.custom = Collections.unmodifiableMap(new LinkedHashMap<>(custom));
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /** The {@code aps} dictionary alone. */
    public Map<String, Object> aps()
    {
        return aps;
    }

    /** The complete payload: {@code aps} first, then custom keys. */
    public Map<String, Object> toMap()
    {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("aps", aps);
        payload.putAll(custom);
        return payload;
    }

    public static final class Builder
    {
        private final Map<String, Object> aps = new LinkedHashMap<>();
        private final Map<String, Object> custom = new LinkedHashMap<>();

        public Builder alert(String alert)
        {
            aps.put("alert", Objects.requireNonNull(alert, "alert"));
            return this;
        }

        /** Structured alert, e.g. {@code title}, {@code body}, {@code loc-key}. */
        public Builder alert(Map<String, ?> alert)
        {
            aps.put("alert", new LinkedHashMap<>(Objects.requireNonNull(alert, "alert")));
            return this;
        }

        public Builder badge(int badge)
        {
            if (badge < 0) {
                throw new IllegalArgumentException("badge must be >= 0");
            }
            aps.put("badge", badge);
            return this;
        }

        public Builder sound(String sound)
        {
            aps.put("sound", Objects.requireNonNull(sound, "sound"));
            return this;
        }

        /** Marks a background update; only a {@code true} value is sent. */
        public Builder contentAvailable(boolean contentAvailable)
        {
            if (contentAvailable) {
                aps.put("content-available", 1);
            }
            else {
                aps.remove("content-available");
            }
            return this;
        }

        public Builder category(String category)
        {
            aps.put("category", Objects.requireNonNull(category, "category"));
            return this;
        }

        /**
         * Add an application-defined top-level key.
         *
         * @throws IllegalArgumentException for {@code "aps"}
         */
        public Builder custom(String key, Object value)
        {
            Objects.requireNonNull(key, "key");
            if ("aps".equals(key)) {
                throw new IllegalArgumentException("\"aps\" is reserved");
            }
            custom.put(key, value);
            return this;
        }

        public ApsPayload build()
        {
            return new ApsPayload(aps, custom);
        }
    }
}
