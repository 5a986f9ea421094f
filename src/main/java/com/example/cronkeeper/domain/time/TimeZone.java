package com.example.cronkeeper.domain.time;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Zone a {@link DateTime} is expressed in.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = TimeZone.Utc.class, name = "Utc"),
        @JsonSubTypes.Type(value = TimeZone.Local.class, name = "Local"),
        @JsonSubTypes.Type(value = TimeZone.Offset.class, name = "Offset")
})
public sealed interface TimeZone {

    ZoneId toZoneId();

    record Utc() implements TimeZone {
        @Override
        public ZoneId toZoneId() {
            return ZoneOffset.UTC;
        }
    }

    /**
     * The daemon host's zone, looked up on every use.
     */
    record Local() implements TimeZone {
        @Override
        public ZoneId toZoneId() {
            return ZoneId.systemDefault();
        }
    }

    record Offset(int hours) implements TimeZone {
        @Override
        public ZoneId toZoneId() {
            return ZoneOffset.ofHours(hours);
        }
    }
}
