package com.example.craftscore.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Review urgency; declaration order is ascending urgency. */
public enum ReviewPriority {

    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
