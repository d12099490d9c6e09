package com.dcruver.gitpet.progression;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete pet mood derived from vitality and idle time.
 */
public enum Mood {
    EXCITED("excited", "Tail wagging at full speed"),
    HAPPY("happy", "Content and playful"),
    NEUTRAL("neutral", "Doing fine"),
    SAD("sad", "Could use some attention"),
    SICK("sick", "Your repository needs care"),
    SLEEPING("sleeping", "Zzz...");

    private final String label;
    private final String description;

    Mood(String label, String description) {
        this.label = label;
        this.description = description;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return label;
    }
}
