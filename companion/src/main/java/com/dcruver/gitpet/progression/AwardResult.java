package com.dcruver.gitpet.progression;

import com.dcruver.gitpet.io.PetState;
import lombok.Value;

/**
 * Outcome of an experience-earning update.
 */
@Value
public class AwardResult {
    PetState state;
    int xpGained;
    int previousLevel;
    int newLevel;

    public boolean isLeveledUp() {
        return newLevel > previousLevel;
    }
}
