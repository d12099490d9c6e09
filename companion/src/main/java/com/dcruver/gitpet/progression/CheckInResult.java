package com.dcruver.gitpet.progression;

import com.dcruver.gitpet.io.PetState;
import lombok.Value;

/**
 * Outcome of a session check-in.
 */
@Value
public class CheckInResult {
    PetState state;

    // Vitality lost to absence
    int decayApplied;

    long hoursAway;

    boolean firstVisitOfDay;

    int xpGained;

    boolean leveledUp;
}
