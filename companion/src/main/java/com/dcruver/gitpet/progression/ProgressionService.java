package com.dcruver.gitpet.progression;

import com.dcruver.gitpet.domain.CodeIssue;
import com.dcruver.gitpet.domain.RepositoryHealth;
import com.dcruver.gitpet.io.PetState;
import com.dcruver.gitpet.io.PetStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Applies scans, awards and absence decay to the stored pet.
 *
 * Every mutation is a single {@link PetStateStore#update} so concurrent actions
 * within the process never overwrite each other's fields.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProgressionService {

    private final PetStateStore stateStore;
    private final Clock clock;

    public PetState currentState() {
        return stateStore.loadOrDefault();
    }

    public Mood mood(long idleSeconds) {
        return currentState().progression().mood(idleSeconds);
    }

    /**
     * Start of a session: charge decay for the time away, grant the daily visit bonus
     * once per local calendar day and move lastVisit to now.
     */
    public CheckInResult checkIn() {
        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);

        AtomicInteger decayApplied = new AtomicInteger();
        AtomicLong hoursAway = new AtomicLong();
        AtomicLong previousXp = new AtomicLong();
        AtomicInteger xpGained = new AtomicInteger();

        PetState updated = stateStore.update(state -> {
            previousXp.set(state.getExperience());
            Instant lastVisit = state.getLastVisit();

            int decay = VitalityCalculator.decay(lastVisit, now);
            int vitality = VitalityCalculator.applyDecay(state.getVitality(), decay);
            // A pet below the floor comes back at the floor, having lost nothing
            decayApplied.set(Math.max(0, state.getVitality() - vitality));

            int bonus = 0;
            if (lastVisit != null) {
                hoursAway.set(Math.max(0, Duration.between(lastVisit, now).toHours()));
                LocalDate lastVisitDay = lastVisit.atZone(clock.getZone()).toLocalDate();
                if (lastVisitDay.isBefore(today)) {
                    bonus = XpAction.FIRST_VISIT_OF_DAY.reward();
                }
            }
            xpGained.set(bonus);

            return state.toBuilder()
                .vitality(vitality)
                .experience(state.getExperience() + bonus)
                .lastVisit(now)
                .createdAt(state.getCreatedAt() != null ? state.getCreatedAt() : now)
                .build();
        });

        if (decayApplied.get() > 0) {
            log.info("Pet lost {} vitality after {} hours away", decayApplied.get(), hoursAway.get());
        }

        boolean leveledUp = LevelCalculator.didLevelUp(previousXp.get(), updated.getExperience());
        return new CheckInResult(updated, decayApplied.get(), hoursAway.get(),
            xpGained.get() > 0, xpGained.get(), leveledUp);
    }

    /**
     * Fold a scan into the pet. Outside a repository nothing changes.
     */
    public AwardResult recordScan(RepositoryHealth health) {
        if (!health.isGitRepo()) {
            PetState state = currentState();
            return new AwardResult(state, 0, state.getLevel(), state.getLevel());
        }

        int xp = XpAction.SCAN.reward();
        AtomicLong previousXp = new AtomicLong();

        PetState updated = stateStore.update(state -> {
            previousXp.set(state.getExperience());
            return state.toBuilder()
                .vitality(VitalityCalculator.vitality(health))
                .experience(state.getExperience() + xp)
                .totalScans(state.getTotalScans() + 1)
                .longestStreak(Math.max(state.getLongestStreak(), health.getStreak()))
                .cleanTreeCount(health.isWorkingTreeClean() ? state.getCleanTreeCount() + 1 : state.getCleanTreeCount())
                .build();
        });

        log.info("Recorded scan: vitality {}, +{} XP", updated.getVitality(), xp);
        return result(updated, previousXp.get(), xp);
    }

    public AwardResult award(XpAction action) {
        return award(action, 1);
    }

    /**
     * Award the action's reward times the multiplier
     */
    public AwardResult award(XpAction action, int multiplier) {
        int xp = action.reward(multiplier);
        if (xp == 0) {
            PetState state = currentState();
            return new AwardResult(state, 0, state.getLevel(), state.getLevel());
        }

        AtomicLong previousXp = new AtomicLong();
        PetState updated = stateStore.update(state -> {
            previousXp.set(state.getExperience());
            return state.withExperience(state.getExperience() + xp);
        });

        log.info("Awarded {} XP for {}", xp, action);
        return result(updated, previousXp.get(), xp);
    }

    /**
     * Feeding counts as a feed even when nothing was found; XP scales with the issue count
     */
    public AwardResult recordFeed(List<CodeIssue> issues) {
        int xp = XpAction.FEED_ISSUE.reward(issues.size());
        AtomicLong previousXp = new AtomicLong();

        PetState updated = stateStore.update(state -> {
            previousXp.set(state.getExperience());
            return state.toBuilder()
                .experience(state.getExperience() + xp)
                .totalFeeds(state.getTotalFeeds() + 1)
                .build();
        });

        return result(updated, previousXp.get(), xp);
    }

    public AwardResult recordPlay() {
        int xp = XpAction.PLAY.reward();
        AtomicLong previousXp = new AtomicLong();

        PetState updated = stateStore.update(state -> {
            previousXp.set(state.getExperience());
            return state.toBuilder()
                .experience(state.getExperience() + xp)
                .totalPlays(state.getTotalPlays() + 1)
                .build();
        });

        return result(updated, previousXp.get(), xp);
    }

    public PetState rename(String name) {
        return stateStore.update(state -> state.withName(name));
    }

    public PetState reset(String name) {
        return stateStore.reset(name);
    }

    private static AwardResult result(PetState updated, long previousXp, int xpGained) {
        int previousLevel = LevelCalculator.level(previousXp);
        if (updated.getLevel() > previousLevel) {
            log.info("Level up! {} -> {} ({})", previousLevel, updated.getLevel(),
                LevelCalculator.title(updated.getLevel()));
        }
        return new AwardResult(updated, xpGained, previousLevel, updated.getLevel());
    }
}
