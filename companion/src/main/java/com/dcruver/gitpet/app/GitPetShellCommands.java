package com.dcruver.gitpet.app;

import com.dcruver.gitpet.domain.CodeIssue;
import com.dcruver.gitpet.domain.HealthScanner;
import com.dcruver.gitpet.domain.RepoStats;
import com.dcruver.gitpet.domain.RepositoryHealth;
import com.dcruver.gitpet.io.PetState;
import com.dcruver.gitpet.progression.AwardResult;
import com.dcruver.gitpet.progression.CheckInResult;
import com.dcruver.gitpet.progression.Mood;
import com.dcruver.gitpet.progression.ProgressionService;
import com.dcruver.gitpet.progression.XpAction;
import com.dcruver.gitpet.reporting.StatusReportFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Spring Shell commands for the git pet.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class GitPetShellCommands {

    private final HealthScanner healthScanner;
    private final ProgressionService progressionService;
    private final StatusReportFormatter formatter;
    private final ShellInteractionTracker interactionTracker;

    // Decay and the daily bonus are charged once per shell session
    private final AtomicBoolean checkedIn = new AtomicBoolean();

    @ShellMethod(key = {"scan", "check"}, value = "Scan the repository and update the pet's health")
    public String scan() {
        log.info("Running repository scan...");

        try {
            String greeting = checkIn();
            interactionTracker.touch();

            RepositoryHealth health = healthScanner.scan();
            StringBuilder result = new StringBuilder(greeting);
            result.append(formatter.formatHealth(health));

            if (health.isGitRepo()) {
                AwardResult award = progressionService.recordScan(health);
                result.append("\n").append(formatter.formatAward("scan", award));
            }
            return result.toString();

        } catch (Exception e) {
            log.error("Scan failed", e);
            return "Scan failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"status", "pet"}, value = "Show the pet's vitality, mood and experience")
    public String status() {
        try {
            String greeting = checkIn();
            long idle = interactionTracker.touch();

            PetState pet = progressionService.currentState();
            Mood mood = pet.progression().mood(idle);
            return greeting + formatter.formatPet(pet, mood);

        } catch (Exception e) {
            log.error("Status failed", e);
            return "Status failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "stats", value = "Show repository and pet statistics")
    public String stats() {
        try {
            String greeting = checkIn();
            interactionTracker.touch();

            RepoStats stats = healthScanner.collectStats();
            AwardResult award = progressionService.award(XpAction.STATS_CHECK);
            return greeting + formatter.formatStats(award.getState(), stats)
                + "\n" + formatter.formatAward("stats check", award);

        } catch (Exception e) {
            log.error("Stats failed", e);
            return "Stats failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "feed", value = "Feed the pet the TODOs, FIXMEs and debug output in your code")
    public String feed() {
        try {
            String greeting = checkIn();
            interactionTracker.touch();

            List<CodeIssue> issues = healthScanner.findCodeIssues();
            AwardResult award = progressionService.recordFeed(issues);
            return greeting + formatter.formatIssues(issues) + formatter.formatAward("feed", award);

        } catch (Exception e) {
            log.error("Feed failed", e);
            return "Feed failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "play", value = "Play with the pet")
    public String play() {
        try {
            String greeting = checkIn();
            interactionTracker.touch();

            AwardResult award = progressionService.recordPlay();
            return greeting + String.format("%s fetched the ball!\n", award.getState().getName())
                + formatter.formatAward("play", award);

        } catch (Exception e) {
            log.error("Play failed", e);
            return "Play failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "mood", value = "Show how the pet feels right now")
    public String mood() {
        try {
            String greeting = checkIn();
            long idle = interactionTracker.touch();

            Mood mood = progressionService.mood(idle);
            return greeting + String.format("%s is %s. %s\n",
                progressionService.currentState().getName(), mood.getLabel(), mood.getDescription());

        } catch (Exception e) {
            log.error("Mood failed", e);
            return "Mood failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "level", value = "Show level progress")
    public String level() {
        try {
            String greeting = checkIn();
            interactionTracker.touch();
            return greeting + formatter.formatLevel(progressionService.currentState());

        } catch (Exception e) {
            log.error("Level failed", e);
            return "Level failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "pet name", value = "Rename the pet")
    public String name(@ShellOption(help = "New name") String name) {
        try {
            interactionTracker.touch();
            if (name == null || name.isBlank()) {
                return "A pet needs a name.";
            }
            PetState pet = progressionService.rename(name);
            return "Your pet is now called " + pet.getName() + ".";

        } catch (Exception e) {
            log.error("Rename failed", e);
            return "Rename failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "pet reset", value = "Start over with a new pet")
    public String reset(
            @ShellOption(defaultValue = PetState.DEFAULT_NAME, help = "Name of the new pet") String name,
            @ShellOption(defaultValue = "false", help = "Confirm the reset") boolean confirm) {
        try {
            interactionTracker.touch();
            if (!confirm) {
                return "This discards all experience. Run 'pet reset --confirm' to continue.";
            }
            PetState pet = progressionService.reset(name);
            checkedIn.set(true);
            return "Say hello to " + pet.getName() + "!";

        } catch (Exception e) {
            log.error("Reset failed", e);
            return "Reset failed: " + e.getMessage();
        }
    }

    /**
     * First command of the session charges absence decay; later commands are no-ops
     */
    private String checkIn() {
        if (!checkedIn.compareAndSet(false, true)) {
            return "";
        }

        CheckInResult checkIn = progressionService.checkIn();
        StringBuilder sb = new StringBuilder();
        if (checkIn.getDecayApplied() > 0) {
            sb.append(String.format("%s missed you! Lost %d HP over %d hours away.\n",
                checkIn.getState().getName(), checkIn.getDecayApplied(), checkIn.getHoursAway()));
        }
        if (checkIn.isFirstVisitOfDay()) {
            sb.append(String.format("+%d XP (first visit today)\n", checkIn.getXpGained()));
        }
        if (checkIn.isLeveledUp()) {
            sb.append(String.format("LEVEL UP! Now level %d\n", checkIn.getState().getLevel()));
        }
        if (sb.length() > 0) {
            sb.append("\n");
        }
        return sb.toString();
    }
}
