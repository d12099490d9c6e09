package com.dcruver.gitpet.reporting;

import com.dcruver.gitpet.domain.CodeIssue;
import com.dcruver.gitpet.domain.HealthCheck;
import com.dcruver.gitpet.domain.RepoStats;
import com.dcruver.gitpet.domain.RepositoryHealth;
import com.dcruver.gitpet.io.PetState;
import com.dcruver.gitpet.progression.AwardResult;
import com.dcruver.gitpet.progression.LevelCalculator;
import com.dcruver.gitpet.progression.LevelProgress;
import com.dcruver.gitpet.progression.Mood;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plain-text rendering of scans and pet state for the shell.
 * Only formats values; every number shown here is computed elsewhere.
 */
@Component
public class StatusReportFormatter {

    static final int BAR_WIDTH = 20;

    public String formatHealth(RepositoryHealth health) {
        if (!health.isGitRepo()) {
            return "Not a git repository. Run git-pet inside a working copy.\n";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Repository health: %d / 100\n", health.getTotalScore()));
        sb.append(bar(health.getTotalScore(), 100)).append("\n\n");

        for (HealthCheck check : health.getChecks()) {
            sb.append(String.format("%-8s %-18s %-20s (%d%%)",
                "[" + check.getStatus() + "]", check.getName(), check.getValue(), check.getWeight()));
            if (check.isDegraded()) {
                sb.append("  ! ").append(check.getDetails());
            }
            sb.append("\n");
        }

        sb.append("\n");
        sb.append(String.format("Commits: %d   Streak: %d days\n", health.getCommitCount(), health.getStreak()));
        return sb.toString();
    }

    public String formatPet(PetState pet, Mood mood) {
        LevelProgress progress = LevelCalculator.progress(pet.getExperience());

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s the %s (level %d)\n",
            pet.getName(), LevelCalculator.title(progress.getLevel()), progress.getLevel()));
        sb.append(String.format("Mood: %s - %s\n", mood.getLabel(), mood.getDescription()));
        sb.append(String.format("HP:   %s %d / 100\n", bar(pet.getVitality(), 100), pet.getVitality()));
        sb.append(String.format("XP:   %s %s\n", bar(progress.getPercentage(), 100), xpLabel(pet, progress)));
        return sb.toString();
    }

    public String formatLevel(PetState pet) {
        LevelProgress progress = LevelCalculator.progress(pet.getExperience());
        int level = progress.getLevel();

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Level %d: %s\n", level, LevelCalculator.title(level)));
        sb.append(LevelCalculator.description(level)).append("\n");
        sb.append(String.format("%s %s\n", bar(progress.getPercentage(), 100), xpLabel(pet, progress)));
        if (!progress.isMaxLevel()) {
            sb.append(String.format("Next: %s at %d XP\n",
                LevelCalculator.title(level + 1), LevelCalculator.threshold(level + 1)));
        }
        return sb.toString();
    }

    public String formatStats(PetState pet, RepoStats stats) {
        StringBuilder sb = new StringBuilder();
        sb.append("Repository stats:\n");
        sb.append(String.format("- First commit: %d days ago\n", stats.getFirstCommitDays()));
        sb.append(String.format("- Total commits: %d\n", stats.getTotalCommits()));
        if (RepoStats.UNKNOWN_EXTENSION.equals(stats.getTopExtension())) {
            sb.append("- Top language: unknown\n");
        } else {
            sb.append(String.format("- Top language: %s (%d files)\n",
                stats.getTopExtension(), stats.getTopExtensionCount()));
        }
        sb.append(String.format("- Average commit message: %d characters\n", stats.getAverageCommitMessageLength()));

        sb.append("\nPet stats:\n");
        sb.append(String.format("- Scans: %d\n", pet.getTotalScans()));
        sb.append(String.format("- Feeds: %d\n", pet.getTotalFeeds()));
        sb.append(String.format("- Plays: %d\n", pet.getTotalPlays()));
        sb.append(String.format("- Longest streak: %d days\n", pet.getLongestStreak()));
        sb.append(String.format("- Clean trees: %d\n", pet.getCleanTreeCount()));
        return sb.toString();
    }

    public String formatIssues(List<CodeIssue> issues) {
        if (issues.isEmpty()) {
            return "Nothing to eat. No TODOs, FIXMEs or debug output found.\n";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Found %d snacks:\n", issues.size()));
        for (CodeIssue issue : issues) {
            sb.append(String.format("- [%s] %s:%d  %s\n",
                label(issue.getType()), issue.getFile(), issue.getLine(), issue.getContent()));
        }
        return sb.toString();
    }

    /**
     * One line per reward, plus a banner on level-up
     */
    public String formatAward(String reason, AwardResult award) {
        if (award.getXpGained() <= 0) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("+%d XP (%s)\n", award.getXpGained(), reason));
        if (award.isLeveledUp()) {
            sb.append(String.format("LEVEL UP! Now level %d: %s\n",
                award.getNewLevel(), LevelCalculator.title(award.getNewLevel())));
        }
        return sb.toString();
    }

    static String bar(int value, int max) {
        int clamped = Math.max(0, Math.min(max, value));
        int filled = max == 0 ? 0 : clamped * BAR_WIDTH / max;
        return "[" + "#".repeat(filled) + "-".repeat(BAR_WIDTH - filled) + "]";
    }

    private static String xpLabel(PetState pet, LevelProgress progress) {
        if (progress.isMaxLevel()) {
            return String.format("%d XP (max level)", pet.getExperience());
        }
        return String.format("%d / %d XP", progress.getCurrent(), progress.getSpan());
    }

    private static String label(CodeIssue.Type type) {
        switch (type) {
            case FIXME:
                return "FIXME";
            case DEBUG_OUTPUT:
                return "debug";
            default:
                return "TODO";
        }
    }
}
