package com.dcruver.gitpet.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * JSON file store for the pet state.
 *
 * Read and write failures are logged and never propagated: a missing or corrupt file
 * means a fresh pet, a failed write means this session's progress is lost.
 */
@Component
@Slf4j
public class PetStateStore {

    private final Path stateFile;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    // Guards load-transform-save in update()
    private final Object lock = new Object();

    @Autowired
    public PetStateStore(@Value("${gitpet.state-file:${user.home}/.gitpet/state.json}") String stateFile,
                         Clock clock) {
        this(Path.of(stateFile), clock);
    }

    public PetStateStore(Path stateFile, Clock clock) {
        this.stateFile = stateFile;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path getStateFile() {
        return stateFile;
    }

    public boolean exists() {
        return Files.isRegularFile(stateFile);
    }

    /**
     * The stored pet, or empty when there is none or the file can't be read
     */
    public Optional<PetState> load() {
        if (!exists()) {
            log.debug("No state file at {}", stateFile);
            return Optional.empty();
        }

        try {
            PetState state = objectMapper.readValue(stateFile.toFile(), PetState.class);
            return Optional.ofNullable(state);
        } catch (IOException e) {
            log.error("Failed to read pet state from {}: {}", stateFile, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public PetState loadOrDefault() {
        return load().orElseGet(() -> PetState.newPet(PetState.DEFAULT_NAME, clock.instant()));
    }

    /**
     * Write the state through a temporary file so a crash never leaves half a document behind
     *
     * @return true when the state reached disk
     */
    public boolean save(PetState state) {
        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            Path tempFile = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), state);
            Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved pet state to {}", stateFile);
            return true;
        } catch (IOException e) {
            log.error("Failed to save pet state to {}: {}", stateFile, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Load the latest state, transform it and save the result.
     * Concurrent updates in this process are serialized so none of them reverts another's fields.
     */
    public PetState update(UnaryOperator<PetState> transform) {
        synchronized (lock) {
            PetState updated = transform.apply(loadOrDefault());
            save(updated);
            return updated;
        }
    }

    /**
     * Replace the stored pet with a new one
     */
    public PetState reset(String name) {
        synchronized (lock) {
            PetState fresh = PetState.newPet(name, clock.instant());
            save(fresh);
            log.info("Reset pet state, new pet {}", fresh.getName());
            return fresh;
        }
    }
}
