package com.dcruver.gitpet;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Git Pet.
 *
 * A terminal companion whose health follows the health of the git working copy
 * it is started in. Commands are served by Spring Shell.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class GitPetApplication {

    public static void main(String[] args) {
        log.info("Starting Git Pet...");
        SpringApplication.run(GitPetApplication.class, args);
    }
}
