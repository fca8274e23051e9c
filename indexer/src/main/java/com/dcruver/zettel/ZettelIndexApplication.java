package com.dcruver.zettel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Zettelkasten index.
 *
 * Keeps a live cross-reference index of the notes under the wiki root and
 * maintains checklist state and status tags as notes change.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class ZettelIndexApplication {

    public static void main(String[] args) {
        log.info("Starting Zettel index...");
        SpringApplication.run(ZettelIndexApplication.class, args);
    }
}
