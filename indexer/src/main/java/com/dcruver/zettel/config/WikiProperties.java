package com.dcruver.zettel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Location of the wiki and tuning of the index services.
 *
 * The wiki root resolves from {@code --zettel.wiki-root}, then the
 * {@code WIKI_ROOT} environment variable, then {@code ~/wiki}.
 */
@ConfigurationProperties(prefix = "zettel")
@Data
public class WikiProperties {
    private String wikiRoot = System.getProperty("user.home") + "/wiki";
    private String noteDirName = "note";
    private String linkFileName = "link.typ";

    private Watcher watcher = new Watcher();
    private Backup backup = new Backup();
    private Executor executor = new Executor();

    public Path getRootPath() {
        return Path.of(wikiRoot).toAbsolutePath().normalize();
    }

    public Path getNoteDir() {
        return getRootPath().resolve(noteDirName);
    }

    public Path getLinkFile() {
        return getRootPath().resolve(linkFileName);
    }

    @Data
    public static class Watcher {
        private boolean enabled = true;
        private long debounceMs = 300;
        private int queueCapacity = 64;
        // Push a changed note's status to the checklists that reference it
        private boolean propagateOnChange = false;
    }

    @Data
    public static class Backup {
        private boolean enabled = true;
        private String dir = ".zettel/backups";
    }

    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
    }
}
