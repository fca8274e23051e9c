package com.dcruver.zettel.io;

import com.dcruver.zettel.config.WikiProperties;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Writes note content back to disk, keeping a timestamped backup of the
 * previous version, and renders unified diffs for dry runs.
 */
@Component
@Slf4j
public class NoteBackupWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final boolean backupEnabled;
    private final Path backupDir;
    private final Clock clock;

    @Autowired
    public NoteBackupWriter(WikiProperties properties) {
        this(properties.getBackup().isEnabled(),
            properties.getRootPath().resolve(properties.getBackup().getDir()),
            Clock.systemDefaultZone());
    }

    public NoteBackupWriter(boolean backupEnabled, Path backupDir, Clock clock) {
        this.backupEnabled = backupEnabled;
        this.backupDir = backupDir;
        this.clock = clock;
    }

    /**
     * Replace the content of {@code file}, backing up the old content first when enabled
     */
    public void write(Path file, String content) throws IOException {
        if (backupEnabled) {
            createBackup(file);
        }
        Files.writeString(file, content);
        log.debug("Wrote note: {}", file);
    }

    /**
     * Copy {@code originalFile} into the backup directory with a timestamp suffix
     */
    public Optional<Path> createBackup(Path originalFile) throws IOException {
        if (!Files.exists(originalFile)) {
            log.warn("Cannot backup non-existent file: {}", originalFile);
            return Optional.empty();
        }

        Files.createDirectories(backupDir);
        String timestamp = TIMESTAMP_FORMAT.format(LocalDateTime.now(clock));
        Path backupFile = backupDir.resolve(originalFile.getFileName() + "." + timestamp + ".bak");

        Files.copy(originalFile, backupFile, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Created backup: {}", backupFile);
        return Optional.of(backupFile);
    }

    /**
     * Unified diff between two versions of a note; empty when they are equal
     */
    public String generateDiff(String original, String revised, String name) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = revised.lines().toList();

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "original/" + name,
            "formatted/" + name,
            originalLines,
            patch,
            3
        );
        return String.join("\n", unifiedDiff);
    }
}
