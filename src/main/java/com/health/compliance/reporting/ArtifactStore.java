package com.health.compliance.reporting;

import com.health.compliance.config.ReportingConfig;
import com.health.compliance.exception.ArtifactWriteException;
import com.health.compliance.model.ArtifactFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes rendered artifacts to the artifact directory. The returned path is the artifact
 * reference stored on the completed job.
 */
@Component
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final ReportingConfig reportingConfig;

    public ArtifactStore(ReportingConfig reportingConfig) {
        this.reportingConfig = reportingConfig;
    }

    /**
     * Write {@code content} as {@code <prefix>_<id>.<ext>}. The file is written to a temp name and
     * moved into place, so a reader never sees a partial artifact.
     */
    @Retryable(retryFor = ArtifactWriteException.class,
            maxAttemptsExpression = "${audit.reporting.retry-max-attempts:3}",
            backoff = @Backoff(delayExpression = "${audit.reporting.retry-delay-ms:1000}", multiplier = 2))
    public String write(String prefix, String id, ArtifactFormat format, String content) {
        Path dir = Paths.get(reportingConfig.getArtifactDir());
        Path target = dir.resolve(prefix + "_" + id + "." + format.getExtension());
        try {
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, prefix + "_" + id, ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("Failed to write artifact {}: {}", target, e.getMessage());
            throw new ArtifactWriteException("Failed to write artifact " + target + ": " + e.getMessage(), e);
        }
        log.info("Wrote artifact {} ({} chars)", target, content.length());
        return target.toAbsolutePath().toString();
    }
}
