package com.di.skyflow.ingest;

import com.di.skyflow.config.SkyFlowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Polls the landing directory and feeds new files to the {@link GroupFormer}.
 * Files already registered are recognised by path and skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "skyflow.ingest.scan-enabled", havingValue = "true")
public class IncomingDirectoryScanner {

    private final GroupFormer groupFormer;
    private final SkyFlowProperties props;

    @Scheduled(fixedDelayString = "${skyflow.ingest.scan-interval:30s}", initialDelay = 0)
    public void scan() {
        Path dir = Path.of(props.getIngest().getIncomingDir());
        if (!Files.isDirectory(dir)) {
            log.warn("[SCANNER] incoming directory {} does not exist", dir);
            return;
        }
        try {
            groupFormer.bootstrap(dir);
        } catch (UncheckedIOException e) {
            log.error("[SCANNER] scan of {} failed: {}", dir, e.getMessage(), e);
        }
    }
}
