package com.hargapangan.market;

import com.hargapangan.config.AsyncConfig;
import com.hargapangan.market.config.StorageProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;

/**
 * Evidence files on the local filesystem under hargapangan.storage.upload-dir. Deletion runs on the
 * evidence executor. References that resolve outside the upload directory are refused.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalEvidenceFileStore implements EvidenceFileStore {

    private final StorageProperties properties;

    @Override
    @Async(AsyncConfig.EVIDENCE_EXECUTOR)
    public void deleteAll(Collection<String> references) {
        if (references == null) {
            return;
        }
        Path root = Paths.get(properties.getUploadDir()).toAbsolutePath().normalize();
        for (String ref : references) {
            if (ref == null || ref.isBlank()) {
                continue;
            }
            Path target = resolve(root, ref);
            if (target == null) {
                log.warn("Refusing to delete evidence outside upload dir: {}", ref);
                continue;
            }
            try {
                if (Files.deleteIfExists(target)) {
                    log.debug("Deleted evidence file {}", target);
                }
            } catch (IOException e) {
                log.warn("Could not delete evidence file {}: {}", target, e.getMessage());
            }
        }
    }

    static Path resolve(Path root, String reference) {
        String name = reference.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        if (name.isBlank() || name.equals("..") || name.equals(".")) {
            return null;
        }
        Path target = root.resolve(name).normalize();
        return target.startsWith(root) ? target : null;
    }
}
