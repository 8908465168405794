package com.defaultrisk.infrastructure.dataset;

import com.defaultrisk.domain.exception.UnsupportedDatasetException;
import com.defaultrisk.domain.model.DatasetRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Stages uploaded datasets on the volume shared with the workers.
 *
 * A staged artifact lives until the pipeline that consumes it finishes, or until
 * dispatch of its job fails. Removal failures are logged and never rethrown.
 */
@Slf4j
@Service
public class DatasetStagingService {

    private final Path stagingDirectory;

    public DatasetStagingService(
            @Value("${app.staging.directory:${java.io.tmpdir}/default-risk-staging}") String stagingDirectory) {
        this.stagingDirectory = Path.of(stagingDirectory).toAbsolutePath();
    }

    public DatasetRef stage(MultipartFile upload) {
        if (upload == null || upload.isEmpty()) {
            throw new UnsupportedDatasetException("Uploaded dataset is empty");
        }
        try (InputStream in = upload.getInputStream()) {
            return stage(upload.getOriginalFilename(), in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stage uploaded dataset", e);
        }
    }

    public DatasetRef stage(String originalFilename, InputStream content) {
        if (DatasetFormat.fromFilename(originalFilename).isEmpty()) {
            throw new UnsupportedDatasetException(
                    "Unsupported dataset file '" + originalFilename + "': expected .csv, .xlsx or .xls");
        }
        try {
            Files.createDirectories(stagingDirectory);
            Path target = stagingDirectory.resolve(UUID.randomUUID() + DatasetFormat.extensionOf(originalFilename));
            Files.copy(content, target);
            log.info("Staged dataset {} as {}", originalFilename, target);
            return new DatasetRef(target.toString(), originalFilename);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stage dataset " + originalFilename, e);
        }
    }

    /**
     * Remove a staged artifact. Never throws.
     */
    public void discard(DatasetRef ref) {
        if (ref == null || ref.getPath() == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(Path.of(ref.getPath()))) {
                log.debug("Removed staged dataset {}", ref.getPath());
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to remove staged dataset {}: {}", ref.getPath(), e.getMessage(), e);
        }
    }

    public Path getStagingDirectory() {
        return stagingDirectory;
    }
}
