package com.testops.publisher.pipeline;

import com.testops.publisher.imports.ImportMetadata;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Input of a full publish run.
 *
 * @param reuseVersion   publish the current version instead of allocating a new one
 * @param archive        results archive to import afterwards; null to skip the import
 * @param importMetadata required when {@code archive} is set
 */
public record PublishRequest(boolean reuseVersion, Path archive, ImportMetadata importMetadata) {

    public PublishRequest {
        if (archive != null && importMetadata == null) {
            throw new IllegalArgumentException("An import needs its metadata (project key)");
        }
    }

    public static PublishRequest withoutImport(boolean reuseVersion) {
        return new PublishRequest(reuseVersion, null, null);
    }

    public Optional<Path> importArchive() {
        return Optional.ofNullable(archive);
    }
}
