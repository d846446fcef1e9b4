package com.testops.publisher.pipeline;

import com.testops.publisher.PublisherException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds the report files of one version by naming convention:
 * {@code <dir>/<baseName>_v<version>.<ext>}.
 */
public final class ArtifactLocator {

    private ArtifactLocator() {}

    /**
     * @return one path per extension, in the order given
     * @throws PublisherException LOCAL_IO naming every missing file
     */
    public static List<Path> locate(Path dir, String baseName, int version, List<String> extensions) {
        List<Path> found   = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String ext : extensions) {
            Path p = dir.resolve(fileName(baseName, version, ext));
            if (Files.isRegularFile(p)) {
                found.add(p);
            } else {
                missing.add(p.toString());
            }
        }
        if (!missing.isEmpty()) {
            throw new PublisherException(PublisherException.Kind.LOCAL_IO,
                    "Required report files missing: " + String.join(", ", missing));
        }
        return found;
    }

    public static String fileName(String baseName, int version, String extension) {
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        return baseName + "_v" + version + "." + ext;
    }
}
