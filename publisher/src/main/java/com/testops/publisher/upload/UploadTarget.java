package com.testops.publisher.upload;

import java.net.URI;
import java.nio.file.Path;
import java.util.Set;

/**
 * Where and what to upload. Immutable for the whole attempt sequence.
 *
 * @param endpoint      full attachment URL, query string included
 * @param file          local file sent as the {@code file} form part
 * @param contentType   declared MIME type of the file part
 * @param successCodes  statuses that count as success for this target
 * @param authorization value of the {@code Authorization} header
 */
public record UploadTarget(
        URI         endpoint,
        Path        file,
        String      contentType,
        Set<Integer> successCodes,
        String      authorization) {

    public UploadTarget {
        if (successCodes == null || successCodes.isEmpty()) {
            throw new IllegalArgumentException("An upload target needs at least one success code");
        }
        successCodes = Set.copyOf(successCodes);
    }

    public String fileName() {
        return file.getFileName().toString();
    }

    /** Content type guessed from the extension, matching what the wiki expects. */
    public static String contentTypeFor(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        if (name.endsWith(".html") || name.endsWith(".htm")) return "text/html; charset=utf-8";
        if (name.endsWith(".pdf"))  return "application/pdf";
        if (name.endsWith(".zip"))  return "application/zip";
        if (name.endsWith(".xml"))  return "application/xml";
        if (name.endsWith(".txt"))  return "text/plain; charset=utf-8";
        return "application/octet-stream";
    }

    @Override
    public String toString() {
        // keep credentials out of log lines
        return "UploadTarget[" + fileName() + " -> " + endpoint + "]";
    }
}
