package com.testops.publisher.upload;

import com.testops.publisher.PublisherException;

import java.io.FileNotFoundException;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * multipart/form-data body for {@link java.net.http.HttpClient}, which has
 * no built-in support for it.
 *
 * File parts are streamed from disk with {@link BodyPublishers#ofFile} so
 * large archives are never loaded into memory.
 */
public final class MultipartBody {

    private static final String CRLF = "\r\n";

    private final String         boundary;
    private final BodyPublisher  publisher;

    private MultipartBody(String boundary, BodyPublisher publisher) {
        this.boundary  = boundary;
        this.publisher = publisher;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public HttpRequest.BodyPublisher publisher() {
        return publisher;
    }

    public static final class Builder {

        private final String              boundary = "----testops" + UUID.randomUUID().toString().replace("-", "");
        private final List<BodyPublisher> parts    = new ArrayList<>();

        private Builder() {}

        public Builder field(String name, String value) {
            parts.add(text("--" + boundary + CRLF
                    + "Content-Disposition: form-data; name=\"" + name + "\"" + CRLF
                    + CRLF
                    + value + CRLF));
            return this;
        }

        public Builder file(String name, Path file, String contentType) {
            String fileName = file.getFileName().toString();
            parts.add(text("--" + boundary + CRLF
                    + "Content-Disposition: form-data; name=\"" + name + "\"; filename=\"" + fileName + "\"" + CRLF
                    + "Content-Type: " + contentType + CRLF
                    + CRLF));
            try {
                parts.add(BodyPublishers.ofFile(file));
            } catch (FileNotFoundException e) {
                throw new PublisherException(PublisherException.Kind.LOCAL_IO,
                        "File not found: " + file, e);
            }
            parts.add(text(CRLF));
            return this;
        }

        public MultipartBody build() {
            List<BodyPublisher> all = new ArrayList<>(parts);
            all.add(text("--" + boundary + "--" + CRLF));
            return new MultipartBody(boundary, BodyPublishers.concat(all.toArray(new BodyPublisher[0])));
        }

        private static BodyPublisher text(String s) {
            return BodyPublishers.ofString(s, StandardCharsets.UTF_8);
        }
    }
}
