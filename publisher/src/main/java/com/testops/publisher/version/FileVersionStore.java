package com.testops.publisher.version;

import com.testops.publisher.PublisherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * {@link VersionStore} backed by a single text file holding one integer.
 *
 * {@link #allocateNext()} holds an exclusive {@link FileLock} on the file for
 * the whole read-increment-write, so concurrent pipeline processes sharing a
 * workspace are serialised instead of racing; threads within one process
 * are serialised on a monitor first. The lock is advisory: other
 * tools that write the file without locking are not excluded.
 */
public class FileVersionStore implements VersionStore {

    private static final Logger log = LoggerFactory.getLogger(FileVersionStore.class);

    // FileLock is held per JVM; threads of this process queue here first
    private static final Object PROCESS_LOCK = new Object();

    private final Path file;

    public FileVersionStore(Path file) {
        this.file = file;
    }

    @Override
    public int allocateNext() {
        synchronized (PROCESS_LOCK) {
            return allocateLocked();
        }
    }

    private int allocateLocked() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {

                int stored = parse(readAll(channel));
                int next;
                try {
                    next = Math.addExact(stored, 1);
                } catch (ArithmeticException e) {
                    throw exhausted(stored);
                }

                channel.truncate(0);
                channel.write(ByteBuffer.wrap(Integer.toString(next).getBytes(StandardCharsets.UTF_8)), 0);
                channel.force(true);

                log.info("Allocated report version v{} ({})", next, file);
                return next;
            }
        } catch (IOException e) {
            throw new PublisherException(PublisherException.Kind.LOCAL_IO,
                    "Could not update version file " + file, e);
        }
    }

    @Override
    public int current() {
        try {
            int stored = parse(Files.readString(file, StandardCharsets.UTF_8));
            return stored >= 1 ? stored : 1;
        } catch (NoSuchFileException e) {
            return 1;
        } catch (IOException e) {
            throw new PublisherException(PublisherException.Kind.LOCAL_IO,
                    "Could not read version file " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    /** Stored value, or 0 for empty, non-numeric or negative content. */
    static int parse(String content) {
        String s = content == null ? "" : content.strip();
        if (s.isEmpty()) {
            return 0;
        }
        try {
            int v = Integer.parseInt(s);
            return Math.max(v, 0);
        } catch (NumberFormatException e) {
            if (s.chars().allMatch(Character::isDigit)) {
                throw exhausted(s);
            }
            log.warn("Version file contains '{}', starting from 0", s);
            return 0;
        }
    }

    // restarting from 1 would hand out versions that were already published
    private static PublisherException exhausted(Object stored) {
        return new PublisherException(PublisherException.Kind.LOCAL_IO,
                "Version counter exhausted at " + stored + "; reset the version file deliberately");
    }

    private static String readAll(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0) {
            return "";
        }
        ByteBuffer buf = ByteBuffer.allocate((int) Math.min(size, 64));
        channel.read(buf, 0);
        buf.flip();
        return StandardCharsets.UTF_8.decode(buf).toString();
    }
}
