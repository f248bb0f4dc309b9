package org.telemetrystore.persistence;

import org.telemetrystore.interfaces.SnapshotStore;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

/**
 * FileSnapshotStore keeps one JSON snapshot in a single durable file.
 * <p>
 * Every save writes the full document to a sibling {@code <name>.tmp}, fsyncs it,
 * then renames it over the durable file with {@link StandardCopyOption#ATOMIC_MOVE}.
 * A crash at any point leaves either the old or the new document, never a mix.
 * </p>
 * <b>Notes:</b>
 * <ul>
 *     <li>Save failures propagate as {@link IOException}; the caller picks the policy.</li>
 *     <li>Load failures are logged and read as "no snapshot".</li>
 *     <li>Directory creation uses {@link Files#createDirectories(Path)} for idempotence.</li>
 * </ul>
 */
public final class FileSnapshotStore implements SnapshotStore {

    public static final String DEFAULT_FILE_NAME = "session_state.json";

    // The durable file, e.g. ./session_state.json
    private final Path file;

    // Sibling temp file used for the write-then-rename
    private final Path tmp;

    /**
     * @param dir      directory holding the snapshot
     * @param fileName name of the durable file inside {@code dir}
     */
    public FileSnapshotStore(Path dir, String fileName) {
        this(dir.resolve(fileName));
    }

    public FileSnapshotStore(Path file) {
        this.file = file.toAbsolutePath();
        this.tmp = this.file.resolveSibling(this.file.getFileName() + ".tmp");
    }

    public Path file() {
        return file;
    }

    /**
     * Reads the durable file.
     *
     * @return file content, or {@code null} if the file does not exist or cannot be read
     */
    @Override
    public String load() {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("[Persist] snapshot load failed for " + file + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Atomically replaces the durable file with {@code json}.
     *
     * @throws IOException if the temp write, fsync or rename fails; the previous
     *                     durable file is unchanged in that case
     */
    @Override
    public void save(String json) throws IOException {
        Path dir = file.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        try {
            try (FileOutputStream os = new FileOutputStream(tmp.toFile())) {
                os.write(json.getBytes(StandardCharsets.UTF_8));
                os.flush();
                os.getFD().sync();
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }
}
