package com.enterprise.dataprocessor.shared.filebridge.adapter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a file through a {@code .tmp} sibling that is moved over the target
 * once complete. A failed write leaves no file under the target name and
 * removes its temp file; an existing target is only replaced on success.
 */
public final class AtomicFiles {

    static final String TEMP_SUFFIX = ".tmp";

    private AtomicFiles() {
    }

    /**
     * Produces the content of a file at the given (temporary) path.
     */
    @FunctionalInterface
    public interface FileContent {

        void writeTo(Path path) throws Exception;
    }

    public static void write(Path target, FileContent content) {
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            content.writeTo(temp);
            move(temp, target);
        } catch (IOException e) {
            discard(temp, e);
            throw new UncheckedIOException("Failed to write " + target, e);
        } catch (RuntimeException e) {
            discard(temp, e);
            throw e;
        } catch (Exception e) {
            discard(temp, e);
            throw new IllegalStateException("Failed to write " + target, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temp, Exception cause) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
