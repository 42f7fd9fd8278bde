package app.signaltrust.keys.secret;

import app.signaltrust.keys.error.LockTimeoutException;
import app.signaltrust.keys.error.StoreIOException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/**
 * Exclusive lock on a sidecar file, shared by every process writing the same store.
 */
final class StoreFileLock implements AutoCloseable {

    private static final long POLL_INTERVAL_MS = 25L;

    private final FileChannel channel;
    private final FileLock lock;

    private StoreFileLock(FileChannel channel, FileLock lock) {
        this.channel = channel;
        this.lock = lock;
    }

    static StoreFileLock acquire(Path lockFile, long deadlineNanos, Duration timeout) throws IOException {
        Path absolute = lockFile.toAbsolutePath();
        Files.createDirectories(absolute.getParent());
        FileChannel channel = FileChannel.open(absolute, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        try {
            while (true) {
                FileLock lock = tryLock(channel);
                if (lock != null) {
                    return new StoreFileLock(channel, lock);
                }
                if (System.nanoTime() - deadlineNanos >= 0) {
                    throw new LockTimeoutException(timeout);
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            channel.close();
            throw new StoreIOException("Interrupted while waiting for the key store file lock", ex);
        } catch (IOException | RuntimeException ex) {
            channel.close();
            throw ex;
        }
    }

    private static FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException ex) {
            // held by another store instance in this JVM
            return null;
        }
    }

    @Override
    public void close() throws IOException {
        try {
            lock.release();
        } finally {
            channel.close();
        }
    }
}
