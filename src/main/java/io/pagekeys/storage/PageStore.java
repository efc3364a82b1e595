package io.pagekeys.storage;

import io.pagekeys.model.PageMeta;
import io.pagekeys.model.StoredPage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Key-addressed page storage. Keys come from {@link PageKeys#storageKey(String)}.
 * Byte arrays passed in or returned are never shared with the store.
 */
public interface PageStore {
    Optional<byte[]> readRaw(String key) throws IOException;

    void writeRaw(String key, byte[] content) throws IOException;

    Optional<PageMeta> readMeta(String key) throws IOException;

    void writeMeta(String key, PageMeta meta) throws IOException;

    /**
     * Moves the content and metadata of {@code key} into the recoverable deleted area.
     *
     * @return the archived file locations
     * @throws java.nio.file.NoSuchFileException when the key holds neither content nor metadata
     */
    List<Path> softDelete(String key) throws IOException;

    List<String> listKeys() throws IOException;

    /** Reads the canonical slot of {@code identifier} first, then its literal slot. */
    Optional<StoredPage> readPreferringCanonical(String identifier) throws IOException;

    /**
     * Runs {@code action} while holding the page locks of {@code keys}. Anything that reads
     * a slot and then writes or deletes based on what it read holds that slot's lock for
     * the whole sequence.
     */
    <T> T withPageLocks(Collection<String> keys, PageAction<T> action) throws IOException;

    @FunctionalInterface
    interface PageAction<T> {
        T run() throws IOException;
    }
}
