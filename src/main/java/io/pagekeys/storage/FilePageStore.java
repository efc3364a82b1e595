package io.pagekeys.storage;

import com.google.common.util.concurrent.Striped;
import io.pagekeys.config.PageKeysConfig;
import io.pagekeys.identifier.IdentifierNormalizer;
import io.pagekeys.model.PageMeta;
import io.pagekeys.model.StoredPage;
import io.pagekeys.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Stores each page as {@code <key>.md} with a {@code <key>.json} metadata sidecar in
 * one flat directory. Deleted pages move to {@code __deleted__/<epochSeconds>/}.
 *
 * <p>Single file operations are guarded by one read/write lock. Page locks, striped by
 * key, are taken outside it and held across read-decide-write sequences.
 */
public final class FilePageStore implements PageStore {
    static final String CONTENT_SUFFIX = ".md";
    static final String META_SUFFIX = ".json";
    private static final int PAGE_LOCK_STRIPES = 64;

    private final PageKeysConfig config;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Striped<Lock> pageLocks = Striped.lock(PAGE_LOCK_STRIPES);

    public FilePageStore(PageKeysConfig config) {
        this.config = config;
    }

    public void init() {
        try {
            Files.createDirectories(config.pagesDir());
            Files.createDirectories(config.deletedRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize page directory: " + config.pagesDir(), e);
        }
    }

    @Override
    public Optional<byte[]> readRaw(String key) throws IOException {
        lock.readLock().lock();
        try {
            Path file = contentFile(key);
            if (!Files.isRegularFile(file)) {
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(file));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void writeRaw(String key, byte[] content) throws IOException {
        lock.writeLock().lock();
        try {
            writeAtomically(contentFile(key), content);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<PageMeta> readMeta(String key) throws IOException {
        lock.readLock().lock();
        try {
            Path file = metaFile(key);
            if (!Files.isRegularFile(file)) {
                return Optional.empty();
            }
            return Optional.of(Jsons.mapper().readValue(file.toFile(), PageMeta.class));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void writeMeta(String key, PageMeta meta) throws IOException {
        lock.writeLock().lock();
        try {
            writeAtomically(metaFile(key), Jsons.toJson(meta).getBytes(StandardCharsets.UTF_8));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Path> softDelete(String key) throws IOException {
        lock.writeLock().lock();
        try {
            List<Path> present = new ArrayList<>(2);
            for (Path file : List.of(contentFile(key), metaFile(key))) {
                if (Files.exists(file)) {
                    present.add(file);
                }
            }
            if (present.isEmpty()) {
                throw new NoSuchFileException(contentFile(key).toString(), null, "no page stored under key " + key);
            }
            Path archiveDir = config.deletedRoot().resolve(Long.toString(Instant.now().getEpochSecond()));
            Files.createDirectories(archiveDir);
            List<Path> archived = new ArrayList<>(present.size());
            for (Path file : present) {
                Path target = freeSlot(archiveDir, file.getFileName().toString());
                Files.move(file, target);
                archived.add(target);
            }
            return archived;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> listKeys() throws IOException {
        lock.readLock().lock();
        try {
            List<String> keys = new ArrayList<>();
            if (!Files.isDirectory(config.pagesDir())) {
                return keys;
            }
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(config.pagesDir(), "*" + CONTENT_SUFFIX)) {
                for (Path path : stream) {
                    if (Files.isRegularFile(path)) {
                        String name = path.getFileName().toString();
                        String key = name.substring(0, name.length() - CONTENT_SUFFIX.length());
                        if (PageKeys.decode(key).isPresent()) {
                            keys.add(key);
                        }
                    }
                }
            }
            keys.sort(String::compareTo);
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<StoredPage> readPreferringCanonical(String identifier) throws IOException {
        Set<String> candidates = new LinkedHashSet<>();
        IdentifierNormalizer.tryNormalize(identifier).ifPresent(candidates::add);
        if (identifier != null && !identifier.isEmpty()) {
            candidates.add(identifier);
        }
        for (String candidate : candidates) {
            String key = PageKeys.storageKey(candidate);
            Optional<byte[]> content = readRaw(key);
            if (content.isPresent()) {
                return Optional.of(new StoredPage(key, candidate, content.get()));
            }
        }
        return Optional.empty();
    }

    @Override
    public <T> T withPageLocks(Collection<String> keys, PageAction<T> action) throws IOException {
        // bulkGet orders stripes consistently, so two callers never wait on each other.
        List<Lock> locks = new ArrayList<>(keys.size());
        for (Lock pageLock : pageLocks.bulkGet(keys)) {
            locks.add(pageLock);
        }
        int held = 0;
        try {
            for (Lock pageLock : locks) {
                pageLock.lock();
                held++;
            }
            return action.run();
        } finally {
            for (int i = held - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
        }
    }

    public Path contentFile(String key) {
        return config.pagesDir().resolve(checkedKey(key) + CONTENT_SUFFIX);
    }

    public Path metaFile(String key) {
        return config.pagesDir().resolve(checkedKey(key) + META_SUFFIX);
    }

    private static String checkedKey(String key) {
        if (key == null || key.isEmpty() || PageKeys.decode(key).isEmpty()) {
            throw new IllegalArgumentException("not a storage key: " + key);
        }
        return key;
    }

    private static Path freeSlot(Path dir, String fileName) {
        Path target = dir.resolve(fileName);
        if (!Files.exists(target)) {
            return target;
        }
        int dot = fileName.lastIndexOf('.');
        String stem = dot < 0 ? fileName : fileName.substring(0, dot);
        String extension = dot < 0 ? "" : fileName.substring(dot);
        for (int i = 1; ; i++) {
            target = dir.resolve(stem + "_" + i + extension);
            if (!Files.exists(target)) {
                return target;
            }
        }
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
