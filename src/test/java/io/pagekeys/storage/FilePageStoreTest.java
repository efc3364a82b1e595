package io.pagekeys.storage;

import io.pagekeys.config.PageKeysConfig;
import io.pagekeys.model.PageMeta;
import io.pagekeys.model.StoredPage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class FilePageStoreTest {

    @Test
    void storageKeysIgnoreCaseAndDecodeBack() {
        Assertions.assertEquals(PageKeys.storageKey("MyPage"), PageKeys.storageKey("mypage"));
        Assertions.assertNotEquals(PageKeys.storageKey("MyPage"), PageKeys.storageKey("my_page"));
        Assertions.assertEquals("my_page", PageKeys.decode(PageKeys.storageKey("my_page")).orElseThrow());
        Assertions.assertEquals("东京", PageKeys.decode(PageKeys.storageKey("东京")).orElseThrow());
        Assertions.assertFalse(PageKeys.storageKey("my_page").contains("="));
        Assertions.assertTrue(PageKeys.decode("not-base32!").isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class, () -> PageKeys.storageKey(""));
    }

    @Test
    void writesReadsAndListsPages() throws Exception {
        Path root = Files.createTempDirectory("pagekeys-store-");
        try {
            FilePageStore store = newStore(root);
            String key = PageKeys.storageKey("my_page");

            store.writeRaw(key, bytes("hello"));
            store.writeMeta(key, new PageMeta("my_page", 42L));
            Files.writeString(root.resolve("pages").resolve("README.md"), "foreign");

            Assertions.assertEquals("hello", text(store.readRaw(key).orElseThrow()));
            Assertions.assertEquals(new PageMeta("my_page", 42L), store.readMeta(key).orElseThrow());
            Assertions.assertEquals(List.of(key), store.listKeys());
            Assertions.assertTrue(store.readRaw(PageKeys.storageKey("other")).isEmpty());
            Assertions.assertTrue(store.readMeta(PageKeys.storageKey("other")).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void prefersCanonicalSlotOverLiteralSlot() throws Exception {
        Path root = Files.createTempDirectory("pagekeys-store-prefer-");
        try {
            FilePageStore store = newStore(root);
            store.writeRaw(PageKeys.storageKey("MyPage"), bytes("legacy"));

            StoredPage legacy = store.readPreferringCanonical("MyPage").orElseThrow();
            Assertions.assertEquals(PageKeys.storageKey("MyPage"), legacy.key());
            Assertions.assertEquals("legacy", text(legacy.content()));

            store.writeRaw(PageKeys.storageKey("my_page"), bytes("canonical"));
            StoredPage canonical = store.readPreferringCanonical("MyPage").orElseThrow();
            Assertions.assertEquals(PageKeys.storageKey("my_page"), canonical.key());
            Assertions.assertEquals("my_page", canonical.identifier());
            Assertions.assertEquals("canonical", text(canonical.content()));

            Assertions.assertTrue(store.readPreferringCanonical("missing").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void softDeleteArchivesBothFilesWithoutOverwriting() throws Exception {
        Path root = Files.createTempDirectory("pagekeys-store-delete-");
        try {
            FilePageStore store = newStore(root);
            String key = PageKeys.storageKey("page");

            store.writeRaw(key, bytes("v1"));
            store.writeMeta(key, new PageMeta("page", 1L));
            List<Path> first = store.softDelete(key);
            store.writeRaw(key, bytes("v2"));
            List<Path> second = store.softDelete(key);

            Assertions.assertEquals(2, first.size());
            Assertions.assertEquals(1, second.size());
            Assertions.assertTrue(store.readRaw(key).isEmpty());
            Assertions.assertTrue(store.listKeys().isEmpty());
            Assertions.assertNotEquals(first.get(0), second.get(0));
            Assertions.assertEquals("v1", Files.readString(first.get(0)));
            Assertions.assertEquals("v2", Files.readString(second.get(0)));
            Assertions.assertTrue(second.get(0).startsWith(root.resolve("pages").resolve("__deleted__")));

            Assertions.assertThrows(NoSuchFileException.class, () -> store.softDelete(key));
        } finally {
            deleteRecursively(root);
        }
    }

    private static FilePageStore newStore(Path root) {
        FilePageStore store = new FilePageStore(PageKeysConfig.fromRoot(root.toString()));
        store.init();
        return store;
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
