package io.pagekeys.rolling;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

final class StringFieldMungingMigrationTest {

    @Test
    void rewritesOnlyTheIdentifierValue() throws Exception {
        StringFieldMungingMigration migration = StringFieldMungingMigration.identifierField();
        byte[] input = bytes("+++\n# page\nidentifier = \"MyPage\"  # legacy\ntitle = \"T\"\n+++\nBody");

        Assertions.assertTrue(migration.appliesTo(input));
        Assertions.assertEquals(
                "+++\n# page\nidentifier = \"my_page\"  # legacy\ntitle = \"T\"\n+++\nBody",
                text(migration.apply(input))
        );
    }

    @Test
    void rewritesContainerInsideInventoryTable() throws Exception {
        StringFieldMungingMigration migration = StringFieldMungingMigration.inventoryContainer();
        byte[] input = bytes("+++\ntitle = 'x'\n\n[inventory]\ncontainer = 'Lab Shelf'\nitems = []\n+++\n");

        Assertions.assertEquals(
                "+++\ntitle = 'x'\n\n[inventory]\ncontainer = \"lab_shelf\"\nitems = []\n+++\n",
                text(migration.apply(input))
        );
    }

    @Test
    void rewritesDottedContainerKey() throws Exception {
        StringFieldMungingMigration migration = StringFieldMungingMigration.inventoryContainer();
        byte[] input = bytes("+++\ninventory.container = \"Box-A\"\n+++\n");

        Assertions.assertEquals("+++\ninventory.container = \"box_a\"\n+++\n", text(migration.apply(input)));
    }

    @Test
    void skipsCanonicalMissingAndUnusableValues() {
        StringFieldMungingMigration migration = StringFieldMungingMigration.identifierField();
        Assertions.assertFalse(migration.appliesTo(bytes("+++\nidentifier = \"my_page\"\n+++\n")));
        Assertions.assertFalse(migration.appliesTo(bytes("+++\ntitle = \"MyPage\"\n+++\n")));
        Assertions.assertFalse(migration.appliesTo(bytes("+++\nidentifier = \"///\"\n+++\n")));
        Assertions.assertFalse(migration.appliesTo(bytes("+++\nidentifier = 42\n+++\n")));
        Assertions.assertFalse(migration.appliesTo(bytes("+++\nidentifier = \n+++\n")));
    }

    @Test
    void failsWhenValueCannotBeRewrittenInPlace() {
        StringFieldMungingMigration container = StringFieldMungingMigration.inventoryContainer();
        byte[] inline = bytes("+++\ninventory = { container = \"Box A\" }\n+++\n");
        Assertions.assertTrue(container.appliesTo(inline));
        Assertions.assertThrows(MigrationException.class, () -> container.apply(inline));

        StringFieldMungingMigration identifier = StringFieldMungingMigration.identifierField();
        byte[] multiline = bytes("+++\nidentifier = \"\"\"MyPage\"\"\"\n+++\n");
        Assertions.assertTrue(identifier.appliesTo(multiline));
        Assertions.assertThrows(MigrationException.class, () -> identifier.apply(multiline));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }
}
