package io.pagekeys.rolling;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

final class DottedKeyTableMigrationTest {
    private final DottedKeyTableMigration migration = new DottedKeyTableMigration();

    @Test
    void groupsTopLevelDottedKeysIntoSortedTables() throws Exception {
        String input = "+++\n"
                + "title = \"t\"\n"
                + "alpha.b = 2\n"
                + "\n"
                + "[zeta]\n"
                + "# z comment\n"
                + "z = 1\n"
                + "\n"
                + "[alpha]\n"
                + "a = 1\n"
                + "+++\n"
                + "body";

        Assertions.assertTrue(migration.appliesTo(bytes(input)));
        Assertions.assertEquals("+++\n"
                + "title = \"t\"\n"
                + "[alpha]\n"
                + "b = 2\n"
                + "a = 1\n"
                + "[zeta]\n"
                + "# z comment\n"
                + "z = 1\n"
                + "+++\n"
                + "body", text(migration.apply(bytes(input))));
    }

    @Test
    void existingTableValueWinsOverDottedDuplicate() throws Exception {
        String input = "+++\ninventory.items = [1]\n[inventory]\nitems = []\n+++\n";

        Assertions.assertEquals("+++\n[inventory]\nitems = []\n+++\n", text(migration.apply(bytes(input))));
    }

    @Test
    void prefixesDottedKeysInsideTables() throws Exception {
        String input = "+++\n[page]\nmeta.author = \"a\"\n+++\n";

        Assertions.assertEquals("+++\n[page]\n[page.meta]\nauthor = \"a\"\n+++\n", text(migration.apply(bytes(input))));
    }

    @Test
    void leavesUnsupportedShapesAlone() {
        Assertions.assertFalse(migration.appliesTo(bytes("+++\nsite = \"x\"\nsite.name = \"y\"\n+++\n")));
        Assertions.assertFalse(migration.appliesTo(bytes("+++\na.b = 1\n[[items]]\nname = \"x\"\n+++\n")));
        Assertions.assertFalse(migration.appliesTo(bytes("+++\na.b = \"\"\"\nmulti\n\"\"\"\n+++\n")));
        Assertions.assertFalse(migration.appliesTo(bytes("+++\na.b = 1\n")));
        Assertions.assertFalse(migration.appliesTo(bytes("+++\nplain = 1\n[t]\nk = 2\n+++\n")));
    }

    @Test
    void leavesValuesSpanningLinesAlone() throws Exception {
        String input = "+++\ntitle = \"x\"\ninventory.items = [\n  \"a\",\n  \"b\",\n]\n+++\nbody\n";

        Assertions.assertFalse(migration.appliesTo(bytes(input)));
        Assertions.assertEquals(input, text(migration.apply(bytes(input))));
        Assertions.assertEquals(input, text(ContentMigrationPipeline.defaults().applyMigrations(bytes(input))));
        Assertions.assertFalse(migration.appliesTo(bytes("+++\nmeta.grid = [\n  [\"a\", \"b\"],\n]\n+++\n")));
        Assertions.assertFalse(migration.appliesTo(bytes("+++\na.b = { c = 1,\n+++\n")));
    }

    @Test
    void keepsHeaderComments() throws Exception {
        String input = "+++\ninventory.container = \"box\"\n[inventory] # note\nitems = []\n+++\n";

        Assertions.assertEquals(
                "+++\n[inventory] # note\ncontainer = \"box\"\nitems = []\n+++\n",
                text(migration.apply(bytes(input)))
        );
    }

    @Test
    void bracketsInsideStringsAndCommentsDoNotCount() {
        Assertions.assertTrue(DottedKeyTableMigration.closesOnSameLine("a.b = \"[\" # {"));
        Assertions.assertTrue(DottedKeyTableMigration.closesOnSameLine("a.b = ['x]', \"y\\\"]\"]"));
        Assertions.assertFalse(DottedKeyTableMigration.closesOnSameLine("a.b = ["));
        Assertions.assertFalse(DottedKeyTableMigration.closesOnSameLine("a.b = \"open"));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }
}
