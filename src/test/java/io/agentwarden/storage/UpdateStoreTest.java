package io.agentwarden.storage;

import io.agentwarden.config.WardenConfig;
import io.agentwarden.model.Backup;
import io.agentwarden.model.ChangeLogEntry;
import io.agentwarden.model.PendingUpdate;
import io.agentwarden.model.UpdateStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Stream;

final class UpdateStoreTest {

    @Test
    void decisionIsCompareAndSetFromPendingApproval() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-update-store-");
        try {
            UpdateStore store = newStore(root);
            store.insert(pending("upd_1"), entry("upd_1", "propose", null, UpdateStatus.PENDING_APPROVAL));

            Assertions.assertTrue(store.recordDecision("upd_1", UpdateStatus.APPROVED, "alice", "looks fine", 20L,
                    entry("upd_1", "approve", UpdateStatus.PENDING_APPROVAL, UpdateStatus.APPROVED)));
            Assertions.assertFalse(store.recordDecision("upd_1", UpdateStatus.REJECTED, "bob", null, 21L,
                    entry("upd_1", "reject", UpdateStatus.PENDING_APPROVAL, UpdateStatus.REJECTED)));

            PendingUpdate approved = store.find("upd_1").orElseThrow();
            Assertions.assertEquals(UpdateStatus.APPROVED, approved.status());
            Assertions.assertEquals("alice", approved.decidedBy());
            Assertions.assertEquals(20L, approved.decidedAtMs());
            Assertions.assertEquals("looks fine", approved.reason());

            List<ChangeLogEntry> log = store.changeLog("upd_1");
            Assertions.assertEquals(2, log.size());
            Assertions.assertEquals("propose", log.get(0).action());
            Assertions.assertNull(log.get(0).fromStatus());
            Assertions.assertEquals(UpdateStatus.APPROVED, log.get(1).toStatus());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void backupIsLinkedOnceAndCannotBeModified() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-backup-immutable-");
        try {
            Database db = new Database(WardenConfig.fromRoot(root.toString()));
            db.init();
            UpdateStore store = new UpdateStore(db);
            store.insert(pending("upd_2"), entry("upd_2", "propose", null, UpdateStatus.PENDING_APPROVAL));

            Backup early = backup("bak_early", "upd_2");
            Assertions.assertFalse(store.saveBackup(early, entry("upd_2", "backup", UpdateStatus.APPROVED, UpdateStatus.APPROVED)));
            Assertions.assertTrue(store.findBackup("bak_early").isEmpty());

            store.recordDecision("upd_2", UpdateStatus.APPROVED, "alice", null, 30L,
                    entry("upd_2", "approve", UpdateStatus.PENDING_APPROVAL, UpdateStatus.APPROVED));
            Assertions.assertTrue(store.saveBackup(backup("bak_1", "upd_2"),
                    entry("upd_2", "backup", UpdateStatus.APPROVED, UpdateStatus.APPROVED)));
            Assertions.assertFalse(store.saveBackup(backup("bak_2", "upd_2"),
                    entry("upd_2", "backup", UpdateStatus.APPROVED, UpdateStatus.APPROVED)));
            Assertions.assertEquals("bak_1", store.find("upd_2").orElseThrow().backupRef());

            Backup stored = store.findBackup("bak_1").orElseThrow();
            Assertions.assertArrayEquals("original".getBytes(StandardCharsets.UTF_8), stored.originalContent());
            Assertions.assertTrue(stored.targetExisted());

            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                Assertions.assertThrows(SQLException.class,
                        () -> st.executeUpdate("UPDATE backups SET original_sha256='x' WHERE backup_id='bak_1'"));
                Assertions.assertThrows(SQLException.class,
                        () -> st.executeUpdate("DELETE FROM backups WHERE backup_id='bak_1'"));
                Assertions.assertThrows(SQLException.class,
                        () -> st.executeUpdate("DELETE FROM update_change_log"));
                Assertions.assertThrows(SQLException.class,
                        () -> st.executeUpdate("UPDATE update_change_log SET actor='mallory'"));
            }
            Assertions.assertTrue(store.findBackup("bak_1").isPresent());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void appliedThenRolledBackOnlyFromTheExpectedStatus() throws Exception {
        Path root = Files.createTempDirectory("agentwarden-test-update-transitions-");
        try {
            UpdateStore store = newStore(root);
            store.insert(pending("upd_3"), entry("upd_3", "propose", null, UpdateStatus.PENDING_APPROVAL));
            Assertions.assertFalse(store.markApplied("upd_3", 40L,
                    entry("upd_3", "apply", UpdateStatus.APPROVED, UpdateStatus.APPLIED)));

            store.recordDecision("upd_3", UpdateStatus.APPROVED, "alice", null, 41L,
                    entry("upd_3", "approve", UpdateStatus.PENDING_APPROVAL, UpdateStatus.APPROVED));
            Assertions.assertTrue(store.markApplied("upd_3", 42L,
                    entry("upd_3", "apply", UpdateStatus.APPROVED, UpdateStatus.APPLIED)));
            Assertions.assertTrue(store.markRolledBack("upd_3", UpdateStatus.APPLIED, 43L,
                    entry("upd_3", "rollback", UpdateStatus.APPLIED, UpdateStatus.ROLLED_BACK)));
            Assertions.assertFalse(store.markRolledBack("upd_3", UpdateStatus.APPLIED, 44L,
                    entry("upd_3", "rollback", UpdateStatus.APPLIED, UpdateStatus.ROLLED_BACK)));

            PendingUpdate done = store.find("upd_3").orElseThrow();
            Assertions.assertEquals(UpdateStatus.ROLLED_BACK, done.status());
            Assertions.assertEquals(42L, done.appliedAtMs());
            Assertions.assertEquals(43L, done.rolledBackAtMs());
            Assertions.assertEquals(4, store.changeLog("upd_3").size());
            Assertions.assertEquals(1, store.list(UpdateStatus.ROLLED_BACK, 10).size());
            Assertions.assertTrue(store.list(UpdateStatus.APPLIED, 10).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    private static UpdateStore newStore(Path root) {
        Database db = new Database(WardenConfig.fromRoot(root.toString()));
        db.init();
        return new UpdateStore(db);
    }

    private static PendingUpdate pending(String id) {
        return new PendingUpdate(id, "prompts/general.txt", "new", "sha-new", "sha-old", null, true,
                UpdateStatus.PENDING_APPROVAL, null, null, 10L, null, null, null, null);
    }

    private static Backup backup(String id, String updateId) {
        return new Backup(id, updateId, "prompts/general.txt", true,
                "original".getBytes(StandardCharsets.UTF_8), "sha-old", 35L);
    }

    private static ChangeLogEntry entry(String updateId, String action, UpdateStatus from, UpdateStatus to) {
        return ChangeLogEntry.of(updateId, 1L, "test", action, from, to, null, null);
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
