package org.endlesssource.mediarelay.agent.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FileCredentialStoreTest {

    @TempDir
    Path dir;

    private static TrustMaterial material(int seed) {
        byte[] key = new byte[32];
        byte[] token = new byte[32];
        key[0] = (byte) seed;
        token[0] = (byte) (seed + 100);
        return new TrustMaterial(key, "client-" + seed, token);
    }

    @Test
    void recordsSurviveReopen() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);
        try (FileCredentialStore store = FileCredentialStore.open(dir, clock)) {
            store.put("alice", material(1));
            store.put("bob", material(2));
        }

        try (FileCredentialStore store = FileCredentialStore.open(dir)) {
            TrustRecord alice = store.get("alice").orElseThrow();
            assertEquals("client-1", alice.clientName());
            assertArrayEquals(material(1).trustToken(), alice.trustToken());
            assertArrayEquals(material(1).identityKey(), alice.identityKey());
            assertEquals(Instant.parse("2026-01-02T03:04:05Z"), alice.createdAt());
            assertEquals(2, store.list().size());
        }
    }

    @Test
    void putReplacesPreviousRecordForIdentity() {
        try (FileCredentialStore store = FileCredentialStore.open(dir)) {
            store.put("alice", material(1));
            store.put("alice", material(7));
            List<TrustRecord> records = store.list();
            assertEquals(1, records.size());
            assertArrayEquals(material(7).trustToken(), records.get(0).trustToken());
        }
    }

    @Test
    void revokeRemovesRecordDurably() {
        try (FileCredentialStore store = FileCredentialStore.open(dir)) {
            store.put("alice", material(1));
            store.put("bob", material(2));
            assertTrue(store.revoke("alice"));
            assertFalse(store.revoke("alice"));
            assertFalse(store.revoke(null));
        }
        try (FileCredentialStore store = FileCredentialStore.open(dir)) {
            assertTrue(store.get("alice").isEmpty());
            assertTrue(store.get("bob").isPresent());
            assertEquals(1, store.revokeAll());
            assertTrue(store.list().isEmpty());
        }
    }

    @Test
    void noTemporaryFilesAreLeftBehind() throws IOException {
        try (FileCredentialStore store = FileCredentialStore.open(dir)) {
            for (int i = 0; i < 5; i++) {
                store.put("id-" + i, material(i));
            }
        }
        try (var files = Files.list(dir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
        assertTrue(Files.exists(dir.resolve(FileCredentialStore.FILE_NAME)));
    }

    @Test
    void fileIsOwnerOnlyWherePosixIsSupported() throws IOException {
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        try (FileCredentialStore store = FileCredentialStore.open(dir.resolve("state"))) {
            store.put("alice", material(1));
        }
        assertEquals("rw-------", PosixFilePermissions.toString(
                Files.getPosixFilePermissions(dir.resolve("state").resolve(FileCredentialStore.FILE_NAME))));
        assertEquals("rwx------", PosixFilePermissions.toString(
                Files.getPosixFilePermissions(dir.resolve("state"))));
    }

    @Test
    void secondStoreOnSameDirectoryIsRefused() {
        try (FileCredentialStore ignored = FileCredentialStore.open(dir)) {
            assertThrows(CredentialStoreException.class, () -> FileCredentialStore.open(dir));
        }
    }

    @Test
    void closedStoreRejectsAccess() {
        FileCredentialStore store = FileCredentialStore.open(dir);
        store.close();
        store.close();
        assertThrows(IllegalStateException.class, () -> store.get("alice"));
        assertThrows(IllegalStateException.class, () -> store.put("alice", material(1)));
    }

    @Test
    void unreadableDocumentFailsToOpen() throws IOException {
        Files.writeString(dir.resolve(FileCredentialStore.FILE_NAME), "{ not json");
        assertThrows(CredentialStoreException.class, () -> FileCredentialStore.open(dir));
    }

    @Test
    void readersNeverSeePartialState() throws Exception {
        try (FileCredentialStore store = FileCredentialStore.open(dir)) {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<?> writer = executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        store.put("id-" + i, material(i));
                    }
                    return null;
                });
                Future<?> reader = executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        for (TrustRecord record : store.list()) {
                            assertEquals(32, record.trustToken().length);
                            assertTrue(record.clientName().startsWith("client-"));
                        }
                    }
                    return null;
                });
                start.countDown();
                writer.get(30, TimeUnit.SECONDS);
                reader.get(30, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }
            assertEquals(50, store.list().size());
        }
    }
}
