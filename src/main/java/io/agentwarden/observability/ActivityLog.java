package io.agentwarden.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentwarden.error.StorageException;
import io.agentwarden.util.Hashing;
import io.agentwarden.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only JSON-lines log of everything the agent did. Each row carries the hash of the row
 * before it, so editing or dropping a line breaks {@link #verify()}.
 */
public final class ActivityLog {
    private static final int TAIL_CHUNK = 8192;
    private static final ConcurrentMap<Path, Object> FILE_MONITORS = new ConcurrentHashMap<>();

    private final Path logFile;
    private final String signingSecret;
    private final Clock clock;
    private final Object fileMonitor;

    public ActivityLog(Path logFile, String signingSecret, Clock clock) {
        this.logFile = logFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        try {
            Files.createDirectories(logFile.getParent());
            if (!Files.exists(logFile)) {
                try {
                    Files.createFile(logFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to initialize activity log: " + logFile, e);
        }
        this.fileMonitor = FILE_MONITORS.computeIfAbsent(logFile.toAbsolutePath().normalize(), k -> new Object());
    }

    /**
     * Appends one row chained to the last row on disk. Other processes append to the same file, so
     * the previous hash is read under an exclusive file lock rather than cached.
     */
    public ActivityRecord append(ActivityEvent event) {
        synchronized (fileMonitor) {
            try (FileChannel channel = FileChannel.open(logFile, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                Map<String, Object> row = buildRow(event, lastRowHash(channel));
                byte[] line = (Jsons.toCompactJson(row) + "\n").getBytes(StandardCharsets.UTF_8);
                ByteBuffer buffer = ByteBuffer.wrap(line);
                long position = channel.size();
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(false);
                return toRecord(Jsons.mapper().valueToTree(row));
            } catch (IOException e) {
                throw new StorageException("Failed to write activity log", e);
            }
        }
    }

    private Map<String, Object> buildRow(ActivityEvent event, String previousHash) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.ofEpochMilli(clock.millis()).toString());
        row.put("event_kind", event.kind().wireName());
        row.put("subject_id", event.subjectId());
        row.put("actor", event.actor());
        row.put("detail", sanitizeDetail(event.detail()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        return row;
    }

    /** Hash of the last row on disk, or empty for a new log. */
    public String currentHash() {
        synchronized (fileMonitor) {
            try (FileChannel channel = FileChannel.open(logFile, StandardOpenOption.READ)) {
                return lastRowHash(channel);
            } catch (IOException e) {
                throw new StorageException("Failed to read activity log", e);
            }
        }
    }

    /** Most recent rows, oldest first. */
    public List<ActivityRecord> tail(int limit) {
        int safeLimit = Math.max(1, limit);
        Deque<ActivityRecord> window = new ArrayDeque<>(safeLimit);
        for (String line : readLines()) {
            if (line.isBlank()) {
                continue;
            }
            try {
                window.addLast(toRecord(Jsons.mapper().readTree(line)));
            } catch (IOException e) {
                throw new StorageException("Failed to parse activity log row", e);
            }
            if (window.size() > safeLimit) {
                window.removeFirst();
            }
        }
        return new ArrayList<>(window);
    }

    public IntegrityReport verify() {
        String expectedPrev = "";
        long rows = 0;
        long lineNo = 0;
        for (String line : readLines()) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return IntegrityReport.broken(rows, lineNo, "unparseable_row");
            }
            rows++;
            String prev = node.path("prev_hash").asText("");
            String hash = node.path("hash").asText("");
            if (!prev.equals(expectedPrev)) {
                return IntegrityReport.broken(rows, lineNo, "prev_hash_mismatch");
            }
            Map<String, Object> body = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> {
                if (!e.getKey().equals("hash") && !e.getKey().equals("signature")) {
                    body.put(e.getKey(), e.getValue());
                }
            });
            if (!Hashing.sha256Hex(Jsons.toCompactJson(body)).equals(hash)) {
                return IntegrityReport.broken(rows, lineNo, "hash_mismatch");
            }
            if (!signingSecret.isBlank()
                    && !Hashing.hmacSha256Hex(signingSecret, hash).equals(node.path("signature").asText(""))) {
                return IntegrityReport.broken(rows, lineNo, "signature_mismatch");
            }
            expectedPrev = hash;
        }
        return IntegrityReport.intact(rows);
    }

    public Path file() {
        return logFile;
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to read activity log", e);
        }
    }

    private static String lastRowHash(FileChannel channel) throws IOException {
        long position = channel.size();
        byte[] collected = new byte[0];
        while (position > 0) {
            int chunk = (int) Math.min(TAIL_CHUNK, position);
            position -= chunk;
            ByteBuffer buffer = ByteBuffer.allocate(chunk);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer, position + buffer.position()) < 0) {
                    break;
                }
            }
            byte[] joined = new byte[chunk + collected.length];
            System.arraycopy(buffer.array(), 0, joined, 0, chunk);
            System.arraycopy(collected, 0, joined, chunk, collected.length);
            collected = joined;

            String text = new String(collected, StandardCharsets.UTF_8).stripTrailing();
            int newline = text.lastIndexOf('\n');
            if (text.isEmpty() && position > 0) {
                continue;
            }
            if (newline >= 0 || position == 0) {
                String last = text.substring(newline + 1);
                return last.isBlank() ? "" : Jsons.mapper().readTree(last).path("hash").asText("");
            }
        }
        return "";
    }

    private static JsonNode sanitizeDetail(Map<String, Object> detail) {
        if (detail == null || detail.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        return SensitiveDataMasker.masked(Jsons.mapper().valueToTree(detail));
    }

    private static ActivityRecord toRecord(JsonNode node) {
        return new ActivityRecord(
                node.path("timestamp").asText(),
                node.path("event_kind").asText(),
                node.path("subject_id").isNull() ? null : node.path("subject_id").asText(null),
                node.path("actor").asText(null),
                node.path("detail"),
                node.path("prev_hash").asText(""),
                node.path("hash").asText("")
        );
    }

    public record ActivityEvent(ActivityKind kind, String subjectId, String actor, Map<String, Object> detail) {
        public static ActivityEvent of(ActivityKind kind, String subjectId, String actor, Map<String, Object> detail) {
            return new ActivityEvent(kind, subjectId, actor == null ? "system" : actor, detail == null ? Map.of() : detail);
        }
    }

    public record ActivityRecord(
            String timestamp,
            String eventKind,
            String subjectId,
            String actor,
            JsonNode detail,
            String prevHash,
            String hash
    ) {
    }

    public record IntegrityReport(boolean intact, long rowsChecked, Long brokenAtLine, String reason) {
        static IntegrityReport intact(long rows) {
            return new IntegrityReport(true, rows, null, null);
        }

        static IntegrityReport broken(long rows, long line, String reason) {
            return new IntegrityReport(false, rows, line, reason);
        }
    }
}
