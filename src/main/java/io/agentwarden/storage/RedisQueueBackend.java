package io.agentwarden.storage;

import io.agentwarden.error.ErrorKind;
import io.agentwarden.error.StorageException;
import io.agentwarden.model.Priority;
import io.agentwarden.model.TaskError;
import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskStatus;
import io.agentwarden.model.TaskType;
import io.agentwarden.model.TaskView;
import io.agentwarden.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;

import java.net.URI;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Multi-node queue on Redis. Each task is a hash; a sorted set of leases scored by expiry plays
 * the role of the broker's visibility timeout, and every state change runs as one Lua script so
 * concurrent workers on different nodes never see a half-applied transition.
 */
public final class RedisQueueBackend implements QueueBackend {
    private static final Logger LOG = LoggerFactory.getLogger(RedisQueueBackend.class);
    private static final long RANK_SPAN = 1_000_000_000_000L;

    private static final String LEASE_CHECK = """
            local st = redis.call('HGET', KEYS[1], 'status')
            local token = redis.call('HGET', KEYS[1], 'lease_token')
            local expires = tonumber(redis.call('HGET', KEYS[1], 'lease_expires_at_ms') or '0')
            local held = (st == 'CLAIMED' or st == 'RUNNING') and token == ARGV[1] and expires >= tonumber(ARGV[2])
            """;

    static final String SUBMIT_SCRIPT = """
            local seq = redis.call('INCR', KEYS[1])
            local score = (tonumber(ARGV[7]) - tonumber(ARGV[3])) * %d + seq
            redis.call('HSET', KEYS[4], 'task_id', ARGV[1], 'seq', seq, 'task_type', ARGV[2],
                'priority_rank', ARGV[3], 'payload_json', ARGV[4], 'status', 'PENDING', 'attempt_count', 0,
                'max_attempts', ARGV[5], 'created_at_ms', ARGV[6], 'cancel_requested', 0,
                'queue_score', string.format('%%.0f', score))
            redis.call('ZADD', KEYS[2], seq, ARGV[1])
            redis.call('ZADD', KEYS[3], score, ARGV[1])
            return seq
            """.formatted(RANK_SPAN);

    static final String CLAIM_SCRIPT = """
            local due = redis.call('ZRANGEBYSCORE', KEYS[2], '-inf', ARGV[1])
            for _, id in ipairs(due) do
                local key = ARGV[5] .. id
                redis.call('ZREM', KEYS[2], id)
                redis.call('HSET', key, 'status', 'PENDING')
                redis.call('HDEL', key, 'next_retry_at_ms')
                redis.call('ZADD', KEYS[1], redis.call('HGET', key, 'queue_score'), id)
            end
            local head = redis.call('ZRANGE', KEYS[1], 0, 0)
            if #head == 0 then
                return false
            end
            local id = head[1]
            local key = ARGV[5] .. id
            redis.call('ZREM', KEYS[1], id)
            redis.call('HSET', key, 'status', 'CLAIMED', 'lease_owner', ARGV[3], 'lease_token', ARGV[4],
                'claimed_at_ms', ARGV[1], 'lease_expires_at_ms', ARGV[2])
            redis.call('ZADD', KEYS[3], ARGV[2], id)
            return id
            """;

    static final String MARK_RUNNING_SCRIPT = LEASE_CHECK + """
            if not held or st ~= 'CLAIMED' then
                return 0
            end
            redis.call('HSET', KEYS[1], 'status', 'RUNNING')
            return 1
            """;

    static final String CHECK_LEASE_SCRIPT = LEASE_CHECK + """
            if not held then
                return 'NOT_HELD'
            end
            if redis.call('HGET', KEYS[1], 'cancel_requested') == '1' then
                return 'CANCEL_REQUESTED'
            end
            return 'HELD'
            """;

    static final String ACK_SCRIPT = LEASE_CHECK + """
            if not held then
                return 'NOT_CLAIMED'
            end
            redis.call('ZREM', KEYS[2], ARGV[4])
            redis.call('HDEL', KEYS[1], 'lease_owner', 'lease_token', 'lease_expires_at_ms')
            if redis.call('HGET', KEYS[1], 'cancel_requested') == '1' then
                redis.call('HSET', KEYS[1], 'status', 'CANCELLED', 'completed_at_ms', ARGV[2])
                return 'CANCELLED'
            end
            redis.call('HSET', KEYS[1], 'status', 'COMPLETED', 'completed_at_ms', ARGV[2], 'result', ARGV[3])
            return 'COMPLETED'
            """;

    static final String FAIL_SCRIPT = LEASE_CHECK + """
            if not held then
                return {'NOT_CLAIMED', 0}
            end
            local attempts = redis.call('HINCRBY', KEYS[1], 'attempt_count', 1)
            redis.call('ZREM', KEYS[2], ARGV[6])
            redis.call('HDEL', KEYS[1], 'lease_owner', 'lease_token', 'lease_expires_at_ms')
            redis.call('HSET', KEYS[1], 'error_json', ARGV[3])
            if redis.call('HGET', KEYS[1], 'cancel_requested') == '1' then
                redis.call('HSET', KEYS[1], 'status', 'CANCELLED', 'completed_at_ms', ARGV[2])
                return {'CANCELLED', attempts}
            end
            if ARGV[4] == '1' and attempts < tonumber(redis.call('HGET', KEYS[1], 'max_attempts')) then
                redis.call('HSET', KEYS[1], 'status', 'RETRYING', 'next_retry_at_ms', ARGV[5])
                redis.call('ZADD', KEYS[3], ARGV[5], ARGV[6])
                return {'RETRY_SCHEDULED', attempts}
            end
            redis.call('HSET', KEYS[1], 'status', 'FAILED', 'completed_at_ms', ARGV[2])
            return {'FAILED', attempts}
            """;

    static final String REAP_SCRIPT = """
            local ids = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', '(' .. ARGV[1], 'LIMIT', 0, tonumber(ARGV[2]))
            local out = {}
            for _, id in ipairs(ids) do
                local key = ARGV[3] .. id
                redis.call('ZREM', KEYS[1], id)
                local st = redis.call('HGET', key, 'status')
                if st == 'CLAIMED' or st == 'RUNNING' then
                    local owner = redis.call('HGET', key, 'lease_owner') or ''
                    local attempts = redis.call('HINCRBY', key, 'attempt_count', 1)
                    redis.call('HDEL', key, 'lease_owner', 'lease_token', 'lease_expires_at_ms', 'claimed_at_ms')
                    local nextStatus = 'PENDING'
                    if redis.call('HGET', key, 'cancel_requested') == '1' then
                        nextStatus = 'CANCELLED'
                        redis.call('HSET', key, 'status', nextStatus, 'completed_at_ms', ARGV[1])
                    elseif attempts >= tonumber(redis.call('HGET', key, 'max_attempts') or '1') then
                        nextStatus = 'FAILED'
                        redis.call('HSET', key, 'status', nextStatus, 'completed_at_ms', ARGV[1],
                            'error_json', cjson.encode({kind = ARGV[4], message = ARGV[5] .. attempts}))
                    else
                        redis.call('HSET', key, 'status', nextStatus)
                        redis.call('ZADD', KEYS[2], redis.call('HGET', key, 'queue_score'), id)
                    end
                    table.insert(out, {id, owner, nextStatus, attempts})
                end
            end
            return out
            """;

    static final String CANCEL_SCRIPT = """
            local st = redis.call('HGET', KEYS[1], 'status')
            if not st then
                return 'NOT_FOUND'
            end
            if st == 'PENDING' or st == 'RETRYING' then
                redis.call('ZREM', KEYS[2], ARGV[2])
                redis.call('ZREM', KEYS[3], ARGV[2])
                redis.call('HDEL', KEYS[1], 'next_retry_at_ms')
                redis.call('HSET', KEYS[1], 'status', 'CANCELLED', 'completed_at_ms', ARGV[1])
                return 'CANCELLED'
            end
            if st == 'CLAIMED' or st == 'RUNNING' then
                redis.call('HSET', KEYS[1], 'cancel_requested', 1)
                return 'CANCEL_REQUESTED'
            end
            return 'NOT_CANCELLABLE'
            """;

    private final UnifiedJedis jedis;
    private final String prefix;

    public RedisQueueBackend(UnifiedJedis jedis, String keyPrefix) {
        this.jedis = jedis;
        this.prefix = keyPrefix == null || keyPrefix.isBlank() ? "warden" : keyPrefix.trim();
    }

    public static RedisQueueBackend connect(String redisUrl, String keyPrefix) {
        return new RedisQueueBackend(new JedisPooled(URI.create(redisUrl)), keyPrefix);
    }

    @Override
    public void init() {
        try {
            boolean existing = jedis.exists(seqKey());
            LOG.info("Redis queue ready, prefix={}, existing={}", prefix, existing);
        } catch (JedisException e) {
            throw new StorageException("Failed to reach Redis queue", e);
        }
    }

    @Override
    public long insert(NewTask task) {
        Object seq = eval(SUBMIT_SCRIPT,
                List.of(seqKey(), allKey(), pendingKey(), taskKey(task.taskId())),
                List.of(
                        task.taskId(),
                        task.type().wireName(),
                        Integer.toString(task.priority().rank()),
                        Jsons.toCompactJson(task.payload()),
                        Integer.toString(task.maxAttempts()),
                        Long.toString(task.createdAtMs()),
                        Integer.toString(Priority.MAX_RANK)
                ),
                "insert task " + task.taskId());
        return toLong(seq);
    }

    @Override
    public Optional<TaskView> claimNext(String workerId, String leaseToken, long nowMs, long leaseExpiresAtMs) {
        Object claimed = eval(CLAIM_SCRIPT,
                List.of(pendingKey(), retryKey(), leasesKey()),
                List.of(Long.toString(nowMs), Long.toString(leaseExpiresAtMs), workerId, leaseToken, taskKeyPrefix()),
                "claim task for worker " + workerId);
        if (claimed == null) {
            return Optional.empty();
        }
        return find(claimed.toString());
    }

    @Override
    public boolean markRunning(String taskId, String leaseToken, long nowMs) {
        Object out = eval(MARK_RUNNING_SCRIPT,
                List.of(taskKey(taskId)),
                List.of(leaseToken, Long.toString(nowMs)),
                "mark task running " + taskId);
        return toLong(out) == 1L;
    }

    @Override
    public LeaseCheck checkLease(String taskId, String leaseToken, long nowMs) {
        Object out = eval(CHECK_LEASE_SCRIPT,
                List.of(taskKey(taskId)),
                List.of(leaseToken, Long.toString(nowMs)),
                "check lease of task " + taskId);
        return LeaseCheck.valueOf(out.toString());
    }

    @Override
    public AckOutcome ack(String taskId, String leaseToken, String result, long nowMs) {
        Object out = eval(ACK_SCRIPT,
                List.of(taskKey(taskId), leasesKey()),
                List.of(leaseToken, Long.toString(nowMs), result == null ? "" : result, taskId),
                "ack task " + taskId);
        return AckOutcome.valueOf(out.toString());
    }

    @Override
    public FailureResolution fail(String taskId, String leaseToken, TaskError error, long nowMs, RetryDecision retry) {
        int currentAttempts = (int) toLong(hget(taskKey(taskId), "attempt_count"));
        long nextRetryAtMs = retry.nextRetryAtMs(currentAttempts + 1, nowMs);
        Object out = eval(FAIL_SCRIPT,
                List.of(taskKey(taskId), leasesKey(), retryKey()),
                List.of(
                        leaseToken,
                        Long.toString(nowMs),
                        Jsons.toCompactJson(error),
                        error.retryable() ? "1" : "0",
                        Long.toString(nextRetryAtMs),
                        taskId
                ),
                "record failure of task " + taskId);
        List<?> parts = (List<?>) out;
        FailureOutcome outcome = FailureOutcome.valueOf(parts.get(0).toString());
        int attempts = (int) toLong(parts.get(1));
        return switch (outcome) {
            case NOT_CLAIMED -> FailureResolution.notClaimed();
            case RETRY_SCHEDULED -> FailureResolution.retryScheduled(attempts, nextRetryAtMs);
            case CANCELLED -> FailureResolution.cancelled(attempts);
            case FAILED -> FailureResolution.failed(attempts);
        };
    }

    @Override
    public List<ReapedTask> reapExpired(long nowMs, int limit) {
        Object out = eval(REAP_SCRIPT,
                List.of(leasesKey(), pendingKey()),
                List.of(
                        Long.toString(nowMs),
                        Integer.toString(Math.max(1, limit)),
                        taskKeyPrefix(),
                        ErrorKind.NOT_CLAIMED.wireName(),
                        ReapedTask.EXHAUSTED_MESSAGE_PREFIX
                ),
                "reap expired leases");
        List<ReapedTask> reaped = new ArrayList<>();
        for (Object row : (List<?>) out) {
            List<?> cols = (List<?>) row;
            String owner = cols.get(1).toString();
            reaped.add(new ReapedTask(
                    cols.get(0).toString(),
                    owner.isEmpty() ? null : owner,
                    TaskStatus.valueOf(cols.get(2).toString()),
                    (int) toLong(cols.get(3))
            ));
        }
        return reaped;
    }

    @Override
    public CancelOutcome cancel(String taskId, long nowMs) {
        Object out = eval(CANCEL_SCRIPT,
                List.of(taskKey(taskId), pendingKey(), retryKey()),
                List.of(Long.toString(nowMs), taskId),
                "cancel task " + taskId);
        return CancelOutcome.valueOf(out.toString());
    }

    @Override
    public Optional<TaskView> find(String taskId) {
        Map<String, String> fields;
        try {
            fields = jedis.hgetAll(taskKey(taskId));
        } catch (JedisException e) {
            throw new StorageException("Failed to read task: " + taskId, e);
        }
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapTask(fields));
    }

    @Override
    public List<TaskView> list(TaskStatus status, int limit) {
        List<String> ids;
        try {
            ids = jedis.zrange(allKey(), 0, -1);
        } catch (JedisException e) {
            throw new StorageException("Failed to list tasks", e);
        }
        List<TaskView> out = new ArrayList<>();
        int safeLimit = Math.max(1, limit);
        for (String id : ids) {
            Optional<TaskView> task = find(id);
            if (task.isEmpty() || (status != null && task.get().status() != status)) {
                continue;
            }
            out.add(task.get());
            if (out.size() >= safeLimit) {
                break;
            }
        }
        return out;
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> out = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            out.put(status, 0L);
        }
        for (TaskView task : list(null, Integer.MAX_VALUE)) {
            out.merge(task.status(), 1L, Long::sum);
        }
        return out;
    }

    @Override
    public void close() {
        jedis.close();
    }

    private Object eval(String script, List<String> keys, List<String> args, String what) {
        try {
            return jedis.eval(script, keys, args);
        } catch (JedisException e) {
            throw new StorageException("Failed to " + what, e);
        }
    }

    private String hget(String key, String field) {
        try {
            return jedis.hget(key, field);
        } catch (JedisException e) {
            throw new StorageException("Failed to read " + key, e);
        }
    }

    private TaskView mapTask(Map<String, String> f) {
        String errorJson = f.get("error_json");
        return new TaskView(
                f.get("task_id"),
                parseLong(f.get("seq"), 0L),
                TaskType.fromWire(f.get("task_type")),
                Priority.fromRank((int) parseLong(f.get("priority_rank"), 1L)),
                Jsons.fromJson(f.get("payload_json"), TaskPayload.class),
                TaskStatus.valueOf(f.get("status")),
                (int) parseLong(f.get("attempt_count"), 0L),
                (int) parseLong(f.get("max_attempts"), 1L),
                parseLong(f.get("created_at_ms"), 0L),
                parseNullableLong(f.get("claimed_at_ms")),
                parseNullableLong(f.get("completed_at_ms")),
                f.get("lease_owner"),
                parseNullableLong(f.get("lease_expires_at_ms")),
                parseNullableLong(f.get("next_retry_at_ms")),
                "1".equals(f.get("cancel_requested")),
                f.get("result"),
                errorJson == null || errorJson.isEmpty() ? null : Jsons.fromJson(errorJson, TaskError.class)
        );
    }

    private static long toLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        return parseLong(value.toString(), 0L);
    }

    private static long parseLong(String raw, long fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Long parseNullableLong(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return parseLong(raw, 0L);
    }

    String taskKey(String taskId) {
        return taskKeyPrefix() + taskId;
    }

    private String taskKeyPrefix() {
        return prefix + ":task:";
    }

    String pendingKey() {
        return prefix + ":pending";
    }

    String retryKey() {
        return prefix + ":retry";
    }

    String leasesKey() {
        return prefix + ":leases";
    }

    String allKey() {
        return prefix + ":tasks";
    }

    String seqKey() {
        return prefix + ":seq";
    }
}
