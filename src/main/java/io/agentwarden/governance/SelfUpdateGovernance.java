package io.agentwarden.governance;

import io.agentwarden.error.InvalidTransitionException;
import io.agentwarden.error.SecurityViolationException;
import io.agentwarden.error.StorageException;
import io.agentwarden.guardrail.GuardrailContext;
import io.agentwarden.guardrail.GuardrailEngine;
import io.agentwarden.guardrail.GuardrailVerdict;
import io.agentwarden.guardrail.PathContainmentRule;
import io.agentwarden.guardrail.SourceScanner;
import io.agentwarden.model.Backup;
import io.agentwarden.model.ChangeLogEntry;
import io.agentwarden.model.PendingUpdate;
import io.agentwarden.model.UpdateStatus;
import io.agentwarden.observability.ActivityKind;
import io.agentwarden.observability.ActivityLog;
import io.agentwarden.observability.MdcContext;
import io.agentwarden.storage.UpdateStore;
import io.agentwarden.util.FileWrites;
import io.agentwarden.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Approval-gated changes to the agent's own files.
 *
 * <p>Lifecycle: {@code PENDING_APPROVAL -> APPROVED | REJECTED}, {@code APPROVED -> APPLIED},
 * {@code APPLIED -> ROLLED_BACK}. Unprotected targets skip the human step: they are approved by
 * {@link #AUTO_ACTOR} and applied as part of {@link #propose}. A backup is committed before any
 * byte of the target is overwritten.
 */
public final class SelfUpdateGovernance {
    private static final Logger LOG = LoggerFactory.getLogger(SelfUpdateGovernance.class);
    public static final String AUTO_ACTOR = "system:auto";
    public static final String GUARDRAIL_ACTOR = "guardrail";
    private static final String RESERVED_ACTOR_PREFIX = "system:";
    private static final int LOCK_STRIPES = 64;

    private final UpdateStore store;
    private final GuardrailEngine guardrails;
    private final ActivityLog activity;
    private final GovernancePolicy policy;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public SelfUpdateGovernance(
            UpdateStore store,
            GuardrailEngine guardrails,
            ActivityLog activity,
            GovernancePolicy policy,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.guardrails = Objects.requireNonNull(guardrails, "guardrails");
        this.activity = Objects.requireNonNull(activity, "activity");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    public GovernancePolicy policy() {
        return policy;
    }

    /**
     * Records a proposed change. Blocked content is stored as REJECTED and reported with
     * {@link SecurityViolationException}; unprotected targets come back already APPLIED.
     */
    public PendingUpdate propose(String targetPath, String content, String originTaskId) {
        Objects.requireNonNull(content, "content");
        Path resolved = resolveInsideAgentRoot(targetPath);
        String relative = relativize(resolved);
        long now = clock.millis();
        String updateId = "upd_" + UUID.randomUUID();
        String proposedSha = Hashing.sha256Hex(content);
        String baseSha = currentHash(resolved);
        boolean protectedTarget = policy.isProtected(relative);

        GuardrailVerdict verdict = guardrails.evaluate(GuardrailContext.generatedOutput(
                content, SourceScanner.languageForPath(relative), resolved.toString()));
        if (!verdict.allowed()) {
            PendingUpdate rejected = new PendingUpdate(updateId, relative, content, proposedSha, baseSha, originTaskId,
                    protectedTarget, UpdateStatus.REJECTED, null, verdict.summary(), now, now, GUARDRAIL_ACTOR, null, null);
            store.insert(rejected, ChangeLogEntry.of(updateId, now, GUARDRAIL_ACTOR, "propose",
                    null, UpdateStatus.REJECTED, baseSha, proposedSha));
            activity.append(ActivityLog.ActivityEvent.of(ActivityKind.UPDATE_REJECTED, updateId, GUARDRAIL_ACTOR,
                    detail("target_path", relative, "origin_task_id", originTaskId, "reason", verdict.summary())));
            LOG.warn("Rejected self-update {} for {}: {}", updateId, relative, verdict.summary());
            throw new SecurityViolationException(verdict);
        }

        PendingUpdate pending = new PendingUpdate(updateId, relative, content, proposedSha, baseSha, originTaskId,
                protectedTarget, UpdateStatus.PENDING_APPROVAL, null, null, now, null, null, null, null);
        store.insert(pending, ChangeLogEntry.of(updateId, now, "agent", "propose",
                null, UpdateStatus.PENDING_APPROVAL, baseSha, proposedSha));
        activity.append(ActivityLog.ActivityEvent.of(ActivityKind.UPDATE_PROPOSED, updateId, "agent",
                detail("target_path", relative, "protected", protectedTarget, "origin_task_id", originTaskId,
                        "base_sha256", baseSha, "proposed_sha256", proposedSha)));
        LOG.info("Proposed self-update {} for {} (protected={})", updateId, relative, protectedTarget);

        if (protectedTarget) {
            return pending;
        }
        synchronized (lockFor(updateId)) {
            transitionDecision(updateId, Decision.APPROVE, AUTO_ACTOR, null);
            return applyLocked(updateId);
        }
    }

    /** Human decision on a protected update. */
    public PendingUpdate decide(String updateId, Decision decision, String actor, String reason) {
        Objects.requireNonNull(decision, "decision");
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor must not be blank");
        }
        if (actor.trim().startsWith(RESERVED_ACTOR_PREFIX)) {
            throw new IllegalArgumentException("actor prefix '" + RESERVED_ACTOR_PREFIX + "' is reserved");
        }
        synchronized (lockFor(updateId)) {
            return transitionDecision(updateId, decision, actor.trim(), reason);
        }
    }

    public PendingUpdate apply(String updateId) {
        synchronized (lockFor(updateId)) {
            return applyLocked(updateId);
        }
    }

    public RollbackOutcome rollback(String updateId, String actor) {
        String who = actor == null || actor.isBlank() ? "operator" : actor.trim();
        synchronized (lockFor(updateId)) {
            PendingUpdate update = require(updateId);
            if (update.status() == UpdateStatus.ROLLED_BACK) {
                return new RollbackOutcome(update, true);
            }
            boolean interruptedApply = update.status() == UpdateStatus.APPROVED && update.backupRef() != null;
            if (update.status() != UpdateStatus.APPLIED && !interruptedApply) {
                throw new InvalidTransitionException(
                        "Update " + updateId + " cannot be rolled back from " + update.status());
            }
            Backup backup = store.findBackup(update.backupRef())
                    .orElseThrow(() -> new IllegalStateException("Backup " + update.backupRef() + " is missing"));
            Path target = policy.agentRoot().resolve(update.targetPath());
            MdcContext.setUpdate(updateId);
            try {
                restore(target, backup);
                long now = clock.millis();
                String afterRef = currentHash(target);
                if (!store.markRolledBack(updateId, update.status(), now, ChangeLogEntry.of(updateId, now, who,
                        "rollback", update.status(), UpdateStatus.ROLLED_BACK, update.proposedSha256(), afterRef))) {
                    throw new InvalidTransitionException("Update " + updateId + " changed state during rollback");
                }
                activity.append(ActivityLog.ActivityEvent.of(ActivityKind.UPDATE_ROLLED_BACK, updateId, who,
                        detail("target_path", update.targetPath(), "backup_ref", backup.backupId(),
                                "restored_sha256", afterRef)));
                LOG.info("Rolled back self-update {} ({})", updateId, update.targetPath());
                return new RollbackOutcome(require(updateId), false);
            } catch (IOException e) {
                throw new StorageException("Failed to restore backup for " + updateId, e);
            } finally {
                MdcContext.clearUpdate();
            }
        }
    }

    public Optional<PendingUpdate> get(String updateId) {
        return store.find(updateId);
    }

    public List<PendingUpdate> list(UpdateStatus status, int limit) {
        return store.list(status, limit);
    }

    public List<ChangeLogEntry> changeLog(String updateId) {
        return store.changeLog(updateId);
    }

    public Optional<Backup> backup(String backupId) {
        return store.findBackup(backupId);
    }

    /** True when the path, resolved against the workspace, falls under the agent root. */
    public boolean targetsAgent(Path resolved) {
        return policy.isAgentPath(resolved);
    }

    private PendingUpdate transitionDecision(String updateId, Decision decision, String actor, String reason) {
        PendingUpdate update = require(updateId);
        if (update.status() != UpdateStatus.PENDING_APPROVAL) {
            throw new InvalidTransitionException(
                    "Update " + updateId + " is " + update.status() + ", decisions need PENDING_APPROVAL");
        }
        UpdateStatus to = decision == Decision.APPROVE ? UpdateStatus.APPROVED : UpdateStatus.REJECTED;
        long now = clock.millis();
        if (!store.recordDecision(updateId, to, actor, reason, now, ChangeLogEntry.of(updateId, now, actor,
                decision == Decision.APPROVE ? "approve" : "reject", UpdateStatus.PENDING_APPROVAL, to,
                update.baseSha256(), update.proposedSha256()))) {
            throw new InvalidTransitionException("Update " + updateId + " was decided concurrently");
        }
        activity.append(ActivityLog.ActivityEvent.of(
                decision == Decision.APPROVE ? ActivityKind.UPDATE_APPROVED : ActivityKind.UPDATE_REJECTED,
                updateId, actor, detail("target_path", update.targetPath(), "reason", reason,
                        "base_sha256", update.baseSha256())));
        return require(updateId);
    }

    private PendingUpdate applyLocked(String updateId) {
        PendingUpdate update = require(updateId);
        if (update.status() != UpdateStatus.APPROVED) {
            throw new InvalidTransitionException(
                    "Update " + updateId + " is " + update.status() + ", apply needs APPROVED");
        }
        Path target = policy.agentRoot().resolve(update.targetPath());
        MdcContext.setUpdate(updateId);
        try {
            String backupRef = update.backupRef();
            if (backupRef == null) {
                String current = currentHash(target);
                if (!Objects.equals(current, update.baseSha256())) {
                    long now = clock.millis();
                    store.appendLog(ChangeLogEntry.of(updateId, now, "system:apply", "apply_conflict",
                            UpdateStatus.APPROVED, UpdateStatus.APPROVED, current, update.proposedSha256()));
                    activity.append(ActivityLog.ActivityEvent.of(ActivityKind.UPDATE_APPLY_FAILED, updateId, "system:apply",
                            detail("target_path", update.targetPath(), "reason", "target changed since proposal",
                                    "expected_sha256", update.baseSha256(), "actual_sha256", current)));
                    throw new InvalidTransitionException("Target " + update.targetPath()
                            + " changed since update " + updateId + " was proposed");
                }
                backupRef = takeBackup(update, target);
            }

            FileWrites.writeAtomically(target, update.proposedContent());
            String written = currentHash(target);
            if (!update.proposedSha256().equals(written)) {
                throw new StorageException("Written content of " + update.targetPath() + " does not match the proposal", null);
            }
            long now = clock.millis();
            if (!store.markApplied(updateId, now, ChangeLogEntry.of(updateId, now, "system:apply", "apply",
                    UpdateStatus.APPROVED, UpdateStatus.APPLIED, update.baseSha256(), written))) {
                throw new InvalidTransitionException("Update " + updateId + " changed state during apply");
            }
            activity.append(ActivityLog.ActivityEvent.of(ActivityKind.UPDATE_APPLIED, updateId, "system:apply",
                    detail("target_path", update.targetPath(), "backup_ref", backupRef, "applied_sha256", written)));
            LOG.info("Applied self-update {} to {} (backup {})", updateId, update.targetPath(), backupRef);
            return require(updateId);
        } catch (IOException e) {
            activity.append(ActivityLog.ActivityEvent.of(ActivityKind.UPDATE_APPLY_FAILED, updateId, "system:apply",
                    detail("target_path", update.targetPath(), "reason", e.getMessage())));
            throw new StorageException("Failed to apply update " + updateId, e);
        } finally {
            MdcContext.clearUpdate();
        }
    }

    private String takeBackup(PendingUpdate update, Path target) throws IOException {
        boolean existed = Files.isRegularFile(target);
        byte[] original = existed ? Files.readAllBytes(target) : null;
        String originalSha = existed ? Hashing.sha256Hex(original) : null;
        long now = clock.millis();
        Backup backup = new Backup("bak_" + UUID.randomUUID(), update.updateId(), update.targetPath(),
                existed, original, originalSha, now);
        if (!store.saveBackup(backup, ChangeLogEntry.of(update.updateId(), now, "system:apply", "backup",
                UpdateStatus.APPROVED, UpdateStatus.APPROVED, originalSha, backup.backupId()))) {
            throw new InvalidTransitionException("Update " + update.updateId() + " already has a backup or left APPROVED");
        }
        return backup.backupId();
    }

    private void restore(Path target, Backup backup) throws IOException {
        if (!backup.targetExisted()) {
            Files.deleteIfExists(target);
            return;
        }
        FileWrites.writeAtomically(target, backup.originalContent());
        String restored = currentHash(target);
        if (!Objects.equals(restored, backup.originalSha256())) {
            throw new IOException("Restored content of " + backup.targetPath() + " does not match backup "
                    + backup.backupId());
        }
    }

    private Path resolveInsideAgentRoot(String targetPath) {
        if (targetPath == null || targetPath.isBlank()) {
            throw new IllegalArgumentException("targetPath must not be blank");
        }
        Path resolved;
        try {
            resolved = PathContainmentRule.resolve(policy.agentRoot(), targetPath);
        } catch (InvalidPathException e) {
            throw new SecurityViolationException(PathContainmentRule.NAME, "Invalid path: " + targetPath);
        }
        if (!policy.isAgentPath(resolved) || resolved.equals(policy.agentRoot())) {
            throw new SecurityViolationException(PathContainmentRule.NAME,
                    "Self-update target resolves outside the agent root: " + targetPath);
        }
        return resolved;
    }

    private String relativize(Path resolved) {
        return policy.agentRoot().relativize(resolved).toString().replace('\\', '/');
    }

    private static String currentHash(Path target) {
        try {
            if (!Files.isRegularFile(target)) {
                return null;
            }
            return Hashing.sha256Hex(Files.readAllBytes(target));
        } catch (IOException e) {
            throw new StorageException("Failed to hash " + target, e);
        }
    }

    private PendingUpdate require(String updateId) {
        return store.find(updateId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown update: " + updateId));
    }

    private Object lockFor(String updateId) {
        return locks[Math.floorMod(updateId.hashCode(), LOCK_STRIPES)];
    }

    private static Map<String, Object> detail(Object... kv) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            if (kv[i + 1] != null) {
                out.put(kv[i].toString(), kv[i + 1]);
            }
        }
        return out;
    }
}
