package io.agentwarden.governance;

import io.agentwarden.model.PendingUpdate;

/** {@code alreadyRolledBack} is set when the call found the update already restored and did nothing. */
public record RollbackOutcome(PendingUpdate update, boolean alreadyRolledBack) {
}
