package io.cronpulse.core.reconcile;

import java.util.List;

public record ReconcileResult(
    List<Long> added,
    List<Long> removed,
    List<Long> rejected
) {
    public ReconcileResult {
        added = added == null ? List.of() : List.copyOf(added);
        removed = removed == null ? List.of() : List.copyOf(removed);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public boolean changed() {
        return !added.isEmpty() || !removed.isEmpty();
    }
}
