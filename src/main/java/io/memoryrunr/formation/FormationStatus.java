package io.memoryrunr.formation;

/**
 * Progress of a queued formation task.
 */
public record FormationStatus(String taskId, State state, String message) {

    public enum State {
        QUEUED,
        IN_PROGRESS,
        COMPLETED,
        FAILED
    }

    public boolean isTerminal() {
        return state == State.COMPLETED || state == State.FAILED;
    }
}
