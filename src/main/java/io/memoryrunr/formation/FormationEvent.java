package io.memoryrunr.formation;

import java.time.Duration;

/**
 * Outcome of one formation attempt, delivered to every {@link FormationListener}.
 *
 * @param type         what happened
 * @param taskId       queue task id, null for synchronous formation
 * @param memoryId     created memory, or the existing one for {@link Type#SKIPPED}
 * @param supersededId memory replaced by this formation, only for {@link Type#SUPERSEDED}
 * @param content      candidate content
 * @param reason       skip or failure reason
 * @param elapsed      time spent forming
 */
public record FormationEvent(
        Type type,
        String taskId,
        String memoryId,
        String supersededId,
        String content,
        String reason,
        Duration elapsed
) {

    public enum Type {
        CREATED,
        SKIPPED,
        SUPERSEDED,
        FAILED
    }

    static final String ALREADY_REMEMBERED = "already remembered";

    public static FormationEvent created(FormationTask task, String memoryId, Duration elapsed) {
        return new FormationEvent(Type.CREATED, task.id(), memoryId, null, task.content(), null, elapsed);
    }

    public static FormationEvent skipped(FormationTask task, String existingId, Duration elapsed) {
        return new FormationEvent(Type.SKIPPED, task.id(), existingId, null, task.content(), ALREADY_REMEMBERED, elapsed);
    }

    public static FormationEvent superseded(FormationTask task, String memoryId, String oldId, Duration elapsed) {
        return new FormationEvent(Type.SUPERSEDED, task.id(), memoryId, oldId, task.content(), null, elapsed);
    }

    public static FormationEvent failed(FormationTask task, String reason, Duration elapsed) {
        return new FormationEvent(Type.FAILED, task.id(), null, null, task.content(), reason, elapsed);
    }

    public boolean isSuccess() {
        return type != Type.FAILED;
    }

    /** Short human-readable summary, as shown in status lines. */
    public String describe() {
        return switch (type) {
            case CREATED -> "Memory stored";
            case SKIPPED -> "Already remembered";
            case SUPERSEDED -> "Memory updated";
            case FAILED -> "Failed: " + reason;
        };
    }
}
