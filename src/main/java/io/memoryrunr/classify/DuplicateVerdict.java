package io.memoryrunr.classify;

/**
 * Outcome of comparing a candidate memory with existing ones.
 *
 * @param action   what to do with the candidate
 * @param reason   the judge's explanation, may be blank
 * @param targetId id or id prefix of the memory to replace, null to replace the most similar one
 */
public record DuplicateVerdict(Action action, String reason, String targetId) {

    public enum Action {
        /** Genuinely new information. */
        NEW,
        /** Says the same as an existing memory. */
        DUPLICATE,
        /** Updates or contradicts an existing memory. */
        SUPERSEDE;

        /** Lenient parse; anything unrecognised counts as {@code NEW}. */
        public static Action fromString(String s) {
            if (s == null || s.isBlank()) return NEW;
            try {
                return valueOf(s.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return NEW;
            }
        }
    }

    public DuplicateVerdict {
        if (action == null) action = Action.NEW;
    }

    public static DuplicateVerdict duplicate(String reason) {
        return new DuplicateVerdict(Action.DUPLICATE, reason, null);
    }

    public static DuplicateVerdict supersede(String reason, String targetId) {
        return new DuplicateVerdict(Action.SUPERSEDE, reason, targetId);
    }

    public static DuplicateVerdict isNew(String reason) {
        return new DuplicateVerdict(Action.NEW, reason, null);
    }
}
