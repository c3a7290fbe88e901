package io.memoryrunr.memory;

/**
 * Categories for memories.
 *
 * <ul>
 *   <li>{@code PREFERENCE}: user preferences (tools, styles, communication).</li>
 *   <li>{@code FACT}: facts about the user or project. The default.</li>
 *   <li>{@code CORRECTION}: corrections the user made to agent behavior.</li>
 *   <li>{@code PATTERN}: observed behavioral patterns.</li>
 * </ul>
 */
public enum MemoryCategory {
    PREFERENCE,
    FACT,
    CORRECTION,
    PATTERN;

    /**
     * Lenient parse used for stored values and classifier replies: blank or unknown becomes {@code FACT}.
     */
    public static MemoryCategory fromString(String s) {
        if (s == null || s.isBlank()) return FACT;
        return switch (s.trim().toLowerCase()) {
            case "preference" -> PREFERENCE;
            case "correction" -> CORRECTION;
            case "pattern" -> PATTERN;
            default -> FACT;
        };
    }

    /**
     * Strict parse for user input. Blank means "not specified" and yields null.
     *
     * @throws MemoryValidationException if the value names no category
     */
    public static MemoryCategory parse(String s) {
        if (s == null || s.isBlank()) return null;
        return switch (s.trim().toLowerCase()) {
            case "preference" -> PREFERENCE;
            case "fact" -> FACT;
            case "correction" -> CORRECTION;
            case "pattern" -> PATTERN;
            default -> throw new MemoryValidationException(
                    "Invalid category '%s' (expected preference, fact, correction or pattern)".formatted(s));
        };
    }

    public String value() {
        return name().toLowerCase();
    }
}
