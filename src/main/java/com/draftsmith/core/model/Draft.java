package com.draftsmith.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An immutable document draft. Every revision produces a new instance.
 */
public record Draft(
    String title,
    String introduction,
    List<String> bodySections,
    String conclusion,
    int wordCount
) implements Serializable {

    public Draft {
        bodySections = bodySections == null ? List.of() : List.copyOf(bodySections);
    }

    /** All text of the draft, title first, sections separated by blank lines. */
    public String text() {
        var sb = new StringBuilder();
        append(sb, title);
        append(sb, introduction);
        bodySections.forEach(section -> append(sb, section));
        append(sb, conclusion);
        return sb.toString();
    }

    private static void append(StringBuilder sb, String part) {
        if (part == null || part.isBlank()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append("\n\n");
        }
        sb.append(part);
    }
}
