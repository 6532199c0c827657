package com.draftsmith.core.model;

import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.error.WorkflowException;

import java.io.Serializable;
import java.util.Map;

/**
 * The subject of a document workflow. Validated once, at entry.
 */
public record Topic(String text) implements Serializable {

    public Topic {
        if (text == null || text.isBlank()) {
            throw new WorkflowException(ErrorCode.INVALID_TOPIC, "Topic cannot be empty",
                    Map.of("field", "topic", "invalidValue", String.valueOf(text)));
        }
        text = text.strip();
    }

    public static Topic of(String text) {
        return new Topic(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
