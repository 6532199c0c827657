package com.draftsmith.core.error;

import com.draftsmith.core.model.ResearchFinding;

import java.util.List;
import java.util.Map;

/**
 * Research stage failed after its retry budget; carries whatever findings were gathered.
 */
public class ResearchFailedException extends WorkflowException {

    private final List<ResearchFinding> partialFindings;

    public ResearchFailedException(String message, List<ResearchFinding> partialFindings,
                                   Map<String, Object> context, Throwable cause) {
        super(ErrorCode.RESEARCH_FAILED, message, context, cause);
        this.partialFindings = partialFindings == null ? List.of() : List.copyOf(partialFindings);
    }

    public List<ResearchFinding> getPartialFindings() {
        return partialFindings;
    }
}
