package com.codebox.engine.template;

import java.util.UUID;

/**
 * Thrown when a private template is requested by someone other than its owner.
 */
public class TemplateAccessDeniedException extends RuntimeException {

    private final UUID templateId;

    public TemplateAccessDeniedException(UUID templateId, String requester) {
        super("Template " + templateId + " is not visible to " + requester);
        this.templateId = templateId;
    }

    public UUID getTemplateId() { return templateId; }
}
