package com.codebox.engine.template;

import java.util.UUID;

/**
 * Thrown when a template id is unknown or the template has been deactivated.
 */
public class TemplateNotFoundException extends RuntimeException {

    private final UUID templateId;

    public TemplateNotFoundException(UUID templateId) {
        super("Template not found: " + templateId);
        this.templateId = templateId;
    }

    public UUID getTemplateId() { return templateId; }
}
