package com.codebox.engine.api.dto;

import com.codebox.engine.model.CodeTemplate;
import com.codebox.engine.model.Language;
import com.codebox.engine.model.TemplateVisibility;

import java.time.Instant;
import java.util.UUID;

public record TemplateResponse(
        UUID               id,
        String             name,
        String             description,
        Language           language,
        String             sourceText,
        TemplateVisibility visibility,
        String             ownerId,
        String             category,
        Instant            updatedAt) {

    public static TemplateResponse from(CodeTemplate t) {
        return new TemplateResponse(
                t.getId(), t.getName(), t.getDescription(), t.getLanguage(),
                t.getSourceText(), t.getVisibility(), t.getOwnerId(),
                t.getCategory(), t.getUpdatedAt());
    }
}
