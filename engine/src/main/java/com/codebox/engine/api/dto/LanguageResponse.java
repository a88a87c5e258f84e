package com.codebox.engine.api.dto;

import com.codebox.engine.model.Language;

/** One entry of GET /languages. */
public record LanguageResponse(Language language, String alias, String fileName) {
}
