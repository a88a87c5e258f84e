package com.codebox.engine.model;

/** PUBLIC templates are readable by everyone, PRIVATE ones only by their owner. */
public enum TemplateVisibility {
    PUBLIC,
    PRIVATE
}
