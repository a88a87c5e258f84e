package com.codebox.engine.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A named, language-tagged snippet that callers can fetch and submit.
 *
 * Templates are authored by the surrounding application; the engine only
 * reads them. A PRIVATE template is visible to its owner alone.
 *
 * DB table: code_templates  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "code_templates")
public class CodeTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Language language;

    @Column(name = "source_text", columnDefinition = "TEXT", nullable = false)
    private String sourceText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TemplateVisibility visibility = TemplateVisibility.PRIVATE;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column
    private String category;

    // Soft-deleted templates stay in the table but are treated as missing.
    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected CodeTemplate() {}   // required by JPA

    public CodeTemplate(String name, Language language, String sourceText,
                        TemplateVisibility visibility, String ownerId) {
        this.name       = name;
        this.language   = language;
        this.sourceText = sourceText;
        this.visibility = visibility;
        this.ownerId    = ownerId;
    }

    // ------------------------------------------------------------------
    // Access rules
    // ------------------------------------------------------------------

    public boolean isVisibleTo(String requester) {
        return visibility == TemplateVisibility.PUBLIC
            || (requester != null && requester.equals(ownerId));
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID               getId()          { return id; }
    public String             getName()        { return name; }
    public String             getDescription() { return description; }
    public Language           getLanguage()    { return language; }
    public String             getSourceText()  { return sourceText; }
    public TemplateVisibility getVisibility()  { return visibility; }
    public String             getOwnerId()     { return ownerId; }
    public String             getCategory()    { return category; }
    public boolean            isActive()       { return active; }
    public Instant            getCreatedAt()   { return createdAt; }
    public Instant            getUpdatedAt()   { return updatedAt; }

    public void setDescription(String description) { this.description = description; }
    public void setCategory(String category)       { this.category = category; }
    public void setActive(boolean active)          { this.active = active; }
}
