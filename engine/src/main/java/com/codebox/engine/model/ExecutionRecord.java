package com.codebox.engine.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger entry for one tracked execution: the request that was submitted
 * paired with the result it produced.
 *
 * Insert-only. Corrections are new rows, never updates; there are no
 * setters on purpose. Large sources are kept only as a SHA-256 hash plus
 * their length; sources up to the inline limit are stored verbatim.
 *
 * Implements {@link Persistable} so that saving a new row is a plain INSERT
 * (the id is assigned, so Spring Data would otherwise merge). Saving the same
 * id twice fails with a key violation instead of overwriting.
 *
 * DB table: execution_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "execution_records")
public class ExecutionRecord implements Persistable<UUID> {

    // Same UUID as ExecutionRequest.executionId, assigned rather than generated.
    @Id
    private UUID id;

    @Column(name = "caller_id", nullable = false, updatable = false)
    private String callerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Language language;

    @Column(name = "template_ref", updatable = false)
    private UUID templateRef;

    // Null when the source exceeded the inline limit.
    @Column(name = "source_text", columnDefinition = "TEXT", updatable = false)
    private String sourceText;

    @Column(name = "source_sha256", nullable = false, updatable = false, length = 64)
    private String sourceSha256;

    @Column(name = "source_bytes", nullable = false, updatable = false)
    private int sourceBytes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ExecutionStatus status;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String stdout;

    @Column(name = "stdout_truncated", nullable = false, updatable = false)
    private boolean stdoutTruncated;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String stderr;

    @Column(name = "stderr_truncated", nullable = false, updatable = false)
    private boolean stderrTruncated;

    @Column(name = "exit_code", updatable = false)
    private Integer exitCode;

    @Column(name = "wall_clock_ms", nullable = false, updatable = false)
    private long wallClockMs;

    @Column(name = "peak_memory_bytes", updatable = false)
    private Long peakMemoryBytes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    @Transient
    private boolean isNew = true;

    @PostLoad
    @PostPersist
    void markStored() {
        this.isNew = false;
    }

    protected ExecutionRecord() {}   // required by JPA

    public ExecutionRecord(ExecutionRequest request, ExecutionResult result,
                           String inlineSource, String sourceSha256) {
        this.id              = request.executionId();
        this.callerId        = request.callerId();
        this.language        = request.language();
        this.templateRef     = request.templateRef();
        this.sourceText      = inlineSource;
        this.sourceSha256    = sourceSha256;
        this.sourceBytes     = request.sourceBytes();
        this.status          = result.status();
        this.reason          = result.reason();
        this.stdout          = result.stdout();
        this.stdoutTruncated = result.stdoutTruncated();
        this.stderr          = result.stderr();
        this.stderrTruncated = result.stderrTruncated();
        this.exitCode        = result.exitCode();
        this.wallClockMs     = result.wallClockMs();
        this.peakMemoryBytes = result.peakMemoryBytes();
        this.createdAt       = result.createdAt();
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    @Override
    public boolean isNew() { return isNew; }

    @Override
    public UUID            getId()              { return id; }
    public String          getCallerId()        { return callerId; }
    public Language        getLanguage()        { return language; }
    public UUID            getTemplateRef()     { return templateRef; }
    public String          getSourceText()      { return sourceText; }
    public String          getSourceSha256()    { return sourceSha256; }
    public int             getSourceBytes()     { return sourceBytes; }
    public ExecutionStatus getStatus()          { return status; }
    public String          getReason()          { return reason; }
    public String          getStdout()          { return stdout; }
    public boolean         isStdoutTruncated()  { return stdoutTruncated; }
    public String          getStderr()          { return stderr; }
    public boolean         isStderrTruncated()  { return stderrTruncated; }
    public Integer         getExitCode()        { return exitCode; }
    public long            getWallClockMs()     { return wallClockMs; }
    public Long            getPeakMemoryBytes() { return peakMemoryBytes; }
    public Instant         getCreatedAt()       { return createdAt; }
}
