package campaign.engine;

import campaign.alert.MigrationAlertLogger;
import campaign.config.MigratorConfig;
import campaign.config.MigratorConfigLoader;
import campaign.exceptions.AdapterNotFoundException;
import campaign.exceptions.FetchException;
import campaign.exceptions.MigrationException;
import campaign.exceptions.UploadRejectedException;
import campaign.mapping.FieldMapper;
import campaign.mapping.MappingResult;
import campaign.mapping.Overrides;
import campaign.report.ErrorKind;
import campaign.report.MigrationFailure;
import campaign.report.MigrationReport;
import campaign.schema.PlatformSchema;
import campaign.schema.SchemaRegistry;
import campaign.validation.BatchValidationResult;
import campaign.validation.BatchValidator;
import campaign.validation.StructuralValidator;
import campaign.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Orchestrates campaign migration from a source platform to the target platform:
 *  - fetch the source record (platform API or uploaded row)
 *  - validate it against the platform's validation schema
 *  - map it to the canonical record with the platform's mapping schema
 *  - apply manual overrides, if any
 *  - upload it to the target
 *
 * <p>Each invocation gets its own {@link MigrationReport}. Record-level failures are
 * caught here and become report entries; a batch always runs to the end. Only
 * setup problems propagate: {@link AdapterNotFoundException} for an unsupported
 * platform, {@link campaign.schema.SchemaNotFoundException} and
 * {@link campaign.schema.SchemaLoadException} for a missing or malformed schema.
 *
 * <p>Records are processed one at a time on the calling thread.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationEngine engine = MigrationEngine.builder()
 *     .config(MigratorConfigLoader.load())
 *     .adapter(new FacebookAdapter(client))
 *     .uploadSink(taboola::createCampaign)
 *     .build();
 *
 * MigrationReport report = engine.migrateBatch("facebook", rows);
 * </pre>
 */
public final class MigrationEngine {

    private static final Logger log = LoggerFactory.getLogger(MigrationEngine.class);

    // migration id generator, used to correlate log events of one invocation
    private static final AtomicLong MIGRATION_COUNTER = new AtomicLong(1L);

    private final SchemaRegistry registry;
    private final Map<String, SourceAdapter> adapters;
    private final UploadSink uploadSink;
    private final StructuralValidator validator;
    private final BatchValidator batchValidator;
    private final FieldMapper mapper;
    private final boolean validateRecords;
    private final boolean warnOnUnfilledFields;

    private MigrationEngine(Builder b) {
        this.registry = b.registry != null ? b.registry : SchemaRegistry.fromConfig(b.config);
        this.adapters = Collections.unmodifiableMap(new LinkedHashMap<>(b.adapters));
        this.uploadSink = b.uploadSink;
        this.validator = new StructuralValidator();
        this.batchValidator = new BatchValidator(registry, validator);
        this.mapper = new FieldMapper();
        this.validateRecords = b.config.validateRecords();
        this.warnOnUnfilledFields = b.config.warnOnUnfilledFields();

        MigrationAlertLogger.setAlertLevel(b.config.alertLevel());
        log.debug("Engine created for platforms {} with {}", adapters.keySet(), b.config);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ===== engine surface =====

    /**
     * Validates a batch against the platform's validation schema.
     *
     * @throws campaign.schema.SchemaNotFoundException if the platform has no schema
     * @throws campaign.schema.SchemaLoadException if the schema is malformed
     */
    public BatchValidationResult validateBatch(List<Map<String, Object>> records, String platform) {
        return batchValidator.validateBatch(records, platform);
    }

    /**
     * Maps one record with the platform's mapping schema, without validating or uploading it.
     *
     * @throws campaign.schema.SchemaNotFoundException if the platform has no schema
     * @throws campaign.schema.SchemaLoadException if the schema is malformed
     */
    public MappingResult mapRecord(Map<String, Object> record, String platform) {
        return mapper.map(record, registry.get(platform).mapping());
    }

    /**
     * Migrates one campaign fetched from the source platform.
     *
     * @see #migrateOne(String, String, Map)
     */
    public MigrationReport migrateOne(String platform, String campaignId) {
        return migrateOne(platform, campaignId, null);
    }

    /**
     * Migrates one campaign fetched from the source platform, applying manual overrides
     * to the mapped record before upload.
     *
     * @param platform source platform
     * @param campaignId the platform's campaign id
     * @param overrides field overrides; a null value removes the field, may be null
     * @return the report holding the single outcome
     * @throws AdapterNotFoundException if no adapter serves the platform
     * @throws campaign.schema.SchemaNotFoundException if the platform has no schema
     * @throws campaign.schema.SchemaLoadException if the schema is malformed
     */
    public MigrationReport migrateOne(String platform, String campaignId, Map<String, Object> overrides) {
        long migrationId = MIGRATION_COUNTER.getAndIncrement();
        log.info("Starting migration of campaign '{}' from {}", campaignId, platform);

        SourceAdapter adapter;
        PlatformSchema schema;
        try {
            adapter = adapterFor(platform);
            schema = registry.get(adapter.platform());
        } catch (RuntimeException e) {
            MigrationAlertLogger.migrationAborted(migrationId, platform, e);
            throw e;
        }

        MigrationReport report = new MigrationReport();
        MigrationAlertLogger.migrationStarted(migrationId, adapter.platform(), 1);
        migrateRecord(new RecordContext(migrationId, adapter.platform(), schema, campaignId, 0, report),
                () -> adapter.fetch(campaignId), overrides);

        MigrationAlertLogger.migrationCompleted(migrationId, report);
        log.info("Migration of campaign '{}' finished: {}", campaignId, report.summary());
        return report;
    }

    /**
     * Migrates a batch of uploaded records. Every record is attempted and ends in exactly
     * one success or failure entry, whatever happens to the others.
     *
     * @param platform source platform
     * @param records uploaded rows in the platform's representation
     * @return the report for the whole batch
     * @throws AdapterNotFoundException if no adapter serves the platform
     * @throws campaign.schema.SchemaNotFoundException if the platform has no schema
     * @throws campaign.schema.SchemaLoadException if the schema is malformed
     */
    public MigrationReport migrateBatch(String platform, List<Map<String, Object>> records) {
        Objects.requireNonNull(records, "records");
        long migrationId = MIGRATION_COUNTER.getAndIncrement();
        log.info("Starting batch migration from {} ({} campaigns)", platform, records.size());

        SourceAdapter adapter;
        PlatformSchema schema;
        try {
            adapter = adapterFor(platform);
            schema = registry.get(adapter.platform());
        } catch (RuntimeException e) {
            MigrationAlertLogger.migrationAborted(migrationId, platform, e);
            throw e;
        }

        MigrationReport report = new MigrationReport();
        MigrationAlertLogger.migrationStarted(migrationId, adapter.platform(), records.size());

        for (int i = 0; i < records.size(); i++) {
            Map<String, Object> row = records.get(i);
            String recordRef = recordName(row, i);
            log.debug("Processing campaign {}/{}: {}", i + 1, records.size(), recordRef);
            migrateRecord(new RecordContext(migrationId, adapter.platform(), schema, recordRef, i, report),
                    () -> {
                        if (row == null) {
                            throw new FetchException("Uploaded row is empty", adapter.platform(), recordRef);
                        }
                        return adapter.fromUpload(row);
                    },
                    null);
        }

        MigrationAlertLogger.migrationCompleted(migrationId, report);
        log.info("Batch migration finished: {}", report.summary());
        return report;
    }

    /**
     * Returns the adapter serving a platform.
     *
     * @throws AdapterNotFoundException if none does
     */
    public SourceAdapter adapterFor(String platform) {
        SourceAdapter adapter = platform == null ? null : adapters.get(normalize(platform));
        if (adapter == null) {
            throw new AdapterNotFoundException(platform);
        }
        return adapter;
    }

    /** Returns the batch validator backing {@link #validateBatch}, for comparison summaries. */
    public BatchValidator batchValidator() {
        return batchValidator;
    }

    public SchemaRegistry schemaRegistry() {
        return registry;
    }

    // ===== single-record path =====

    @FunctionalInterface
    private interface RecordSource {
        Map<String, Object> get() throws MigrationException;
    }

    private record RecordContext(
            long migrationId,
            String platform,
            PlatformSchema schema,
            String recordRef,
            int index,
            MigrationReport report
    ) {}

    private void migrateRecord(RecordContext ctx, RecordSource source, Map<String, Object> overrides) {
        MigrationStage stage = MigrationStage.FETCHING;
        try {
            enter(ctx, stage);
            Map<String, Object> sourceRecord = source.get();
            if (sourceRecord == null) {
                throw new FetchException("Source returned no record", ctx.platform(), ctx.recordRef());
            }

            if (validateRecords) {
                stage = MigrationStage.VALIDATING;
                enter(ctx, stage);
                List<ValidationIssue> issues = validator.validate(sourceRecord, ctx.schema().validation(), ctx.index());
                if (!issues.isEmpty()) {
                    fail(ctx, stage, ErrorKind.VALIDATION_FAILED,
                            "Campaign '" + ctx.recordRef() + "' failed validation: " + describe(issues), null);
                    return;
                }
            }

            stage = MigrationStage.MAPPING;
            enter(ctx, stage);
            MappingResult mapped = mapper.map(sourceRecord, ctx.schema().mapping());
            for (String warning : mapped.warnings()) {
                warn(ctx, warning);
            }
            if (warnOnUnfilledFields) {
                for (String field : mapped.unfilledFields()) {
                    warn(ctx, "No value or default found for field '" + field + "'");
                }
            }

            Map<String, Object> canonical = mapped.record();
            if (overrides != null && !overrides.isEmpty()) {
                stage = MigrationStage.OVERRIDING;
                enter(ctx, stage);
                canonical = Overrides.apply(canonical, overrides);
            }

            stage = MigrationStage.UPLOADING;
            enter(ctx, stage);
            Map<String, Object> created = uploadSink.create(Collections.unmodifiableMap(new LinkedHashMap<>(canonical)));
            if (created == null) {
                created = Map.of();
            }

            enter(ctx, MigrationStage.DONE);
            String message = "Campaign '" + created.getOrDefault("name", ctx.recordRef())
                    + "' created in target with ID '" + created.get("id") + "'";
            ctx.report().addSuccess(message);
            MigrationAlertLogger.recordSucceeded(ctx.migrationId(), ctx.recordRef(), message);

        } catch (FetchException e) {
            fail(ctx, stage, ErrorKind.FETCH_FAILED,
                    "Failed to fetch campaign '" + ctx.recordRef() + "' from " + ctx.platform() + ": " + e.getBareMessage(), e);
        } catch (UploadRejectedException e) {
            fail(ctx, stage, ErrorKind.UPLOAD_REJECTED,
                    "Target rejected campaign '" + ctx.recordRef() + "': " + e.getBareMessage(), e);
        } catch (MigrationException e) {
            fail(ctx, stage, stage == MigrationStage.FETCHING ? ErrorKind.FETCH_FAILED : ErrorKind.UNEXPECTED_ERROR,
                    "Failed to migrate campaign '" + ctx.recordRef() + "': " + e.getBareMessage(), e);
        } catch (RuntimeException e) {
            fail(ctx, stage, ErrorKind.UNEXPECTED_ERROR,
                    "A critical error occurred while migrating campaign '" + ctx.recordRef() + "': " + e, e);
        }
    }

    private void enter(RecordContext ctx, MigrationStage stage) {
        ctx.report().recordStage(ctx.recordRef(), stage);
        MigrationAlertLogger.stageEntered(ctx.migrationId(), ctx.recordRef(), stage);
    }

    private void warn(RecordContext ctx, String warning) {
        ctx.report().addWarning("Campaign '" + ctx.recordRef() + "': " + warning);
        MigrationAlertLogger.recordWarning(ctx.migrationId(), ctx.recordRef(), warning);
    }

    private void fail(RecordContext ctx, MigrationStage stage, ErrorKind kind, String message, Throwable cause) {
        ctx.report().recordStage(ctx.recordRef(), MigrationStage.FAILED);
        MigrationFailure failure = new MigrationFailure(message, kind, stage, ctx.recordRef(), cause);
        ctx.report().addFailure(failure);
        MigrationAlertLogger.recordFailed(ctx.migrationId(), failure);
    }

    private static String describe(List<ValidationIssue> issues) {
        return issues.stream()
                .map(i -> i.fieldPath() + " " + i.issueType().literal() + " (" + i.description() + ")")
                .collect(Collectors.joining("; "));
    }

    private static String recordName(Map<String, Object> row, int index) {
        Object name = row == null ? null : row.get("name");
        if (name instanceof CharSequence && !name.toString().isBlank()) {
            return name.toString();
        }
        return "Campaign_" + (index + 1);
    }

    private static String normalize(String platform) {
        return platform.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Builder for constructing {@link MigrationEngine} instances.
     */
    public static final class Builder {
        private MigratorConfig config = MigratorConfig.DEFAULTS;
        private SchemaRegistry registry;
        private final Map<String, SourceAdapter> adapters = new LinkedHashMap<>();
        private UploadSink uploadSink;

        /**
         * Applies a configuration; the schema registry is derived from it unless one is
         * set explicitly.
         *
         * <p>The alert level is process-wide: {@link #build()} sets it on
         * {@link MigrationAlertLogger}, so the most recently built engine decides it for
         * every engine in the JVM.
         */
        public Builder config(MigratorConfig config) {
            this.config = config != null ? config : MigratorConfig.DEFAULTS;
            return this;
        }

        /**
         * Loads configuration from the default classpath resource and applies it.
         *
         * @see MigratorConfigLoader#load()
         */
        public Builder loadConfig() {
            return config(MigratorConfigLoader.load());
        }

        public Builder schemaRegistry(SchemaRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Registers a source adapter under its platform identifier, replacing any
         * adapter registered for the same platform.
         */
        public Builder adapter(SourceAdapter adapter) {
            Objects.requireNonNull(adapter, "adapter");
            this.adapters.put(normalize(adapter.platform()), adapter);
            return this;
        }

        public Builder uploadSink(UploadSink uploadSink) {
            this.uploadSink = uploadSink;
            return this;
        }

        public MigrationEngine build() {
            Objects.requireNonNull(uploadSink, "uploadSink");
            return new MigrationEngine(this);
        }
    }
}
