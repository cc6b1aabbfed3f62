package demo;

import campaign.config.MigratorConfigLoader;
import campaign.engine.MigrationEngine;
import campaign.report.MigrationReport;
import campaign.validation.BatchValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs the migration engine end to end against the mock platforms.
 *
 * <p>The demo migrates one Facebook and one Twitter campaign through the platform
 * APIs, then validates and migrates an uploaded Facebook batch containing defective
 * rows, printing each report as JSON.
 *
 * <h2>Usage:</h2>
 * <pre>
 * java demo.DemoMain                       # classpath campaign-migrator.properties
 * java demo.DemoMain path/to/config.yml    # external configuration
 * </pre>
 */
public class DemoMain {

    private static final Logger log = LoggerFactory.getLogger(DemoMain.class);

    public static void main(String[] args) throws IOException {
        MigrationEngine.Builder builder = MigrationEngine.builder();
        if (args.length > 0) {
            builder.config(MigratorConfigLoader.loadFromFile(Path.of(args[0])));
        } else {
            builder.loadConfig();
        }

        TaboolaApiClient taboola = new TaboolaApiClient();
        MigrationEngine engine = builder
                .adapter(new FacebookAdapter(new FacebookApiClient().failOn("fb_missing")))
                .adapter(new TwitterAdapter())
                .uploadSink(taboola)
                .build();

        print("Facebook campaign fb_123", engine.migrateOne("facebook", "fb_123"));
        print("Facebook campaign fb_missing", engine.migrateOne("facebook", "fb_missing"));
        print("Twitter campaign tw_456 with overrides",
                engine.migrateOne("twitter", "tw_456", Map.of("cpc_bid", 0.75)));

        List<Map<String, Object>> upload = SampleCampaigns.facebookUploadWithIssues();
        BatchValidationResult validation = engine.validateBatch(upload, "facebook");
        if (validation.hasIssues()) {
            log.info("Uploaded batch has {} issue(s) in {} record(s)",
                    validation.issues().size(), validation.invalidCount());
            System.out.println(JsonRenderer.render(
                    engine.batchValidator().comparisonSummary(upload, validation.issues(), "facebook")));
        }
        print("Uploaded Facebook batch", engine.migrateBatch("facebook", upload));

        log.info("Taboola now holds {} migrated campaign(s)", taboola.createdCampaigns().size());
    }

    private static void print(String title, MigrationReport report) {
        System.out.println("=== " + title + ": " + report.summary());
        System.out.println(JsonRenderer.render(report.toMap()));
    }
}
