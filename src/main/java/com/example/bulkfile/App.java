package com.example.bulkfile;

import com.example.bulkfile.directory.DirectoryCache;
import com.example.bulkfile.directory.DirectoryProvider;
import com.example.bulkfile.directory.StaticDirectoryProvider;
import com.example.bulkfile.model.Summary;
import com.example.bulkfile.model.WorkItem;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // CLI contract: a JSON config file and a JSON work plan.
        if (args.length < 2) {
            LOGGER.error("Usage: java -jar bulk-file-engine.jar <config.json> <plan.json>");
            System.exit(1);
            return;
        }
        EngineConfig config;
        try {
            config = new ConfigLoader().load(Path.of(args[0]));
            config.validate();
        } catch (ConfigException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            System.exit(2);
            return;
        }
        List<WorkItem> items = new WorkPlanLoader().load(Path.of(args[1]));

        DirectoryProvider provider = DirectoryProvider.unavailable();
        if (config.directoryFile().isPresent()) {
            provider = StaticDirectoryProvider.load(config.directoryFile().get());
        } else {
            LOGGER.warn("No directoryFile configured; every item gets a fallback owner.");
        }
        IdentityPolicy policy = config.identity();
        DirectoryCache cache = new DirectoryCache(
                provider,
                policy.groupKeysFor(items.stream().map(WorkItem::tag).toList()),
                Duration.ofSeconds(config.cacheTtlSeconds()),
                Clock.systemUTC()
        );

        FilePrimitives files = new NioFilePrimitives();
        BulkFileBuilder builder = new BulkFileBuilder(files, new TemplateContentStubProvider(), new MimeTypeDetector(new Tika()));
        BatchPipeline pipeline = new BatchPipeline(builder, new IdentityAssigner(cache, policy), files);
        TaskScheduler scheduler = new TaskScheduler(config, pipeline, cache, new ProgressAggregator());

        ScheduledExecutorService refresher = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("directory-refresh", true));
        Summary summary;
        try (DirectoryCache.AutoRefresh ignored = cache.startAutoRefresh(refresher)) {
            summary = scheduler.execute(items);
        } finally {
            refresher.shutdownNow();
        }

        if (config.reportFile().isPresent()) {
            new RunReportWriter().write(config.reportFile().get(), summary);
            LOGGER.info("Run report written to {}", config.reportFile().get());
        }
    }
}
