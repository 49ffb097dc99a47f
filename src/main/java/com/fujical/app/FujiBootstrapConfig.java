package com.fujical.app;

import com.fujical.app.properties.DbProperties;
import com.fujical.app.properties.PipelineProperties;
import com.fujical.engine.config.Config;
import com.fujical.engine.db.CandidateDao;
import com.fujical.engine.db.Database;
import com.fujical.engine.db.FujiEventDao;
import com.fujical.engine.db.LocationDao;
import com.fujical.engine.db.PipelineStateDao;
import com.fujical.engine.db.MigrationRunner;
import com.fujical.engine.db.OrbitSnapshotDao;
import com.fujical.engine.ephemeris.AnalyticEphemerisProvider;
import com.fujical.engine.ephemeris.CelestialPositionProvider;
import com.fujical.engine.runner.FujiEventQueryService;
import com.fujical.engine.runner.FujiOrchestrator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.support.ResourcePropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wiring for the CLI. Database beans are lazy so usage errors and config problems surface
 * before a connection is attempted.
 */
@Configuration
@EnableConfigurationProperties({DbProperties.class, PipelineProperties.class})
public class FujiBootstrapConfig {
    static final String WORKING_DIR_KEY = "app.working_dir";

    /**
     * Context over the classpath {@code config.properties} with the working-directory copy
     * taking precedence. Database credentials come from the environment inside {@link DbSettings}.
     */
    public static AnnotationConfigApplicationContext open(Path workingDir) throws IOException {
        StandardEnvironment environment = new StandardEnvironment();
        MutablePropertySources sources = environment.getPropertySources();
        sources.remove(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME);
        sources.remove(StandardEnvironment.SYSTEM_PROPERTIES_PROPERTY_SOURCE_NAME);
        ClassPathResource bundled = new ClassPathResource("config.properties");
        if (bundled.exists()) {
            sources.addLast(new ResourcePropertySource("classpath-config", bundled));
        }
        sources.addLast(new MapPropertySource("working-dir", Map.of(WORKING_DIR_KEY, workingDir.toString())));
        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            sources.addFirst(new ResourcePropertySource("working-dir-config", new FileSystemResource(local)));
        }

        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
        context.setEnvironment(environment);
        context.register(FujiBootstrapConfig.class);
        context.refresh();
        return context;
    }

    @Bean
    public Config fujiConfig(Environment environment, PipelineProperties pipeline) {
        Map<String, Object> raw = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Map<String, String> fallbacks = new LinkedHashMap<>();
        fallbacks.put("app.zone", pipeline.getZone());
        fallbacks.put("stage1.threads", String.valueOf(pipeline.getStage1().getThreads()));
        fallbacks.put("stage1.chunk_days", String.valueOf(pipeline.getStage1().getChunkDays()));
        fallbacks.put("stage1.batch_size", String.valueOf(pipeline.getStage1().getBatchSize()));
        fallbacks.put("stage1.resume_enabled", String.valueOf(pipeline.getStage1().isResumeEnabled()));
        fallbacks.put("stage1.checkpoint_key", pipeline.getStage1().getCheckpointKey());
        fallbacks.put("stage3.source", pipeline.getStage3().getSource());
        fallbacks.put("stage3.threads", String.valueOf(pipeline.getStage3().getThreads()));
        Path workingDir = Path.of(environment.getProperty(WORKING_DIR_KEY, ".")).toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, raw, fallbacks);
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = DbSettings.fromProperties(dbProperties).open();
        System.out.println("DB url=" + database.maskedJdbcUrl() + ", schema=" + database.schema());
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    public CelestialPositionProvider celestialPositionProvider() {
        return new AnalyticEphemerisProvider();
    }

    @Bean
    @Lazy
    public PipelineStateDao pipelineStateDao(Database database) {
        return new PipelineStateDao(database);
    }

    @Bean
    @Lazy
    public LocationDao locationDao(Database database) {
        return new LocationDao(database);
    }

    @Bean
    @Lazy
    public OrbitSnapshotDao orbitSnapshotDao(Database database) {
        return new OrbitSnapshotDao(database);
    }

    @Bean
    @Lazy
    public CandidateDao candidateDao(Database database) {
        return new CandidateDao(database);
    }

    @Bean
    @Lazy
    public FujiEventDao fujiEventDao(Database database) {
        return new FujiEventDao(database);
    }

    @Bean
    @Lazy
    public FujiOrchestrator fujiOrchestrator(
            Config config,
            CelestialPositionProvider provider,
            OrbitSnapshotDao orbitSnapshotDao,
            CandidateDao candidateDao,
            FujiEventDao fujiEventDao,
            LocationDao locationDao,
            PipelineStateDao pipelineStateDao,
            Database database
    ) {
        return new FujiOrchestrator(
                config,
                provider,
                orbitSnapshotDao,
                candidateDao,
                fujiEventDao,
                locationDao,
                pipelineStateDao,
                database
        );
    }

    @Bean
    @Lazy
    public FujiEventQueryService fujiEventQueryService(FujiEventDao fujiEventDao, FujiOrchestrator fujiOrchestrator) {
        return new FujiEventQueryService(fujiEventDao, fujiOrchestrator);
    }
}
