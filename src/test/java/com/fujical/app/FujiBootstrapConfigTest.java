package com.fujical.app;

import com.fujical.engine.config.Config;
import com.fujical.engine.ephemeris.AnalyticEphemerisProvider;
import com.fujical.engine.ephemeris.CelestialPositionProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.StandardEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FujiBootstrapConfigTest {

    private AnnotationConfigApplicationContext context(Map<String, Object> properties) {
        StandardEnvironment environment = new StandardEnvironment();
        MutablePropertySources sources = environment.getPropertySources();
        sources.remove(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME);
        sources.remove(StandardEnvironment.SYSTEM_PROPERTIES_PROPERTY_SOURCE_NAME);
        sources.addFirst(new MapPropertySource("test", properties));

        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
        context.setEnvironment(environment);
        context.register(FujiBootstrapConfig.class);
        context.refresh();
        return context;
    }

    @Test
    void contextShouldBindConfigWithoutOpeningTheDatabase() {
        try (AnnotationConfigApplicationContext context = context(Map.of(
                "app.zone", "UTC",
                "stage1.chunk_days", "7",
                "pipeline.stage3.threads", "6"))) {
            Config config = context.getBean(Config.class);

            assertEquals("UTC", config.getString("app.zone"));
            assertEquals(7, config.getInt("stage1.chunk_days"));
            assertEquals(6, config.getInt("stage3.threads"));
            assertEquals(1000, config.getInt("stage1.batch_size"));
            assertTrue(context.getBean(CelestialPositionProvider.class) instanceof AnalyticEphemerisProvider);
        }
    }

    @Test
    void pipelineDefaultsShouldFillUnsetKeys() {
        try (AnnotationConfigApplicationContext context = context(Map.of())) {
            Config config = context.getBean(Config.class);

            assertEquals("Asia/Tokyo", config.getString("app.zone"));
            assertEquals(4, config.getInt("stage1.threads"));
            assertEquals("STAGE1", config.getString("stage3.source"));
        }
    }

    @Test
    void openShouldLetTheWorkingDirectoryFileOverrideTheBundledOne(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), "stage1.chunk_days=7\napp.zone=UTC\n");

        try (AnnotationConfigApplicationContext context = FujiBootstrapConfig.open(dir)) {
            Config config = context.getBean(Config.class);

            assertEquals(7, config.getInt("stage1.chunk_days"));
            assertEquals(ZoneId.of("UTC"), config.zone());
            assertEquals(0.70, config.getDouble("stage2.moon.min_illumination"), 1e-9);
            assertEquals(dir.resolve("outputs").normalize(), config.getPath("outputs.dir"));
            assertTrue(context.containsBean("fujiOrchestrator"));
        }
    }

    @Test
    void openWithoutWorkingDirectoryFileShouldUseTheBundledValues(@TempDir Path dir) throws Exception {
        try (AnnotationConfigApplicationContext context = FujiBootstrapConfig.open(dir)) {
            Config config = context.getBean(Config.class);

            assertEquals("Asia/Tokyo", config.getString("app.zone"));
            assertEquals(5, config.getInt("stage1.interval_minutes"));
        }
    }
}
