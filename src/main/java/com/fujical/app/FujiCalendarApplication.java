package com.fujical.app;

import com.fujical.core.CheckResult;
import com.fujical.engine.config.Config;
import com.fujical.engine.db.LocationDao;
import com.fujical.engine.model.FujiEvent;
import com.fujical.engine.model.ObserverLocation;
import com.fujical.engine.runner.DayEvents;
import com.fujical.engine.runner.FujiEventQueryService;
import com.fujical.engine.runner.FujiOrchestrator;
import com.fujical.engine.runner.HealthReport;
import com.fujical.engine.runner.PrecomputeResult;
import com.fujical.engine.runner.RecomputeResult;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line entry point for the yearly pipeline, single-location recomputation,
 * health checks and day queries.
 */
public final class FujiCalendarApplication {
    private static final String APP_NAME = "fujical";
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new FujiCalendarApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp(APP_NAME, options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp(APP_NAME, options);
            return 0;
        }

        Integer year;
        LocalDate day;
        try {
            day = cmd.hasOption("day") ? LocalDate.parse(cmd.getOptionValue("day").trim()) : null;
            year = parseYear(cmd, day);
        } catch (DateTimeParseException | NumberFormatException e) {
            System.err.println("ERROR: invalid argument: " + e.getMessage());
            return 2;
        }
        String usageError = validate(cmd, year);
        if (usageError != null) {
            new HelpFormatter().printHelp(APP_NAME, options);
            System.err.println("ERROR: " + usageError);
            return 2;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        try (AnnotationConfigApplicationContext context = FujiBootstrapConfig.open(workingDir)) {
            installLogRoutingIfNeeded(context.getBean(Config.class));
            FujiOrchestrator orchestrator = context.getBean(FujiOrchestrator.class);

            if (cmd.hasOption("precompute")) {
                return report(orchestrator.precomputeYear(year, cmd.hasOption("reset-checkpoint")));
            }
            if (cmd.hasOption("from-stage2")) {
                return report(orchestrator.executeFromStage2(year));
            }
            if (cmd.hasOption("recompute-location")) {
                long locationId = Long.parseLong(cmd.getOptionValue("recompute-location").trim());
                return report(orchestrator.recomputeLocation(locationId, year));
            }
            if (cmd.hasOption("health-check")) {
                return report(orchestrator.healthCheck(year));
            }
            if (day != null) {
                long locationId = Long.parseLong(cmd.getOptionValue("location").trim());
                Optional<ObserverLocation> location = context.getBean(LocationDao.class).findById(locationId);
                if (location.isEmpty()) {
                    System.err.println("ERROR: location not found: " + locationId);
                    return 1;
                }
                return report(context.getBean(FujiEventQueryService.class).eventsForDay(location.get(), day));
            }
            orchestrator.resetCheckpoint();
            System.out.println("Stage1 checkpoint cleared.");
            return 0;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private Integer parseYear(CommandLine cmd, LocalDate day) {
        if (cmd.hasOption("year")) {
            return Integer.parseInt(cmd.getOptionValue("year").trim());
        }
        return day == null ? null : day.getYear();
    }

    private String validate(CommandLine cmd, Integer year) {
        boolean actionSet = cmd.hasOption("precompute")
                || cmd.hasOption("from-stage2")
                || cmd.hasOption("recompute-location")
                || cmd.hasOption("health-check")
                || cmd.hasOption("day");
        if (!actionSet) {
            return cmd.hasOption("reset-checkpoint")
                    ? null
                    : "one of --precompute, --from-stage2, --recompute-location, --health-check, --day is required";
        }
        if (cmd.hasOption("day") && !cmd.hasOption("location")) {
            return "--day requires --location";
        }
        if (year == null) {
            return "--year is required";
        }
        if (year < 1900 || year > 2100) {
            return "--year must be between 1900 and 2100";
        }
        return null;
    }

    private int report(PrecomputeResult result) {
        System.out.println("success=" + result.success());
        System.out.println("year=" + result.year());
        System.out.println("total_data_points=" + result.totalDataPoints());
        System.out.println("total_candidates=" + result.totalCandidates());
        System.out.println("total_events=" + result.totalEvents());
        System.out.println("time_ms=" + result.timeMs());
        if (!result.success()) {
            System.err.println("failed_stage=" + result.failedStage() + ", error=" + result.error());
        }
        JSONObject json = new JSONObject();
        json.put("success", result.success());
        json.put("year", result.year());
        json.put("total_data_points", result.totalDataPoints());
        json.put("total_candidates", result.totalCandidates());
        json.put("total_events", result.totalEvents());
        json.put("time_ms", result.timeMs());
        json.put("stage_breakdown", new JSONObject(result.stageBreakdown()));
        if (result.failedStage() != null) {
            json.put("failed_stage", result.failedStage().name());
            json.put("error", result.error());
        }
        JSONObject byType = new JSONObject();
        result.statistics().byPhenomenon().forEach((type, n) -> byType.put(type.code(), n));
        JSONObject byTier = new JSONObject();
        result.statistics().byTier().forEach((tier, n) -> byTier.put(tier.code(), n));
        json.put("events_by_phenomenon", byType);
        json.put("events_by_tier", byTier);
        json.put("locations_with_events", result.statistics().locationsWithEvents());
        System.out.println(json.toString(2));
        return result.success() ? 0 : 1;
    }

    private int report(RecomputeResult result) {
        JSONObject json = new JSONObject();
        json.put("success", result.success());
        json.put("location_id", result.locationId());
        json.put("year", result.year());
        json.put("event_count", result.eventCount());
        json.put("time_ms", result.timeMs());
        if (!result.success()) {
            json.put("error", result.error());
        }
        System.out.println(json.toString(2));
        return result.success() ? 0 : 1;
    }

    private int report(HealthReport report) {
        JSONObject checks = new JSONObject();
        for (Map.Entry<String, CheckResult> entry : report.checks().entrySet()) {
            CheckResult check = entry.getValue();
            JSONObject item = new JSONObject();
            item.put("status", check.status().name());
            item.put("reason", check.reason());
            item.put("evidence", new JSONObject(check.evidence()));
            checks.put(entry.getKey(), item);
            System.out.println("check " + entry.getKey() + "=" + check.status() + " " + check.reason());
        }
        JSONObject json = new JSONObject();
        json.put("healthy", report.healthy());
        json.put("year", report.year());
        json.put("checks", checks);
        json.put("recommendations", new JSONArray(report.recommendations()));
        System.out.println(json.toString(2));
        return report.healthy() ? 0 : 1;
    }

    private int report(DayEvents dayEvents) {
        JSONArray events = new JSONArray();
        for (FujiEvent e : dayEvents.events()) {
            JSONObject item = new JSONObject();
            item.put("phenomenon_type", e.phenomenonType.code());
            item.put("time", e.instant.toString());
            item.put("azimuth", e.azimuth);
            item.put("elevation", e.elevation);
            item.put("azimuth_diff", e.azimuthDiff);
            item.put("elevation_diff", e.elevationDiff);
            item.put("accuracy_tier", e.accuracyTier.code());
            item.put("quality_score", e.qualityScore);
            if (e.moonIllumination != null) {
                item.put("moon_illumination", e.moonIllumination);
            }
            events.put(item);
        }
        JSONObject json = new JSONObject();
        json.put("date", dayEvents.date().toString());
        json.put("location_id", dayEvents.locationId());
        json.put("source", dayEvents.precomputed() ? "precomputed" : "direct");
        json.put("events", events);
        System.out.println(json.toString(2));
        return 0;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (FujiCalendarApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("fujical.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must be initialised before the streams are swapped.
                LogManager.getLogger(FujiCalendarApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("year").hasArg().argName("yyyy").desc("calendar year to process").build());
        OptionGroup actions = new OptionGroup();
        actions.addOption(Option.builder().longOpt("precompute").desc("run stages 1-3 for the year").build());
        actions.addOption(Option.builder().longOpt("from-stage2").desc("rerun stages 2-3 against existing stage 1 data").build());
        actions.addOption(Option.builder().longOpt("recompute-location").hasArg().argName("id").desc("rematch one location for the year").build());
        actions.addOption(Option.builder().longOpt("health-check").desc("check stage coverage for the year").build());
        actions.addOption(Option.builder().longOpt("day").hasArg().argName("yyyy-MM-dd").desc("events for one location and date").build());
        options.addOptionGroup(actions);
        options.addOption(Option.builder().longOpt("location").hasArg().argName("id").desc("location id for --day").build());
        options.addOption(Option.builder().longOpt("reset-checkpoint").desc("clear the stage 1 resume checkpoint").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
