package com.mlab.telescope.scheduler;

import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.model.RunOptions;
import com.mlab.telescope.model.RunSummary;
import com.mlab.telescope.model.Selector;
import com.mlab.telescope.service.SelectorFileParser;
import com.mlab.telescope.service.TelescopeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Command line entry point.
 *
 * Usage: telescope [options] selector.json [selector.json ...]
 *
 *   --output=DIR            where result files go (telescope.output.output-dir)
 *   --maxminddir=DIR        where GeoIPASNum2 snapshots live (telescope.translation.maxmind-dir)
 *   --credentialspath=FILE  warehouse credentials (telescope.auth.credentials-path)
 *   --maxconcurrency=N      concurrent job ceiling (telescope.scheduler.max-concurrent-jobs)
 *   --savequery             also write each query's text
 *   --dryrun                compile queries without submitting them
 *   --ignorecache           re-run selectors whose results already exist
 *   --verbose               debug logging
 *
 * Valued options are plain property aliases, see application.yml.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TelescopeRunner implements ApplicationRunner {

    private final SelectorFileParser selectorFileParser;
    private final TelescopeService telescopeService;
    private final TelescopeProperties properties;
    private final LoggingSystem loggingSystem;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("verbose")) {
            loggingSystem.setLogLevel("com.mlab.telescope", LogLevel.DEBUG);
        }

        List<Path> selectorFiles = args.getNonOptionArgs().stream()
                .map(Paths::get)
                .collect(Collectors.toList());
        if (selectorFiles.isEmpty()) {
            log.error("No selector files given. Usage: telescope [options] selector.json [selector.json ...]");
            return;
        }

        List<Selector> selectors = selectorFileParser.parseAll(selectorFiles);
        log.info("Parsed {} selectors from {} files.", selectors.size(), selectorFiles.size());

        RunSummary summary = telescopeService.run(selectors, optionsFrom(args));
        log.info("Run complete: {} succeeded, {} failed, {} abandoned.",
                summary.succeeded(), summary.failed(), summary.abandoned());
    }

    RunOptions optionsFrom(ApplicationArguments args) {
        return RunOptions.builder()
                .outputDir(Paths.get(properties.getOutput().getOutputDir()))
                .maxmindDir(Paths.get(properties.getTranslation().getMaxmindDir()))
                .maxConcurrentJobs(properties.getScheduler().getMaxConcurrentJobs())
                .dryRun(args.containsOption("dryrun"))
                .ignoreCache(args.containsOption("ignorecache"))
                .saveQuery(args.containsOption("savequery"))
                .build();
    }
}
