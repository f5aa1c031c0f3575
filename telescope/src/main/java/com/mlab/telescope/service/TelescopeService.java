package com.mlab.telescope.service;

import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.exception.NoClientNetworkBlocksFoundException;
import com.mlab.telescope.exception.TelescopeException;
import com.mlab.telescope.model.CompiledQuery;
import com.mlab.telescope.model.IpRange;
import com.mlab.telescope.model.QueryMetadata;
import com.mlab.telescope.model.RunOptions;
import com.mlab.telescope.model.RunSummary;
import com.mlab.telescope.model.Selector;
import com.mlab.telescope.model.WorkItem;
import com.mlab.telescope.output.OutputPaths;
import com.mlab.telescope.output.QueryTextWriter;
import com.mlab.telescope.scheduler.QueryWorkScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns selectors into work items and hands them to the scheduler.
 *
 * For each selector: skip it if its result file is already cached, resolve
 * client network blocks and server addresses, compile the query, optionally
 * save the query text, and queue it. A selector that cannot be prepared is
 * logged and skipped; the others still run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TelescopeService {

    static final DateTimeFormatter DATE_LABEL = DateTimeFormatter.ofPattern("yyyy-MM-dd-HHmmss")
            .withZone(ZoneOffset.UTC);

    private final IpTranslatorFactory translatorFactory;
    private final SiteResolver siteResolver;
    private final QueryCompiler queryCompiler;
    private final QueryTextWriter queryTextWriter;
    private final QueryWorkScheduler scheduler;
    private final TelescopeProperties properties;

    public RunSummary run(List<Selector> selectors, RunOptions options) {
        List<WorkItem> items = prepare(selectors, options);

        if (options.isDryRun()) {
            log.info("Dry run: built {} queries, none submitted.", items.size());
            return new RunSummary(0, 0, 0, 0);
        }

        log.info("Finished processing selector files, approximately {} queries to be performed.", items.size());
        return scheduler.run(items, options.getMaxConcurrentJobs());
    }

    /**
     * Build one work item per selector that is neither cached nor broken.
     */
    public List<WorkItem> prepare(List<Selector> selectors, RunOptions options) {
        List<Selector> ordered = new ArrayList<>(selectors);
        // Selectors usually arrive in date order; shuffling spreads concurrent jobs across tables.
        if (properties.getScheduler().isShuffleSelectors()) {
            Collections.shuffle(ordered);
        }

        List<WorkItem> items = new ArrayList<>();
        for (Selector selector : ordered) {
            QueryMetadata metadata = metadataFor(selector);
            Path resultPath = OutputPaths.resultPath(options.getOutputDir(), metadata);

            CompiledQuery query;
            try {
                if (!options.isIgnoreCache() && OutputPaths.isCached(resultPath)) {
                    log.info("Raw data file found ({}), assuming this is cached copy of same data and moving off. "
                            + "Use --ignorecache to suppress this behavior.", resultPath);
                    continue;
                }
                log.debug("Did not find existing data file: {}", resultPath);
                log.debug("Generating query for {}.", metadata.describe());

                query = compile(selector, options.getMaxmindDir());
                if (options.isSaveQuery()) {
                    queryTextWriter.write(OutputPaths.queryPath(options.getOutputDir(), metadata), query.getText());
                }
            } catch (TelescopeException | UncheckedIOException e) {
                log.error("Failed to prepare query for {}: {}", metadata.describe(), e.getMessage());
                continue;
            }

            if (options.isDryRun()) {
                log.warn("Dry run flag caught, built query for {} and reached the point that it would be posted, "
                        + "moving on.", metadata.describe());
            }
            items.add(WorkItem.of(query, metadata, resultPath));
        }
        return items;
    }

    /**
     * Format a duration the way selector files write it, e.g. 108000 seconds as "1d6h".
     */
    public static String durationToString(long durationSeconds) {
        StringBuilder label = new StringBuilder();
        long remaining = durationSeconds;

        long days = remaining / 86_400;
        if (days > 0) {
            label.append(days).append('d');
            remaining %= 86_400;
        }
        long hours = remaining / 3_600;
        if (hours > 0) {
            label.append(hours).append('h');
            remaining %= 3_600;
        }
        long minutes = remaining / 60;
        if (minutes > 0) {
            label.append(minutes).append('m');
            remaining %= 60;
        }
        if (remaining > 0) {
            label.append(remaining).append('s');
        }
        return label.toString();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private QueryMetadata metadataFor(Selector selector) {
        return QueryMetadata.builder()
                .date(DATE_LABEL.format(selector.getStartTime()))
                .duration(durationToString(selector.getDurationSeconds()))
                .site(selector.getSite())
                .clientProvider(selector.getClientProvider())
                .clientCountry(selector.getClientCountry())
                .metric(selector.getMetric())
                .build();
    }

    private CompiledQuery compile(Selector selector, Path maxmindDir) {
        List<IpRange> clientBlocks = List.of();
        if (selector.getClientProvider() != null) {
            AsnBlockTranslator translator = translatorFactory.create(selector.getIpTranslationSpec(), maxmindDir);
            clientBlocks = translator.findBlocks(selector.getClientProvider());
            if (clientBlocks.isEmpty()) {
                throw new NoClientNetworkBlocksFoundException(selector.getClientProvider());
            }
        }

        List<String> serverIps = List.of();
        if (selector.getSite() != null) {
            serverIps = siteResolver.resolve(selector.getSite());
        }

        return queryCompiler.compile(selector, clientBlocks, serverIps);
    }
}
