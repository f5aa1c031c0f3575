package com.mlab.telescope.service;

import com.mlab.telescope.exception.IpTranslationConfigException;
import com.mlab.telescope.model.IpTranslationSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and caches {@link AsnBlockTranslator}s, one per translation spec and
 * snapshot directory, so every selector sharing a spec shares its lookup cache.
 */
@Component
@Slf4j
public class IpTranslatorFactory {

    static final String MAXMIND = "maxmind";

    private final Map<CacheKey, AsnBlockTranslator> translators = new ConcurrentHashMap<>();

    public AsnBlockTranslator create(IpTranslationSpec spec, Path maxmindDir) {
        return translators.computeIfAbsent(new CacheKey(spec, maxmindDir), this::load);
    }

    private AsnBlockTranslator load(CacheKey key) {
        IpTranslationSpec spec = key.spec();
        if (!MAXMIND.equals(spec.strategyName())) {
            throw new IpTranslationConfigException("UnrecognizedIPTranslationStrategy: " + spec.strategyName());
        }
        if (spec.snapshotDates().isEmpty()) {
            throw new IpTranslationConfigException("IPTranslationStrategyNoDatesSpecified");
        }
        if (spec.snapshotDates().size() > 1) {
            // Needs a time-indexed translator, not a list of tables.
            throw new IpTranslationConfigException("Multiple ASN snapshot processing is not supported.");
        }

        log.info("Loading ASN snapshot {} from {}", spec.snapshotDates().get(0), key.maxmindDir());
        return AsnBlockTranslator.load(spec.snapshotDates().get(0), key.maxmindDir());
    }

    private record CacheKey(IpTranslationSpec spec, Path maxmindDir) {
    }
}
