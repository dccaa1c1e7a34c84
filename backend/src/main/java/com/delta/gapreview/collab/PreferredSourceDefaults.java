package com.delta.gapreview.collab;

import com.delta.gapreview.config.ReviewProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Source boosts applied when a run request names no preferred sources. Read once from
 * {@code preferred-sources.csv} on the classpath (columns {@code name,boost}).
 */
@Component
public class PreferredSourceDefaults {
    private static final Logger log = LoggerFactory.getLogger(PreferredSourceDefaults.class);
    static final String RESOURCE = "preferred-sources.csv";

    private final Map<String, Double> defaults;
    private final double minBoost;
    private final double maxBoost;

    public PreferredSourceDefaults(ReviewProperties properties) {
        this.minBoost = properties.getRanking().getMinBoost();
        this.maxBoost = properties.getRanking().getMaxBoost();
        this.defaults = Map.copyOf(load());
    }

    public Map<String, Double> defaults() {
        return defaults;
    }

    /**
     * Case-folds names, drops non-positive or missing boosts and clamps the rest.
     */
    public Map<String, Double> normalize(Map<String, Double> requested) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (requested == null) {
            return out;
        }
        requested.forEach((name, boost) -> {
            if (name == null || name.isBlank() || boost == null || boost.isNaN() || boost <= 0) {
                return;
            }
            out.put(name.trim().toLowerCase(Locale.ROOT), Math.max(minBoost, Math.min(maxBoost, boost)));
        });
        return out;
    }

    public Map<String, Double> resolve(Map<String, Double> requested) {
        Map<String, Double> normalized = normalize(requested);
        return normalized.isEmpty() ? defaults : normalized;
    }

    private Map<String, Double> load() {
        ClassPathResource resource = new ClassPathResource(RESOURCE);
        if (!resource.exists()) {
            log.warn("No {} on classpath; preferred source defaults are empty", RESOURCE);
            return Map.of();
        }
        Map<String, Double> raw = new LinkedHashMap<>();
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String name = record.isMapped("name") ? record.get("name") : null;
                String boost = record.isMapped("boost") ? record.get("boost") : null;
                Double value = parseBoost(boost);
                if (name == null || name.isBlank() || value == null) {
                    log.debug("Skipping preferred source row {}", record.getRecordNumber());
                    continue;
                }
                raw.put(name, value);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read " + RESOURCE, e);
        }
        Map<String, Double> normalized = normalize(raw);
        log.info("Loaded {} preferred source defaults", normalized.size());
        return normalized;
    }

    private Double parseBoost(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }
}
