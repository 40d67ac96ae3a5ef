package com.di.bqtarget.ingest;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of the available {@link IngestionEngine} beans, keyed by their normalized
 * {@link IngestionEngine#type()} (case-insensitive, trimmed).
 *
 * <p>Two engines declaring the same type is a wiring error and fails startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionEngineRegistry {

    private final List<IngestionEngine> engines;

    private Map<String, IngestionEngine> enginesByType;

    /**
     * Validates and indexes the discovered engines.
     * Called after dependency injection via {@link PostConstruct}.
     */
    @PostConstruct
    public void initialize() {
        if (engines == null || engines.isEmpty()) {
            log.warn("No IngestionEngine beans found. Registry will be empty.");
            enginesByType = Collections.emptyMap();
            return;
        }

        Map<String, List<IngestionEngine>> grouped = engines.stream()
                .peek(this::validateEngineType)
                .collect(Collectors.groupingBy(engine -> normalizeType(engine.type())));

        List<Map.Entry<String, List<IngestionEngine>>> duplicates = grouped.entrySet().stream()
                .filter(entry -> entry.getValue().size() > 1)
                .toList();
        if (!duplicates.isEmpty()) {
            String detail = duplicates.stream()
                    .map(entry -> String.format("'%s' -> [%s]", entry.getKey(), entry.getValue().stream()
                            .map(engine -> engine.getClass().getName())
                            .collect(Collectors.joining(", "))))
                    .collect(Collectors.joining(" ; "));
            throw new IllegalStateException("Duplicate IngestionEngine type() values detected: " + detail);
        }

        enginesByType = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, entry -> entry.getValue().get(0)));

        log.info("Registered {} ingestion engine type(s): {}", enginesByType.size(), enginesByType.keySet());
    }

    /**
     * @param type strategy key (case-insensitive)
     * @throws IllegalArgumentException if no engine is registered for the type
     */
    public IngestionEngine getEngine(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Engine type cannot be null or blank");
        }
        IngestionEngine engine = enginesByType.get(normalizeType(type));
        if (engine == null) {
            throw new IllegalArgumentException(String.format(
                    "Unsupported ingestion strategy: '%s'. Available strategies: %s", type, enginesByType.keySet()));
        }
        return engine;
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(enginesByType.keySet());
    }

    public boolean hasEngine(String type) {
        return type != null && !type.isBlank() && enginesByType.containsKey(normalizeType(type));
    }

    private void validateEngineType(IngestionEngine engine) {
        String type = engine.type();
        if (type == null || type.isBlank()) {
            throw new IllegalStateException(String.format(
                    "Engine %s returned blank type(). Engine type must be non-null and non-blank.",
                    engine.getClass().getName()));
        }
    }

    private static String normalizeType(String type) {
        return type == null ? null : type.trim().toLowerCase(Locale.ROOT);
    }
}
