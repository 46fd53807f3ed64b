package com.trialstruct.service.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trialstruct.service.normalize.UnitMappingConfig.OrdinalGrade;
import com.trialstruct.service.normalize.UnitMappingConfig.OrdinalScale;
import com.trialstruct.service.normalize.UnitMappingConfig.UnitEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * UCUM / OMOP lookup over a static mapping table.
 *
 * All keys are indexed lower-cased and trimmed, so lookups are case-insensitive.
 * Ordinal scale aliases match when the entity text equals or contains them.
 */
@Slf4j
public class UcumUnitNormalizer implements UnitNormalizer {

    /** OMOP concept for the UCUM {score} unit. */
    public static final int SCORE_UNIT_CONCEPT_ID = 8527;

    private static final Pattern GRADE_PREFIX = Pattern.compile("^(grade|class|score|stage)\\s+");
    private static final Pattern WHOLE_NUMBER = Pattern.compile("^\\d{1,9}(\\.0+)?$");

    private final Map<String, NormalizedCode> unitLookup = new HashMap<>();
    private final Map<String, Integer> valueLookup = new HashMap<>();
    private final Map<String, OrdinalScale> ordinalScales;

    public UcumUnitNormalizer(UnitMappingConfig config) {
        for (UnitEntry entry : config.units()) {
            NormalizedCode code = new NormalizedCode(entry.canonical(), entry.omopUnitConceptId());
            unitLookup.put(key(entry.canonical()), code);
            if (entry.aliases() != null) {
                for (String alias : entry.aliases()) {
                    unitLookup.put(key(alias), code);
                }
            }
        }
        config.valueMappings().forEach((text, conceptId) -> valueLookup.put(key(text), conceptId));
        this.ordinalScales = new LinkedHashMap<>(config.ordinalScales());

        log.info("Loaded unit mappings: {} unit keys, {} value keys, {} ordinal scales",
            unitLookup.size(), valueLookup.size(), ordinalScales.size());
    }

    public static UcumUnitNormalizer fromClasspath(ObjectMapper objectMapper, String resource) {
        try (InputStream in = UcumUnitNormalizer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Unit mapping resource not found: " + resource);
            }
            return new UcumUnitNormalizer(objectMapper.readValue(in, UnitMappingConfig.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read unit mappings from " + resource, e);
        }
    }

    @Override
    public NormalizedCode normalizeUnit(String unitText) {
        if (isBlank(unitText)) {
            return NormalizedCode.EMPTY;
        }
        return unitLookup.getOrDefault(key(unitText), NormalizedCode.EMPTY);
    }

    @Override
    public NormalizedCode normalizeValue(String valueText) {
        if (isBlank(valueText)) {
            return NormalizedCode.EMPTY;
        }
        String normalized = key(valueText);
        Integer conceptId = valueLookup.get(normalized);
        return conceptId != null ? new NormalizedCode(normalized, conceptId) : NormalizedCode.EMPTY;
    }

    @Override
    public Optional<OrdinalMatch> normalizeOrdinal(String rawValue, String entityText) {
        if (isBlank(entityText)) {
            return Optional.empty();
        }
        String entity = key(entityText);

        for (Map.Entry<String, OrdinalScale> entry : ordinalScales.entrySet()) {
            OrdinalScale scale = entry.getValue();
            if (!matchesScale(entity, entry.getKey(), scale)) {
                continue;
            }
            Integer unitConceptId = scale.unitConceptId() != null ? scale.unitConceptId() : SCORE_UNIT_CONCEPT_ID;
            Integer valueConceptId = null;
            String grade = normalizeGrade(rawValue);
            if (grade != null && scale.values() != null) {
                OrdinalGrade known = scale.values().get(grade);
                if (known != null) {
                    valueConceptId = known.omopValueConceptId();
                }
            }
            return Optional.of(new OrdinalMatch(entry.getKey(), valueConceptId, unitConceptId));
        }
        return Optional.empty();
    }

    @Override
    public List<PendingOrdinalGrade> pendingOrdinalGrades() {
        List<PendingOrdinalGrade> pending = new ArrayList<>();
        ordinalScales.forEach((name, scale) -> {
            if (scale.values() == null) {
                return;
            }
            scale.values().forEach((grade, info) -> {
                if (info == null || info.omopValueConceptId() == null) {
                    pending.add(new PendingOrdinalGrade(name, grade, info != null ? info.description() : null));
                }
            });
        });
        return pending;
    }

    private boolean matchesScale(String entity, String scaleName, OrdinalScale scale) {
        if (entity.equals(key(scaleName))) {
            return true;
        }
        if (scale.entityAliases() == null) {
            return false;
        }
        for (String alias : scale.entityAliases()) {
            String aliasKey = key(alias);
            if (!aliasKey.isEmpty() && (entity.equals(aliasKey) || entity.contains(aliasKey))) {
                return true;
            }
        }
        return false;
    }

    /**
     * "Grade 2", "2.0" and " 2 " all normalize to "2".
     */
    static String normalizeGrade(String rawValue) {
        if (isBlank(rawValue)) {
            return null;
        }
        String grade = GRADE_PREFIX.matcher(key(rawValue)).replaceFirst("").trim();
        if (WHOLE_NUMBER.matcher(grade).matches()) {
            return String.valueOf(Long.parseLong(grade.replaceFirst("\\.0+$", "")));
        }
        return grade;
    }

    private static String key(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
