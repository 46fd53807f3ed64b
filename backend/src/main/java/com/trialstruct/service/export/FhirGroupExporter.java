package com.trialstruct.service.export;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trialstruct.model.criteria.AtomicCriterion;
import com.trialstruct.model.criteria.Criterion;
import com.trialstruct.model.enums.CriteriaType;
import com.trialstruct.model.tree.AtomicNode;
import com.trialstruct.model.tree.BranchNode;
import com.trialstruct.model.tree.ExpressionNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * FHIR Group Exporter
 *
 * Builds a FHIR R4 Group resource (EBM implementation guide) whose
 * characteristics are the protocol's eligibility criteria.
 * AND flattens into the parent, OR becomes a contained any-of Group
 * and NOT inverts the exclude flag of everything below it.
 */
@Component
public class FhirGroupExporter {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    static final String COMBINATION_EXTENSION_URL =
        "http://hl7.org/fhir/uv/ebm/StructureDefinition/characteristic-combination";
    static final String OMOP_SYSTEM = "http://ohdsi.org/omop/concept";
    private static final String UCUM_SYSTEM = "http://unitsofmeasure.org";
    private static final String USAGE_CONTEXT_SYSTEM = "http://terminology.hl7.org/CodeSystem/usage-context-type";

    private static final Map<String, String> SYSTEM_URIS = Map.of(
        "snomed", "http://snomed.info/sct",
        "snomedct", "http://snomed.info/sct",
        "loinc", "http://loinc.org",
        "rxnorm", "http://www.nlm.nih.gov/research/umls/rxnorm",
        "icd10", "http://hl7.org/fhir/sid/icd-10",
        "icd10cm", "http://hl7.org/fhir/sid/icd-10-cm",
        "cpt", "http://www.ama-assn.org/go/cpt",
        "hcpcs", "urn:oid:2.16.840.1.113883.6.285",
        "omop", OMOP_SYSTEM
    );

    private static final Map<String, String> COMPARATORS = Map.of(
        ">", "gt",
        ">=", "ge",
        "<", "lt",
        "<=", "le",
        "gt", "gt",
        "gte", "ge",
        "lt", "lt",
        "lte", "le"
    );

    public ObjectNode export(ProtocolExportData data) {
        List<ObjectNode> characteristics = new ArrayList<>();
        for (Criterion criterion : data.criteria()) {
            boolean exclude = criterion.getCriteriaType() == CriteriaType.EXCLUSION;
            data.treeFor(criterion)
                .ifPresent(tree -> characteristics.addAll(buildCharacteristics(tree.root(), data, exclude)));
        }

        ObjectNode group = JSON.objectNode();
        group.put("resourceType", "Group");
        group.put("id", data.protocol().getId());
        group.put("type", "person");
        group.put("actual", false);
        group.put("name", data.protocol().getTitle());
        group.putArray("characteristic").addAll(characteristics);

        if (!characteristics.isEmpty()) {
            group.set("extension", combinationExtension("all-of"));
        }
        return group;
    }

    // ========================================================================
    // Tree Walk
    // ========================================================================

    private List<ObjectNode> buildCharacteristics(ExpressionNode node, ProtocolExportData data, boolean exclude) {
        if (node instanceof AtomicNode leaf) {
            return data.atomic(leaf.atomicCriterionId())
                .map(atomic -> buildCharacteristic(atomic, exclude))
                .map(List::of)
                .orElse(List.of());
        }
        if (!(node instanceof BranchNode branch)) {
            return List.of();
        }

        return switch (branch.operator()) {
            case AND -> {
                List<ObjectNode> result = new ArrayList<>();
                for (ExpressionNode child : branch.children()) {
                    result.addAll(buildCharacteristics(child, data, exclude));
                }
                yield result;
            }
            case OR -> buildOrCharacteristic(branch, data, exclude);
            case NOT -> branch.children().isEmpty()
                ? List.of()
                : buildCharacteristics(branch.children().get(0), data, !exclude);
        };
    }

    private List<ObjectNode> buildOrCharacteristic(BranchNode branch, ProtocolExportData data, boolean exclude) {
        List<ObjectNode> alternatives = new ArrayList<>();
        for (ExpressionNode child : branch.children()) {
            alternatives.addAll(buildCharacteristics(child, data, exclude));
        }
        if (alternatives.isEmpty()) {
            return List.of();
        }

        String nestedId = UUID.randomUUID().toString();
        ObjectNode nested = JSON.objectNode();
        nested.put("resourceType", "Group");
        nested.put("id", nestedId);
        nested.put("type", "person");
        nested.put("actual", false);
        nested.putArray("characteristic").addAll(alternatives);
        nested.set("extension", combinationExtension("any-of"));

        ObjectNode characteristic = JSON.objectNode();
        characteristic.putObject("code").put("text", "Nested OR group");
        characteristic.putObject("valueReference").put("reference", "#/" + nestedId);
        characteristic.put("exclude", exclude);
        characteristic.set("_contained", nested);
        return List.of(characteristic);
    }

    // ========================================================================
    // Characteristics
    // ========================================================================

    private ObjectNode buildCharacteristic(AtomicCriterion atomic, boolean exclude) {
        if (ConceptIds.isDemographic(atomic)) {
            return buildAgeCharacteristic(atomic, exclude);
        }

        String code = ConceptIds.conceptCode(atomic);
        if (code == null) {
            return null;
        }

        ObjectNode characteristic = JSON.objectNode();
        ObjectNode coding = characteristic.putObject("code").putArray("coding").addObject();
        coding.put("system", systemUri(atomic.getEntityConceptSystem()));
        coding.put("code", code);
        coding.put("display", atomic.getOriginalText() != null ? atomic.getOriginalText() : "");
        characteristic.put("exclude", exclude || atomic.isNegation());

        if (atomic.getValueNumeric() != null) {
            ObjectNode quantity = characteristic.putObject("valueQuantity");
            quantity.put("value", atomic.getValueNumeric());
            if (hasText(atomic.getUnitText())) {
                quantity.put("unit", atomic.getUnitText());
            }
            putComparator(quantity, atomic.getRelationOperator());
        } else if (hasText(atomic.getValueText())) {
            characteristic.putObject("valueCodeableConcept").put("text", atomic.getValueText());
        } else {
            characteristic.put("valueBoolean", !atomic.isNegation());
        }
        return characteristic;
    }

    private ObjectNode buildAgeCharacteristic(AtomicCriterion atomic, boolean exclude) {
        if (atomic.getValueNumeric() == null) {
            return null;
        }

        ObjectNode characteristic = JSON.objectNode();
        ObjectNode coding = characteristic.putObject("code").putArray("coding").addObject();
        coding.put("system", USAGE_CONTEXT_SYSTEM);
        coding.put("code", "age");
        coding.put("display", "Age Range");
        characteristic.put("exclude", exclude);

        ObjectNode quantity = characteristic.putObject("valueQuantity");
        quantity.put("value", atomic.getValueNumeric());
        quantity.put("unit", hasText(atomic.getUnitText()) ? atomic.getUnitText() : "years");
        quantity.put("system", UCUM_SYSTEM);
        quantity.put("code", "a");
        putComparator(quantity, atomic.getRelationOperator());
        return characteristic;
    }

    private static void putComparator(ObjectNode quantity, String relation) {
        if (!hasText(relation)) {
            return;
        }
        String comparator = COMPARATORS.get(relation.trim().toLowerCase(Locale.ROOT));
        if (comparator != null) {
            quantity.put("comparator", comparator);
        }
    }

    static String systemUri(String system) {
        if (!hasText(system)) {
            return OMOP_SYSTEM;
        }
        return SYSTEM_URIS.getOrDefault(system.toLowerCase(Locale.ROOT), "urn:oid:" + system);
    }

    private static ArrayNode combinationExtension(String combination) {
        ArrayNode extensions = JSON.arrayNode();
        ObjectNode extension = extensions.addObject();
        extension.put("url", COMBINATION_EXTENSION_URL);
        extension.put("valueCode", combination);
        return extensions;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
