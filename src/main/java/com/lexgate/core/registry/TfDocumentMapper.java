package com.lexgate.core.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexgate.core.model.AcceptancePredicate;
import com.lexgate.core.model.DecisionMode;
import com.lexgate.core.model.DecisionRule;
import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;
import com.lexgate.core.model.Footprint;
import com.lexgate.core.model.PrecedenceTier;
import com.lexgate.core.model.TaskFunction;
import com.lexgate.core.model.TfStatus;
import com.lexgate.core.model.Transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a schema-valid TF document onto a {@link TaskFunction}.
 */
final class TfDocumentMapper {

    private final ObjectMapper mapper;

    TfDocumentMapper(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    TaskFunction toTaskFunction(JsonNode doc, String source) {
        JsonNode detection = doc.path("detection");
        JsonNode ontology = doc.path("ontology");
        JsonNode rule = doc.path("decision_rule");
        JsonNode detector = doc.path("detector");
        JsonNode footprint = doc.path("footprint");

        var transforms = new ArrayList<Transform>();
        for (String name : strings(doc.path("allowed_transforms"))) {
            transforms.add(Transform.fromWireName(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown transform: " + name)));
        }
        var predicates = new ArrayList<AcceptancePredicate>();
        for (String name : strings(doc.path("verify"))) {
            predicates.add(AcceptancePredicate.fromString(name));
        }

        Map<String, Object> params = detector.has("params")
                ? mapper.convertValue(detector.get("params"), new TypeReference<Map<String, Object>>() {})
                : Map.of();

        return new TaskFunction(
                doc.path("id").asText(),
                doc.path("name").asText(),
                TfStatus.fromString(doc.path("status").asText()),
                PrecedenceTier.fromString(doc.path("tier").asText()),
                doc.path("confidence").asDouble(),
                strings(detection.path("signals")),
                strings(detection.path("hints")),
                strings(ontology.path("entities")),
                strings(ontology.path("relations")),
                ontology.path("scope").asText(""),
                strings(doc.path("logic").path("constraints")),
                transforms,
                new DecisionRule(
                        DecisionMode.fromString(rule.path("mode").asText()),
                        rule.path("min_confidence").asDouble(0.0),
                        rule.path("text").asText("")),
                new DetectorSpec(DetectorKind.fromString(detector.path("kind").asText()), params),
                new Footprint(strings(footprint.path("include")), strings(footprint.path("exclude"))),
                predicates,
                source);
    }

    private static List<String> strings(JsonNode node) {
        var result = new ArrayList<String>();
        if (node != null && node.isArray()) {
            node.forEach(n -> result.add(n.asText()));
        }
        return result;
    }
}
