package com.memory.graph.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memory.graph.core.NameNormalizer;
import com.memory.graph.core.model.EntityKind;
import com.memory.graph.core.model.Relation;
import com.memory.graph.provider.ProviderErrorKind;
import com.memory.graph.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates raw provider output and turns it into typed candidates.
 *
 * <p>Markdown code fences and any prose around the outermost JSON object are tolerated. The
 * object itself must carry an {@code entities} and a {@code relations} array; every entity
 * needs a name and a known kind, and every relation must connect two extracted entities.
 * Any mismatch is reported as {@link ProviderErrorKind#INVALID_RESPONSE}: nothing is dropped
 * silently.</p>
 */
public class ExtractionOutputParser {
    private static final Logger log = LoggerFactory.getLogger(ExtractionOutputParser.class);

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final Pattern NON_KIND_CHARS = Pattern.compile("[^A-Z0-9]+");

    private static final List<String> ENTITY_KIND_FIELDS = List.of("kind", "type", "entity_type");
    private static final List<String> ENTITY_LABEL_FIELDS = List.of("system_labels", "labels");
    private static final List<String> RELATION_KIND_FIELDS = List.of("kind", "relationType", "relation_type", "type");

    private final ObjectMapper objectMapper;

    public ExtractionOutputParser() {
        this(new ObjectMapper());
    }

    public ExtractionOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedExtraction parse(String raw) throws ProviderException {
        JsonNode root = readRoot(raw);

        JsonNode entityNodes = root.get("entities");
        JsonNode relationNodes = root.get("relations");
        if (entityNodes == null || !entityNodes.isArray()) {
            throw invalid("missing 'entities' array");
        }
        if (relationNodes == null || !relationNodes.isArray()) {
            throw invalid("missing 'relations' array");
        }

        List<CandidateEntity> entities = new ArrayList<>();
        Set<String> knownNames = new HashSet<>();
        int index = 0;
        for (JsonNode node : entityNodes) {
            CandidateEntity entity = readEntity(node, index++);
            entities.add(entity);
            knownNames.add(NameNormalizer.normalize(entity.name()));
        }

        List<CandidateRelation> relations = new ArrayList<>();
        index = 0;
        for (JsonNode node : relationNodes) {
            CandidateRelation relation = readRelation(node, index++);
            if (!knownNames.contains(NameNormalizer.normalize(relation.source()))) {
                throw invalid("relation " + (index - 1) + " references unknown source '" + relation.source() + "'");
            }
            if (!knownNames.contains(NameNormalizer.normalize(relation.target()))) {
                throw invalid("relation " + (index - 1) + " references unknown target '" + relation.target() + "'");
            }
            relations.add(relation);
        }

        log.debug("extraction.parsed entities={} relations={}", entities.size(), relations.size());
        return new ParsedExtraction(entities, relations);
    }

    /**
     * Normalizes a relation kind such as {@code "works at"} to {@code WORKS_AT}.
     *
     * @return the normalized kind, or empty if nothing usable remains
     */
    public static Optional<String> normalizeRelationKind(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        String upper = NON_KIND_CHARS.matcher(kind.trim().toUpperCase(Locale.ROOT)).replaceAll("_");
        String trimmed = upper.replaceAll("^_+|_+$", "");
        if (trimmed.isEmpty() || !Relation.KIND_PATTERN.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(trimmed);
    }

    private JsonNode readRoot(String raw) throws ProviderException {
        if (raw == null || raw.isBlank()) {
            throw invalid("empty output");
        }
        String candidate = raw.strip();
        Matcher fence = CODE_FENCE.matcher(candidate);
        if (fence.find()) {
            candidate = fence.group(1);
        }
        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw invalid("no JSON object found");
        }
        try {
            JsonNode root = objectMapper.readTree(candidate.substring(start, end + 1));
            if (root == null || !root.isObject()) {
                throw invalid("top-level value is not an object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw invalid("malformed JSON: " + e.getOriginalMessage());
        }
    }

    private CandidateEntity readEntity(JsonNode node, int index) throws ProviderException {
        if (!node.isObject()) {
            throw invalid("entity " + index + " is not an object");
        }
        String name = text(node, "name");
        if (name == null) {
            throw invalid("entity " + index + " has no name");
        }
        String kindValue = firstText(node, ENTITY_KIND_FIELDS) != null
                ? firstText(node, ENTITY_KIND_FIELDS)
                : firstLabel(node);
        if (kindValue == null) {
            throw invalid("entity '" + name + "' has no kind");
        }
        EntityKind kind = EntityKind.parse(kindValue)
                .filter(EntityKind::isExtractable)
                .orElseThrow(() -> invalid("entity '" + name + "' has unsupported kind '" + kindValue + "'"));
        return new CandidateEntity(name.strip(), kind, text(node, "summary"));
    }

    private CandidateRelation readRelation(JsonNode node, int index) throws ProviderException {
        if (!node.isObject()) {
            throw invalid("relation " + index + " is not an object");
        }
        String source = text(node, "source") != null ? text(node, "source") : text(node, "from");
        String target = text(node, "target") != null ? text(node, "target") : text(node, "to");
        if (source == null || target == null) {
            throw invalid("relation " + index + " is missing an endpoint");
        }
        String rawKind = firstText(node, RELATION_KIND_FIELDS);
        String kind = normalizeRelationKind(rawKind)
                .orElseThrow(() -> invalid("relation " + index + " has invalid kind '" + rawKind + "'"));

        Double confidence = null;
        JsonNode confidenceNode = node.get("confidence");
        if (confidenceNode != null && !confidenceNode.isNull()) {
            if (!confidenceNode.isNumber()) {
                throw invalid("relation " + index + " has non-numeric confidence");
            }
            confidence = confidenceNode.asDouble();
            if (confidence < 0.0 || confidence > 1.0) {
                throw invalid("relation " + index + " has confidence outside [0, 1]: " + confidence);
            }
        }
        return new CandidateRelation(source.strip(), target.strip(), kind, confidence);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static String firstText(JsonNode node, List<String> fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String firstLabel(JsonNode node) {
        for (String field : ENTITY_LABEL_FIELDS) {
            JsonNode labels = node.get(field);
            if (labels != null && labels.isArray() && labels.size() > 0 && labels.get(0).isTextual()) {
                return labels.get(0).asText();
            }
        }
        return null;
    }

    private static ProviderException invalid(String detail) {
        return new ProviderException(ProviderErrorKind.INVALID_RESPONSE, "Invalid extraction output: " + detail);
    }
}
