package com.memory.graph.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.memory.graph.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic, rule-based extractor with no I/O.
 *
 * <p>Capitalized phrases become entities; their kind is inferred from name suffixes, a small
 * gazetteer and the preceding words. Within a sentence the first entity is treated as the
 * subject and is related to each later entity using the closest keyword between them
 * ("met", "visited", "works at", "in", ...).</p>
 *
 * <p>This provider is also the fallback when a model-backed provider fails.</p>
 */
public class LocalHeuristicProvider implements ExtractionProvider {
    private static final Logger log = LoggerFactory.getLogger(LocalHeuristicProvider.class);

    public static final String PROVIDER_NAME = "local-heuristic";
    static final double HEURISTIC_CONFIDENCE = 0.5;
    private static final int MAX_SUMMARY_LENGTH = 280;

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\R+");
    private static final Pattern CAPITALIZED_PHRASE = Pattern.compile("\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*\\b");

    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "he", "she", "it", "we", "i", "my", "me", "you", "they", "our", "their",
            "his", "her", "this", "that", "then", "today", "yesterday", "tomorrow", "mid", "first",
            "after", "before", "when", "later", "on", "in", "at", "and", "but",
            "january", "february", "march", "april", "may", "june", "july", "august",
            "september", "october", "november", "december",
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday");

    private static final Set<String> ORGANIZATION_SUFFIXES = Set.of(
            "inc", "corp", "corporation", "ltd", "llc", "labs", "company", "university", "college",
            "bank", "florist", "bakery", "school", "hospital", "group", "foundation", "agency");

    private static final Set<String> EVENT_SUFFIXES = Set.of(
            "festival", "conference", "party", "wedding", "summit", "concert", "meetup", "day");

    private static final Set<String> LOCATION_SUFFIXES = Set.of(
            "street", "avenue", "road", "park", "lake", "river", "junction", "station", "beach",
            "mountain", "city", "square", "bridge", "island", "valley");

    private static final Set<String> KNOWN_LOCATIONS = Set.of(
            "paris", "london", "berlin", "rome", "madrid", "lisbon", "tokyo", "new york", "boston",
            "chicago", "seattle", "san francisco", "los angeles", "amsterdam", "dublin", "vienna",
            "prague", "sydney", "toronto", "montreal", "france", "germany", "italy", "spain",
            "japan", "canada", "england", "ireland");

    private static final Pattern ORGANIZATION_CONTEXT = Pattern.compile(
            "\\b(?:works?|worked|working|employed|joined)\\s+(?:at|for|by)?\\s*(?:the\\s+)?$");
    private static final Pattern LOCATION_CONTEXT = Pattern.compile(
            "\\b(?:in|near|from|to|at|into|around|visited|visit|visiting)\\s+(?:the\\s+)?$");

    private static final List<RelationKeyword> RELATION_KEYWORDS = List.of(
            new RelationKeyword(Pattern.compile("\\b(?:works?|worked|working)\\s+(?:at|for)\\b"), "WORKS_AT"),
            new RelationKeyword(Pattern.compile("\\b(?:lives?|lived|living)\\s+in\\b"), "LIVES_IN"),
            new RelationKeyword(Pattern.compile("\\b(?:met|meets?|meeting)\\b"), "MET"),
            new RelationKeyword(Pattern.compile("\\b(?:visit|visits|visited|visiting)\\b"), "VISITED"),
            new RelationKeyword(Pattern.compile("\\b(?:knows?|knew)\\b"), "KNOWS"),
            new RelationKeyword(Pattern.compile("\\bmarried\\b"), "MARRIED"),
            new RelationKeyword(Pattern.compile("\\b(?:in|at)\\b"), "LOCATED_IN"));

    static final String DEFAULT_RELATION = "RELATED_TO";

    private final ObjectMapper objectMapper;

    public LocalHeuristicProvider() {
        this(new ObjectMapper());
    }

    public LocalHeuristicProvider(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String extract(String text, ProviderConfig config) {
        Map<String, Mention> entities = new LinkedHashMap<>();
        List<ObjectNode> relations = new ArrayList<>();
        Set<String> seenRelations = new HashSet<>();

        for (String sentence : SENTENCE_BOUNDARY.split(text == null ? "" : text.strip())) {
            String trimmed = sentence.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            List<Mention> mentions = findMentions(trimmed);
            for (Mention mention : mentions) {
                entities.putIfAbsent(mention.key(), mention);
            }
            addRelations(trimmed, mentions, relations, seenRelations);
        }

        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode entityArray = root.putArray("entities");
        for (Mention mention : entities.values()) {
            entityArray.addObject()
                    .put("name", mention.name())
                    .put("kind", mention.kind().name())
                    .put("summary", mention.summary());
        }
        ArrayNode relationArray = root.putArray("relations");
        relations.forEach(relationArray::add);

        log.debug("heuristic.extracted entities={} relations={}", entities.size(), relations.size());
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // tree nodes built above always serialize
            throw new IllegalStateException("Could not serialize heuristic extraction", e);
        }
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public ProviderKind getKind() {
        return ProviderKind.LOCAL;
    }

    private List<Mention> findMentions(String sentence) {
        List<Mention> mentions = new ArrayList<>();
        Matcher matcher = CAPITALIZED_PHRASE.matcher(sentence);
        while (matcher.find()) {
            String[] words = matcher.group().split("\\s+");
            int first = 0;
            while (first < words.length && STOPWORDS.contains(words[first].toLowerCase(Locale.ROOT))) {
                first++;
            }
            if (first == words.length) {
                continue;
            }
            String name = String.join(" ", Arrays.copyOfRange(words, first, words.length));
            int start = sentence.indexOf(name, matcher.start());
            String before = sentence.substring(0, start).toLowerCase(Locale.ROOT);
            EntityKind kind = inferKind(name, before);
            Mention mention = new Mention(name, kind, summarize(sentence), start, start + name.length());
            if (mentions.stream().noneMatch(m -> m.key().equals(mention.key()))) {
                mentions.add(mention);
            }
        }
        return mentions;
    }

    private EntityKind inferKind(String name, String textBefore) {
        String lower = name.toLowerCase(Locale.ROOT);
        String lastWord = lower.substring(lower.lastIndexOf(' ') + 1);
        if (ORGANIZATION_SUFFIXES.contains(lastWord)) {
            return EntityKind.ORGANIZATION;
        }
        if (EVENT_SUFFIXES.contains(lastWord)) {
            return EntityKind.EVENT;
        }
        if (KNOWN_LOCATIONS.contains(lower) || LOCATION_SUFFIXES.contains(lastWord)) {
            return EntityKind.LOCATION;
        }
        if (ORGANIZATION_CONTEXT.matcher(textBefore).find()) {
            return EntityKind.ORGANIZATION;
        }
        if (LOCATION_CONTEXT.matcher(textBefore).find()) {
            return EntityKind.LOCATION;
        }
        return EntityKind.PERSON;
    }

    private void addRelations(String sentence, List<Mention> mentions,
                              List<ObjectNode> relations, Set<String> seen) {
        if (mentions.size() < 2) {
            return;
        }
        Mention subject = mentions.get(0);
        for (Mention object : mentions.subList(1, mentions.size())) {
            if (object.start() < subject.end()) {
                continue;
            }
            String gap = sentence.substring(subject.end(), object.start()).toLowerCase(Locale.ROOT);
            String kind = relationKind(gap);
            String key = subject.key() + "|" + kind + "|" + object.key();
            if (seen.add(key)) {
                ObjectNode relation = objectMapper.createObjectNode()
                        .put("source", subject.name())
                        .put("target", object.name())
                        .put("kind", kind)
                        .put("confidence", HEURISTIC_CONFIDENCE);
                relations.add(relation);
            }
        }
    }

    /**
     * Picks the keyword that ends closest to the object; on a tie the longer phrase wins.
     */
    static String relationKind(String gap) {
        String best = DEFAULT_RELATION;
        int bestEnd = -1;
        int bestLength = -1;
        for (RelationKeyword keyword : RELATION_KEYWORDS) {
            Matcher matcher = keyword.pattern().matcher(gap);
            while (matcher.find()) {
                int length = matcher.end() - matcher.start();
                if (matcher.end() > bestEnd || (matcher.end() == bestEnd && length > bestLength)) {
                    best = keyword.kind();
                    bestEnd = matcher.end();
                    bestLength = length;
                }
            }
        }
        return best;
    }

    private static String summarize(String sentence) {
        return sentence.length() <= MAX_SUMMARY_LENGTH
                ? sentence
                : sentence.substring(0, MAX_SUMMARY_LENGTH - 3) + "...";
    }

    private record Mention(String name, EntityKind kind, String summary, int start, int end) {
        String key() {
            return kind.name() + ":" + name.toLowerCase(Locale.ROOT);
        }
    }

    private record RelationKeyword(Pattern pattern, String kind) {}
}
