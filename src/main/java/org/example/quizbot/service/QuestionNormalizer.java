package org.example.quizbot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.example.quizbot.model.Question;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps provider payloads into {@link Question}s. Accepts a bare question object, an object
 * wrapping a list of questions, or a top-level list. Invalid items are dropped individually.
 */
@Component
public class QuestionNormalizer {

    private static final Logger log = LoggerFactory.getLogger(QuestionNormalizer.class);

    private static final List<String> TEXT_KEYS = List.of("text", "question", "pergunta");
    private static final List<String> OPTIONS_KEYS = List.of("options", "opcoes");
    private static final List<String> CORRECT_KEYS = List.of("correctIndex", "correct", "correta");
    private static final List<String> EXPLANATION_KEYS = List.of("explanation", "comentario");
    private static final List<String> TOPIC_KEYS = List.of("topic", "topico");
    private static final Pattern NUMERIC = Pattern.compile("-?\\d{1,9}");
    private static final List<String> PREFERRED_LIST_KEYS = List.of("result", "questions", "questoes", "items", "data");

    public List<Question> normalize(JsonNode raw, String defaultTopic) {
        JsonNode items = unwrap(raw);
        if (items == null) {
            return List.of();
        }

        List<Question> questions = new ArrayList<>();
        int dropped = 0;
        for (JsonNode item : items) {
            Optional<Question> question = toQuestion(item, defaultTopic);
            if (question.isPresent()) {
                questions.add(question.get());
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} malformed question item(s) from provider payload", dropped);
        }
        return questions;
    }

    private JsonNode unwrap(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return null;
        }
        if (raw.isArray()) {
            return raw;
        }
        if (!raw.isObject()) {
            return null;
        }
        if (hasRequiredKeys(raw)) {
            return JsonNodeFactory.instance.arrayNode().add(raw);
        }
        for (String key : PREFERRED_LIST_KEYS) {
            JsonNode candidate = raw.get(key);
            if (candidate != null && candidate.isArray()) {
                return candidate;
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
        while (fields.hasNext()) {
            JsonNode candidate = fields.next().getValue();
            if (candidate.isArray()) {
                return candidate;
            }
        }
        return null;
    }

    private Optional<Question> toQuestion(JsonNode item, String defaultTopic) {
        if (item == null || !item.isObject() || !hasRequiredKeys(item)) {
            return Optional.empty();
        }

        String text = firstPresent(item, TEXT_KEYS)
                .filter(QuestionNormalizer::isScalar)
                .map(JsonNode::asText)
                .orElse("")
                .trim();
        if (text.isBlank()) {
            return Optional.empty();
        }

        JsonNode optionsNode = firstPresent(item, OPTIONS_KEYS).orElse(null);
        if (optionsNode == null || !optionsNode.isArray() || optionsNode.size() < 2) {
            return Optional.empty();
        }
        List<String> options = new ArrayList<>();
        for (JsonNode option : optionsNode) {
            if (!isScalar(option)) {
                return Optional.empty();
            }
            options.add(option.asText());
        }

        JsonNode correctNode = firstPresent(item, CORRECT_KEYS).orElse(null);
        int correctIndex = resolveCorrectIndex(correctNode, options);
        if (correctIndex < 0) {
            return Optional.empty();
        }

        String explanation = firstPresent(item, EXPLANATION_KEYS)
                .filter(node -> !node.isNull())
                .map(JsonNode::asText)
                .orElse("");
        String topic = firstPresent(item, TOPIC_KEYS)
                .filter(node -> !node.isNull())
                .map(JsonNode::asText)
                .map(String::trim)
                .filter(value -> !value.isBlank())
                .orElse(defaultTopic == null || defaultTopic.isBlank() ? Question.DEFAULT_TOPIC : defaultTopic);

        return Optional.of(new Question(text, options, correctIndex, explanation, topic));
    }

    /**
     * The answer arrives either as an index (number or numeric string) or as the literal option text.
     * A numeric string that is not a valid index is still tried as option text.
     *
     * @return resolved index, or -1 when it cannot be resolved
     */
    int resolveCorrectIndex(JsonNode correctNode, List<String> options) {
        if (correctNode == null || correctNode.isNull()) {
            return -1;
        }
        if (correctNode.isIntegralNumber()) {
            return correctNode.canConvertToInt() ? inRange(correctNode.intValue(), options) : -1;
        }
        if (correctNode.isNumber()) {
            double value = correctNode.asDouble();
            if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                return -1;
            }
            return inRange((int) value, options);
        }
        if (!correctNode.isValueNode()) {
            return -1;
        }

        String literal = correctNode.asText().trim();
        if (literal.isEmpty()) {
            return -1;
        }
        if (NUMERIC.matcher(literal).matches()) {
            int index = inRange(Integer.parseInt(literal), options);
            if (index >= 0) {
                return index;
            }
        }
        for (int i = 0; i < options.size(); i++) {
            if (options.get(i).trim().equals(literal)) {
                return i;
            }
        }
        for (int i = 0; i < options.size(); i++) {
            if (options.get(i).trim().equalsIgnoreCase(literal)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isScalar(JsonNode node) {
        return node != null && node.isValueNode() && !node.isNull();
    }

    private int inRange(int index, List<String> options) {
        return index >= 0 && index < options.size() ? index : -1;
    }

    private boolean hasRequiredKeys(JsonNode node) {
        return firstPresent(node, TEXT_KEYS).isPresent()
                && firstPresent(node, OPTIONS_KEYS).isPresent()
                && firstPresent(node, CORRECT_KEYS).isPresent();
    }

    private Optional<JsonNode> firstPresent(JsonNode node, List<String> keys) {
        for (String key : keys) {
            if (node.has(key)) {
                return Optional.of(node.get(key));
            }
        }
        return Optional.empty();
    }
}
