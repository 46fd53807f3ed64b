package com.trialstruct.service.structure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trialstruct.model.tree.FieldMapping;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonReferenceSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Logic Detection Service
 *
 * Asks a structured-reasoning model how a criterion's field mappings are
 * combined (AND / OR / NOT) and returns the proposed tree only after it
 * passes {@link LogicTreeValidator}.
 *
 * Returns empty, and the caller falls back to a flat AND, when:
 * - there are fewer than two field mappings
 * - no chat model is configured
 * - the call fails, times out or returns unparseable output
 * - the proposed tree fails index validation
 */
@Slf4j
@Service
public class LogicDetectionService {

    private static final String NODE_DEFINITION = "logic_node";

    private static final String SYSTEM_PROMPT =
        "You are a clinical trial protocol analyst. Analyze the logical structure of eligibility criteria.";

    static final JsonSchema RESPONSE_SCHEMA = buildResponseSchema();

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final String modelName;

    @Autowired
    public LogicDetectionService(
            ObjectProvider<ChatModel> chatModelProvider,
            ObjectMapper objectMapper,
            @Value("${structure.llm.model-name:gpt-4o-mini}") String modelName) {
        this(chatModelProvider.getIfAvailable(), objectMapper, modelName);
    }

    public LogicDetectionService(ChatModel chatModel, ObjectMapper objectMapper, String modelName) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.modelName = modelName;
    }

    /**
     * Model identifier recorded on trees built from a detected structure.
     */
    public String getModelName() {
        return modelName;
    }

    public Optional<LogicDetectionResponse> detect(String criterionText, List<FieldMapping> fieldMappings) {
        if (fieldMappings == null || fieldMappings.size() <= 1) {
            return Optional.empty();
        }
        if (chatModel == null) {
            log.warn("No chat model configured, skipping logic detection for '{}'", abbreviate(criterionText));
            return Optional.empty();
        }

        try {
            String prompt = buildPrompt(criterionText, fieldMappings);
            log.debug("Logic detection prompt:\n{}", prompt);

            ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(prompt))
                .responseFormat(ResponseFormat.builder()
                    .type(ResponseFormatType.JSON)
                    .jsonSchema(RESPONSE_SCHEMA)
                    .build())
                .build();

            ChatResponse response = chatModel.chat(request);
            String text = response != null && response.aiMessage() != null ? response.aiMessage().text() : null;
            if (text == null || text.isBlank()) {
                log.warn("Logic detection returned no content for '{}'", abbreviate(criterionText));
                return Optional.empty();
            }

            LogicDetectionResponse detected = objectMapper.readValue(stripCodeFence(text), LogicDetectionResponse.class);
            if (detected == null || !LogicTreeValidator.isValid(detected.root(), fieldMappings.size())) {
                log.warn("Logic tree validation failed for '{}', invalid or incomplete indices",
                    abbreviate(criterionText));
                return Optional.empty();
            }
            return Optional.of(detected);

        } catch (Exception e) {
            log.warn("Logic detection failed for '{}': {}", abbreviate(criterionText), e.getMessage(), e);
            return Optional.empty();
        }
    }

    String buildPrompt(String criterionText, List<FieldMapping> fieldMappings) {
        StringBuilder mappings = new StringBuilder();
        for (int i = 0; i < fieldMappings.size(); i++) {
            FieldMapping fm = fieldMappings.get(i);
            mappings.append("  [").append(i).append("] ")
                .append(orPlaceholder(fm.entity())).append(' ')
                .append(orPlaceholder(fm.relation())).append(' ')
                .append(orPlaceholder(fm.value()));
            if (fm.unit() != null && !fm.unit().isBlank()) {
                mappings.append(' ').append(fm.unit());
            }
            mappings.append('\n');
        }

        return String.format("""
            Criterion text: %s

            Field mappings (indexed):
            %s
            Instructions:
            - Determine how the field mappings are logically connected
            - Use AND when all conditions must be met simultaneously
            - Use OR when any one condition suffices
            - Use NOT to negate a condition
            - Use ATOMIC for leaf nodes that reference a single field_mapping by index
            - Return a tree where the root is AND, OR, NOT, or ATOMIC
            - Every ATOMIC node must have field_mapping_index set to a valid index (0 to %d)
            - Each field_mapping index must appear exactly once
            """, criterionText, mappings, fieldMappings.size() - 1);
    }

    private static JsonSchema buildResponseSchema() {
        JsonObjectSchema node = JsonObjectSchema.builder()
            .description("Node of the logic tree")
            .addProperty("node_type", JsonEnumSchema.builder()
                .enumValues("ATOMIC", "AND", "OR", "NOT")
                .description("Logic operator, or ATOMIC for a leaf referencing one field mapping")
                .build())
            .addProperty("field_mapping_index", JsonIntegerSchema.builder()
                .description("0-based index into the field mappings; ATOMIC nodes only")
                .build())
            .addProperty("children", JsonArraySchema.builder()
                .description("Child nodes for AND/OR/NOT; omitted for ATOMIC")
                .items(JsonReferenceSchema.builder().reference(NODE_DEFINITION).build())
                .build())
            .required("node_type")
            .build();

        return JsonSchema.builder()
            .name("LogicDetectionResponse")
            .rootElement(JsonObjectSchema.builder()
                .addProperty("root", JsonReferenceSchema.builder().reference(NODE_DEFINITION).build())
                .addStringProperty("reasoning", "Explanation of the detected logical structure")
                .required("root")
                .definitions(Map.of(NODE_DEFINITION, node))
                .build())
            .build();
    }

    private static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }

    private static String orPlaceholder(String text) {
        return text != null ? text : "?";
    }

    static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 50 ? text : text.substring(0, 50);
    }
}
