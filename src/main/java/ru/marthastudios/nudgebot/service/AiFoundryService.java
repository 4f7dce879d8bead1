package ru.marthastudios.nudgebot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.marthastudios.nudgebot.api.AiFoundryApi;
import ru.marthastudios.nudgebot.dto.ai.ChatRequestDto;
import ru.marthastudios.nudgebot.pojo.AiFollowUpResponse;
import ru.marthastudios.nudgebot.pojo.AiUserMatchResult;
import ru.marthastudios.nudgebot.pojo.EnrichedUserInfo;
import ru.marthastudios.nudgebot.property.AiProperty;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Azure AI Foundry calls: smart group member matching and follow-up chat answers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AiFoundryService {
    static final String NO_ANSWER_RESPONSE = "I'm sorry, I couldn't process your message. Please try again.";
    static final String ERROR_RESPONSE = "I apologize, but I'm having trouble responding right now. Please try again later.";

    private static final int FOLLOW_UP_MAX_TOKENS = 500;
    private static final double FOLLOW_UP_TEMPERATURE = 0.7;
    private static final int END_DETECTION_MAX_LENGTH = 50;
    private static final double DEFAULT_CONFIDENCE = 0.5;
    private static final List<String> END_INDICATORS = List.of(
            "thank", "thanks", "got it", "ok", "okay", "understood",
            "bye", "goodbye", "cheers", "perfect", "great", "awesome");

    private static final String SMART_GROUP_SYSTEM_PROMPT =
            "You are an AI assistant that helps match users to group criteria based on their profile data.\n"
            + "\n"
            + "Current date: %s\n"
            + "\n"
            + "You will receive:\n"
            + "1. A description of the target user group\n"
            + "2. A list of users with their metadata (name, department, job title, location, company, manager, employee type)\n"
            + "\n"
            + "Your task is to identify which users match the group description and return them with confidence scores.\n"
            + "\n"
            + "MATCHING RULES:\n"
            + "- Only include users that genuinely match ALL specified criteria\n"
            + "- Confidence score should be between 0.0 and 1.0 (1.0 = perfect match)\n"
            + "- Include a brief reason explaining why the user matches (reference specific attributes)\n"
            + "- If no users match, return an empty array\n"
            + "\n"
            + "Return your response as a JSON array in this exact format:\n"
            + "[\n"
            + "  {\"upn\": \"user@example.com\", \"confidence\": 0.95, \"reason\": \"Matches because...\"},\n"
            + "  ...\n"
            + "]\n"
            + "\n"
            + "Only return the JSON array, no other text.";

    private final AiFoundryApi aiFoundryApi;
    private final AiProperty aiProperty;
    private final SettingsService settingsService;
    private final ObjectMapper objectMapper;

    public boolean isEnabled() {
        return aiProperty.isConfigured();
    }

    public List<AiUserMatchResult> resolveSmartGroupMembers(String groupDescription, List<EnrichedUserInfo> availableUsers) {
        if (!isEnabled()) {
            throw new IllegalStateException("AI Foundry is not configured. Copilot Connected mode is disabled.");
        }

        log.info("Resolving smart group '{}' against {} users", groupDescription, availableUsers.size());

        if (availableUsers.isEmpty()) {
            log.warn("No users provided for smart group resolution");
            return new ArrayList<>();
        }

        StringBuilder userListText = new StringBuilder();

        for (int i = 0; i < availableUsers.size(); i++) {
            if (i > 0) {
                userListText.append('\n');
            }

            userListText.append(i + 1).append(". ").append(availableUsers.get(i).toAiSummary());
        }

        String systemPrompt = String.format(SMART_GROUP_SYSTEM_PROMPT, LocalDate.now(ZoneOffset.UTC));
        String userPrompt = "Group Description: " + groupDescription + "\n\n"
                + "Available Users:\n" + userListText + "\n\n"
                + "Which users match the group description? Return as JSON array.";

        log.debug("System prompt: {}", systemPrompt);
        log.debug("User prompt: {}", userPrompt);

        ChatRequestDto chatRequestDto = ChatRequestDto.builder()
                .messages(List.of(
                        new ChatRequestDto.Message(ChatRequestDto.Message.SYSTEM_ROLE, systemPrompt),
                        new ChatRequestDto.Message(ChatRequestDto.Message.USER_ROLE, userPrompt)))
                .maxTokens(aiProperty.getMaxTokens())
                .temperature((double) aiProperty.getParsedTemperature())
                .build();

        String responseText;

        try {
            responseText = aiFoundryApi.createChatCompletionText(chatRequestDto);
        } catch (RuntimeException e) {
            log.error("Error calling AI Foundry for smart group resolution", e);
            throw e;
        }

        if (responseText == null) {
            return new ArrayList<>();
        }

        log.debug("AI response: {}", responseText);

        List<AiUserMatchResult> results = parseUserMatchResponse(responseText, availableUsers);

        log.info("AI matched {} users for smart group", results.size());

        return results;
    }

    public AiFollowUpResponse handleFollowUpChat(String userUpn, String userMessage, String originalNudgeContext,
                                                 List<ChatRequestDto.Message> conversationHistory) {
        log.info("Handling follow-up chat from {}: {}...", userUpn, userMessage.substring(0, Math.min(50, userMessage.length())));

        String systemPrompt = getFollowUpChatSystemPrompt();

        if (originalNudgeContext != null && !originalNudgeContext.isEmpty()) {
            systemPrompt += "\n\nThe original nudge message context was about: " + originalNudgeContext;
        }

        try {
            List<ChatRequestDto.Message> messages = new ArrayList<>();

            messages.add(new ChatRequestDto.Message(ChatRequestDto.Message.SYSTEM_ROLE, systemPrompt));

            if (conversationHistory != null) {
                for (ChatRequestDto.Message message : conversationHistory) {
                    if (ChatRequestDto.Message.USER_ROLE.equalsIgnoreCase(message.getRole())) {
                        messages.add(new ChatRequestDto.Message(ChatRequestDto.Message.USER_ROLE, message.getContent()));
                    } else if (ChatRequestDto.Message.ASSISTANT_ROLE.equalsIgnoreCase(message.getRole())) {
                        messages.add(new ChatRequestDto.Message(ChatRequestDto.Message.ASSISTANT_ROLE, message.getContent()));
                    }
                }
            }

            messages.add(new ChatRequestDto.Message(ChatRequestDto.Message.USER_ROLE, userMessage));

            ChatRequestDto chatRequestDto = ChatRequestDto.builder()
                    .messages(messages)
                    .maxTokens(FOLLOW_UP_MAX_TOKENS)
                    .temperature(FOLLOW_UP_TEMPERATURE)
                    .build();

            String responseText = aiFoundryApi.createChatCompletionText(chatRequestDto);

            if (responseText != null) {
                return new AiFollowUpResponse(responseText, detectConversationEnd(userMessage));
            }

            return new AiFollowUpResponse(NO_ANSWER_RESPONSE, false);
        } catch (Exception e) {
            log.error("Error handling follow-up chat via AI Foundry", e);

            return new AiFollowUpResponse(ERROR_RESPONSE, true);
        }
    }

    List<AiUserMatchResult> parseUserMatchResponse(String responseText, List<EnrichedUserInfo> availableUsers) {
        List<AiUserMatchResult> results = new ArrayList<>();

        JsonNode jsonResults;

        try {
            jsonResults = objectMapper.readTree(stripCodeFences(responseText));
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse AI response as JSON: {}", responseText, e);
            return results;
        }

        if (jsonResults == null || !jsonResults.isArray()) {
            log.warn("AI response is not a JSON array: {}", responseText);
            return results;
        }

        Map<String, EnrichedUserInfo> upnLookup = new HashMap<>();

        for (EnrichedUserInfo user : availableUsers) {
            upnLookup.putIfAbsent(user.getUserPrincipalName().toLowerCase(Locale.ROOT), user);
        }

        for (JsonNode item : jsonResults) {
            String upn = item.path("upn").asText(null);

            if (upn == null) {
                continue;
            }

            EnrichedUserInfo user = upnLookup.get(upn.toLowerCase(Locale.ROOT));

            if (user == null) {
                continue;
            }

            JsonNode confidence = item.get("confidence");
            JsonNode reason = item.get("reason");

            results.add(AiUserMatchResult.builder()
                    .userPrincipalName(user.getUserPrincipalName())
                    .confidenceScore(confidence != null && confidence.isNumber() ? confidence.asDouble() : DEFAULT_CONFIDENCE)
                    .reason(reason != null && !reason.isNull() ? reason.asText() : null)
                    .build());
        }

        return results;
    }

    static String stripCodeFences(String responseText) {
        String cleaned = responseText.trim();

        if (!cleaned.startsWith("```")) {
            return cleaned;
        }

        List<String> lines = new ArrayList<>(Arrays.asList(cleaned.split("\n")));

        lines.remove(0);

        if (!lines.isEmpty() && lines.get(lines.size() - 1).trim().startsWith("```")) {
            lines.remove(lines.size() - 1);
        }

        return String.join("\n", lines);
    }

    static boolean detectConversationEnd(String userMessage) {
        if (userMessage.length() >= END_DETECTION_MAX_LENGTH) {
            return false;
        }

        String userLower = userMessage.toLowerCase(Locale.ROOT);

        return END_INDICATORS.stream().anyMatch(userLower::contains);
    }

    private String getFollowUpChatSystemPrompt() {
        try {
            return settingsService.getEffectiveFollowUpChatSystemPrompt();
        } catch (Exception e) {
            log.warn("Failed to load custom system prompt, using default", e);

            return SettingsService.DEFAULT_FOLLOW_UP_CHAT_SYSTEM_PROMPT;
        }
    }
}
