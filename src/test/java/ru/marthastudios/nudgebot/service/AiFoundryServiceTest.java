package ru.marthastudios.nudgebot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import ru.marthastudios.nudgebot.api.AiFoundryApi;
import ru.marthastudios.nudgebot.dto.ai.ChatRequestDto;
import ru.marthastudios.nudgebot.pojo.AiFollowUpResponse;
import ru.marthastudios.nudgebot.pojo.AiUserMatchResult;
import ru.marthastudios.nudgebot.pojo.EnrichedUserInfo;
import ru.marthastudios.nudgebot.property.AiProperty;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AiFoundryServiceTest {
    private AiFoundryApi aiFoundryApi;
    private AiProperty aiProperty;
    private SettingsService settingsService;
    private AiFoundryService aiFoundryService;

    private final List<EnrichedUserInfo> users = List.of(
            EnrichedUserInfo.builder().userPrincipalName("Alice@Contoso.com").displayName("Alice").department("Sales").build(),
            EnrichedUserInfo.builder().userPrincipalName("bob@contoso.com").displayName("Bob").department("Finance").build());

    @BeforeEach
    void setUp() {
        aiFoundryApi = mock(AiFoundryApi.class);
        settingsService = mock(SettingsService.class);

        aiProperty = new AiProperty();
        aiProperty.setEndpoint("https://contoso.openai.azure.com/");
        aiProperty.setDeploymentName("gpt-4o");
        aiProperty.setApiKey("key");
        aiProperty.setMaxTokens(2000);
        aiProperty.setTemperature("0.3");

        aiFoundryService = new AiFoundryService(aiFoundryApi, aiProperty, settingsService, new ObjectMapper());
    }

    @Test
    void parsesMatchesInsideCodeFences() {
        String response = "```json\n"
                + "[{\"upn\": \"alice@contoso.com\", \"confidence\": 0.9, \"reason\": \"Works in Sales\"}]\n"
                + "```";

        List<AiUserMatchResult> results = aiFoundryService.parseUserMatchResponse(response, users);

        assertEquals(1, results.size());
        assertEquals("Alice@Contoso.com", results.get(0).getUserPrincipalName());
        assertEquals(0.9, results.get(0).getConfidenceScore());
        assertEquals("Works in Sales", results.get(0).getReason());
    }

    @Test
    void unknownUpnsAreDroppedAndConfidenceDefaults() {
        String response = "[{\"upn\": \"mallory@evil.com\", \"confidence\": 1.0},"
                + " {\"upn\": \"bob@contoso.com\"},"
                + " {\"confidence\": 0.4}]";

        List<AiUserMatchResult> results = aiFoundryService.parseUserMatchResponse(response, users);

        assertEquals(1, results.size());
        assertEquals("bob@contoso.com", results.get(0).getUserPrincipalName());
        assertEquals(0.5, results.get(0).getConfidenceScore());
        assertNull(results.get(0).getReason());
    }

    @Test
    void duplicateUpnsResolveToFirstUser() {
        List<EnrichedUserInfo> duplicated = new ArrayList<>(users);
        duplicated.add(EnrichedUserInfo.builder().userPrincipalName("alice@contoso.com").displayName("Alice 2").build());

        List<AiUserMatchResult> results = aiFoundryService.parseUserMatchResponse("[{\"upn\": \"ALICE@contoso.com\"}]", duplicated);

        assertEquals("Alice@Contoso.com", results.get(0).getUserPrincipalName());
    }

    @Test
    void unparsableResponseGivesEmptyList() {
        assertTrue(aiFoundryService.parseUserMatchResponse("Sorry, I can't help with that.", users).isEmpty());
        assertTrue(aiFoundryService.parseUserMatchResponse("{\"upn\": \"bob@contoso.com\"}", users).isEmpty());
    }

    @Test
    void resolveSmartGroupMembersSendsUserSummaries() {
        when(aiFoundryApi.createChatCompletionText(any())).thenReturn("[{\"upn\": \"bob@contoso.com\", \"confidence\": 0.8}]");

        List<AiUserMatchResult> results = aiFoundryService.resolveSmartGroupMembers("Finance people", users);

        assertEquals(1, results.size());

        ArgumentCaptor<ChatRequestDto> captor = ArgumentCaptor.forClass(ChatRequestDto.class);

        verify(aiFoundryApi).createChatCompletionText(captor.capture());

        ChatRequestDto request = captor.getValue();

        assertEquals(2000, request.getMaxTokens());
        assertEquals(0.3, request.getTemperature(), 0.0001);
        assertEquals(ChatRequestDto.Message.SYSTEM_ROLE, request.getMessages().get(0).getRole());

        String userPrompt = request.getMessages().get(1).getContent();

        assertTrue(userPrompt.contains("Group Description: Finance people"));
        assertTrue(userPrompt.contains("2. UPN: bob@contoso.com | Name: Bob | Department: Finance"));
    }

    @Test
    void resolveSmartGroupMembersRequiresConfiguration() {
        aiProperty.setApiKey("");

        assertFalse(aiFoundryService.isEnabled());
        assertThrows(IllegalStateException.class, () -> aiFoundryService.resolveSmartGroupMembers("anyone", users));
    }

    @Test
    void resolveSmartGroupMembersWithNoUsersSkipsModel() {
        assertTrue(aiFoundryService.resolveSmartGroupMembers("anyone", List.of()).isEmpty());
        verifyNoInteractions(aiFoundryApi);
    }

    @Test
    void followUpChatIncludesPromptContextAndHistory() {
        when(settingsService.getEffectiveFollowUpChatSystemPrompt()).thenReturn("Custom prompt");
        when(aiFoundryApi.createChatCompletionText(any())).thenReturn("Here's how.");

        List<ChatRequestDto.Message> history = List.of(
                new ChatRequestDto.Message(ChatRequestDto.Message.USER_ROLE, "earlier question"),
                new ChatRequestDto.Message(ChatRequestDto.Message.ASSISTANT_ROLE, "earlier answer"),
                new ChatRequestDto.Message("tool", "ignored"));

        AiFollowUpResponse response = aiFoundryService.handleFollowUpChat("alice@contoso.com", "How do I start?", "Copilot tips", history);

        assertEquals("Here's how.", response.getResponse());
        assertFalse(response.isShouldEndConversation());

        ArgumentCaptor<ChatRequestDto> captor = ArgumentCaptor.forClass(ChatRequestDto.class);

        verify(aiFoundryApi).createChatCompletionText(captor.capture());

        List<ChatRequestDto.Message> messages = captor.getValue().getMessages();

        assertEquals(4, messages.size());
        assertTrue(messages.get(0).getContent().startsWith("Custom prompt"));
        assertTrue(messages.get(0).getContent().contains("Copilot tips"));
        assertEquals("How do I start?", messages.get(3).getContent());
        assertEquals(500, captor.getValue().getMaxTokens());
    }

    @Test
    void followUpChatEndsOnShortThanks() {
        when(settingsService.getEffectiveFollowUpChatSystemPrompt()).thenReturn("prompt");
        when(aiFoundryApi.createChatCompletionText(any())).thenReturn("You're welcome!");

        assertTrue(aiFoundryService.handleFollowUpChat("alice@contoso.com", "Thanks!", null, null).isShouldEndConversation());
    }

    @Test
    void followUpChatErrorApologisesAndEnds() {
        when(settingsService.getEffectiveFollowUpChatSystemPrompt()).thenReturn("prompt");
        when(aiFoundryApi.createChatCompletionText(any())).thenThrow(new IllegalStateException("429"));

        AiFollowUpResponse response = aiFoundryService.handleFollowUpChat("alice@contoso.com", "help", null, null);

        assertEquals(AiFoundryService.ERROR_RESPONSE, response.getResponse());
        assertTrue(response.isShouldEndConversation());
    }

    @Test
    void followUpChatWithoutAnswer() {
        when(settingsService.getEffectiveFollowUpChatSystemPrompt()).thenReturn("prompt");
        when(aiFoundryApi.createChatCompletionText(any())).thenReturn(null);

        AiFollowUpResponse response = aiFoundryService.handleFollowUpChat("alice@contoso.com", "thanks", null, null);

        assertEquals(AiFoundryService.NO_ANSWER_RESPONSE, response.getResponse());
        assertFalse(response.isShouldEndConversation());
    }

    @Test
    void conversationEndNeedsShortMessage() {
        assertTrue(AiFoundryService.detectConversationEnd("ok got it"));
        assertFalse(AiFoundryService.detectConversationEnd("Thanks, but can you explain how Copilot handles my meeting notes?"));
        assertFalse(AiFoundryService.detectConversationEnd("What is this?"));
    }

    @Test
    void stripCodeFencesLeavesPlainJsonAlone() {
        assertEquals("[]", AiFoundryService.stripCodeFences("  []  "));
        assertEquals("[1]", AiFoundryService.stripCodeFences("```\n[1]\n```"));
    }
}
