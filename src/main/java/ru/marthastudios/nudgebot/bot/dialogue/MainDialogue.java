package ru.marthastudios.nudgebot.bot.dialogue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.marthastudios.nudgebot.bot.BotStateStore;
import ru.marthastudios.nudgebot.bot.TurnContext;
import ru.marthastudios.nudgebot.dto.ai.ChatRequestDto;
import ru.marthastudios.nudgebot.enums.DialogueTurnStatus;
import ru.marthastudios.nudgebot.pojo.AiFollowUpResponse;
import ru.marthastudios.nudgebot.pojo.BotUser;
import ru.marthastudios.nudgebot.pojo.CachedUserAndConversationData;
import ru.marthastudios.nudgebot.pojo.MainDialogueConvoState;
import ru.marthastudios.nudgebot.property.BotProperty;
import ru.marthastudios.nudgebot.service.AiFoundryService;
import ru.marthastudios.nudgebot.service.BotConversationCache;
import ru.marthastudios.nudgebot.util.BotUserUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for every message a user sends the bot.
 */
@Component
@Slf4j
public class MainDialogue extends CommonBotDialogue {
    public static final String CACHE_NAME_CONVO_STATE = "CACHE_NAME_CONVO_STATE";
    public static final int MAX_HISTORY_ENTRIES = 20;
    public static final String DEFAULT_RESPONSE = "Hi! I'm the Office Nudge bot. I deliver important messages and tips to help you stay productive. "
            + "If you have questions about a message I sent, feel free to reply!";

    private final AiFoundryService aiFoundryService;

    public MainDialogue(BotConversationCache botConversationCache, BotProperty botProperty, BotStateStore botStateStore,
                        AiFoundryService aiFoundryService) {
        super(MainDialogue.class.getSimpleName(), botConversationCache, botProperty, botStateStore);

        this.aiFoundryService = aiFoundryService;

        addStep(this::newChat);
    }

    /**
     * The user is either answering a card or has just said something. Answer through the AI model when
     * it is configured, otherwise introduce the bot.
     */
    DialogueTurnStatus newChat(TurnContext turnContext) {
        MainDialogueConvoState convoState = getConvoState(BotStateStore.userKey(turnContext.getActivity()));
        String userMessage = turnContext.getActivity().getText();

        if (aiFoundryService.isEnabled() && userMessage != null && !userMessage.isEmpty()) {
            try {
                log.info("Processing follow-up chat via AI: {}...", userMessage.substring(0, Math.min(50, userMessage.length())));

                List<ChatRequestDto.Message> conversationHistory = convoState.getConversationHistory() != null
                        ? new ArrayList<>(convoState.getConversationHistory())
                        : new ArrayList<>();

                AiFollowUpResponse aiResponse = aiFoundryService.handleFollowUpChat(resolveUserName(turnContext), userMessage,
                        convoState.getLastNudgeContext(), conversationHistory);

                conversationHistory.add(new ChatRequestDto.Message(ChatRequestDto.Message.USER_ROLE, userMessage));
                conversationHistory.add(new ChatRequestDto.Message(ChatRequestDto.Message.ASSISTANT_ROLE, aiResponse.getResponse()));

                convoState.setConversationHistory(trimHistory(conversationHistory));

                sendMsg(turnContext, aiResponse.getResponse());

                if (aiResponse.isShouldEndConversation()) {
                    convoState.setConversationHistory(null);
                }

                return DialogueTurnStatus.COMPLETE;
            } catch (Exception e) {
                log.error("Error processing AI follow-up chat", e);
            }
        }

        sendMsg(turnContext, DEFAULT_RESPONSE);

        return DialogueTurnStatus.COMPLETE;
    }

    public MainDialogueConvoState getConvoState(String userKey) {
        MainDialogueConvoState convoState = botStateStore.getProperty(userKey, CACHE_NAME_CONVO_STATE, MainDialogueConvoState.class);

        if (convoState == null) {
            convoState = new MainDialogueConvoState();

            botStateStore.setProperty(userKey, CACHE_NAME_CONVO_STATE, convoState);
        }

        return convoState;
    }

    static List<ChatRequestDto.Message> trimHistory(List<ChatRequestDto.Message> conversationHistory) {
        if (conversationHistory.size() <= MAX_HISTORY_ENTRIES) {
            return conversationHistory;
        }

        return new ArrayList<>(conversationHistory.subList(conversationHistory.size() - MAX_HISTORY_ENTRIES, conversationHistory.size()));
    }

    private String resolveUserName(TurnContext turnContext) {
        BotUser botUser = BotUserUtils.getBotUser(turnContext);
        CachedUserAndConversationData cachedUser = getCachedUser(botUser);

        return cachedUser != null && cachedUser.getUserPrincipalName() != null
                ? cachedUser.getUserPrincipalName()
                : turnContext.getActivity().getFrom().getId();
    }
}
