package ru.marthastudios.nudgebot.bot.dialogue;

import lombok.Getter;
import ru.marthastudios.nudgebot.bot.BotStateStore;
import ru.marthastudios.nudgebot.bot.TurnContext;
import ru.marthastudios.nudgebot.bot.card.BaseAdaptiveCard;
import ru.marthastudios.nudgebot.dto.botframework.ActivityDto;
import ru.marthastudios.nudgebot.dto.botframework.ActivityTypes;
import ru.marthastudios.nudgebot.dto.botframework.AttachmentDto;
import ru.marthastudios.nudgebot.dto.botframework.InputHints;
import ru.marthastudios.nudgebot.enums.DialogueTurnStatus;
import ru.marthastudios.nudgebot.pojo.BotUser;
import ru.marthastudios.nudgebot.pojo.CachedUserAndConversationData;
import ru.marthastudios.nudgebot.property.BotProperty;
import ru.marthastudios.nudgebot.service.BotConversationCache;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for waterfall dialogues. The index of the step to run next is kept in conversation state, so a
 * step that prompts the user resumes at the following step on the next message.
 */
public abstract class CommonBotDialogue {
    @Getter
    private final String dialogueId;
    protected final BotConversationCache botConversationCache;
    protected final BotProperty botProperty;
    protected final BotStateStore botStateStore;

    private final List<WaterfallStep> steps = new ArrayList<>();

    protected CommonBotDialogue(String dialogueId, BotConversationCache botConversationCache, BotProperty botProperty,
                                BotStateStore botStateStore) {
        this.dialogueId = dialogueId;
        this.botConversationCache = botConversationCache;
        this.botProperty = botProperty;
        this.botStateStore = botStateStore;
    }

    protected void addStep(WaterfallStep step) {
        steps.add(step);
    }

    public DialogueTurnStatus run(TurnContext turnContext) {
        String conversationKey = BotStateStore.conversationKey(turnContext.getActivity());

        Integer storedIndex = botStateStore.getProperty(conversationKey, stepPropertyName(), Integer.class);
        int stepIndex = storedIndex != null && storedIndex < steps.size() ? storedIndex : 0;

        DialogueTurnStatus status = steps.get(stepIndex).execute(turnContext);

        if (status == DialogueTurnStatus.WAITING && stepIndex + 1 < steps.size()) {
            botStateStore.setProperty(conversationKey, stepPropertyName(), stepIndex + 1);
        } else {
            botStateStore.deleteProperty(conversationKey, stepPropertyName());
        }

        return status;
    }

    private String stepPropertyName() {
        return dialogueId + ".step";
    }

    protected CachedUserAndConversationData getCachedUser(BotUser botUser) {
        botConversationCache.populateMemCacheIfEmpty();

        return botConversationCache.getCachedUser(botUser.getUserId());
    }

    protected DialogueTurnStatus promptWithCard(TurnContext turnContext, BaseAdaptiveCard card) {
        return promptWithCard(turnContext, card.getCardAttachment());
    }

    protected DialogueTurnStatus promptWithCard(TurnContext turnContext, AttachmentDto attachment) {
        turnContext.sendActivity(ActivityDto.builder()
                .type(ActivityTypes.MESSAGE)
                .attachments(List.of(attachment))
                .inputHint(InputHints.EXPECTING_INPUT)
                .build());

        return DialogueTurnStatus.WAITING;
    }

    protected void sendMsg(TurnContext turnContext, String msg) {
        turnContext.sendActivity(buildMsg(msg));
    }

    protected ActivityDto buildMsg(String msg) {
        return ActivityDto.builder()
                .type(ActivityTypes.MESSAGE)
                .text(msg)
                .speak(msg)
                .inputHint(InputHints.EXPECTING_INPUT)
                .build();
    }
}
