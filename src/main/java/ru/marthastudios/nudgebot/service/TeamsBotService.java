package ru.marthastudios.nudgebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.marthastudios.nudgebot.api.BotFrameworkApi;
import ru.marthastudios.nudgebot.bot.BotStateStore;
import ru.marthastudios.nudgebot.bot.ConversationResumeHandler;
import ru.marthastudios.nudgebot.bot.TurnContext;
import ru.marthastudios.nudgebot.bot.TurnErrorHandler;
import ru.marthastudios.nudgebot.bot.card.BotFirstIntroductionCard;
import ru.marthastudios.nudgebot.bot.dialogue.MainDialogue;
import ru.marthastudios.nudgebot.dto.botframework.ActivityDto;
import ru.marthastudios.nudgebot.dto.botframework.ActivityTypes;
import ru.marthastudios.nudgebot.dto.botframework.ChannelAccountDto;
import ru.marthastudios.nudgebot.pojo.BotUser;
import ru.marthastudios.nudgebot.pojo.CachedUserAndConversationData;
import ru.marthastudios.nudgebot.pojo.PendingCardInfo;
import ru.marthastudios.nudgebot.pojo.ResumedConversation;
import ru.marthastudios.nudgebot.property.BotProperty;
import ru.marthastudios.nudgebot.util.BotUserUtils;

@Service
@RequiredArgsConstructor
@Slf4j
public class TeamsBotService {
    private final BotFrameworkApi botFrameworkApi;
    private final BotConversationCache botConversationCache;
    private final ConversationResumeHandler<PendingCardInfo> conversationResumeHandler;
    private final MainDialogue mainDialogue;
    private final TurnErrorHandler turnErrorHandler;
    private final BotProperty botProperty;

    public void onTurn(ActivityDto activity) {
        TurnContext turnContext = new TurnContext(activity, botFrameworkApi);

        try {
            if (activity.getType() == null) {
                log.warn("Received activity {} without a type", activity.getId());
                return;
            }

            switch (activity.getType()) {
                case ActivityTypes.MESSAGE -> mainDialogue.run(turnContext);
                case ActivityTypes.CONVERSATION_UPDATE -> {
                    if (activity.getMembersAdded() != null && !activity.getMembersAdded().isEmpty()) {
                        handleMembersAdded(turnContext);
                    }
                }
                default -> log.debug("Ignoring activity of type {}", activity.getType());
            }
        } catch (Exception e) {
            turnErrorHandler.onTurnError(turnContext, e);
        }
    }

    /**
     * New thread with the bot, usually because the app was just installed for the user.
     */
    private void handleMembersAdded(TurnContext turnContext) {
        ActivityDto activity = turnContext.getActivity();

        for (ChannelAccountDto member : activity.getMembersAdded()) {
            if (activity.getRecipient() != null && member.getId().equals(activity.getRecipient().getId())) {
                continue;
            }

            BotUser botUser = BotUserUtils.parseBotUserInfo(member);

            if (!botUser.isAzureAdUserId()) {
                turnContext.sendText("Hi, anonymous user. I only work with Azure AD users in Teams normally...");
            }

            botConversationCache.populateMemCacheIfEmpty();

            CachedUserAndConversationData cachedUser = botConversationCache.getCachedUser(botUser.getUserId());

            if (cachedUser == null || cachedUser.getUserPrincipalName() == null) {
                botConversationCache.addConversationReferenceToCache(activity, botUser);

                cachedUser = botConversationCache.getCachedUser(botUser.getUserId());

                if (cachedUser == null || cachedUser.getUserPrincipalName() == null) {
                    log.error("Failed to add new user ID {} to conversation cache.", botUser.getUserId());
                    continue;
                }

                turnContext.sendAttachment(new BotFirstIntroductionCard(botProperty.getName()).getCardAttachment());
            } else {
                log.debug("User {} found in conversation cache.", botUser.getUserId());
            }

            ResumedConversation<PendingCardInfo> resumed = conversationResumeHandler.loadDataAndResumeConversation(cachedUser.getUserPrincipalName());

            if (resumed.getData() != null && resumed.getAttachment() != null) {
                log.info("Resuming conversation with user {} by sending next card (card {}).", botUser.getUserId(),
                        resumed.getData().getTemplateName());

                turnContext.sendAttachment(resumed.getAttachment());

                mainDialogue.getConvoState(BotStateStore.userKey(activity.getChannelId(), member.getId()))
                        .setLastNudgeContext(resumed.getData().getTemplateName());
            } else {
                log.info("No conversation to resume with user {}.", botUser.getUserId());
            }
        }
    }
}
