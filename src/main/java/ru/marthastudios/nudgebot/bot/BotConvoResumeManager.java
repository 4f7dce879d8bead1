package ru.marthastudios.nudgebot.bot;

import com.microsoft.graph.models.User;
import com.microsoft.kiota.ApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.marthastudios.nudgebot.api.BotFrameworkApi;
import ru.marthastudios.nudgebot.api.GraphApi;
import ru.marthastudios.nudgebot.dto.botframework.ActivityDto;
import ru.marthastudios.nudgebot.dto.botframework.ActivityTypes;
import ru.marthastudios.nudgebot.dto.botframework.ChannelAccountDto;
import ru.marthastudios.nudgebot.pojo.CachedUserAndConversationData;
import ru.marthastudios.nudgebot.pojo.ConversationResumeResult;
import ru.marthastudios.nudgebot.pojo.PendingCardInfo;
import ru.marthastudios.nudgebot.pojo.ResumedConversation;
import ru.marthastudios.nudgebot.property.BotProperty;
import ru.marthastudios.nudgebot.service.BotConversationCache;

import java.util.List;

/**
 * Starts or resumes a proactive conversation with a user. Users the bot has not met yet get the Teams app
 * installed; the card is then delivered when Teams reports the new conversation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BotConvoResumeManager {
    private static final String TEAMS_CHANNEL_ID = "msteams";
    private static final String BOT_ID_PREFIX = "28:";
    private static final int HTTP_CONFLICT = 409;

    private final BotConversationCache botConversationCache;
    private final ConversationResumeHandler<PendingCardInfo> conversationResumeHandler;
    private final GraphApi graphApi;
    private final BotFrameworkApi botFrameworkApi;
    private final BotProperty botProperty;

    public ConversationResumeResult resumeConversation(String upn) {
        User graphUser;

        try {
            graphUser = graphApi.getUser(upn);
        } catch (ApiException e) {
            String message = "Couldn't get user by UPN '" + upn + "' - " + e.getMessage();
            log.warn(message, e);
            return ConversationResumeResult.failed(message, e);
        }

        if (graphUser == null || graphUser.getId() == null) {
            String message = "User " + upn + " not found or has no ID";
            log.warn(message);
            return ConversationResumeResult.failed(message);
        }

        botConversationCache.populateMemCacheIfEmpty();

        if (botConversationCache.containsUserId(graphUser.getId())) {
            return sendMessageToExistingConversation(graphUser.getId(), upn);
        }

        return installBotAndQueueMessage(graphUser.getId(), upn);
    }

    private ConversationResumeResult sendMessageToExistingConversation(String userId, String upn) {
        CachedUserAndConversationData cachedUser = botConversationCache.getCachedUser(userId);

        try {
            ResumedConversation<PendingCardInfo> resumed = conversationResumeHandler.loadDataAndResumeConversation(upn);

            ActivityDto resumeActivity = ActivityDto.builder()
                    .type(ActivityTypes.MESSAGE)
                    .channelId(TEAMS_CHANNEL_ID)
                    .from(ChannelAccountDto.builder().id(BOT_ID_PREFIX + botProperty.getAppId()).build())
                    .attachments(List.of(resumed.getAttachment()))
                    .build();

            botFrameworkApi.sendToConversation(cachedUser.getServiceUrl(), cachedUser.getConversationId(), resumeActivity);

            ConversationResumeResult result = ConversationResumeResult.messageSent(upn);
            log.info("Conversation resume result: {} for user {}", result.getStatus(), upn);
            return result;
        } catch (Exception e) {
            String message = "Error sending message to " + upn + ": " + e.getMessage();
            log.error(message, e);
            return ConversationResumeResult.failed(message, e);
        }
    }

    private ConversationResumeResult installBotAndQueueMessage(String userId, String upn) {
        String appCatalogTeamAppId = botProperty.getAppCatalogTeamAppId();

        if (appCatalogTeamAppId == null || appCatalogTeamAppId.isBlank()) {
            String message = "Can't install Teams app for bot - no bot.app-catalog-team-app-id found in configuration";
            log.error(message);
            return ConversationResumeResult.failed(message);
        }

        try {
            try {
                graphApi.installAppForUser(userId, appCatalogTeamAppId);
            } catch (ApiException e) {
                if (e.getResponseStatusCode() != HTTP_CONFLICT) {
                    throw e;
                }

                triggerUserConversationUpdate(userId, appCatalogTeamAppId);
            }

            ConversationResumeResult result = ConversationResumeResult.appInstalled(upn);
            log.info("Conversation resume result: {} for user {}", result.getStatus(), upn);
            return result;
        } catch (ApiException e) {
            String message = "Couldn't install Teams app for user '" + userId + "' - " + e.getMessage() + " - is user licensed for Teams?";
            log.warn(message, e);
            return ConversationResumeResult.failed(message, e);
        }
    }

    /**
     * The app is already installed, so Teams won't send a conversationUpdate by itself. Reading the
     * installation's chat makes it do so.
     */
    private void triggerUserConversationUpdate(String userId, String appCatalogTeamAppId) {
        log.info("Triggering new conversation with bot {} for user {}", appCatalogTeamAppId, userId);

        try {
            String installationId = graphApi.getInstalledAppId(userId, appCatalogTeamAppId);

            if (installationId == null) {
                log.warn("App {} reported as installed but not found for user {}", appCatalogTeamAppId, userId);
                return;
            }

            graphApi.getInstalledAppChat(userId, installationId);
        } catch (ApiException e) {
            log.warn("Couldn't get chat for user '{}'", userId, e);
        }
    }
}
