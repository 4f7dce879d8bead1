package ru.marthastudios.nudgebot.service;

import com.microsoft.graph.models.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.marthastudios.nudgebot.api.GraphApi;
import ru.marthastudios.nudgebot.dto.botframework.ActivityDto;
import ru.marthastudios.nudgebot.entity.CachedUserConversation;
import ru.marthastudios.nudgebot.pojo.BotUser;
import ru.marthastudios.nudgebot.pojo.CachedUserAndConversationData;
import ru.marthastudios.nudgebot.repository.CachedUserConversationRepository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Conversation references for every Azure AD user the bot has talked to, kept in memory and backed by
 * the {@code conversation_cache} table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BotConversationCache {
    private final CachedUserConversationRepository cachedUserConversationRepository;
    private final UserService userService;
    private final GraphApi graphApi;

    private final Map<String, CachedUserAndConversationData> memCache = new ConcurrentHashMap<>();

    public synchronized void populateMemCacheIfEmpty() {
        if (!memCache.isEmpty()) {
            return;
        }

        loadFromStorage();
    }

    /**
     * Drops the memory map and reloads it from storage.
     */
    public synchronized void reload() {
        memCache.clear();

        loadFromStorage();
    }

    private void loadFromStorage() {
        List<CachedUserConversation> storedConversations = cachedUserConversationRepository.findAll();

        storedConversations.forEach(stored -> memCache.put(stored.getAzureAdId(), toCachedUser(stored)));

        log.info("Loaded {} conversation references into memory cache", storedConversations.size());
    }

    public boolean containsUserId(String azureAdId) {
        return memCache.containsKey(azureAdId);
    }

    public CachedUserAndConversationData getCachedUser(String azureAdId) {
        return memCache.get(azureAdId);
    }

    public void addConversationReferenceToCache(ActivityDto activity, BotUser botUser) {
        if (!botUser.isAzureAdUserId()) {
            log.warn("Not caching conversation for non Azure AD user {}", botUser.getUserId());
            return;
        }

        String upn;

        try {
            User graphUser = graphApi.getUser(botUser.getUserId());

            upn = graphUser != null ? graphUser.getUserPrincipalName() : null;
        } catch (Exception e) {
            log.error("Couldn't look up UPN for user {}", botUser.getUserId(), e);
            return;
        }

        if (upn == null) {
            log.warn("User {} has no UPN in Graph, not caching conversation", botUser.getUserId());
            return;
        }

        CachedUserConversation stored = CachedUserConversation.builder()
                .azureAdId(botUser.getUserId())
                .userPrincipalName(upn)
                .serviceUrl(activity.getServiceUrl())
                .conversationId(activity.getConversation().getId())
                .timestamp(System.currentTimeMillis())
                .build();

        cachedUserConversationRepository.save(stored);
        userService.createOrUpdate(upn, botUser.getUserId());

        memCache.put(stored.getAzureAdId(), toCachedUser(stored));

        log.info("Cached conversation {} for user {}", stored.getConversationId(), upn);
    }

    private static CachedUserAndConversationData toCachedUser(CachedUserConversation stored) {
        return CachedUserAndConversationData.builder()
                .azureAdId(stored.getAzureAdId())
                .userPrincipalName(stored.getUserPrincipalName())
                .serviceUrl(stored.getServiceUrl())
                .conversationId(stored.getConversationId())
                .build();
    }
}
