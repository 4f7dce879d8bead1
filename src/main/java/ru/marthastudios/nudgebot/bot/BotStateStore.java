package ru.marthastudios.nudgebot.bot;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.marthastudios.nudgebot.dto.botframework.ActivityDto;
import ru.marthastudios.nudgebot.property.NudgeProperty;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * In-memory user and conversation state. Each key holds a bag of named properties; a key that is not
 * touched for the idle expiry time is dropped.
 */
@Component
@Slf4j
public class BotStateStore {
    private final Cache<String, Map<String, Object>> states;

    public BotStateStore(NudgeProperty nudgeProperty) {
        this.states = CacheBuilder.newBuilder()
                .expireAfterAccess(nudgeProperty.getStateIdleExpiryHours(), TimeUnit.HOURS)
                .build();
    }

    public static String userKey(ActivityDto activity) {
        return userKey(activity.getChannelId(), activity.getFrom().getId());
    }

    public static String userKey(String channelId, String userId) {
        return channelId + "/users/" + userId;
    }

    public static String conversationKey(ActivityDto activity) {
        return activity.getChannelId() + "/conversations/" + activity.getConversation().getId();
    }

    public <T> T getProperty(String key, String property, Class<T> type) {
        Map<String, Object> bag = states.getIfPresent(key);

        if (bag == null) {
            return null;
        }

        Object value = bag.get(property);

        return type.isInstance(value) ? type.cast(value) : null;
    }

    public void setProperty(String key, String property, Object value) {
        Map<String, Object> bag = states.asMap().computeIfAbsent(key, k -> new ConcurrentHashMap<>());

        if (value == null) {
            bag.remove(property);
        } else {
            bag.put(property, value);
        }
    }

    public void deleteProperty(String key, String property) {
        setProperty(key, property, null);
    }

    public void delete(String key) {
        states.invalidate(key);
    }

    public void evictExpired() {
        states.cleanUp();

        log.info("Bot state store holds {} keys after eviction", states.size());
    }

    public long size() {
        return states.size();
    }
}
