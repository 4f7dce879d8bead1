package ru.marthastudios.nudgebot.bot;

import ru.marthastudios.nudgebot.pojo.ResumedConversation;

/**
 * Decides what the bot sends when it picks a conversation back up with a user.
 */
public interface ConversationResumeHandler<T> {
    ResumedConversation<T> loadDataAndResumeConversation(String chatUserUpn);
}
