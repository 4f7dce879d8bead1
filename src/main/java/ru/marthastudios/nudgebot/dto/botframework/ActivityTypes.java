package ru.marthastudios.nudgebot.dto.botframework;

public abstract class ActivityTypes {
    public static final String MESSAGE = "message";
    public static final String CONVERSATION_UPDATE = "conversationUpdate";
    public static final String INVOKE = "invoke";
    public static final String TRACE = "trace";
}
