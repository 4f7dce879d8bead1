package ru.marthastudios.nudgebot.enums;

public enum ConversationResumeStatus {
    MESSAGE_SENT,
    APP_INSTALLED_PENDING,
    FAILED
}
