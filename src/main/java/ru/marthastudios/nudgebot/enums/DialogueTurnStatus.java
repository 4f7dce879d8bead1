package ru.marthastudios.nudgebot.enums;

public enum DialogueTurnStatus {
    WAITING,
    COMPLETE
}
