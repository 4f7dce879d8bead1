package ru.marthastudios.nudgebot.bot.dialogue;

import ru.marthastudios.nudgebot.bot.TurnContext;
import ru.marthastudios.nudgebot.enums.DialogueTurnStatus;

@FunctionalInterface
public interface WaterfallStep {
    DialogueTurnStatus execute(TurnContext turnContext);
}
