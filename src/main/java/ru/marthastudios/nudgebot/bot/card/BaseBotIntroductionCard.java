package ru.marthastudios.nudgebot.bot.card;

import lombok.Getter;

@Getter
public abstract class BaseBotIntroductionCard extends BaseAdaptiveCard {
    public static final String FIELD_NAME_BOT_NAME = "${BotName}";

    private final String botName;

    protected BaseBotIntroductionCard(String botName) {
        this.botName = botName;
    }

    protected String replaceCommonFields(String json) {
        return json.replace(FIELD_NAME_BOT_NAME, botName);
    }
}
