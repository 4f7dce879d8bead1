package ru.marthastudios.nudgebot.bot.card;

public class BotFirstIntroductionCard extends BaseBotIntroductionCard {
    private static final String RESOURCE_PATH = "cards/BotFirstIntro.json";

    public BotFirstIntroductionCard(String botName) {
        super(botName);
    }

    @Override
    public String getCardContent() {
        return replaceCommonFields(readResource(RESOURCE_PATH));
    }
}
