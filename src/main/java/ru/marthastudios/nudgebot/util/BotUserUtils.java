package ru.marthastudios.nudgebot.util;

import ru.marthastudios.nudgebot.bot.TurnContext;
import ru.marthastudios.nudgebot.dto.botframework.ChannelAccountDto;
import ru.marthastudios.nudgebot.pojo.BotUser;

public class BotUserUtils {
    public static BotUser parseBotUserInfo(ChannelAccountDto account) {
        if (account.getAadObjectId() == null || account.getAadObjectId().isEmpty()) {
            return new BotUser(account.getId(), false);
        }

        return new BotUser(account.getAadObjectId(), true);
    }

    public static BotUser getBotUser(TurnContext turnContext) {
        return parseBotUserInfo(turnContext.getActivity().getFrom());
    }
}
