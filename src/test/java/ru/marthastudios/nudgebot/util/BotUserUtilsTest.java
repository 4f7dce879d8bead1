package ru.marthastudios.nudgebot.util;

import org.junit.jupiter.api.Test;
import ru.marthastudios.nudgebot.dto.botframework.ChannelAccountDto;
import ru.marthastudios.nudgebot.pojo.BotUser;

import static org.junit.jupiter.api.Assertions.*;

class BotUserUtilsTest {
    @Test
    void parseBotUserInfoUsesAadObjectIdWhenPresent() {
        BotUser botUser = BotUserUtils.parseBotUserInfo(ChannelAccountDto.builder()
                .id("29:teams-user")
                .aadObjectId("0b3f6a8e-aad")
                .build());

        assertEquals("0b3f6a8e-aad", botUser.getUserId());
        assertTrue(botUser.isAzureAdUserId());
    }

    @Test
    void parseBotUserInfoFallsBackToChannelIdWithoutAadObjectId() {
        BotUser botUser = BotUserUtils.parseBotUserInfo(ChannelAccountDto.builder()
                .id("29:teams-user")
                .aadObjectId("")
                .build());

        assertEquals("29:teams-user", botUser.getUserId());
        assertFalse(botUser.isAzureAdUserId());
    }
}
