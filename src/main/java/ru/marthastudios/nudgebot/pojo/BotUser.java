package ru.marthastudios.nudgebot.pojo;

import lombok.*;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class BotUser {
    private String userId;
    private boolean azureAdUserId;
}
