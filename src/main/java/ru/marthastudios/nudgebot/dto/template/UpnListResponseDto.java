package ru.marthastudios.nudgebot.dto.template;

import lombok.*;

import java.util.List;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class UpnListResponseDto {
    private List<String> upns;
    private int count;

    public UpnListResponseDto(List<String> upns) {
        this(upns, upns.size());
    }
}
