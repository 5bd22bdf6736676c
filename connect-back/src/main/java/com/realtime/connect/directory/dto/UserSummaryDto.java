package com.realtime.connect.directory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummaryDto {
    private UUID id;
    private String username;
    private String displayName;
    private String avatarUrl;
    private String currentMood;
    private String bio;
    private boolean online;
}
