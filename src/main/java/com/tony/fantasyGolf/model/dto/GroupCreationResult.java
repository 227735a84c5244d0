package com.tony.fantasyGolf.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class GroupCreationResult {
    private boolean success;
    private long groupsCreated;
    private int golfersProcessed;
    private String message;

    public static GroupCreationResult failure(String message) {
        return new GroupCreationResult(false, 0, 0, message);
    }
}
