package com.offy.competition.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InviteUsersRequest {
    @NotEmpty(message = "User ids cannot be empty")
    private List<Long> userIds;
}
