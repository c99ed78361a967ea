package com.offy.competition.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InvitationResponseRequest {
    @NotNull(message = "Accept flag cannot be null")
    private Boolean accept;
}
