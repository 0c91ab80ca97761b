package com.ridematch.pool.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmPoolRequest {

    @NotNull
    private UUID poolPassengerId;

    @NotNull
    private Boolean accept;
}
