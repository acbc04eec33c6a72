package dev.sidechain.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityStatusRequest {

    @NotNull(message = "showActivityStatus is required")
    private Boolean showActivityStatus;

    @NotNull(message = "showLastActive is required")
    private Boolean showLastActive;
}
