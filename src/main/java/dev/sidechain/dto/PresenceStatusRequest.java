package dev.sidechain.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PresenceStatusRequest {

    @JsonProperty("user_ids")
    @JsonAlias("userIds")
    @NotEmpty(message = "user_ids must not be empty")
    @Size(max = 100, message = "At most 100 user ids per request")
    private List<@NotBlank(message = "user_ids must not contain blank ids") String> userIds;
}
