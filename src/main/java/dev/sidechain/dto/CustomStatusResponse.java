package dev.sidechain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CustomStatusResponse(String userId, String customStatus) {
}
