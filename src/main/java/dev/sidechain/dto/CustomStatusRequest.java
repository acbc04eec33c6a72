package dev.sidechain.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Blank or missing text clears the status; longer text is cut to 100 characters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomStatusRequest {

    @Size(max = 500, message = "Status text must be at most 500 characters")
    private String text;
}
