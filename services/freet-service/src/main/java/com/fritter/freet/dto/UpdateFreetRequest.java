package com.fritter.freet.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to replace the content of a freet")
public class UpdateFreetRequest {

    @NotBlank(message = "Freet content must be at least one character long.")
    @Schema(description = "New freet text, 1-140 characters after trimming", required = true)
    private String content;
}
