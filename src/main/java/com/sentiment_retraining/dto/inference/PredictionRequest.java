package com.sentiment_retraining.dto.inference;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRequest {

    @NotBlank(message = "Text cannot be empty or only whitespace")
    @Size(max = 5000, message = "Text must be at most 5000 characters")
    private String text;
}
