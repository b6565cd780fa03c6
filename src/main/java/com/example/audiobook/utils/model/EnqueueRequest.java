package com.example.audiobook.utils.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class EnqueueRequest {
    @NotBlank(message = "item id is required")
    private String itemId;
    @NotBlank(message = "title is required")
    private String title;
    @NotBlank(message = "destination directory is required")
    private String destinationDirectory;
    private String quality;
}
