package com.example.audiobook.utils.model;

import lombok.Value;

@Value
public class CompletionEvent {
    String itemId;
    String title;
    String finalPath;
}
