package com.example.audiobook.utils.model;

import lombok.Value;

@Value
public class ErrorEvent {
    String itemId;
    String title;
    String errorMessage;
}
