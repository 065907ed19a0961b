package com.sentiment_retraining.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@AllArgsConstructor
@Setter
@Getter
@Builder
public class Metadata {

    @Builder.Default
    private Instant timestamp = Instant.now();

    @Builder.Default
    private String requestId = UUID.randomUUID().toString();

    public Metadata() {
        this.timestamp = Instant.now();
        this.requestId = UUID.randomUUID().toString();
    }
}
