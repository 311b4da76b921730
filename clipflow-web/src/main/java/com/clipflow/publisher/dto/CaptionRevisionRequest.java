package com.clipflow.publisher.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record CaptionRevisionRequest(@NotBlank String caption, List<String> hashtags) {
}
