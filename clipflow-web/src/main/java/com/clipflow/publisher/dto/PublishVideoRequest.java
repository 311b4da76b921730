package com.clipflow.publisher.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record PublishVideoRequest(@NotEmpty List<String> platforms) {
}
