package com.clipflow.publisher.dto;

import jakarta.validation.constraints.NotBlank;

public record RegisterVideoRequest(String title, @NotBlank String fileUrl) {
}
