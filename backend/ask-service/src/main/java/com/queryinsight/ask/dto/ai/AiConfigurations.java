package com.queryinsight.ask.dto.ai;

public record AiConfigurations(String language) {
}
