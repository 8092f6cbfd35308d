package com.study.webflux.conversation.domain.conversation.model;

public record GenerationParameters(
	String model,
	int maxTokens,
	double temperature
) {
	public GenerationParameters {
		if (maxTokens <= 0) {
			throw new IllegalArgumentException("maxTokens must be positive");
		}
		if (temperature < 0) {
			throw new IllegalArgumentException("temperature cannot be negative");
		}
	}
}
