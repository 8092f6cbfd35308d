package com.study.webflux.conversation.domain.conversation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
	SYSTEM("system"),
	USER("user"),
	ASSISTANT("assistant");

	private final String value;

	MessageRole(String value) {
		this.value = value;
	}

	@JsonValue
	public String getValue() {
		return value;
	}

	@JsonCreator
	public static MessageRole from(String value) {
		for (MessageRole role : values()) {
			if (role.value.equalsIgnoreCase(value)) {
				return role;
			}
		}
		throw new IllegalArgumentException("unknown message role: " + value);
	}
}
