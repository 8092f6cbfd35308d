package com.study.webflux.conversation.domain.conversation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** 대화를 구성하는 한 개의 메시지입니다. */
public record Turn(
	MessageRole role,
	String content
) {
	public Turn {
		if (role == null) {
			throw new IllegalArgumentException("role cannot be null");
		}
		if (content == null) {
			content = "";
		}
	}

	public static Turn system(String content) {
		return new Turn(MessageRole.SYSTEM, content);
	}

	public static Turn user(String content) {
		return new Turn(MessageRole.USER, content);
	}

	public static Turn assistant(String content) {
		return new Turn(MessageRole.ASSISTANT, content);
	}

	@JsonIgnore
	public boolean isSystem() {
		return role == MessageRole.SYSTEM;
	}

	@JsonIgnore
	public boolean isUser() {
		return role == MessageRole.USER;
	}

	/** system 이외의 실제 대화 메시지인지 여부입니다. */
	@JsonIgnore
	public boolean isExchange() {
		return role == MessageRole.USER || role == MessageRole.ASSISTANT;
	}
}
