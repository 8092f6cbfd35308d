package com.study.webflux.conversation.domain.conversation.service;

import java.util.List;
import java.util.Optional;

import com.study.webflux.conversation.domain.conversation.model.Turn;

/** 첫 번째 사용자 메시지로 대화 목록 미리보기 문자열을 만듭니다. */
public class PreviewExtractor {

	private static final String ELLIPSIS = "...";

	private final int maxLength;

	public PreviewExtractor(int maxLength) {
		if (maxLength <= ELLIPSIS.length()) {
			throw new IllegalArgumentException("previewLength 설정값이 너무 작습니다.");
		}
		this.maxLength = maxLength;
	}

	public Optional<String> extract(List<Turn> turns) {
		return turns.stream()
			.filter(Turn::isUser)
			.map(turn -> turn.content().trim())
			.filter(content -> !content.isEmpty())
			.findFirst()
			.map(this::truncate);
	}

	private String truncate(String text) {
		if (text.length() <= maxLength) {
			return text;
		}
		return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
	}
}
