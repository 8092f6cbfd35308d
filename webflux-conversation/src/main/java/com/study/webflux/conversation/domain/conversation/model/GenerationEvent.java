package com.study.webflux.conversation.domain.conversation.model;

/** 생성 모델이 스트리밍으로 내보내는 이벤트입니다. */
public record GenerationEvent(
	Type type,
	String text,
	String detail
) {
	public enum Type {
		DELTA,
		END,
		ERROR
	}

	public GenerationEvent {
		if (type == null) {
			throw new IllegalArgumentException("type cannot be null");
		}
	}

	public static GenerationEvent delta(String text) {
		return new GenerationEvent(Type.DELTA, text, null);
	}

	public static GenerationEvent end() {
		return new GenerationEvent(Type.END, null, null);
	}

	public static GenerationEvent error(String detail) {
		return new GenerationEvent(Type.ERROR, null, detail);
	}

	public boolean isTerminal() {
		return type != Type.DELTA;
	}
}
