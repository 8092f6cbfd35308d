package com.study.webflux.conversation.domain.conversation.model;

public record OwnerId(
	String value
) {
	public OwnerId {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("ownerId cannot be null or blank");
		}
		if (value.length() > 128) {
			throw new IllegalArgumentException("ownerId too long");
		}
	}

	public static OwnerId of(String value) {
		return new OwnerId(value);
	}

	public static OwnerId ofNullable(String value) {
		return (value == null || value.isBlank()) ? null : new OwnerId(value);
	}

	public static String valueOf(OwnerId ownerId) {
		return ownerId == null ? null : ownerId.value();
	}
}
