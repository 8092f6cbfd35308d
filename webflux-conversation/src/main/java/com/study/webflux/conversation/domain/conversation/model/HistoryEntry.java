package com.study.webflux.conversation.domain.conversation.model;

import java.time.Instant;

public record HistoryEntry(
	String id,
	String preview,
	Instant timestamp
) {
}
