package com.study.webflux.conversation.domain.conversation.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

public enum HistoryGroup {
	TODAY("Today", 0),
	PREVIOUS_7_DAYS("Previous 7 Days", 7),
	PREVIOUS_30_DAYS("Previous 30 Days", 30);

	private final String label;
	private final int daysBack;

	HistoryGroup(String label, int daysBack) {
		this.label = label;
		this.daysBack = daysBack;
	}

	public String label() {
		return label;
	}

	/** 오늘 0시를 기준으로 시각이 속하는 그룹을 찾습니다. 30일보다 오래되면 비어 있습니다. */
	public static Optional<HistoryGroup> classify(Instant timestamp, LocalDate today, ZoneId zone) {
		if (timestamp == null) {
			return Optional.empty();
		}
		for (HistoryGroup group : values()) {
			Instant lowerBound = today.minusDays(group.daysBack).atStartOfDay(zone).toInstant();
			if (!timestamp.isBefore(lowerBound)) {
				return Optional.of(group);
			}
		}
		return Optional.empty();
	}
}
