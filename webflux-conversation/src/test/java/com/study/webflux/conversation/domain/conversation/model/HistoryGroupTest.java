package com.study.webflux.conversation.domain.conversation.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryGroupTest {

	private static final ZoneId ZONE = ZoneOffset.UTC;
	private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

	@Test
	@DisplayName("오늘 0시 이후는 Today")
	void classify_sinceMidnight_today() {
		assertThat(HistoryGroup.classify(Instant.parse("2025-06-15T00:00:00Z"), TODAY, ZONE))
			.contains(HistoryGroup.TODAY);
	}

	@Test
	@DisplayName("어제 23시 59분은 Previous 7 Days")
	void classify_yesterday_previous7Days() {
		assertThat(HistoryGroup.classify(Instant.parse("2025-06-14T23:59:00Z"), TODAY, ZONE))
			.contains(HistoryGroup.PREVIOUS_7_DAYS);
	}

	@Test
	@DisplayName("8일 전은 Previous 30 Days, 31일 전은 제외")
	void classify_olderBoundaries() {
		assertThat(HistoryGroup.classify(Instant.parse("2025-06-07T10:00:00Z"), TODAY, ZONE))
			.contains(HistoryGroup.PREVIOUS_30_DAYS);
		assertThat(HistoryGroup.classify(Instant.parse("2025-05-15T10:00:00Z"), TODAY, ZONE))
			.isEmpty();
	}

	@Test
	@DisplayName("라벨은 목록 응답의 그룹 이름이다")
	void label() {
		assertThat(HistoryGroup.TODAY.label()).isEqualTo("Today");
		assertThat(HistoryGroup.PREVIOUS_7_DAYS.label()).isEqualTo("Previous 7 Days");
		assertThat(HistoryGroup.PREVIOUS_30_DAYS.label()).isEqualTo("Previous 30 Days");
	}
}
