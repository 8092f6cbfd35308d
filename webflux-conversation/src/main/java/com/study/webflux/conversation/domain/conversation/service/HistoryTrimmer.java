package com.study.webflux.conversation.domain.conversation.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.study.webflux.conversation.domain.conversation.model.Turn;

/**
 * 대화 길이를 maxHistory개로 제한합니다. 맨 앞의 system 메시지는 항상 유지하고 오래된 메시지부터 제거합니다.
 */
public class HistoryTrimmer {

	private final int maxHistory;

	public HistoryTrimmer(int maxHistory) {
		if (maxHistory <= 0) {
			throw new IllegalArgumentException("maxHistory 설정값은 0 이하일 수 없습니다.");
		}
		this.maxHistory = maxHistory;
	}

	public List<Turn> trim(List<Turn> turns) {
		Optional<Turn> systemTurn = turns.stream().filter(Turn::isSystem).findFirst();
		int bound = maxHistory + (systemTurn.isPresent() ? 1 : 0);
		if (turns.size() <= bound) {
			return turns;
		}

		List<Turn> exchange = turns.stream().filter(turn -> !turn.isSystem()).toList();
		List<Turn> trimmed = new ArrayList<>(bound);
		systemTurn.ifPresent(trimmed::add);
		trimmed.addAll(exchange.subList(Math.max(0, exchange.size() - maxHistory), exchange.size()));
		return List.copyOf(trimmed);
	}
}
