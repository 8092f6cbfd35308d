package com.study.webflux.conversation.application.conversation.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.conversation.domain.conversation.model.Conversation;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.ConversationQuery;
import com.study.webflux.conversation.domain.conversation.model.HistoryEntry;
import com.study.webflux.conversation.domain.conversation.model.HistoryGroup;
import com.study.webflux.conversation.domain.conversation.model.OwnerId;
import com.study.webflux.conversation.domain.conversation.port.ConversationRepository;
import com.study.webflux.conversation.domain.conversation.service.PreviewExtractor;
import com.study.webflux.conversation.infrastructure.conversation.config.properties.ConversationProperties;
import reactor.core.publisher.Mono;

/**
 * 영속 저장소의 대화를 최근 활동 순으로 읽어 Today / Previous 7 Days / Previous 30 Days 그룹으로 나눕니다.
 */
@Slf4j
@Service
public class ConversationHistoryQueryService {

	private final ConversationRepository conversationRepository;
	private final PreviewExtractor previewExtractor;
	private final Clock clock;
	private final int maxResults;

	public ConversationHistoryQueryService(ConversationRepository conversationRepository,
		PreviewExtractor previewExtractor,
		Clock clock,
		ConversationProperties properties) {
		this.conversationRepository = conversationRepository;
		this.previewExtractor = previewExtractor;
		this.clock = clock;
		this.maxResults = properties.getHistory().getMaxResults();
	}

	/**
	 * @param owner
	 *            조회할 소유자, 익명이면 null
	 * @param activeConversationId
	 *            종료되지 않았더라도 함께 보여줄 현재 대화, 없으면 null
	 */
	public Mono<Map<String, List<HistoryEntry>>> listFor(OwnerId owner,
		ConversationId activeConversationId) {
		ConversationQuery query = activeConversationId == null
			? ConversationQuery.endedOnly(maxResults)
			: ConversationQuery.endedOrActive(activeConversationId, maxResults);
		LocalDate today = LocalDate.now(clock);
		ZoneId zone = clock.getZone();

		return conversationRepository.findByOwner(owner, query)
			.take(maxResults)
			.collectList()
			.map(conversations -> group(conversations, today, zone))
			.onErrorResume(error -> {
				log.warn("대화 목록 조회 실패: owner={}, error={}", OwnerId.valueOf(owner),
					error.getMessage());
				return Mono.just(emptyGroups());
			});
	}

	private Map<String, List<HistoryEntry>> group(List<Conversation> conversations,
		LocalDate today,
		ZoneId zone) {
		Map<String, List<HistoryEntry>> groups = emptyGroups();
		for (Conversation conversation : conversations) {
			Instant timestamp = conversation.isEnded()
				? conversation.endedAt()
				: conversation.updatedAt();
			HistoryGroup.classify(timestamp, today, zone)
				.ifPresent(group -> previewExtractor.extract(conversation.turns())
					.ifPresent(preview -> groups.get(group.label())
						.add(new HistoryEntry(conversation.id().value(), preview, timestamp))));
		}
		return groups;
	}

	private static Map<String, List<HistoryEntry>> emptyGroups() {
		Map<String, List<HistoryEntry>> groups = new LinkedHashMap<>();
		for (HistoryGroup group : HistoryGroup.values()) {
			groups.put(group.label(), new ArrayList<>());
		}
		return groups;
	}
}
