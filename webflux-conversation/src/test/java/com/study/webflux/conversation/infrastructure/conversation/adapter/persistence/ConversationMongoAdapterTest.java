package com.study.webflux.conversation.infrastructure.conversation.adapter.persistence;

import java.time.Instant;
import java.util.List;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import com.study.webflux.conversation.domain.conversation.entity.ConversationEntity;
import com.study.webflux.conversation.domain.conversation.entity.ConversationEntity.TurnDocument;
import com.study.webflux.conversation.domain.conversation.exception.ConversationAccessDeniedException;
import com.study.webflux.conversation.domain.conversation.model.Conversation;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.ConversationQuery;
import com.study.webflux.conversation.domain.conversation.model.OwnerId;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import com.study.webflux.conversation.infrastructure.conversation.repository.ConversationMongoRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationMongoAdapterTest {

	private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

	@Mock
	private ConversationMongoRepository mongoRepository;

	private ConversationMongoAdapter adapter;

	@BeforeEach
	void setUp() {
		adapter = new ConversationMongoAdapter(mongoRepository);
	}

	@Test
	@DisplayName("대화 저장 시 메시지 목록을 문서로 변환한다")
	void upsert_success() {
		Conversation conversation = new Conversation(ConversationId.of("conv-1"),
			OwnerId.of("user-1"), List.of(Turn.system("prompt"), Turn.user("안녕하세요")), NOW,
			null, NOW, false);
		when(mongoRepository.save(any(ConversationEntity.class)))
			.thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

		StepVerifier.create(adapter.upsert(conversation)).expectNext(conversation)
			.verifyComplete();

		ArgumentCaptor<ConversationEntity> captor = ArgumentCaptor.forClass(ConversationEntity.class);
		verify(mongoRepository).save(captor.capture());
		ConversationEntity entity = captor.getValue();
		assertThat(entity.conversationId()).isEqualTo("conv-1");
		assertThat(entity.ownerId()).isEqualTo("user-1");
		assertThat(entity.turns()).containsExactly(new TurnDocument("system", "prompt"),
			new TurnDocument("user", "안녕하세요"));
		assertThat(entity.temporary()).isFalse();
	}

	@Test
	@DisplayName("임시 대화는 저장하지 않고 예외 발생")
	void upsert_temporary_rejected() {
		Conversation conversation = new Conversation(ConversationId.of("conv-tmp"), null,
			List.of(Turn.user("비밀")), NOW, null, NOW, true);

		StepVerifier.create(adapter.upsert(conversation))
			.expectError(IllegalArgumentException.class)
			.verify();

		verifyNoInteractions(mongoRepository);
	}

	@Test
	@DisplayName("다른 소유자의 대화 조회 시 접근 거부")
	void findById_otherOwner_denied() {
		ConversationEntity entity = new ConversationEntity("conv-1", "alice",
			List.of(new TurnDocument("user", "질문")), NOW, NOW, NOW, false);
		when(mongoRepository.findById("conv-1")).thenReturn(Mono.just(entity));

		StepVerifier.create(adapter.findById(ConversationId.of("conv-1"), OwnerId.of("bob")))
			.expectError(ConversationAccessDeniedException.class)
			.verify();
	}

	@Test
	@DisplayName("익명 대화 문서는 owner가 null인 대화로 변환된다")
	void findById_anonymous() {
		ConversationEntity entity = new ConversationEntity("conv-2", null,
			List.of(new TurnDocument("user", "질문"), new TurnDocument("assistant", "답변")), NOW,
			null, NOW, false);
		when(mongoRepository.findById("conv-2")).thenReturn(Mono.just(entity));

		StepVerifier.create(adapter.findById(ConversationId.of("conv-2"), OwnerId.of("bob")))
			.assertNext(conversation -> {
				assertThat(conversation.isAnonymous()).isTrue();
				assertThat(conversation.turns()).containsExactly(Turn.user("질문"),
					Turn.assistant("답변"));
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("목록 조회 시 현재 대화 ID와 최근 활동 순 정렬을 전달한다")
	void findByOwner_withActive() {
		Pageable expected = PageRequest.of(0, 100,
			Sort.by(Sort.Direction.DESC, "updatedAt").and(Sort.by(Sort.Direction.DESC, "endedAt")));
		when(mongoRepository.findListable("user-1", "conv-active", expected))
			.thenReturn(Flux.empty());

		StepVerifier.create(adapter.findByOwner(OwnerId.of("user-1"),
			ConversationQuery.endedOrActive(ConversationId.of("conv-active"), 100)))
			.verifyComplete();

		verify(mongoRepository).findListable("user-1", "conv-active", expected);
	}

	@Test
	@DisplayName("익명 요청자는 owner가 null인 종료 대화만 조회한다")
	void findByOwner_anonymousEndedOnly() {
		ConversationEntity entity = new ConversationEntity("conv-3", null,
			List.of(new TurnDocument("user", "질문")), NOW, NOW, NOW, false);
		when(mongoRepository.findListable(any(), any(), any(Pageable.class)))
			.thenReturn(Flux.just(entity));

		StepVerifier.create(adapter.findByOwner(null, ConversationQuery.endedOnly(10)))
			.assertNext(conversation -> assertThat(conversation.id().value()).isEqualTo("conv-3"))
			.verifyComplete();

		verify(mongoRepository).findListable(null, null, PageRequest.of(0, 10,
			Sort.by(Sort.Direction.DESC, "updatedAt").and(Sort.by(Sort.Direction.DESC, "endedAt"))));
	}

	@Test
	@DisplayName("소유자 삭제는 계정 단위로만 수행한다")
	void deleteAllByOwner() {
		when(mongoRepository.deleteByOwnerId("user-1")).thenReturn(Mono.just(3L));

		StepVerifier.create(adapter.deleteAllByOwner(OwnerId.of("user-1"))).expectNext(3L)
			.verifyComplete();
	}
}
