package com.study.webflux.conversation.infrastructure.conversation.adapter.llm;

import java.util.List;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;

import com.study.webflux.conversation.domain.conversation.model.GenerationEvent;
import com.study.webflux.conversation.domain.conversation.model.GenerationParameters;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpringAiGenerationAdapterTest {

	private static final GenerationParameters PARAMETERS = new GenerationParameters("gpt-4o-mini",
		2048, 0.7);

	@Mock
	private ChatModel chatModel;

	private SpringAiGenerationAdapter adapter;

	@BeforeEach
	void setUp() {
		adapter = new SpringAiGenerationAdapter(chatModel);
	}

	@Test
	@DisplayName("응답 청크는 DELTA로, 스트림 종료는 END로 변환된다")
	void stream_success() {
		when(chatModel.stream(any(Prompt.class))).thenReturn(
			Flux.just(createChatResponse("Hi"), createChatResponse(" there")));

		StepVerifier.create(adapter.stream(List.of(Turn.user("Hello")), PARAMETERS))
			.expectNext(GenerationEvent.delta("Hi"))
			.expectNext(GenerationEvent.delta(" there"))
			.expectNext(GenerationEvent.end())
			.verifyComplete();
	}

	@Test
	@DisplayName("메시지 역할과 생성 옵션을 Prompt로 전달한다")
	void stream_convertsTurnsAndOptions() {
		ArgumentCaptor<Prompt> promptCaptor = ArgumentCaptor.forClass(Prompt.class);
		when(chatModel.stream(any(Prompt.class))).thenReturn(Flux.just(createChatResponse("응답")));

		adapter.stream(List.of(Turn.system("prompt"), Turn.user("질문"), Turn.assistant("이전 답변"),
			Turn.user("추가 질문")), PARAMETERS).blockLast();

		verify(chatModel).stream(promptCaptor.capture());
		Prompt prompt = promptCaptor.getValue();
		assertThat(prompt.getInstructions()).hasSize(4);
		assertThat(prompt.getInstructions().get(0)).isInstanceOf(SystemMessage.class);
		assertThat(prompt.getInstructions().get(1)).isInstanceOf(UserMessage.class);
		assertThat(prompt.getInstructions().get(2)).isInstanceOf(AssistantMessage.class);
		OpenAiChatOptions options = (OpenAiChatOptions) prompt.getOptions();
		assertThat(options.getModel()).isEqualTo("gpt-4o-mini");
		assertThat(options.getMaxTokens()).isEqualTo(2048);
		assertThat(options.getTemperature()).isEqualTo(0.7);
	}

	@Test
	@DisplayName("빈 메시지는 Prompt에서 제외한다")
	void stream_skipsBlankTurns() {
		ArgumentCaptor<Prompt> promptCaptor = ArgumentCaptor.forClass(Prompt.class);
		when(chatModel.stream(any(Prompt.class))).thenReturn(Flux.just(createChatResponse("응답")));

		adapter.stream(List.of(Turn.user("질문"), Turn.assistant("")), PARAMETERS).blockLast();

		verify(chatModel).stream(promptCaptor.capture());
		assertThat(promptCaptor.getValue().getInstructions()).hasSize(1);
	}

	@Test
	@DisplayName("전송 실패는 ERROR 이벤트로 변환된다")
	void stream_transportFailure_errorEvent() {
		when(chatModel.stream(any(Prompt.class))).thenReturn(
			Flux.error(new RuntimeException("connection reset")));

		StepVerifier.create(adapter.stream(List.of(Turn.user("Hello")), PARAMETERS))
			.expectNext(GenerationEvent.error("connection reset"))
			.verifyComplete();
	}

	@Test
	@DisplayName("중간 실패 시 받은 DELTA 뒤에 ERROR 이벤트가 온다")
	void stream_midStreamFailure() {
		when(chatModel.stream(any(Prompt.class))).thenReturn(Flux.concat(
			Flux.just(createChatResponse("부분")),
			Flux.error(new RuntimeException("rate limited"))));

		StepVerifier.create(adapter.stream(List.of(Turn.user("Hello")), PARAMETERS))
			.expectNext(GenerationEvent.delta("부분"))
			.expectNext(GenerationEvent.error("rate limited"))
			.verifyComplete();
	}

	private ChatResponse createChatResponse(String content) {
		return new ChatResponse(List.of(new Generation(new AssistantMessage(content))));
	}
}
