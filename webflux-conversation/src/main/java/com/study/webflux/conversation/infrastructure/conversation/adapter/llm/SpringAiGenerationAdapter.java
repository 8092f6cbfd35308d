package com.study.webflux.conversation.infrastructure.conversation.adapter.llm;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.stereotype.Component;

import com.study.webflux.conversation.domain.conversation.model.GenerationEvent;
import com.study.webflux.conversation.domain.conversation.model.GenerationParameters;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import com.study.webflux.conversation.domain.conversation.port.GenerationPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Spring AI ChatModel 스트림을 생성 이벤트로 변환합니다. 응답 청크는 DELTA로, 정상 종료는 END로, 전송 실패는 ERROR로 전달됩니다.
 */
@Slf4j
@Component
public class SpringAiGenerationAdapter implements GenerationPort {

	private final ChatModel chatModel;

	public SpringAiGenerationAdapter(ChatModel chatModel) {
		this.chatModel = chatModel;
	}

	@Override
	public Flux<GenerationEvent> stream(List<Turn> turns, GenerationParameters parameters) {
		OpenAiChatOptions options = OpenAiChatOptions.builder()
			.model(parameters.model())
			.maxTokens(parameters.maxTokens())
			.temperature(parameters.temperature())
			.build();

		Prompt prompt = new Prompt(convertTurns(turns), options);

		return chatModel.stream(prompt)
			.mapNotNull(response -> {
				var generation = response.getResult();
				return generation != null && generation.getOutput() != null
					? generation.getOutput().getText()
					: null;
			})
			.filter(text -> !text.isEmpty())
			.map(GenerationEvent::delta)
			.concatWith(Mono.fromSupplier(GenerationEvent::end))
			.onErrorResume(error -> {
				log.error("응답 생성 스트림 실패: model={}, error={}", parameters.model(), error.getMessage());
				return Mono.just(GenerationEvent.error(error.getMessage()));
			});
	}

	private List<Message> convertTurns(List<Turn> turns) {
		return turns.stream()
			.filter(turn -> !turn.content().isBlank())
			.map(this::convertTurn)
			.toList();
	}

	private Message convertTurn(Turn turn) {
		return switch (turn.role()) {
			case SYSTEM -> new SystemMessage(turn.content());
			case USER -> new UserMessage(turn.content());
			case ASSISTANT -> new AssistantMessage(turn.content());
		};
	}
}
