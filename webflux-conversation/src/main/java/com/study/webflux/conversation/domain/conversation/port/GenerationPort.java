package com.study.webflux.conversation.domain.conversation.port;

import java.util.List;

import com.study.webflux.conversation.domain.conversation.model.GenerationEvent;
import com.study.webflux.conversation.domain.conversation.model.GenerationParameters;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import reactor.core.publisher.Flux;

public interface GenerationPort {

	/**
	 * 메시지 목록으로 응답을 생성하고 DELTA 이벤트를 순서대로 내보낸 뒤 END 또는 ERROR 이벤트로 종료합니다.
	 * 첫 이벤트 이전의 전송 실패는 Flux 에러로 전달될 수 있습니다.
	 */
	Flux<GenerationEvent> stream(List<Turn> turns, GenerationParameters parameters);
}
