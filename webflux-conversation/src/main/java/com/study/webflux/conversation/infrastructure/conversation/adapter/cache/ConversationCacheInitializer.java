package com.study.webflux.conversation.infrastructure.conversation.adapter.cache;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.study.webflux.conversation.domain.conversation.port.ConversationCachePort;

/**
 * 애플리케이션 시작 시 현재 스키마 버전과 다른 캐시 항목을 정리합니다. 별도의 마이그레이션 단계 없이 캐시 형식 변경을 처리합니다.
 */
@Slf4j
@Component
public class ConversationCacheInitializer implements ApplicationRunner {

	private static final Duration PURGE_TIMEOUT = Duration.ofSeconds(30);

	private final ConversationCachePort cachePort;

	public ConversationCacheInitializer(ConversationCachePort cachePort) {
		this.cachePort = cachePort;
	}

	@Override
	public void run(ApplicationArguments args) {
		cachePort.purgeStaleVersions()
			.timeout(PURGE_TIMEOUT)
			.doOnError(error -> log.warn("캐시 정리가 시간 내에 끝나지 않았습니다: {}", error.getMessage()))
			.onErrorReturn(0L)
			.subscribe();
	}
}
