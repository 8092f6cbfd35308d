package com.study.webflux.conversation.infrastructure.conversation.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.study.webflux.conversation.domain.conversation.model.GenerationParameters;
import com.study.webflux.conversation.domain.conversation.service.HistoryTrimmer;
import com.study.webflux.conversation.domain.conversation.service.PreviewExtractor;
import com.study.webflux.conversation.infrastructure.conversation.config.properties.ConversationProperties;

/** 대화 캐시와 기록 관리 정책을 구성합니다. */
@Configuration
public class ConversationConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public HistoryTrimmer historyTrimmer(ConversationProperties properties) {
		return new HistoryTrimmer(properties.getMaxHistory());
	}

	@Bean
	public PreviewExtractor previewExtractor(ConversationProperties properties) {
		return new PreviewExtractor(properties.getHistory().getPreviewLength());
	}

	@Bean
	public GenerationParameters generationParameters(ConversationProperties properties) {
		var generation = properties.getGeneration();
		return new GenerationParameters(generation.getModel(), generation.getMaxTokens(),
			generation.getTemperature());
	}

	/** 대화 캐시용 String 템플릿입니다. 메시지 목록은 JSON 문자열로 저장합니다. */
	@Bean
	public ReactiveRedisTemplate<String, String> reactiveStringRedisTemplate(
		ReactiveRedisConnectionFactory connectionFactory) {
		RedisSerializationContext<String, String> context = RedisSerializationContext
			.<String, String>newSerializationContext(new StringRedisSerializer())
			.value(new StringRedisSerializer()).build();

		return new ReactiveRedisTemplate<>(connectionFactory, context);
	}
}
