package com.study.webflux.conversation.infrastructure.conversation.adapter.cache;

import java.time.Duration;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import com.study.webflux.conversation.domain.conversation.port.ConversationCachePort;
import com.study.webflux.conversation.infrastructure.conversation.config.properties.ConversationProperties;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis에 대화 메시지 목록을 JSON으로 저장하는 캐시 어댑터입니다.
 *
 * <p>
 * 키 형식은 {@code chat:{version}:{conversationId}}이며, Redis 장애 시 빈 목록 조회와 무시된 쓰기로 동작합니다.
 */
@Slf4j
@Component
public class RedisConversationCacheAdapter implements ConversationCachePort {

	private static final TypeReference<List<Turn>> TURN_LIST = new TypeReference<>() {
	};
	private static final long SCAN_BATCH_SIZE = 100;

	private final ReactiveRedisTemplate<String, String> redisTemplate;
	private final ObjectMapper objectMapper;
	private final String keyPrefix;
	private final String version;
	private final Duration defaultTtl;
	private final List<String> purgeNamespaces;

	public RedisConversationCacheAdapter(ReactiveRedisTemplate<String, String> redisTemplate,
		ObjectMapper objectMapper,
		ConversationProperties properties) {
		this.redisTemplate = redisTemplate;
		this.objectMapper = objectMapper;
		var cache = properties.getCache();
		this.keyPrefix = cache.getKeyPrefix();
		this.version = cache.getVersion();
		this.defaultTtl = cache.getTtl();
		this.purgeNamespaces = List.copyOf(cache.getPurgeNamespaces());
	}

	String keyFor(ConversationId conversationId) {
		return keyPrefix + ":" + version + ":" + conversationId.value();
	}

	@Override
	public Mono<List<Turn>> get(ConversationId conversationId) {
		String key = keyFor(conversationId);
		return redisTemplate.opsForValue().get(key)
			.flatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, TURN_LIST)))
			.doOnNext(turns -> log.debug("대화 캐시 조회: conversationId={}, size={}",
				conversationId.value(),
				turns.size()))
			.defaultIfEmpty(List.of())
			.onErrorResume(error -> {
				log.warn("대화 캐시 조회 실패, 빈 기록으로 처리합니다: key={}, error={}", key, error.getMessage());
				return Mono.just(List.of());
			});
	}

	@Override
	public Mono<Void> put(ConversationId conversationId, List<Turn> turns) {
		return put(conversationId, turns, defaultTtl);
	}

	@Override
	public Mono<Void> put(ConversationId conversationId, List<Turn> turns, Duration ttl) {
		String key = keyFor(conversationId);
		return Mono.fromCallable(() -> objectMapper.writeValueAsString(turns))
			.flatMap(json -> redisTemplate.opsForValue().set(key, json, ttl))
			.doOnNext(saved -> log.debug("대화 캐시 저장: key={}, size={}", key, turns.size()))
			.onErrorResume(error -> {
				log.warn("대화 캐시 저장 실패: key={}, error={}", key, error.getMessage());
				return Mono.empty();
			})
			.then();
	}

	@Override
	public Mono<Void> delete(ConversationId conversationId) {
		String key = keyFor(conversationId);
		return redisTemplate.delete(key)
			.doOnNext(count -> log.debug("대화 캐시 삭제: key={}, deleted={}", key, count))
			.onErrorResume(error -> {
				log.warn("대화 캐시 삭제 실패: key={}, error={}", key, error.getMessage());
				return Mono.empty();
			})
			.then();
	}

	@Override
	public Mono<Long> purgeStaleVersions() {
		return Flux.fromIterable(purgeNamespaces)
			.concatMap(this::purgeNamespace)
			.reduce(0L, Long::sum)
			.doOnNext(count -> log.info("이전 버전 캐시 정리 완료: version={}, deleted={}", version, count))
			.onErrorResume(error -> {
				log.warn("이전 버전 캐시 정리 실패: {}", error.getMessage());
				return Mono.just(0L);
			});
	}

	private Mono<Long> purgeNamespace(String namespace) {
		String currentPrefix = namespace + ":" + version + ":";
		ScanOptions options = ScanOptions.scanOptions()
			.match(namespace + ":*")
			.count(SCAN_BATCH_SIZE)
			.build();
		return redisTemplate.scan(options)
			.filter(key -> !key.startsWith(currentPrefix))
			.concatMap(redisTemplate::delete)
			.reduce(0L, Long::sum);
	}
}
