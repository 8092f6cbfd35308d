package com.study.webflux.conversation.application.conversation.controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import com.study.webflux.conversation.domain.conversation.exception.ConversationAccessDeniedException;
import com.study.webflux.conversation.domain.conversation.exception.ConversationNotFoundException;
import com.study.webflux.conversation.domain.conversation.exception.ConversationPersistenceException;
import com.study.webflux.conversation.domain.conversation.exception.GenerationFailedException;
import com.study.webflux.conversation.domain.conversation.exception.GenerationInProgressException;
import com.study.webflux.conversation.domain.conversation.exception.InvalidMessageException;

/** 대화 API 예외를 JSON 응답으로 변환합니다. */
@Slf4j
@RestControllerAdvice(assignableTypes = ConversationChatController.class)
public class ConversationExceptionHandler {

	@ExceptionHandler({InvalidMessageException.class, WebExchangeBindException.class,
		ServerWebInputException.class})
	public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
		String message = ex instanceof WebExchangeBindException bindException
			? bindException.getBindingResult().getAllErrors().stream()
				.map(ObjectError::getDefaultMessage)
				.findFirst()
				.orElse("Invalid request")
			: ex.getMessage();
		return respond(HttpStatus.BAD_REQUEST, "invalid_message", message);
	}

	@ExceptionHandler(ConversationNotFoundException.class)
	public ResponseEntity<Map<String, Object>> handleNotFound(ConversationNotFoundException ex) {
		return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
	}

	@ExceptionHandler(ConversationAccessDeniedException.class)
	public ResponseEntity<Map<String, Object>> handleAccessDenied(
		ConversationAccessDeniedException ex) {
		log.warn("대화 접근 거부: {}", ex.getMessage());
		return respond(HttpStatus.FORBIDDEN, "forbidden", ex.getMessage());
	}

	@ExceptionHandler(GenerationInProgressException.class)
	public ResponseEntity<Map<String, Object>> handleInProgress(GenerationInProgressException ex) {
		return respond(HttpStatus.CONFLICT, "generation_in_progress", ex.getMessage());
	}

	@ExceptionHandler(GenerationFailedException.class)
	public ResponseEntity<Map<String, Object>> handleGenerationFailed(GenerationFailedException ex) {
		log.error("응답 생성 실패: {}", ex.getMessage());
		return respond(HttpStatus.BAD_GATEWAY, "generation_failed", ex.getMessage());
	}

	@ExceptionHandler(ConversationPersistenceException.class)
	public ResponseEntity<Map<String, Object>> handlePersistence(
		ConversationPersistenceException ex) {
		log.warn("대화 저장소 접근 실패: {}", ex.getMessage(), ex.getCause());
		return respond(HttpStatus.SERVICE_UNAVAILABLE, "storage_unavailable", ex.getMessage());
	}

	private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error,
		String message) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("status", status.value());
		body.put("error", error);
		body.put("message", message);
		body.put("timestamp", Instant.now().toString());
		return ResponseEntity.status(status).body(body);
	}
}
