package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.api.dto.response.StreamEventResponse;
import java.util.UUID;
import reactor.core.publisher.Flux;

/**
 * A started stream.
 *
 * @param streamId id a reconnecting client resumes by
 * @param messageId assistant message row, null for ephemeral streams
 * @param events events for the originating client
 */
public record StreamHandle(String streamId, UUID messageId, Flux<StreamEventResponse> events) {}
