package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.api.dto.request.StartStreamRequest;

/** Entry point for starting a generation stream. */
public interface StreamOrchestrator {

  /**
   * Validates, admits and starts a stream. Every failure raised here happens before any row is
   * written or any pointer is set.
   *
   * @param request the start request
   * @param bucketKey rate-limit bucket of the caller
   * @return the started stream
   */
  StreamHandle start(StartStreamRequest request, String bucketKey);
}
