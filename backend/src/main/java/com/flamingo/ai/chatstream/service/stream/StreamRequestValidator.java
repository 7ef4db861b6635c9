package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.api.dto.request.ChatMessageInput;
import com.flamingo.ai.chatstream.api.dto.request.StartStreamRequest;
import com.flamingo.ai.chatstream.domain.enums.MessageRole;
import com.flamingo.ai.chatstream.exception.ValidationException;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Request checks that need no datastore access. */
@Component
public class StreamRequestValidator {

  private static final Set<String> REASONING_EFFORTS = Set.of("none", "low", "medium", "high");

  /**
   * Validates a start request.
   *
   * @throws ValidationException describing the first problem found
   */
  public void validate(StartStreamRequest request) {
    List<ChatMessageInput> messages = request.getMessages();
    if (messages == null || messages.isEmpty()) {
      throw new ValidationException("messages must not be empty");
    }
    for (int i = 0; i < messages.size(); i++) {
      ChatMessageInput message = messages.get(i);
      if (message == null) {
        throw new ValidationException("messages[" + i + "] must not be null");
      }
      if (MessageRole.fromWireName(message.getRole()).isEmpty()) {
        throw new ValidationException(
            "messages[" + i + "].role must be one of user, assistant, system");
      }
      if (!StringUtils.hasText(message.resolveText())) {
        throw new ValidationException("messages[" + i + "] must have content or text parts");
      }
    }
    if (!StringUtils.hasText(request.getModel())) {
      throw new ValidationException("model is required");
    }
    if (!StringUtils.hasText(request.getProviderSelector())) {
      throw new ValidationException("providerSelector is required");
    }
    if (request.getReasoningEffort() != null
        && !REASONING_EFFORTS.contains(request.getReasoningEffort())) {
      throw new ValidationException("reasoningEffort must be one of none, low, medium, high");
    }
  }
}
