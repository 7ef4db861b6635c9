package com.flamingo.ai.chatstream.service.stream;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.chatstream.api.dto.request.ChatMessageInput;
import com.flamingo.ai.chatstream.api.dto.request.StartStreamRequest;
import com.flamingo.ai.chatstream.exception.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class StreamRequestValidatorTest {

  private final StreamRequestValidator validator = new StreamRequestValidator();

  @Test
  void shouldAcceptTextParts_whenContentBlank() {
    ChatMessageInput message =
        ChatMessageInput.builder()
            .role("user")
            .content(" ")
            .parts(
                List.of(
                    new ChatMessageInput.Part("image", null),
                    new ChatMessageInput.Part("text", "What is this?")))
            .build();

    assertThatCode(() -> validator.validate(request(message))).doesNotThrowAnyException();
  }

  @Test
  void shouldRejectMessageWithoutText() {
    ChatMessageInput message =
        ChatMessageInput.builder()
            .role("user")
            .parts(List.of(new ChatMessageInput.Part("image", null)))
            .build();

    assertThatThrownBy(() -> validator.validate(request(message)))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("messages[0]");
  }

  @Test
  void shouldAcceptOnlyLowerCaseRoleNames() {
    StartStreamRequest system =
        request(ChatMessageInput.builder().role("system").content("be brief").build());
    StartStreamRequest capitalised =
        request(ChatMessageInput.builder().role("User").content("hi").build());
    StartStreamRequest missing = request(ChatMessageInput.builder().content("hi").build());

    assertThatCode(() -> validator.validate(system)).doesNotThrowAnyException();
    assertThatThrownBy(() -> validator.validate(capitalised))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("messages[0].role");
    assertThatThrownBy(() -> validator.validate(missing))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("messages[0].role");
  }

  @Test
  void shouldRejectUnknownReasoningEffort() {
    StartStreamRequest request =
        request(ChatMessageInput.builder().role("user").content("hi").build());
    request.setReasoningEffort("extreme");

    assertThatThrownBy(() -> validator.validate(request))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("reasoningEffort");
  }

  @Test
  void shouldRequireModelAndProvider() {
    StartStreamRequest noModel =
        request(ChatMessageInput.builder().role("user").content("hi").build());
    noModel.setModel(" ");
    StartStreamRequest noProvider =
        request(ChatMessageInput.builder().role("user").content("hi").build());
    noProvider.setProviderSelector(null);

    assertThatThrownBy(() -> validator.validate(noModel)).hasMessage("model is required");
    assertThatThrownBy(() -> validator.validate(noProvider))
        .hasMessage("providerSelector is required");
  }

  private static StartStreamRequest request(ChatMessageInput message) {
    return StartStreamRequest.builder()
        .messages(List.of(message))
        .model("test-model")
        .providerSelector("osschat")
        .build();
  }
}
