package com.flamingo.ai.chatstream.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** Request DTO for starting a generation stream. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartStreamRequest {

  @NotEmpty(message = "messages must not be empty")
  @Valid
  private List<ChatMessageInput> messages;

  @NotBlank(message = "model is required")
  private String model;

  /** Configured provider name, e.g. osschat or openrouter. */
  @NotBlank(message = "providerSelector is required")
  private String providerSelector;

  /** Caller's own provider key. Required by providers that do not use a server key. */
  @ToString.Exclude private String credentialMaterial;

  /** Chat to persist into. Absent for ephemeral streams. */
  private UUID chatId;

  private String userId;

  @Pattern(regexp = "none|low|medium|high", message = "must be one of none, low, medium, high")
  private String reasoningEffort;

  private Boolean enableTools;

  /** Upper bound of tool-loop steps; clamped to the configured ceiling. */
  private Integer maxSteps;
}
