package com.flamingo.ai.chatstream.service.stream;

import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.exception.AuthException;
import com.flamingo.ai.chatstream.exception.ConfigurationException;
import com.flamingo.ai.chatstream.exception.ValidationException;
import com.flamingo.ai.chatstream.relay.ResolvedProvider;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Picks the provider endpoint and the credential for a request. */
@Component
@RequiredArgsConstructor
public class ProviderResolver {

  private final StreamConfig streamConfig;

  /**
   * Resolves a provider selector.
   *
   * @throws ValidationException if no such provider is configured
   * @throws AuthException if the provider needs the caller's key and none was sent
   * @throws ConfigurationException if the provider needs a server key that is not configured
   */
  public ResolvedProvider resolve(String selector, String credentialMaterial) {
    StreamConfig.Provider provider = streamConfig.getProviders().get(selector);
    if (provider == null) {
      throw new ValidationException("Unknown provider: " + selector);
    }

    String apiKey;
    if (provider.isRequiresCallerCredential()) {
      if (!StringUtils.hasText(credentialMaterial)) {
        throw new AuthException("An API key is required for provider " + selector);
      }
      apiKey = credentialMaterial.trim();
    } else if (StringUtils.hasText(credentialMaterial)) {
      apiKey = credentialMaterial.trim();
    } else {
      if (!StringUtils.hasText(provider.getApiKey())) {
        throw new ConfigurationException("Server API key not configured for provider " + selector);
      }
      apiKey = provider.getApiKey();
    }
    return new ResolvedProvider(
        selector, provider.getBaseUrl(), apiKey, Map.copyOf(provider.getHeaders()));
  }
}
