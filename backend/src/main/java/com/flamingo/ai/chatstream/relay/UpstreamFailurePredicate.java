package com.flamingo.ai.chatstream.relay;

import com.flamingo.ai.chatstream.exception.AuthException;
import com.flamingo.ai.chatstream.exception.ConfigurationException;
import com.flamingo.ai.chatstream.exception.RateLimitException;
import com.flamingo.ai.chatstream.exception.UpstreamProviderException;
import com.flamingo.ai.chatstream.exception.ValidationException;
import java.util.function.Predicate;

/**
 * Decides which failures of {@code open} count against the shared "upstream" circuit breaker. Only
 * provider-side trouble does: 5xx answers, connection errors and timeouts. Answers caused by the
 * caller (bad credentials, unknown model, malformed request, quota) are not recorded.
 */
public class UpstreamFailurePredicate implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    if (throwable instanceof UpstreamProviderException providerError) {
      return providerError.getStatus() >= 500;
    }
    return !(throwable instanceof AuthException
        || throwable instanceof RateLimitException
        || throwable instanceof ValidationException
        || throwable instanceof ConfigurationException);
  }
}
