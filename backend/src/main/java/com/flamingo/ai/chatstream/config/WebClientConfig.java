package com.flamingo.ai.chatstream.config;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/** WebClient used for provider streaming calls and tool HTTP calls. */
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

  private final StreamConfig streamConfig;

  @Bean(destroyMethod = "dispose")
  public ConnectionProvider upstreamConnectionProvider() {
    return ConnectionProvider.builder("upstream").maxConnections(200).build();
  }

  @Bean
  public WebClient upstreamWebClient(ConnectionProvider upstreamConnectionProvider) {
    StreamConfig.Upstream upstream = streamConfig.getUpstream();
    HttpClient httpClient =
        HttpClient.create(upstreamConnectionProvider)
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) upstream.getConnectTimeout().toMillis())
            // Read timeout between bytes; the total generation limit is enforced by the pump.
            .responseTimeout(upstream.getResponseTimeout());

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
        .build();
  }
}
