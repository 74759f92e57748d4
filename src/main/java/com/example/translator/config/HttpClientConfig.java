package com.example.translator.config;

import com.example.translator.properties.ApplicationProperties;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OkHttp client configuration for the upstream translation provider
 */
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class HttpClientConfig {

  private final ApplicationProperties properties;

  @Bean
  public ConnectionPool sharedConnectionPool() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new ConnectionPool(client.maxIdleConnections(), client.keepAliveDurationMinutes(), TimeUnit.MINUTES);
  }

  @Bean
  public Dispatcher sharedDispatcher() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(client.maxRequests());
    dispatcher.setMaxRequestsPerHost(client.maxRequestsPerHost());
    return dispatcher;
  }

  /**
   * Streaming client: the read timeout bounds the gap between two fragments, not the whole call.
   */
  @Bean
  public OkHttpClient upstreamOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher) {
    ApplicationProperties.UpstreamProperties upstream = properties.upstream();
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(upstream.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .readTimeout(upstream.readTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .writeTimeout(upstream.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .build();
  }
}
