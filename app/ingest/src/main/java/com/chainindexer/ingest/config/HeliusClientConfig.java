/*
 * どこで: Ingest 設定
 * 何を: Helius 購読編集専用の RestClient を提供する
 * なぜ: 外部 API ごとに baseUrl とタイムアウトの設定責務を分離するため
 */
package com.chainindexer.ingest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HeliusClientConfig {

  @Bean
  RestClient heliusRestClient(RestClient.Builder builder, HeliusWebhookProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
