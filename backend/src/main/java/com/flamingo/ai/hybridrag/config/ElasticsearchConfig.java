package com.flamingo.ai.hybridrag.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.HttpHost;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connection to the cluster holding the chunk vector index.
 *
 * <p>Chunks are written without null fields, so a chunk ingested before its embedding was
 * computed never stores an explicit {@code embedding: null} that the dense_vector mapping would
 * reject. Reads tolerate fields added to the index mapping by later releases.
 */
@Slf4j
@Configuration
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Bean
  public Rest5Client rest5Client() {
    HttpHost endpoint = chunkIndexEndpoint(scheme, host, port);
    log.info("Chunk index cluster at {}", endpoint.toURI());
    return Rest5Client.builder(endpoint).build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(Rest5Client rest5Client) {
    return new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper(chunkObjectMapper()));
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }

  static HttpHost chunkIndexEndpoint(String scheme, String host, int port) {
    if (host == null || host.isBlank()) {
      throw new IllegalStateException("elasticsearch.host must be set");
    }
    if (port <= 0 || port > 65535) {
      throw new IllegalStateException("elasticsearch.port out of range: " + port);
    }
    return new HttpHost(scheme, host.trim(), port);
  }

  static ObjectMapper chunkObjectMapper() {
    return new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }
}
