package com.flamingo.ai.hybridrag.config;

import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Neo4j driver for the knowledge graph store. */
@Configuration
public class Neo4jConfig {

  @Bean(destroyMethod = "close")
  public Driver neo4jDriver(
      @Value("${neo4j.uri:bolt://localhost:7687}") String uri,
      @Value("${neo4j.user:neo4j}") String user,
      @Value("${neo4j.password:neo4j}") String password) {
    return GraphDatabase.driver(uri, AuthTokens.basic(user, password));
  }
}
