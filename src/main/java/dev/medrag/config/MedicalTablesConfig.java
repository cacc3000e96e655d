package dev.medrag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.medrag.query.SynonymNormalizer;
import dev.medrag.rule.RuleTable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/**
 * Loads the medical keyword tables from JSON resources.
 *
 * <p>Both tables are ordered JSON objects. A missing or malformed table stops the application at
 * startup.
 */
@Configuration
public class MedicalTablesConfig {

  private static final Logger log = LoggerFactory.getLogger(MedicalTablesConfig.class);

  @Bean
  public RuleTable ruleTable(
      ObjectMapper objectMapper,
      @Value("${medrag.tables.rules:classpath:medical/rules.json}") Resource resource) {
    try (InputStream json = resource.getInputStream()) {
      RuleTable table = RuleTable.fromJson(json, objectMapper);
      log.info("Loaded rule table with {} categories from {}", table.keywords().size(), resource);
      return table;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load rule table from " + resource, e);
    }
  }

  @Bean
  public SynonymNormalizer synonymNormalizer(
      ObjectMapper objectMapper,
      @Value("${medrag.tables.synonyms:classpath:medical/synonyms.json}") Resource resource) {
    try (InputStream json = resource.getInputStream()) {
      SynonymNormalizer normalizer = SynonymNormalizer.fromJson(json, objectMapper);
      log.info("Loaded {} synonym entries from {}", normalizer.entries().size(), resource);
      return normalizer;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load synonym table from " + resource, e);
    }
  }
}
