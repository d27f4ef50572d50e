package com.actionplan.taskimport.config;

import com.actionplan.taskimport.service.pipeline.header.HeaderSynonymTable;
import com.actionplan.taskimport.service.pipeline.normalize.Vocabulary;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class TaskImportConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public HeaderSynonymTable headerSynonymTable() {
    return HeaderSynonymTable.defaults();
  }

  /** Built-in French/English vocabulary plus the spellings configured under task.import. */
  @Bean
  public Vocabulary vocabulary(TaskImportProperties properties) {
    var extension = properties.toVocabularyExtension();
    if (!extension.isEmpty()) {
      log.info(
          "Configured vocabulary extension: {} status and {} category spelling(s)",
          extension.statusSynonyms().size(),
          extension.categorySynonyms().size());
    }
    return Vocabulary.defaults().extendedWith(extension);
  }
}
