package com.actionplan.taskimport.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.actionplan.taskimport.TaskImportApplication;
import com.actionplan.taskimport.domain.TaskStatus;
import com.actionplan.taskimport.service.pipeline.normalize.Vocabulary;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    classes = TaskImportApplication.class,
    properties = {
      "task.import.zone-id=Europe/Paris",
      "task.import.max-file-size-mb=5",
      "task.import.status-synonyms.[validé]=done",
      "task.import.category-synonyms.[commissioning]=Installation"
    })
class TaskImportConfigTest {

  @Autowired private TaskImportProperties properties;

  @Autowired private Vocabulary vocabulary;

  @Test
  void properties_bound() {
    assertThat(properties.getZone()).isEqualTo(ZoneId.of("Europe/Paris"));
    assertThat(properties.getMaxFileSizeBytes()).isEqualTo(5L * 1024 * 1024);
    assertThat(properties.getStatusSynonyms()).containsEntry("validé", TaskStatus.DONE);
  }

  @Test
  void vocabulary_includesConfiguredSpellings() {
    assertThat(vocabulary.normalizeStatus("Validé")).isEqualTo(TaskStatus.DONE);
    assertThat(vocabulary.lookupCategory("Commissioning")).contains("Installation");
    assertThat(vocabulary.normalizeStatus("terminé")).isEqualTo(TaskStatus.DONE);
  }

  @Test
  void defaults_whenNothingConfigured() {
    var defaults = new TaskImportProperties();

    assertThat(defaults.getZone()).isEqualTo(ZoneId.of("UTC"));
    assertThat(defaults.getMaxFileSizeMb()).isEqualTo(10);
    assertThat(defaults.toVocabularyExtension().isEmpty()).isTrue();
  }
}
