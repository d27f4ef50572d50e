package com.actionplan.taskimport.service.pipeline.normalize;

import com.actionplan.taskimport.domain.TaskStatus;
import java.util.Map;

/**
 * Additional value spellings supplied by the caller, typically vocabulary already known to the
 * rest of the system. Category targets may be labels outside the fixed category set.
 */
public record VocabularyExtension(
    Map<String, TaskStatus> statusSynonyms, Map<String, String> categorySynonyms) {

  public static final VocabularyExtension NONE = new VocabularyExtension(Map.of(), Map.of());

  public VocabularyExtension {
    statusSynonyms = statusSynonyms == null ? Map.of() : Map.copyOf(statusSynonyms);
    categorySynonyms = categorySynonyms == null ? Map.of() : Map.copyOf(categorySynonyms);
  }

  public boolean isEmpty() {
    return statusSynonyms.isEmpty() && categorySynonyms.isEmpty();
  }
}
