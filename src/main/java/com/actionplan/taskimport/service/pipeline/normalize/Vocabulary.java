package com.actionplan.taskimport.service.pipeline.normalize;

import com.actionplan.taskimport.domain.TaskCategory;
import com.actionplan.taskimport.domain.TaskStatus;
import java.text.Normalizer;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * French/English synonym tables for status and category cell values. Lookups are exact after
 * trimming and lower-casing.
 */
public final class Vocabulary {

  private final Map<String, TaskStatus> statuses;
  private final Map<String, String> categories;

  private Vocabulary(Map<String, TaskStatus> statuses, Map<String, String> categories) {
    this.statuses = Collections.unmodifiableMap(statuses);
    this.categories = Collections.unmodifiableMap(categories);
  }

  public static Vocabulary defaults() {
    var statuses = new HashMap<String, TaskStatus>();
    register(statuses, TaskStatus.DONE,
        List.of("done", "completed", "finished", "complete", "terminé", "termine", "fini"));
    register(statuses, TaskStatus.PENDING,
        List.of("pending", "waiting", "wait", "en attente", "attente"));
    register(statuses, TaskStatus.IN_PROGRESS,
        List.of("in-progress", "in progress", "inprogress", "progress", "working", "en cours",
            "cours"));
    register(statuses, TaskStatus.CANCELLED,
        List.of("cancelled", "canceled", "cancel", "annulé", "annule"));
    register(statuses, TaskStatus.ON_HOLD,
        List.of("on-hold", "on hold", "onhold", "hold", "paused", "pause", "en pause"));

    var categories = new HashMap<String, String>();
    register(categories, TaskCategory.INSTALLATION.getLabel(),
        List.of("installation", "install", "installing", "setup"));
    register(categories, TaskCategory.REPAIR.getLabel(),
        List.of("repair", "réparation", "reparation", "fix", "fixing", "maintenance"));
    register(categories, TaskCategory.DEVELOPMENT.getLabel(),
        List.of("development", "développement", "developpement", "dev", "programming",
            "coding"));
    register(categories, TaskCategory.DELIVERY.getLabel(),
        List.of("delivery", "livraison", "shipping", "transport", "expedition", "expédition"));
    register(categories, TaskCategory.COMMERCIAL.getLabel(),
        List.of("commercial", "sales", "vente", "marketing", "business"));

    return new Vocabulary(statuses, categories);
  }

  /** Copy of this vocabulary with the extension's spellings added. Built-in spellings win. */
  public Vocabulary extendedWith(VocabularyExtension extension) {
    if (extension == null || extension.isEmpty()) {
      return this;
    }
    var extendedStatuses = new HashMap<>(statuses);
    extension.statusSynonyms().forEach((raw, status) -> extendedStatuses.putIfAbsent(key(raw), status));
    var extendedCategories = new HashMap<>(categories);
    extension.categorySynonyms()
        .forEach((raw, label) -> extendedCategories.putIfAbsent(key(raw), label.trim()));
    return new Vocabulary(extendedStatuses, extendedCategories);
  }

  /** Unknown or empty values are {@link TaskStatus#PENDING}, the safe default for a backlog item. */
  public TaskStatus normalizeStatus(String raw) {
    if (raw == null || raw.isBlank()) {
      return TaskStatus.PENDING;
    }
    return statuses.getOrDefault(key(raw), TaskStatus.PENDING);
  }

  public Optional<String> lookupCategory(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(categories.get(key(raw)));
  }

  /** "network SETUP" -> "Network setup". */
  public static String capitalize(String raw) {
    String value = raw.trim();
    if (value.isEmpty()) {
      return value;
    }
    int firstLength = Character.charCount(value.codePointAt(0));
    return value.substring(0, firstLength).toUpperCase(Locale.ROOT)
        + value.substring(firstLength).toLowerCase(Locale.ROOT);
  }

  private static <V> void register(Map<String, V> table, V target, List<String> spellings) {
    spellings.forEach(spelling -> table.put(key(spelling), target));
  }

  private static String key(String raw) {
    // NFC so that a decomposed "é" typed on some keyboards matches the table
    return Normalizer.normalize(raw.trim(), Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
  }
}
