package com.actionplan.taskimport.config;

import com.actionplan.taskimport.domain.TaskStatus;
import com.actionplan.taskimport.service.pipeline.normalize.VocabularyExtension;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "task.import")
public class TaskImportProperties {

    private int maxFileSizeMb = 10;

    /** Zone in which workbook dates without an offset are anchored. */
    private String zoneId = "UTC";

    /** Extra status spellings applied to every import, e.g. {@code "[a faire]": pending}. */
    private Map<String, TaskStatus> statusSynonyms = new LinkedHashMap<>();

    /** Extra category spellings applied to every import; targets may be custom labels. */
    private Map<String, String> categorySynonyms = new LinkedHashMap<>();

    public ZoneId getZone() {
        return ZoneId.of(zoneId);
    }

    public long getMaxFileSizeBytes() {
        return (long) maxFileSizeMb * 1024 * 1024;
    }

    public VocabularyExtension toVocabularyExtension() {
        return new VocabularyExtension(statusSynonyms, categorySynonyms);
    }
}
