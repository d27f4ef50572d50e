package com.actionplan.taskimport.service.file;

import com.actionplan.taskimport.config.TaskImportProperties;
import com.actionplan.taskimport.util.SecureExcelUtils;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskUploadFileService {

    private final TaskImportProperties properties;

    /**
     * Checks an uploaded workbook before it reaches the import engine and returns its content.
     * Only .xlsx is accepted.
     *
     * @throws IllegalArgumentException if the file is missing, empty or not an .xlsx name
     * @throws MaxUploadSizeExceededException if the file is larger than the configured ceiling
     * @throws SecurityException if the content is not a zip container
     */
    public byte[] readValidatedXlsx(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }

        String originalName = file.getOriginalFilename();
        if (originalName != null && originalName.trim().toLowerCase().endsWith(".xls")) {
            throw new IllegalArgumentException(
                "Unsupported file format. Only .xlsx files can be uploaded.");
        }
        String safeName = SecureExcelUtils.sanitizeFilename(originalName);

        long maxBytes = properties.getMaxFileSizeBytes();
        if (file.getSize() > maxBytes) {
            throw new MaxUploadSizeExceededException(maxBytes);
        }

        byte[] bytes = file.getBytes();
        SecureExcelUtils.validateContent(bytes);
        log.debug("Accepted upload '{}' ({} bytes)", safeName, bytes.length);
        return bytes;
    }
}
