package com.photodb.archiver.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last directory modification time for which every file in the directory was
 * processed. Written only after the whole batch for that directory finished.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DirectoryWatermark {

    private String directoryPath;

    /** Epoch millis */
    private long lastProcessedMtime;
}
