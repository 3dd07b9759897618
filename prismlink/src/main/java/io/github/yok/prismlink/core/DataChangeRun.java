package io.github.yok.prismlink.core;

import lombok.Value;

/**
 * Outcome of {@link DataChangeService#run}: the staged files and the activity start answer.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class DataChangeRun {

    // Null when the data change ran without files
    StagingResult files;

    // Null when files were requested but none could be staged
    ActivityStart activity;
}
