package uk.gegc.revisionhelper.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for revision defaults
 */
@Component
@ConfigurationProperties(prefix = "revision")
@Data
public class RevisionProperties {

    /**
     * Question count used when a revision does not specify one
     */
    private int defaultQuestionCount = 2;

    /**
     * Accuracy threshold (percent) used when a revision does not specify one
     */
    private int defaultAccuracyThreshold = 80;

    /**
     * Substitute the built-in arithmetic questions when nothing could be parsed
     */
    private boolean fallbackQuestionsEnabled = true;
}
