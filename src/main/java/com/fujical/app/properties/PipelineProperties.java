package com.fujical.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Stage-1 batching knobs and the Stage-3 source, bound under {@code pipeline}.
 * Other tunables are read through {@code Config}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private String zone = "Asia/Tokyo";
    private Stage1 stage1 = new Stage1();
    private Stage3 stage3 = new Stage3();

    @Getter
    @Setter
    public static class Stage1 {
        private int threads = 4;
        private int chunkDays = 14;
        private int batchSize = 1000;
        private boolean resumeEnabled = true;
        private String checkpointKey = "stage1.orbit.checkpoint.v1";
    }

    @Getter
    @Setter
    public static class Stage3 {
        private String source = "STAGE1";
        private int threads = 4;
    }
}
