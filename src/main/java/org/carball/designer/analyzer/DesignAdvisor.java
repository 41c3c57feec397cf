package org.carball.designer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.designer.config.CostModelConfig;
import org.carball.designer.costmodel.CostModel;
import org.carball.designer.costmodel.DesignRanker;
import org.carball.designer.model.stats.CollectionStat;
import org.carball.designer.model.workload.Workload;
import org.carball.designer.stats.OperationClassifier;
import org.carball.designer.stats.QueryClass;
import org.carball.designer.stats.StatisticsProcessor;
import org.carball.designer.workload.SegmentedWorkload;
import org.carball.designer.workload.TraceFileConnector;
import org.carball.designer.workload.WorkloadSegmenter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Builds the read-only evaluation snapshot once, before any design is scored.
 * Statistics and segmentation happen here, synchronously; the resulting
 * {@link CostModel} can then be shared by parallel search workers.
 */
@Slf4j
public class DesignAdvisor {

    private final CostModelConfig config;
    private final StatisticsProcessor statisticsProcessor;
    private final WorkloadSegmenter segmenter;
    private final OperationClassifier classifier;

    public DesignAdvisor(CostModelConfig config) {
        this(config, new StatisticsProcessor());
    }

    public DesignAdvisor(CostModelConfig config, StatisticsProcessor statisticsProcessor) {
        config.validate();
        this.config = config;
        this.statisticsProcessor = statisticsProcessor;
        this.segmenter = new WorkloadSegmenter();
        this.classifier = new OperationClassifier();

        log.info("Initialized DesignAdvisor with config: {}", config.getConfigurationSummary());
    }

    public CostModel prepare(Workload workload,
                             Map<String, ? extends Iterable<Map<String, Object>>> sampledRows,
                             int sampleRate) {
        log.info("Preparing evaluation snapshot for {} sessions", workload.sessions().size());

        // Step 1: Per-collection statistics
        Map<String, CollectionStat> stats =
                statisticsProcessor.computeStats(sampledRows, workload.operations(), sampleRate);

        // Step 2: Time intervals for skew
        SegmentedWorkload segmented = segmenter.segment(workload.sessions(), config.getSkewIntervals());

        return new CostModel(stats, segmented, config);
    }

    /**
     * Prepares the snapshot from an exported trace file, using the file's sample rate.
     */
    public CostModel prepare(Path traceFile) throws IOException {
        TraceFileConnector connector = new TraceFileConnector(traceFile);
        TraceFileConnector.ExportMetadata metadata = connector.getExportMetadata();
        log.info("Trace export of database '{}' taken {}", metadata.databaseName(), metadata.exportTimestamp());

        Map<String, List<Map<String, Object>>> dataset = connector.getDataset();
        return prepare(connector.getWorkload(), dataset, metadata.sampleRate());
    }

    /**
     * Query classes of the trace with their frequencies, most useful to a search
     * procedure deciding which operations to optimize for.
     */
    public Map<QueryClass, Long> queryClasses(Workload workload) {
        return classifier.histogram(workload.operations());
    }

    public DesignRanker ranker(CostModel costModel) {
        return new DesignRanker(costModel);
    }
}
