package com.dwimerge.core.qc;

import com.dwimerge.core.error.MissingInputException;
import com.dwimerge.core.model.ConfoundSummary;
import com.dwimerge.core.model.ConfoundTable;
import com.dwimerge.core.model.GradientTable;
import com.dwimerge.core.model.QcMetrics;
import com.dwimerge.core.model.SeriesQcRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Collects the upstream quality signals of a merged series into one {@link SeriesQcRecord}.
 *
 * <p>The mask overlap, the pre-merge metrics, the post-merge metrics and the merged gradient
 * table are required; {@link #aggregate()} fails with {@link MissingInputException} naming the
 * first one that was never supplied. Confounds are optional: without them the motion columns
 * are {@code NaN}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * SeriesQcRecord record = new SeriesQcAggregator("sub-01_dwi", "average")
 *     .diceScore(0.93)
 *     .preMergeMetrics(raw)
 *     .postMergeMetrics(merged)
 *     .gradientTable(table)
 *     .confounds(confounds)
 *     .aggregate();
 * }</pre>
 */
public class SeriesQcAggregator {

    private static final Logger log = LoggerFactory.getLogger(SeriesQcAggregator.class);

    static final String RAW_PREFIX = "raw_";
    static final String MERGED_PREFIX = "t1_";

    private final String fileName;
    private final String strategyId;
    private String sourceFile;
    private Double diceScore;
    private QcMetrics preMerge;
    private QcMetrics postMerge;
    private GradientTable gradientTable;
    private ConfoundTable confounds;

    public SeriesQcAggregator(String fileName, String strategyId) {
        this.fileName = Objects.requireNonNull(fileName, "fileName must not be null");
        this.strategyId = Objects.requireNonNull(strategyId, "strategyId must not be null");
    }

    public SeriesQcAggregator sourceFile(String sourceFile) {
        this.sourceFile = sourceFile;
        return this;
    }

    public SeriesQcAggregator diceScore(double diceScore) {
        this.diceScore = diceScore;
        return this;
    }

    public SeriesQcAggregator preMergeMetrics(QcMetrics metrics) {
        this.preMerge = metrics;
        return this;
    }

    public SeriesQcAggregator postMergeMetrics(QcMetrics metrics) {
        this.postMerge = metrics;
        return this;
    }

    public SeriesQcAggregator gradientTable(GradientTable table) {
        this.gradientTable = table;
        return this;
    }

    public SeriesQcAggregator confounds(ConfoundTable table) {
        this.confounds = table;
        return this;
    }

    /**
     * Builds the record.
     *
     * @return the series QC record
     * @throws MissingInputException if a required signal was never supplied
     */
    public SeriesQcRecord aggregate() {
        require(diceScore, "dice_score", "mask overlap was never computed");
        require(preMerge, "raw_qc", "pre-merge QC metrics are missing");
        require(postMerge, "merged_qc", "post-merge QC metrics are missing");
        require(gradientTable, "gradient_table", "merged gradient table is missing");

        ConfoundSummary motion;
        if (confounds == null) {
            log.warn("No confounds for {}; motion columns will be empty", fileName);
            motion = ConfoundSummary.unavailable();
        } else {
            motion = ConfoundSummarizer.summarize(confounds);
        }

        return new SeriesQcRecord(
            fileName,
            sourceFile,
            diceScore,
            preMerge.prefixed(RAW_PREFIX),
            postMerge.prefixed(MERGED_PREFIX),
            motion,
            gradientTable.size(),
            gradientTable.shells(),
            strategyId);
    }

    private void require(Object value, String subject, String message) {
        if (value == null) {
            throw new MissingInputException(subject, message + " for " + fileName);
        }
    }
}
