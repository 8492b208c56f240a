package com.dwimerge.core.gradient;

import com.dwimerge.core.model.GradientTable;
import com.dwimerge.core.model.MergedDataset;
import com.dwimerge.core.model.VolumeProvenance;
import com.dwimerge.core.model.VolumeSource;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the q-space sampling scheme of a merged series as a JSON reportlet.
 *
 * <p>The report lists the shells, one row per merged volume with its direction and the
 * group volumes it was built from, and the source file of every group. The reportlets
 * directory is fixed at construction.
 *
 * <p><b>Example output:</b>
 * <pre>{@code
 * {
 *   "strategy" : "average",
 *   "groups" : [ "dir_AP", "dir_PA" ],
 *   "shells" : [ { "bValue" : 0.0, "volumes" : 1 }, { "bValue" : 1000.0, "volumes" : 4 } ],
 *   "volumes" : [ { "index" : 0, "bValue" : 0.0, "direction" : [ 0.0, 0.0, 0.0 ],
 *                   "sources" : [ "dir_AP[0]", "dir_PA[0]" ] }, ... ]
 * }
 * }</pre>
 */
public class SamplingSchemeReport {

    private static final Logger log = LoggerFactory.getLogger(SamplingSchemeReport.class);

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path reportletsDirectory;

    public SamplingSchemeReport(Path reportletsDirectory) {
        this.reportletsDirectory = Objects.requireNonNull(reportletsDirectory, "reportletsDirectory must not be null");
    }

    /**
     * JSON document of the report.
     *
     * @param strategy merge strategy id
     * @param groups contributing groups in merge order
     * @param sourceFiles group id to original image path, where known
     * @param shells shells with their volume counts
     * @param volumes one row per merged volume
     */
    public record Document(
        @JsonProperty("strategy") String strategy,
        @JsonProperty("groups") List<String> groups,
        @JsonProperty("sourceFiles") Map<String, String> sourceFiles,
        @JsonProperty("shells") List<Shell> shells,
        @JsonProperty("volumes") List<Volume> volumes
    ) {}

    /**
     * One b-value shell.
     *
     * @param bValue shell b-value, rounded
     * @param volumes volumes on the shell
     */
    public record Shell(@JsonProperty("bValue") double bValue, @JsonProperty("volumes") int volumes) {}

    /**
     * One merged volume.
     *
     * @param index position in the merged series
     * @param bValue effective b-value
     * @param direction unit direction
     * @param sources group volumes the volume was built from
     */
    public record Volume(
        @JsonProperty("index") int index,
        @JsonProperty("bValue") double bValue,
        @JsonProperty("direction") double[] direction,
        @JsonProperty("sources") List<String> sources
    ) {}

    /**
     * Builds the report document.
     *
     * @param dataset merged dataset
     * @param table gradient table of the dataset
     * @param sourceFiles group id to original image path
     * @return document
     */
    public Document describe(MergedDataset dataset, GradientTable table, Map<String, String> sourceFiles) {
        Map<Double, Integer> shellCounts = new LinkedHashMap<>();
        for (double shell : table.shells()) {
            shellCounts.put(shell, 0);
        }
        List<Volume> volumes = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            GradientTable.Row row = table.rows().get(i);
            double shell = Math.round(row.bValue() / GradientTable.SHELL_WIDTH) * GradientTable.SHELL_WIDTH;
            shellCounts.merge(shell, 1, Integer::sum);
            VolumeProvenance provenance = dataset.provenance().get(i);
            volumes.add(new Volume(i, row.bValue(),
                new double[] {row.direction().x(), row.direction().y(), row.direction().z()},
                provenance.sources().stream().map(VolumeSource::toString).toList()));
        }
        List<Shell> shells = new ArrayList<>();
        shellCounts.forEach((b, count) -> shells.add(new Shell(b, count)));
        return new Document(dataset.strategyId(), dataset.groupOrder(), new LinkedHashMap<>(sourceFiles), shells, volumes);
    }

    /**
     * Writes the report to {@code <reportlets>/<prefix>_desc-samplingscheme_dwi.json}.
     *
     * @param prefix output prefix
     * @param dataset merged dataset
     * @param table gradient table of the dataset
     * @param sourceFiles group id to original image path
     * @return written file
     */
    public Path write(String prefix, MergedDataset dataset, GradientTable table, Map<String, String> sourceFiles) {
        Path target = reportletsDirectory.resolve(prefix + "_desc-samplingscheme_dwi.json");
        try {
            Files.createDirectories(reportletsDirectory);
            objectMapper.writeValue(target.toFile(), describe(dataset, table, sourceFiles));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write sampling scheme report: " + target, e);
        }
        log.info("Wrote sampling scheme report: {}", target);
        return target;
    }
}
