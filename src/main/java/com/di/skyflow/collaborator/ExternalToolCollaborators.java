package com.di.skyflow.collaborator;

import com.di.skyflow.calibration.CalTableKind;
import com.di.skyflow.calibration.CalibrationTable;
import com.di.skyflow.common.Result;
import com.di.skyflow.config.SkyFlowProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Production collaborators: each pipeline step is an external command configured under
 * {@code skyflow.tools.*}. Placeholders available to every template:
 * {@code {output}} (suggested output path) and step-specific ones listed per method.
 * Steps print the produced reference on their last output line.
 */
@Component
@Slf4j
public class ExternalToolCollaborators
        implements ConversionCollaborator, CalibrationSolver, CalibrationApplier, ImagingCollaborator, MosaicBuilder {

    private final ExternalToolRunner runner;
    private final SkyFlowProperties.Tools tools;

    public ExternalToolCollaborators(ExternalToolRunner runner, SkyFlowProperties props) {
        this.runner = runner;
        this.tools = props.getTools();
    }

    /** Placeholders: {@code {group}}, {@code {inputs}}, {@code {output}}. */
    @Override
    public Result<String> convert(String groupId, List<String> subbandPaths) {
        Map<String, List<String>> vars = new HashMap<>();
        vars.put("group", List.of(groupId));
        vars.put("inputs", subbandPaths);
        vars.put("output", List.of(outputPath("ms", groupId + ".ms")));
        return runner.run("convert", tools.getConvertCommand(), vars).flatMap(o -> producedReference("convert", o));
    }

    /**
     * Placeholders: {@code {ms}}, {@code {field}}, {@code {refant}}, {@code {output}}.
     * Output lines are {@code <KIND> <path>} or bare table paths with a recognised suffix.
     */
    @Override
    public Result<List<CalibrationTable>> solve(String observationRef, String referenceField, String referenceAntenna) {
        Map<String, List<String>> vars = new HashMap<>();
        vars.put("ms", List.of(observationRef));
        vars.put("field", List.of(nullToEmpty(referenceField)));
        vars.put("refant", List.of(nullToEmpty(referenceAntenna)));
        vars.put("output", List.of(outputPath("caltables", baseName(observationRef))));
        return runner.run("solve", tools.getSolveCommand(), vars).flatMap(ExternalToolCollaborators::parseTables);
    }

    /** Placeholders: {@code {ms}}, {@code {tables}}, {@code {weights}} (one weight per table). */
    @Override
    public Result<Void> apply(String observationRef, List<WeightedCalibration> calibrations) {
        List<String> tables = new ArrayList<>();
        List<String> weights = new ArrayList<>();
        for (WeightedCalibration c : calibrations) {
            for (String path : c.tablePaths()) {
                tables.add(path);
                weights.add(String.format(Locale.ROOT, "%.6f", c.weight()));
            }
        }
        Map<String, List<String>> vars = new HashMap<>();
        vars.put("ms", List.of(observationRef));
        vars.put("tables", tables);
        vars.put("weights", weights);
        return runner.run("apply", tools.getApplyCommand(), vars).map(o -> null);
    }

    /** Placeholders: {@code {ms}}, {@code {calibrated}} (true/false), {@code {output}}. */
    @Override
    public Result<String> image(String observationRef, boolean calibrated) {
        Map<String, List<String>> vars = new HashMap<>();
        vars.put("ms", List.of(observationRef));
        vars.put("calibrated", List.of(Boolean.toString(calibrated)));
        vars.put("output", List.of(outputPath("images", baseName(observationRef))));
        return runner.run("image", tools.getImageCommand(), vars).flatMap(o -> producedReference("image", o));
    }

    /** Placeholders: {@code {mosaic}}, {@code {images}}, {@code {output}}. */
    @Override
    public Result<String> buildMosaic(String mosaicId, List<String> orderedImages) {
        Map<String, List<String>> vars = new HashMap<>();
        vars.put("mosaic", List.of(mosaicId));
        vars.put("images", orderedImages);
        vars.put("output", List.of(outputPath("mosaics", mosaicId + ".fits")));
        return runner.run("mosaic", tools.getMosaicCommand(), vars).flatMap(o -> producedReference("mosaic", o));
    }

    // ------------------------------------------------------------------

    static Result<List<CalibrationTable>> parseTables(ToolOutput output) {
        List<CalibrationTable> tables = new ArrayList<>();
        for (String raw : output.lines()) {
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+", 2);
            if (parts.length == 2) {
                try {
                    tables.add(CalibrationTable.of(CalTableKind.fromCode(parts[0]), parts[1].trim()));
                    continue;
                } catch (IllegalArgumentException e) {
                    log.trace("[TOOL] '{}' is not a <KIND> <path> line", line);
                }
            }
            Optional<CalTableKind> kind = CalTableKind.fromPath(line);
            kind.ifPresent(k -> tables.add(CalibrationTable.of(k, line)));
        }
        if (tables.isEmpty()) {
            return Result.fatal("SOLVE_NO_TABLES", "solver reported no calibration tables:\n" + output.tail(20));
        }
        return Result.success(tables);
    }

    private static Result<String> producedReference(String tool, ToolOutput output) {
        String ref = output.lastLine();
        if (ref == null) {
            return Result.fatal(tool.toUpperCase(Locale.ROOT) + "_NO_OUTPUT", tool + " printed no output reference");
        }
        return Result.success(ref);
    }

    private String outputPath(String kind, String name) {
        return Path.of(tools.getOutputDir(), kind, name).toString();
    }

    private static String baseName(String ref) {
        Path name = Path.of(ref).getFileName();
        return name == null ? ref : name.toString();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
