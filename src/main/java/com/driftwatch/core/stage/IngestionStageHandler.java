package com.driftwatch.core.stage;

import com.driftwatch.core.arrival.ArrivalDetector;
import com.driftwatch.core.error.DriftwatchException;
import com.driftwatch.core.ledger.LedgerStore;
import com.driftwatch.core.model.IngestedFileRecord;
import com.driftwatch.core.model.PipelineStage;
import com.driftwatch.core.model.StepResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in ingestion stage.
 * <p>
 * Merges every data file of the input directory into one CSV (header of the
 * first file, duplicate rows dropped), writes the merged basenames to the
 * record file and replaces the {@code ingested_files} ledger with this batch.
 */
public class IngestionStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(IngestionStageHandler.class);

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private final LedgerStore ledger;
    private final ArrivalDetector detector;

    public IngestionStageHandler(LedgerStore ledger, ArrivalDetector detector) {
        this.ledger = ledger;
        this.detector = detector;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.INGESTION;
    }

    @Override
    public StepResult run(Map<String, String> params) {
        Path inputDir = Path.of(require(params, StageParams.INPUT_PATH));
        Path outFile = Path.of(require(params, StageParams.OUT_FILE));
        Path recordFile = Path.of(require(params, StageParams.RECORD_FILE));

        Set<String> files;
        try {
            files = detector.listDataFiles(inputDir);
        } catch (DriftwatchException e) {
            return StepResult.failed(stage(), e.getMessage(), 0);
        }
        if (files.isEmpty()) {
            return StepResult.failed(stage(), "no " + detector.extension() + " files in " + inputDir, 0);
        }

        List<String> header = null;
        Set<List<String>> rows = new LinkedHashSet<>();
        int read = 0;
        try {
            for (String name : files) {
                Path file = inputDir.resolve(name);
                try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                     CSVParser parser = READ_FORMAT.parse(reader)) {
                    List<String> fileHeader = parser.getHeaderNames();
                    if (header == null) {
                        header = fileHeader;
                    } else if (!header.equals(fileHeader)) {
                        return StepResult.failed(stage(), "header of " + name + " " + fileHeader
                                + " does not match " + header, 0);
                    }
                    for (CSVRecord record : parser) {
                        rows.add(record.toList());
                        read++;
                    }
                }
            }
            writeMerged(outFile, header, rows);
            writeRecordFile(recordFile, files);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Ingestion of {} failed", inputDir, e);
            return StepResult.failed(stage(), "cannot merge " + inputDir + ": " + e.getMessage(), 0);
        }

        Instant batchTime = Instant.now();
        List<IngestedFileRecord> records = new ArrayList<>();
        for (String name : files) {
            records.add(new IngestedFileRecord(batchTime, name));
        }
        try {
            ledger.replaceIngestedFiles(records);
        } catch (DriftwatchException e) {
            return StepResult.failed(stage(), e.getMessage(), 0);
        }

        log.info("Ingested {} files ({} rows read, {} unique) into {}", files.size(), read, rows.size(), outFile);
        return StepResult.ok(stage(), 0);
    }

    @Override
    public String describe() {
        return "built-in CSV merge";
    }

    private static void writeMerged(Path outFile, List<String> header, Set<List<String>> rows) throws IOException {
        createParent(outFile);
        var format = CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(String[]::new))
                .build();
        try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
    }

    private static void writeRecordFile(Path recordFile, Set<String> files) throws IOException {
        createParent(recordFile);
        Files.write(recordFile, files, StandardCharsets.UTF_8);
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    static String require(Map<String, String> params, String key) {
        String value = params.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing stage parameter '" + key + "'");
        }
        return value;
    }
}
