package com.govchat.policyscanner.output;

import com.govchat.policyscanner.config.PolicyScannerProperties;
import com.govchat.policyscanner.model.DocumentMetadata;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Exports the documents found by one discovery run to CSV.
 *
 * Output path pattern: {outputDir}/discovered_{sourceId}_{yyyyMMdd_HHmmss}.csv
 * e.g. /data/output/discovered_gemeenteblad-utrecht_20240115_030000.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DiscoveryCsvWriter {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final String[] HEADERS = {
            "external_id", "title", "url",
            "document_type", "publication_date", "effective_date",
            "municipality", "description", "file_size"
    };

    private final PolicyScannerProperties properties;

    /**
     * @return the written file, or null when there was nothing to write
     */
    public Path write(String sourceId, List<DocumentMetadata> documents) {
        if (documents.isEmpty()) return null;

        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        String filename = String.format("discovered_%s_%s.csv", sourceId, LocalDateTime.now().format(FILE_TIMESTAMP));
        Path outputPath = outputDir.resolve(filename);

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }
            for (DocumentMetadata document : documents) {
                writer.writeNext(toRow(document));
            }
            log.info("Written {} discovered documents to CSV: {}", documents.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed", e);
        }
    }

    private String[] toRow(DocumentMetadata d) {
        return new String[]{
                str(d.getExternalId()),
                str(d.getTitle()),
                str(d.getUrl()),
                d.getDocumentType().value(),
                str(d.getPublicationDate()),
                str(d.getEffectiveDate()),
                str(d.getMunicipality()),
                str(d.getDescription()),
                str(d.getFileSize())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
