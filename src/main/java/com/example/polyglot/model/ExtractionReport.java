package com.example.polyglot.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of an extraction run.
 *
 * @param catalogPath catalog the records were taken from
 * @param outputFile  exchange file the records were written to
 * @param records     extracted records in catalog order
 */
public record ExtractionReport(
        Path catalogPath,
        Path outputFile,
        List<ExchangeRecord> records
) {}
