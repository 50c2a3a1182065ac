package com.hargapangan.market;

import java.util.List;

/**
 * Outcome of a CSV import. errors holds the first ten "row N: reason" messages.
 */
public record CsvImportResult(int total, int imported, int skipped, List<String> errors, String batchId) {
}
