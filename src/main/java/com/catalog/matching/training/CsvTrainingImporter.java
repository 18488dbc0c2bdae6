package com.catalog.matching.training;

import com.catalog.matching.audit.AuditAction;
import com.catalog.matching.audit.AuditEntry;
import com.catalog.matching.audit.AuditService;
import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchQuality;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.rules.NormalizationEngine;
import com.catalog.matching.similarity.ProductTextSimilarity;
import com.catalog.matching.store.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Imports historical approvals from CSV.
 *
 * <p>Expected format:</p>
 * <pre>
 * line_item_text,catalog_description,sku,match_quality,confidence
 * "1/4-20 x 1 hex bolt ss","Hex Bolt 1/4-20 x 1in Stainless",HB-1420-1,EXCELLENT,0.95
 * </pre>
 *
 * <p>{@code sku}, {@code match_quality} and {@code confidence} are optional. The product is
 * resolved by SKU when one is given and known, otherwise by the closest catalog name at or
 * above {@link #MIN_NAME_SIMILARITY}. Rows without a product are skipped. Every imported row
 * goes through {@link TrainingFeedbackRecorder#recordApproval}.</p>
 */
public class CsvTrainingImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvTrainingImporter.class);

    static final double MIN_NAME_SIMILARITY = 0.6;

    private static final String LINE_ITEM = "line_item_text";
    private static final String DESCRIPTION = "catalog_description";
    private static final String SKU = "sku";
    private static final String QUALITY = "match_quality";
    private static final String CONFIDENCE = "confidence";

    private final TrainingFeedbackRecorder recorder;
    private final CatalogStore catalogStore;
    private final NormalizationEngine normalizer;
    private final AuditService auditService;
    private final ProductTextSimilarity nameSimilarity = new ProductTextSimilarity();

    public CsvTrainingImporter(TrainingFeedbackRecorder recorder,
                               CatalogStore catalogStore,
                               NormalizationEngine normalizer,
                               AuditService auditService) {
        this.recorder = recorder;
        this.catalogStore = catalogStore;
        this.normalizer = normalizer;
        this.auditService = auditService;
    }

    public ImportResult importCsv(CatalogScope scope, InputStream input, String importedBy) {
        return importCsv(scope, new InputStreamReader(input, StandardCharsets.UTF_8), importedBy);
    }

    /**
     * @throws IllegalArgumentException if the header lacks a required column
     * @throws com.catalog.matching.store.CatalogUnavailableException if the catalog cannot be read
     */
    public ImportResult importCsv(CatalogScope scope, Reader reader, String importedBy) {
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRows = 0;
        long created = 0;
        long updated = 0;
        long skipped = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = br.readLine();
            if (header == null) {
                return new ImportResult(0, 0, 0, 0, List.of());
            }
            Map<String, Integer> columns = parseHeader(header);
            List<CatalogName> catalog = catalogNames(scope);

            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                totalRows++;
                List<String> fields = parseLine(line);
                String lineItem = field(fields, columns, LINE_ITEM);
                String description = field(fields, columns, DESCRIPTION);
                if (lineItem.isEmpty()) {
                    errors.add(new ImportResult.ImportError(lineNumber, lineItem, "line_item_text is empty"));
                    continue;
                }

                Optional<Product> product = resolveProduct(scope, catalog, field(fields, columns, SKU), description);
                if (product.isEmpty()) {
                    skipped++;
                    log.debug("No product for import line {} ('{}')", lineNumber, description);
                    continue;
                }

                try {
                    ApprovalAck ack = recorder.recordApproval(new ApprovalRequest(
                            scope,
                            lineItem,
                            product.get().id(),
                            null,
                            0.0,
                            MatchQuality.parse(field(fields, columns, QUALITY), MatchQuality.GOOD),
                            parseConfidence(field(fields, columns, CONFIDENCE)),
                            importedBy));
                    if (!ack.persisted()) {
                        errors.add(new ImportResult.ImportError(lineNumber, lineItem, ack.message()));
                    } else if (ack.created()) {
                        created++;
                    } else {
                        updated++;
                    }
                } catch (IllegalArgumentException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, lineItem, e.getMessage()));
                    log.warn("import.error line={} lineItem='{}' error={}", lineNumber, lineItem, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(totalRows, created, updated, skipped, errors);
        auditService.record(AuditEntry.builder()
                .action(AuditAction.TRAINING_IMPORTED)
                .scope(scope.tenantId())
                .subjectId("csv")
                .actorId(importedBy)
                .detail("rows", totalRows)
                .detail("imported", result.importedCount())
                .detail("skipped", skipped)
                .detail("errors", result.errorCount())
                .build());
        log.info("import.completed scope={} result={}", scope, result);
        return result;
    }

    private List<CatalogName> catalogNames(CatalogScope scope) {
        List<CatalogName> names = new ArrayList<>();
        for (Product product : catalogStore.findAll(scope)) {
            names.add(new CatalogName(product, normalizer.normalize(product.name())));
        }
        return names;
    }

    private Optional<Product> resolveProduct(CatalogScope scope, List<CatalogName> catalog, String sku, String description) {
        if (!sku.isEmpty()) {
            Optional<Product> bySku = catalogStore.findBySku(scope, sku);
            if (bySku.isPresent()) {
                return bySku;
            }
        }
        String normalized = normalizer.normalize(description);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        Product best = null;
        double bestScore = MIN_NAME_SIMILARITY;
        for (CatalogName candidate : catalog) {
            double score = nameSimilarity.compute(normalized, candidate.normalizedName());
            if (score > bestScore || (best == null && score >= bestScore)) {
                best = candidate.product();
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Catalog product with its name normalized once per import.
     */
    private record CatalogName(Product product, String normalizedName) {}

    private static double parseConfidence(String value) {
        if (value.isEmpty()) {
            return ApprovalRequest.DEFAULT_CONFIDENCE;
        }
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed)) {
                return ApprovalRequest.DEFAULT_CONFIDENCE;
            }
            return Math.max(0.0, Math.min(1.0, parsed));
        } catch (NumberFormatException e) {
            return ApprovalRequest.DEFAULT_CONFIDENCE;
        }
    }

    private static Map<String, Integer> parseHeader(String header) {
        List<String> names = parseLine(header.startsWith("\uFEFF") ? header.substring(1) : header);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            columns.putIfAbsent(names.get(i).toLowerCase(Locale.ROOT), i);
        }
        if (!columns.containsKey(LINE_ITEM) || !columns.containsKey(DESCRIPTION)) {
            throw new IllegalArgumentException(
                    "CSV header must contain " + LINE_ITEM + " and " + DESCRIPTION + " columns");
        }
        return columns;
    }

    private static String field(List<String> fields, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        if (index == null || index >= fields.size()) {
            return "";
        }
        return fields.get(index).trim();
    }

    /**
     * Splits one CSV line, honouring double quotes and doubled-quote escapes.
     */
    static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString().trim());
        return fields;
    }
}
