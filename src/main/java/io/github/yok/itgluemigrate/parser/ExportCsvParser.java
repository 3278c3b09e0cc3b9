package io.github.yok.itgluemigrate.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.yok.itgluemigrate.util.TextFiles;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses the CSV files of an IT Glue export.
 *
 * <p>
 * Core entity files have a fixed set of columns and are mapped into typed records. Every other
 * {@code *.csv} in the export root is a custom asset type whose columns are discovered from the
 * header and typed by {@link FieldInferrer}.
 * </p>
 *
 * <p>
 * All cell values are trimmed once; empty or whitespace-only cells become {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ExportCsvParser {

    /**
     * Core entity names in the order they are reported by
     * {@link #validateExportStructure(Path)}.
     */
    public static final List<String> CORE_ENTITIES =
            ImmutableList.of("organizations", "configurations", "documents", "locations",
                    "passwords");

    /**
     * File names that are never treated as custom asset types. {@code contacts.csv} is recognized
     * but not migrated.
     */
    public static final Set<String> CORE_ENTITY_FILES = ImmutableSet.of("organizations.csv",
            "configurations.csv", "documents.csv", "locations.csv", "passwords.csv",
            "contacts.csv");

    /**
     * Columns of custom asset CSVs that carry record metadata rather than field values.
     */
    public static final Set<String> METADATA_COLUMNS = ImmutableSet.of("id", "organization",
            "organization_id", "created_at", "updated_at", "archived");

    private final FieldInferrer fieldInferrer;
    private final ObjectMapper objectMapper;

    /**
     * Creates a parser with a default {@link FieldInferrer}.
     */
    public ExportCsvParser() {
        this(new FieldInferrer(), new ObjectMapper());
    }

    /**
     * Creates a parser.
     *
     * @param fieldInferrer inferrer used for custom asset columns
     * @param objectMapper mapper used for JSON-valued cells
     */
    public ExportCsvParser(FieldInferrer fieldInferrer, ObjectMapper objectMapper) {
        this.fieldInferrer = Preconditions.checkNotNull(fieldInferrer);
        this.objectMapper = Preconditions.checkNotNull(objectMapper);
    }

    /**
     * Parses {@code organizations.csv}.
     *
     * @param path CSV file
     * @return records in file order
     */
    public List<OrganizationRecord> parseOrganizations(Path path) {
        List<OrganizationRecord> out = new ArrayList<>();
        for (Map<String, String> row : readTable(path).getRows()) {
            OrganizationRecord rec = new OrganizationRecord();
            rec.setId(row.get("id"));
            rec.setName(row.get("name"));
            rec.setDescription(row.get("description"));
            rec.setQuickNotes(row.get("quick_notes"));
            rec.setOrganizationStatus(row.get("organization_status"));
            out.add(rec);
        }
        log.info("Parsed organizations: {} rows ({})", out.size(), path.getFileName());
        return out;
    }

    /**
     * Parses {@code configurations.csv}.
     *
     * @param path CSV file
     * @return records in file order
     * @throws ExportParseException if a {@code configuration_interfaces} cell is not valid JSON
     */
    public List<ConfigurationRecord> parseConfigurations(Path path) {
        List<ConfigurationRecord> out = new ArrayList<>();
        List<Map<String, String>> rows = readTable(path).getRows();
        // row 1 is the header
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            ConfigurationRecord rec = new ConfigurationRecord();
            rec.setId(row.get("id"));
            rec.setName(row.get("name"));
            rec.setHostname(row.get("hostname"));
            rec.setIp(row.get("ip"));
            rec.setMac(row.get("mac"));
            rec.setSerial(row.get("serial"));
            rec.setManufacturer(row.get("manufacturer"));
            rec.setModel(row.get("model"));
            rec.setNotes(row.get("notes"));
            rec.setOrganizationId(firstOf(row, "organization_id", "organization"));
            rec.setConfigurationType(row.get("configuration_type"));
            rec.setConfigurationInterfaces(
                    parseJsonCell(path, row.get("configuration_interfaces"), i + 2));
            rec.setArchived(row.get("archived"));
            rec.setConfigurationStatus(row.get("configuration_status"));
            out.add(rec);
        }
        log.info("Parsed configurations: {} rows ({})", out.size(), path.getFileName());
        return out;
    }

    /**
     * Parses {@code documents.csv}.
     *
     * @param path CSV file
     * @return records in file order
     */
    public List<DocumentRecord> parseDocuments(Path path) {
        List<DocumentRecord> out = new ArrayList<>();
        for (Map<String, String> row : readTable(path).getRows()) {
            DocumentRecord rec = new DocumentRecord();
            rec.setId(row.get("id"));
            rec.setName(row.get("name"));
            rec.setLocator(row.get("locator"));
            rec.setOrganizationId(firstOf(row, "organization_id", "organization"));
            rec.setContent(row.get("content"));
            rec.setArchived(row.get("archived"));
            out.add(rec);
        }
        log.info("Parsed documents: {} rows ({})", out.size(), path.getFileName());
        return out;
    }

    /**
     * Parses {@code locations.csv}.
     *
     * @param path CSV file
     * @return records in file order
     */
    public List<LocationRecord> parseLocations(Path path) {
        List<LocationRecord> out = new ArrayList<>();
        for (Map<String, String> row : readTable(path).getRows()) {
            LocationRecord rec = new LocationRecord();
            rec.setId(row.get("id"));
            rec.setName(row.get("name"));
            rec.setAddress1(firstOf(row, "address_1", "address1"));
            rec.setAddress2(firstOf(row, "address_2", "address2"));
            rec.setCity(row.get("city"));
            rec.setRegion(firstOf(row, "region", "state"));
            rec.setPostalCode(firstOf(row, "postal_code", "zip"));
            rec.setCountry(row.get("country"));
            rec.setPhone(row.get("phone"));
            rec.setOrganizationId(firstOf(row, "organization_id", "organization"));
            out.add(rec);
        }
        log.info("Parsed locations: {} rows ({})", out.size(), path.getFileName());
        return out;
    }

    /**
     * Parses {@code passwords.csv}.
     *
     * @param path CSV file
     * @return records in file order
     */
    public List<PasswordRecord> parsePasswords(Path path) {
        List<PasswordRecord> out = new ArrayList<>();
        for (Map<String, String> row : readTable(path).getRows()) {
            PasswordRecord rec = new PasswordRecord();
            rec.setId(row.get("id"));
            rec.setName(row.get("name"));
            rec.setUsername(row.get("username"));
            rec.setPassword(row.get("password"));
            rec.setUrl(row.get("url"));
            rec.setNotes(row.get("notes"));
            rec.setResourceType(row.get("resource_type"));
            rec.setResourceId(row.get("resource_id"));
            rec.setOtpSecret(row.get("otp_secret"));
            rec.setOrganizationId(firstOf(row, "organization_id", "organization"));
            rec.setArchived(row.get("archived"));
            out.add(rec);
        }
        log.info("Parsed passwords: {} rows ({})", out.size(), path.getFileName());
        return out;
    }

    /**
     * Parses a custom asset CSV and infers its schema.
     *
     * @param path CSV file
     * @param assetType custom asset type slug (the file stem)
     * @return inferred field definitions and the asset rows
     */
    public CustomAssetCsv parseCustomAssetCsv(Path path, String assetType) {
        CsvTable table = readTable(path);
        List<CustomAssetRecord> assets = new ArrayList<>();
        List<Map<String, String>> fieldRows = new ArrayList<>();
        for (Map<String, String> row : table.getRows()) {
            CustomAssetRecord rec = new CustomAssetRecord();
            rec.setId(row.get("id"));
            rec.setOrganizationId(firstOf(row, "organization_id", "organization"));
            rec.setAssetType(assetType);
            rec.setArchived(row.get("archived"));
            for (Map.Entry<String, String> e : row.entrySet()) {
                if (!METADATA_COLUMNS.contains(e.getKey())) {
                    rec.getFields().put(e.getKey(), e.getValue());
                }
            }
            fieldRows.add(rec.getFields());
            assets.add(rec);
        }
        List<FieldDefinition> defs =
                fieldInferrer.inferSchema(table.getHeaders(), fieldRows, METADATA_COLUMNS);
        log.info("Parsed custom asset type [{}]: {} rows, {} fields", assetType, assets.size(),
                defs.size());
        return new CustomAssetCsv(defs, assets);
    }

    /**
     * Lists custom asset type slugs: the stems of every non-core {@code *.csv} file directly
     * under the export root, sorted.
     *
     * @param exportPath export root
     * @return sorted slugs
     */
    public List<String> discoverCustomAssetTypes(Path exportPath) {
        if (!Files.isDirectory(exportPath)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(exportPath)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .filter(n -> !CORE_ENTITY_FILES.contains(n.toLowerCase(Locale.ROOT)))
                    .map(FilenameUtils::getBaseName).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list export directory: " + exportPath, e);
        }
    }

    /**
     * Counts the data rows of a CSV file.
     *
     * @param path CSV file
     * @return number of records after the header
     */
    public int getRowCount(Path path) {
        return readTable(path).getRows().size();
    }

    /**
     * Checks which core files are present and readable and discovers custom asset types.
     *
     * @param exportPath export root
     * @return structure report
     * @throws ExportNotFoundException if {@code exportPath} does not exist
     * @throws ExportParseException if {@code exportPath} is not a directory
     */
    public ExportValidationResult validateExportStructure(Path exportPath) {
        if (!Files.exists(exportPath)) {
            throw new ExportNotFoundException(exportPath);
        }
        if (!Files.isDirectory(exportPath)) {
            throw new ExportParseException(exportPath, "Expected a directory, not a file");
        }
        ExportValidationResult result = new ExportValidationResult();
        for (String entity : CORE_ENTITIES) {
            Path file = exportPath.resolve(entity + ".csv");
            if (!Files.isRegularFile(file)) {
                result.getCoreEntities().put(entity, CoreEntityStatus.absent());
                continue;
            }
            try {
                result.getCoreEntities().put(entity,
                        CoreEntityStatus.counted(getRowCount(file), file.toString()));
            } catch (ExportParseException e) {
                log.warn("Unreadable core file {}: {}", file, e.getMessage());
                result.getCoreEntities().put(entity, CoreEntityStatus.failed(e.getMessage()));
                result.getErrors().add("Error reading " + entity + ".csv: " + e.getMessage());
            }
        }
        result.setCustomAssetTypes(discoverCustomAssetTypes(exportPath));
        CoreEntityStatus orgs = result.getCoreEntities().get("organizations");
        result.setValid(orgs.isPresent() && orgs.getError() == null);
        return result;
    }

    /**
     * Reads a CSV file into normalized rows keyed by (trimmed) header.
     *
     * @param path CSV file
     * @return header list and rows
     * @throws ExportNotFoundException if the file does not exist
     * @throws ExportParseException if the file cannot be read or parsed
     */
    CsvTable readTable(Path path) {
        if (!Files.exists(path)) {
            throw new ExportNotFoundException(path);
        }
        String text;
        try {
            text = TextFiles.readText(path);
        } catch (IOException e) {
            throw new ExportParseException(path, "Failed to read file: " + e.getMessage(), null,
                    e);
        }
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true).setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL).get();
        try (CSVParser parser = CSVParser.parse(text, fmt)) {
            List<String> headers = parser.getHeaderNames().stream().map(StringUtils::trim)
                    .collect(Collectors.toList());
            List<Map<String, String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    String value = i < record.size() ? record.get(i) : null;
                    String header = headers.get(i);
                    if (StringUtils.isEmpty(header) || row.get(header) != null) {
                        continue;
                    }
                    row.put(header, normalizeValue(value));
                }
                rows.add(row);
            }
            return new CsvTable(headers, rows);
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new ExportParseException(path, "Malformed CSV: " + e.getMessage(), null, e);
        }
    }

    /**
     * Trims a cell value; empty or whitespace-only values become {@code null}.
     *
     * @param value raw cell value
     * @return normalized value
     */
    static String normalizeValue(String value) {
        return StringUtils.trimToNull(value);
    }

    private JsonNode parseJsonCell(Path path, String value, int fileRow) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw new ExportParseException(path,
                    "Invalid JSON in configuration_interfaces: " + e.getOriginalMessage(),
                    fileRow, e);
        }
    }

    private static String firstOf(Map<String, String> row, String... columns) {
        for (String column : columns) {
            String value = row.get(column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Parsed CSV content.
     */
    static final class CsvTable {

        private final List<String> headers;
        private final List<Map<String, String>> rows;

        CsvTable(List<String> headers, List<Map<String, String>> rows) {
            this.headers = new ArrayList<>(new LinkedHashSet<>(headers));
            this.rows = rows;
        }

        List<String> getHeaders() {
            return headers;
        }

        List<Map<String, String>> getRows() {
            return rows;
        }
    }
}
