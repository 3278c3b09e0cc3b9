package io.github.yok.itgluemigrate.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.yok.itgluemigrate.attachment.AttachmentStats;
import io.github.yok.itgluemigrate.attachment.AttachmentValidationResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Result of {@code preview}, reviewed by the operator and consumed by {@code run}.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MigrationPlan {

    /**
     * Plan format version written and accepted by this tool.
     */
    public static final int PLAN_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private int version = PLAN_VERSION;

    @JsonProperty("export_path")
    private String exportPath;

    @JsonProperty("api_url")
    private String apiUrl;

    @JsonProperty("scanned_at")
    private String scannedAt;

    private Organizations organizations = new Organizations();

    @JsonProperty("custom_asset_types")
    private Map<String, CustomAssetTypePlan> customAssetTypes = new LinkedHashMap<>();

    @JsonProperty("entity_counts")
    private Map<String, Integer> entityCounts = new LinkedHashMap<>();

    @JsonProperty("disabled_counts")
    private Map<String, Integer> disabledCounts = new LinkedHashMap<>();

    private AttachmentStats attachments;

    @JsonProperty("attachment_validation")
    private AttachmentValidationResult attachmentValidation;

    private List<MigrationWarning> warnings = new ArrayList<>();

    @JsonProperty("warning_summary")
    private WarningSummary warningSummary;

    /**
     * Organization section of the plan.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Organizations {

        private int total;

        private int matched;

        @JsonProperty("to_create")
        private int toCreate;

        // organization name -> match result
        private Map<String, MatchResult> mapping = new LinkedHashMap<>();
    }

    /**
     * Writes the plan as indented JSON.
     *
     * @param path target file
     * @throws IOException if the file cannot be written
     */
    public void write(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), this);
    }

    /**
     * Reads a plan and checks its version.
     *
     * @param path plan file
     * @return the plan
     * @throws PlanFormatException if the file is unreadable, not a plan, or another version
     */
    public static MigrationPlan read(Path path) {
        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new PlanFormatException("Failed to read plan file: " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new PlanFormatException("Invalid plan file: expected a JSON object");
        }
        JsonNode version = root.get("version");
        if (version == null || !version.isInt() || version.intValue() != PLAN_VERSION) {
            throw new PlanFormatException("Plan file version " + version
                    + " is not compatible with this tool (expected version " + PLAN_VERSION
                    + ")");
        }
        try {
            return MAPPER.treeToValue(root, MigrationPlan.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new PlanFormatException("Invalid plan file structure: " + e.getMessage(), e);
        }
    }
}
