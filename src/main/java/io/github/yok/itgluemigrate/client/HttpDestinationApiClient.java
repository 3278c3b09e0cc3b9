package io.github.yok.itgluemigrate.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import io.github.yok.itgluemigrate.config.ApiConfig;
import io.github.yok.itgluemigrate.parser.FieldDefinition;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.hc.client5.http.classic.methods.HttpDelete;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpPut;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;

/**
 * {@link DestinationApiClient} over Apache HttpClient 5 with JSON bodies.
 *
 * <p>
 * API calls carry {@code Authorization: Bearer <token>}. Presigned uploads are sent without it,
 * after the configured host rewrites are applied to the URL.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class HttpDestinationApiClient implements DestinationApiClient {

    private static final int MAX_CONNECTIONS_PER_ROUTE = 16;

    private final String baseUrl;
    private final String token;
    private final Map<String, String> hostRewrites;
    private final RequestConfig apiRequestConfig;
    private final RequestConfig uploadRequestConfig;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    /**
     * Creates a client.
     *
     * @param baseUrl destination base URL, e.g. {@code https://docs.example.com}
     * @param token API token
     * @param apiConfig timeouts and host rewrites
     * @param objectMapper JSON mapper
     */
    public HttpDestinationApiClient(String baseUrl, String token, ApiConfig apiConfig,
            ObjectMapper objectMapper) {
        Preconditions.checkArgument(StringUtils.isNotBlank(baseUrl), "baseUrl must not be blank");
        Preconditions.checkArgument(StringUtils.isNotBlank(token), "token must not be blank");
        this.baseUrl = StringUtils.stripEnd(baseUrl, "/");
        this.token = token;
        this.hostRewrites = new LinkedHashMap<>(apiConfig.getHostRewrites());
        this.apiRequestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.ofSeconds(apiConfig.getTimeoutSeconds()))
                .setConnectionRequestTimeout(Timeout.ofSeconds(apiConfig.getTimeoutSeconds()))
                .build();
        this.uploadRequestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.ofSeconds(apiConfig.getUploadTimeoutSeconds()))
                .setConnectionRequestTimeout(Timeout.ofSeconds(apiConfig.getTimeoutSeconds()))
                .build();
        this.httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnPerRoute(MAX_CONNECTIONS_PER_ROUTE)
                        .setMaxConnTotal(MAX_CONNECTIONS_PER_ROUTE * 2).build())
                .build();
        this.objectMapper = objectMapper;
    }

    // ----------------------------------------------------------------------
    // Organizations
    // ----------------------------------------------------------------------

    @Override
    public JsonNode listOrganizations() {
        return get("/api/organizations", Map.of());
    }

    @Override
    public JsonNode getOrganization(String orgId) {
        return get("/api/organizations/" + orgId, Map.of());
    }

    @Override
    public JsonNode createOrganization(String name, boolean enabled,
            Map<String, Object> metadata) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", name);
        body.put("is_enabled", enabled);
        if (metadata != null) {
            body.set("metadata", objectMapper.valueToTree(metadata));
        }
        return post("/api/organizations", body);
    }

    // ----------------------------------------------------------------------
    // Global types
    // ----------------------------------------------------------------------

    @Override
    public JsonNode listConfigurationTypes(boolean includeInactive) {
        return get("/api/configuration-types", Map.of("include_inactive", includeInactive));
    }

    @Override
    public JsonNode createConfigurationType(String name) {
        return post("/api/configuration-types", objectMapper.createObjectNode().put("name", name));
    }

    @Override
    public JsonNode listConfigurationStatuses(boolean includeInactive) {
        return get("/api/configuration-statuses", Map.of("include_inactive", includeInactive));
    }

    @Override
    public JsonNode createConfigurationStatus(String name) {
        return post("/api/configuration-statuses",
                objectMapper.createObjectNode().put("name", name));
    }

    @Override
    public JsonNode listCustomAssetTypes(boolean includeInactive) {
        return get("/api/custom-asset-types", Map.of("include_inactive", includeInactive));
    }

    @Override
    public JsonNode createCustomAssetType(String name, List<FieldDefinition> fields,
            String displayFieldKey) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", name);
        body.set("fields", objectMapper.valueToTree(fields));
        if (displayFieldKey != null) {
            body.put("display_field_key", displayFieldKey);
        }
        return post("/api/custom-asset-types", body);
    }

    // ----------------------------------------------------------------------
    // Organization-scoped entities
    // ----------------------------------------------------------------------

    @Override
    public JsonNode listConfigurations(String orgId, int limit, int offset) {
        return get(orgPath(orgId, "/configurations"), page(limit, offset));
    }

    @Override
    public JsonNode createConfiguration(String orgId, ConfigurationRequest request) {
        if (!request.isEnabled()) {
            log.info("Creating disabled configuration: {}", request.getName());
        }
        return post(orgPath(orgId, "/configurations"), objectMapper.valueToTree(request));
    }

    @Override
    public JsonNode listLocations(String orgId, int limit, int offset) {
        return get(orgPath(orgId, "/locations"), page(limit, offset));
    }

    @Override
    public JsonNode createLocation(String orgId, String name, String notes,
            Map<String, Object> metadata) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", name);
        if (notes != null) {
            body.put("notes", notes);
        }
        if (metadata != null) {
            body.set("metadata", objectMapper.valueToTree(metadata));
        }
        return post(orgPath(orgId, "/locations"), body);
    }

    @Override
    public JsonNode listDocuments(String orgId, String path, int limit, int offset) {
        Map<String, Object> params = page(limit, offset);
        if (path != null) {
            params.put("path", path);
        }
        return get(orgPath(orgId, "/documents"), params);
    }

    @Override
    public JsonNode createDocument(String orgId, String path, String name, String content,
            Map<String, Object> metadata, boolean enabled) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("path", path);
        body.put("name", name);
        body.put("content", StringUtils.defaultString(content));
        body.put("is_enabled", enabled);
        if (metadata != null) {
            body.set("metadata", objectMapper.valueToTree(metadata));
        }
        return post(orgPath(orgId, "/documents"), body);
    }

    @Override
    public JsonNode listPasswords(String orgId, int limit, int offset) {
        return get(orgPath(orgId, "/passwords"), page(limit, offset));
    }

    @Override
    public JsonNode createPassword(String orgId, PasswordRequest request) {
        return post(orgPath(orgId, "/passwords"), objectMapper.valueToTree(request));
    }

    @Override
    public JsonNode listCustomAssets(String orgId, String typeId, int limit, int offset) {
        return get(orgPath(orgId, "/custom-asset-types/" + typeId + "/assets"),
                page(limit, offset));
    }

    @Override
    public JsonNode createCustomAsset(String orgId, String typeId, Map<String, Object> values,
            Map<String, Object> metadata, boolean enabled) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("values", objectMapper.valueToTree(values));
        body.put("is_enabled", enabled);
        if (metadata != null) {
            body.set("metadata", objectMapper.valueToTree(metadata));
        }
        return post(orgPath(orgId, "/custom-asset-types/" + typeId + "/assets"), body);
    }

    // ----------------------------------------------------------------------
    // Relationships
    // ----------------------------------------------------------------------

    @Override
    public JsonNode listRelationships(String orgId, String entityType, String entityId) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("entity_type", entityType);
        params.put("entity_id", entityId);
        return get(orgPath(orgId, "/relationships"), params);
    }

    @Override
    public JsonNode createRelationship(String orgId, String sourceType, String sourceId,
            String targetType, String targetId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("source_type", sourceType);
        body.put("source_id", sourceId);
        body.put("target_type", targetType);
        body.put("target_id", targetId);
        return post(orgPath(orgId, "/relationships"), body);
    }

    @Override
    public void deleteRelationship(String orgId, String relationshipId) {
        execute(new HttpDelete(uri(orgPath(orgId, "/relationships/" + relationshipId),
                Map.of())));
    }

    // ----------------------------------------------------------------------
    // Attachments and images
    // ----------------------------------------------------------------------

    @Override
    public JsonNode listAttachments(String orgId, String entityType, String entityId,
            int limit, int offset) {
        Map<String, Object> params = page(limit, offset);
        if (entityType != null) {
            params.put("entity_type", entityType);
        }
        if (entityId != null) {
            params.put("entity_id", entityId);
        }
        return get(orgPath(orgId, "/attachments"), params);
    }

    @Override
    public JsonNode createAttachment(String orgId, String entityType, String entityId,
            String filename, String contentType, long sizeBytes) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("entity_type", entityType);
        body.put("entity_id", entityId);
        body.put("filename", filename);
        body.put("content_type", contentType);
        body.put("size_bytes", sizeBytes);
        return post(orgPath(orgId, "/attachments"), body);
    }

    @Override
    public JsonNode getAttachmentDownloadUrl(String orgId, String attachmentId) {
        return get(orgPath(orgId, "/attachments/" + attachmentId + "/download"), Map.of());
    }

    @Override
    public void deleteAttachment(String orgId, String attachmentId) {
        execute(new HttpDelete(uri(orgPath(orgId, "/attachments/" + attachmentId), Map.of())));
    }

    @Override
    public JsonNode uploadDocumentImage(String orgId, String filename, String contentType,
            long sizeBytes, String documentId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("filename", filename);
        body.put("content_type", contentType);
        body.put("size_bytes", sizeBytes);
        if (documentId != null) {
            body.put("document_id", documentId);
        }
        return post(orgPath(orgId, "/documents/images"), body);
    }

    @Override
    public void uploadToPresignedUrl(String uploadUrl, byte[] content, String contentType) {
        String target = rewriteHost(uploadUrl);
        HttpPut put = new HttpPut(target);
        put.setConfig(uploadRequestConfig);
        put.setEntity(new ByteArrayEntity(content, ContentType.parse(contentType)));
        try (ClassicHttpResponse response = httpClient.executeOpen(null, put, null)) {
            int status = response.getCode();
            if (status >= 400) {
                String text = bodyText(response);
                throw new ApiException(status, "Failed to upload file: " + text, text, null);
            }
            EntityUtils.consume(response.getEntity());
        } catch (IOException e) {
            throw new ApiException(0, "Upload failed: " + e.getMessage(), null, e);
        }
        log.debug("Uploaded {} bytes to presigned URL", content.length);
    }

    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            log.warn("Failed to close HTTP client: {}", e.getMessage());
        }
    }

    /**
     * Applies the configured host rewrites to a URL.
     *
     * @param url absolute URL
     * @return the URL with its authority replaced when it matches a rewrite, else unchanged
     */
    String rewriteHost(String url) {
        URI parsed;
        try {
            parsed = new URI(url);
        } catch (URISyntaxException e) {
            return url;
        }
        String authority = parsed.getRawAuthority();
        if (authority == null || !hostRewrites.containsKey(authority)) {
            return url;
        }
        String replacement = hostRewrites.get(authority);
        int start = url.indexOf(authority);
        return url.substring(0, start) + replacement + url.substring(start + authority.length());
    }

    // ----------------------------------------------------------------------
    // Transport
    // ----------------------------------------------------------------------

    private JsonNode get(String path, Map<String, ?> params) {
        return execute(new HttpGet(uri(path, params)));
    }

    private JsonNode post(String path, JsonNode body) {
        HttpPost post = new HttpPost(uri(path, Map.of()));
        try {
            post.setEntity(new StringEntity(objectMapper.writeValueAsString(body),
                    ContentType.APPLICATION_JSON));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
        return execute(post);
    }

    private JsonNode execute(HttpUriRequestBase request) {
        request.setConfig(apiRequestConfig);
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        request.setHeader(HttpHeaders.ACCEPT, "application/json");
        log.debug("{} {}", request.getMethod(), request.getRequestUri());

        int status;
        String text;
        try (ClassicHttpResponse response = httpClient.executeOpen(null, request, null)) {
            status = response.getCode();
            text = bodyText(response);
        } catch (IOException e) {
            throw new ApiException(0, "Request failed: " + e.getMessage(), null, e);
        }

        if (status >= 400) {
            throw new ApiException(status, errorDetail(text), text, null);
        }
        if (status == 204 || StringUtils.isBlank(text)) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ApiException(status, "Invalid JSON response: " + e.getOriginalMessage(),
                    text, e);
        }
    }

    private String errorDetail(String text) {
        if (StringUtils.isBlank(text)) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node != null && node.isObject() && node.has("detail")) {
                JsonNode detail = node.get("detail");
                return detail.isTextual() ? detail.asText() : detail.toString();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return text;
    }

    private static String bodyText(ClassicHttpResponse response) throws IOException {
        if (response.getEntity() == null) {
            return "";
        }
        try {
            return EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
        } catch (ParseException e) {
            throw new IOException("Unreadable response body", e);
        }
    }

    private URI uri(String path, Map<String, ?> params) {
        try {
            URIBuilder builder = new URIBuilder(baseUrl + path);
            params.forEach((k, v) -> builder.addParameter(k, String.valueOf(v)));
            return builder.build();
        } catch (URISyntaxException e) {
            throw new ApiException(0, "Invalid URL: " + baseUrl + path, null, e);
        }
    }

    private static String orgPath(String orgId, String suffix) {
        return "/api/organizations/" + orgId + suffix;
    }

    private static Map<String, Object> page(int limit, int offset) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("limit", limit);
        params.put("offset", offset);
        return params;
    }
}
