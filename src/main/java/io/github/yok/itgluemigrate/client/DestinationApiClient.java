package io.github.yok.itgluemigrate.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.itgluemigrate.parser.FieldDefinition;
import java.util.List;
import java.util.Map;

/**
 * Operations of the BifrostDocs API used by the migration.
 *
 * <p>
 * Every call returns the decoded JSON response (an empty object for {@code 204 No Content}) and
 * throws {@link ApiException} when the destination answers with a status of 400 or above or
 * cannot be reached.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DestinationApiClient extends AutoCloseable {

    // ----------------------------------------------------------------------
    // Organizations
    // ----------------------------------------------------------------------

    JsonNode listOrganizations();

    JsonNode getOrganization(String orgId);

    /**
     * Creates an organization.
     *
     * @param name organization name
     * @param enabled whether the organization is enabled
     * @param metadata external-system metadata, may be {@code null}
     * @return the created organization, including its {@code id}
     */
    JsonNode createOrganization(String name, boolean enabled, Map<String, Object> metadata);

    // ----------------------------------------------------------------------
    // Global types
    // ----------------------------------------------------------------------

    JsonNode listConfigurationTypes(boolean includeInactive);

    JsonNode createConfigurationType(String name);

    JsonNode listConfigurationStatuses(boolean includeInactive);

    JsonNode createConfigurationStatus(String name);

    JsonNode listCustomAssetTypes(boolean includeInactive);

    /**
     * Creates a custom asset type.
     *
     * @param name display name
     * @param fields field definitions
     * @param displayFieldKey key of the field that names an asset, may be {@code null}
     * @return the created type, including its {@code id}
     */
    JsonNode createCustomAssetType(String name, List<FieldDefinition> fields,
            String displayFieldKey);

    // ----------------------------------------------------------------------
    // Organization-scoped entities
    // ----------------------------------------------------------------------

    JsonNode listConfigurations(String orgId, int limit, int offset);

    JsonNode createConfiguration(String orgId, ConfigurationRequest request);

    JsonNode listLocations(String orgId, int limit, int offset);

    JsonNode createLocation(String orgId, String name, String notes, Map<String, Object> metadata);

    JsonNode listDocuments(String orgId, String path, int limit, int offset);

    /**
     * Creates a document.
     *
     * @param orgId destination organization id
     * @param path virtual folder path such as {@code /Network/VPN}
     * @param name document title
     * @param content HTML content
     * @param metadata external-system metadata, may be {@code null}
     * @param enabled whether the document is enabled
     * @return the created document, including its {@code id}
     */
    JsonNode createDocument(String orgId, String path, String name, String content,
            Map<String, Object> metadata, boolean enabled);

    JsonNode listPasswords(String orgId, int limit, int offset);

    JsonNode createPassword(String orgId, PasswordRequest request);

    JsonNode listCustomAssets(String orgId, String typeId, int limit, int offset);

    JsonNode createCustomAsset(String orgId, String typeId, Map<String, Object> values,
            Map<String, Object> metadata, boolean enabled);

    // ----------------------------------------------------------------------
    // Relationships
    // ----------------------------------------------------------------------

    JsonNode listRelationships(String orgId, String entityType, String entityId);

    JsonNode createRelationship(String orgId, String sourceType, String sourceId,
            String targetType, String targetId);

    void deleteRelationship(String orgId, String relationshipId);

    // ----------------------------------------------------------------------
    // Attachments and images
    // ----------------------------------------------------------------------

    JsonNode listAttachments(String orgId, String entityType, String entityId, int limit,
            int offset);

    /**
     * Registers an attachment and obtains a presigned upload URL.
     *
     * @param orgId destination organization id
     * @param entityType destination entity type, e.g. {@code configuration}
     * @param entityId destination entity id
     * @param filename original file name
     * @param contentType MIME type
     * @param sizeBytes file size
     * @return ticket with {@code id} and {@code upload_url}
     */
    JsonNode createAttachment(String orgId, String entityType, String entityId, String filename,
            String contentType, long sizeBytes);

    JsonNode getAttachmentDownloadUrl(String orgId, String attachmentId);

    void deleteAttachment(String orgId, String attachmentId);

    /**
     * Registers an image to embed in document content.
     *
     * @param orgId destination organization id
     * @param filename file name including extension
     * @param contentType image MIME type
     * @param sizeBytes file size
     * @param documentId destination document id, may be {@code null}
     * @return ticket with {@code upload_url} and {@code image_url}
     */
    JsonNode uploadDocumentImage(String orgId, String filename, String contentType,
            long sizeBytes, String documentId);

    /**
     * Uploads bytes to a presigned URL without the API credentials.
     *
     * @param uploadUrl presigned PUT URL
     * @param content file content
     * @param contentType MIME type
     */
    void uploadToPresignedUrl(String uploadUrl, byte[] content, String contentType);

    @Override
    void close();
}
