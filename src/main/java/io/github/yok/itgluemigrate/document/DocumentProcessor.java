package io.github.yok.itgluemigrate.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.itgluemigrate.attachment.AttachmentScanner;
import io.github.yok.itgluemigrate.attachment.DocumentFolder;
import io.github.yok.itgluemigrate.client.ApiException;
import io.github.yok.itgluemigrate.client.ApiResponses;
import io.github.yok.itgluemigrate.client.DestinationApiClient;
import io.github.yok.itgluemigrate.parser.DocumentRecord;
import io.github.yok.itgluemigrate.state.MigrationState;
import io.github.yok.itgluemigrate.util.TextFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/**
 * Turns exported documents into destination content and uploads entity attachments.
 *
 * <p>
 * Document images are uploaded through {@link DestinationApiClient#uploadDocumentImage} and the
 * {@code src} of each {@code <img>} is rewritten to the returned URL. Each local file is uploaded
 * at most once per processor instance; the cache is keyed by the canonical file path.
 * </p>
 *
 * <p>
 * Attachment uploads of one entity run on a pool bounded by the configured upload concurrency.
 * Per-file failures are recorded in the {@link MigrationState} and never rethrown.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DocumentProcessor implements AutoCloseable {

    /**
     * Destination entity types of the standard export attachment folders.
     */
    public static final Map<String, String> ENTITY_TYPE_MAPPING = ImmutableMap.of(
            "configurations", "configuration",
            "documents", "document",
            "passwords", "password",
            "locations", "location");

    static final String CUSTOM_ASSET = "custom_asset";

    private static final Pattern IMG_SRC = Pattern.compile(
            "<img\\s+[^>]*src=[\"']([^\"']+)[\"'][^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BR_BEFORE_LI_END = Pattern.compile(
            "<br\\s*/?>\\s*(?=</li>)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BR_BEFORE_LIST = Pattern.compile(
            "<br\\s*/?>\\s*(?=<[uo]l>)", Pattern.CASE_INSENSITIVE);
    private static final List<String> INDEX_NAMES = List.of("index.html", "index.htm");

    private final DestinationApiClient client;
    private final Path exportPath;
    private final AttachmentScanner scanner;
    private final ExecutorService uploadPool;
    private final Map<Path, String> imageUrlCache = new ConcurrentHashMap<>();
    private Map<String, DocumentFolder> documentFolders;

    /**
     * Creates a processor.
     *
     * @param client destination API client
     * @param exportPath export root
     * @param scanner attachment scanner used to locate files
     * @param uploadConcurrency maximum parallel attachment uploads, at least 1
     */
    public DocumentProcessor(DestinationApiClient client, Path exportPath,
            AttachmentScanner scanner, int uploadConcurrency) {
        Preconditions.checkNotNull(client, "client must not be null");
        Preconditions.checkNotNull(exportPath, "exportPath must not be null");
        Preconditions.checkNotNull(scanner, "scanner must not be null");
        Preconditions.checkArgument(uploadConcurrency > 0,
                "uploadConcurrency must be positive: %s", uploadConcurrency);
        this.client = client;
        this.exportPath = exportPath;
        this.scanner = scanner;
        this.uploadPool = Executors.newFixedThreadPool(uploadConcurrency,
                new ThreadFactoryBuilder().setNameFormat("attachment-upload-%d")
                        .setDaemon(true).build());
    }

    // ----------------------------------------------------------------------
    // Documents
    // ----------------------------------------------------------------------

    /**
     * Loads a document's HTML, uploads its local images and rewrites their URLs.
     *
     * <p>
     * Problems with the document or a single image are returned as warnings. A document without
     * a folder or HTML file yields empty HTML and one warning.
     * </p>
     *
     * @param doc document row
     * @param orgUuid destination organization id
     * @return rewritten HTML and warnings
     */
    public ProcessedDocument processDocument(DocumentRecord doc, String orgUuid) {
        List<String> warnings = new ArrayList<>();
        String docId = StringUtils.defaultString(doc.getId());
        String notFound = "Document HTML not found for ID " + docId + " (name: "
                + StringUtils.defaultIfEmpty(doc.getName(), "unknown") + ")";

        Optional<DocumentFolder> folder = Optional.ofNullable(documentFolders().get(docId));
        if (folder.isEmpty()) {
            warnings.add(notFound);
            return new ProcessedDocument("", warnings);
        }
        Path docFolder = folder.get().getFolder();
        Optional<Path> htmlFile = findHtmlFile(docFolder);
        if (htmlFile.isEmpty()) {
            warnings.add(notFound);
            return new ProcessedDocument("", warnings);
        }
        String html;
        try {
            html = TextFiles.readText(htmlFile.get());
        } catch (IOException e) {
            log.warn("Failed to read document HTML {}: {}", htmlFile.get(), e.getMessage());
            warnings.add(notFound);
            return new ProcessedDocument("", warnings);
        }

        html = cleanHtml(html);
        Set<String> sources = extractImageSources(html);
        if (sources.isEmpty()) {
            log.debug("No images found in document {}", docId);
            return new ProcessedDocument(html, warnings);
        }

        Map<String, String> replacements = new LinkedHashMap<>();
        for (String src : sources) {
            if (isRemote(src)) {
                continue;
            }
            Optional<Path> local = AttachmentScanner.resolveLocal(src, htmlFile.get(), docFolder);
            if (local.isEmpty()) {
                warnings.add("Image not found: " + src);
                continue;
            }
            String url = uploadImage(local.get(), orgUuid);
            if (url == null) {
                warnings.add("Failed to upload image: " + src);
                continue;
            }
            replacements.put(src, url);
        }
        if (!replacements.isEmpty()) {
            html = transformHtml(html, replacements);
            log.info("Document {}: replaced {} image URLs", docId, replacements.size());
        }
        return new ProcessedDocument(html, warnings);
    }

    /**
     * Drops line breaks that directly precede a list item end or a nested list.
     *
     * @param html document HTML
     * @return cleaned HTML
     */
    static String cleanHtml(String html) {
        String cleaned = BR_BEFORE_LI_END.matcher(html).replaceAll("");
        return BR_BEFORE_LIST.matcher(cleaned).replaceAll("");
    }

    /**
     * Extracts the {@code src} values of {@code <img>} tags in document order.
     *
     * @param html document HTML
     * @return unique sources
     */
    static Set<String> extractImageSources(String html) {
        Set<String> sources = new LinkedHashSet<>();
        Matcher m = IMG_SRC.matcher(html);
        while (m.find()) {
            sources.add(m.group(1));
        }
        return sources;
    }

    /**
     * Replaces image sources inside {@code <img>} tags only, keeping every other attribute and
     * the original quote characters.
     *
     * @param html document HTML
     * @param replacements {@code old src → new URL}
     * @return rewritten HTML
     */
    static String transformHtml(String html, Map<String, String> replacements) {
        String result = html;
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            Pattern p = Pattern.compile("(<img\\s+[^>]*src=[\"'])" + Pattern.quote(entry.getKey())
                    + "([\"'][^>]*>)", Pattern.CASE_INSENSITIVE);
            result = p.matcher(result).replaceAll(
                    "$1" + Matcher.quoteReplacement(entry.getValue()) + "$2");
        }
        return result;
    }

    private static boolean isRemote(String src) {
        String lower = src.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://")
                || lower.startsWith("data:");
    }

    private static Optional<Path> findHtmlFile(Path docFolder) {
        List<Path> html = listByExtension(docFolder, ".html");
        if (html.isEmpty()) {
            html = listByExtension(docFolder, ".htm");
        }
        for (Path file : html) {
            if (INDEX_NAMES.contains(file.getFileName().toString().toLowerCase(Locale.ROOT))) {
                return Optional.of(file);
            }
        }
        return html.stream().findFirst();
    }

    private static List<Path> listByExtension(Path dir, String extension) {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT)
                            .endsWith(extension))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list document folder {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    // built once per cache lifetime; the documents tree is walked only here
    private synchronized Map<String, DocumentFolder> documentFolders() {
        if (documentFolders == null) {
            documentFolders = Files.isDirectory(exportPath)
                    ? scanner.getDocumentFolderMapping(exportPath)
                    : Map.of();
        }
        return documentFolders;
    }

    private String uploadImage(Path imagePath, String orgUuid) {
        String cached = imageUrlCache.get(imagePath);
        if (cached != null) {
            log.debug("Using cached URL for {}", imagePath.getFileName());
            return cached;
        }
        try {
            byte[] content = Files.readAllBytes(imagePath);
            if (content.length == 0) {
                log.warn("Skipping empty image file: {}", imagePath);
                return null;
            }
            String name = imagePath.getFileName().toString();
            String contentType = ImageTypes.detect(name, content);
            String filename = ImageTypes.ensureExtension(name, contentType);

            JsonNode ticket = client.uploadDocumentImage(orgUuid, filename, contentType,
                    content.length, null);
            String uploadUrl = ApiResponses.text(ticket, "upload_url");
            String imageUrl = ApiResponses.text(ticket, "image_url");
            if (uploadUrl == null || imageUrl == null) {
                log.error("Invalid upload response for {}: {}", filename, ticket);
                return null;
            }
            client.uploadToPresignedUrl(uploadUrl, content, contentType);
            imageUrlCache.put(imagePath, imageUrl);
            log.debug("Uploaded image {} -> {}", filename, imageUrl);
            return imageUrl;
        } catch (ApiException e) {
            log.warn("API error uploading image {}: {}", imagePath, e.getMessage());
            return null;
        } catch (IOException e) {
            log.warn("Failed to read image file {}: {}", imagePath, e.getMessage());
            return null;
        }
    }

    // ----------------------------------------------------------------------
    // Attachments
    // ----------------------------------------------------------------------

    /**
     * Uploads the files under {@code attachments/{entityType}/{entityId}/}.
     *
     * <p>
     * Files already completed in the state and empty files are skipped. Each success or failure
     * is recorded in the state when one is given.
     * </p>
     *
     * @param entityType export attachment folder, e.g. {@code configurations} or an asset slug
     * @param entityId export entity id
     * @param orgUuid destination organization id
     * @param destinationEntityId destination entity id
     * @param state migration state, may be {@code null}
     * @param knownCustomAssetTypes custom asset type slugs of the export
     * @return number of uploaded files
     */
    public int uploadEntityAttachments(String entityType, String entityId, String orgUuid,
            String destinationEntityId, MigrationState state, Set<String> knownCustomAssetTypes) {
        String targetType = targetEntityType(entityType, knownCustomAssetTypes);
        List<Path> files = scanner.getEntityAttachments(exportPath, entityType, entityId);
        if (files.isEmpty()) {
            log.debug("No attachments found for {}/{}", entityType, entityId);
            return 0;
        }

        Map<Path, Future<Boolean>> futures = new LinkedHashMap<>();
        for (Path file : files) {
            String filename = file.getFileName().toString();
            if (state != null && state.isAttachmentCompleted(entityType, entityId, filename)) {
                log.debug("Skipping already completed attachment: {}", filename);
                continue;
            }
            futures.put(file, uploadPool.submit(() -> uploadAttachment(file, entityType, entityId,
                    targetType, orgUuid, destinationEntityId, state)));
        }

        int uploaded = 0;
        for (Map.Entry<Path, Future<Boolean>> entry : futures.entrySet()) {
            try {
                if (entry.getValue().get()) {
                    uploaded++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new IllegalStateException(
                        "Interrupted while uploading attachments of " + entityType + "/"
                                + entityId,
                        e);
            } catch (ExecutionException e) {
                String filename = entry.getKey().getFileName().toString();
                recordFailure(state, entityType, entityId, filename, e.getCause().toString());
                log.warn("Attachment upload task failed for {}/{}/{}", entityType, entityId,
                        filename, e.getCause());
            }
        }
        if (uploaded > 0) {
            log.info("Uploaded {}/{} attachments for {}/{}", uploaded, files.size(), entityType,
                    entityId);
        }
        return uploaded;
    }

    /**
     * Maps an export attachment folder to a destination entity type.
     *
     * @param entityType export attachment folder
     * @param knownCustomAssetTypes custom asset type slugs of the export
     * @return destination entity type
     */
    static String targetEntityType(String entityType, Set<String> knownCustomAssetTypes) {
        String mapped = ENTITY_TYPE_MAPPING.get(entityType);
        if (mapped != null) {
            return mapped;
        }
        if (knownCustomAssetTypes == null || !knownCustomAssetTypes.contains(entityType)) {
            log.warn("Unknown entity type '{}' - treating as custom_asset", entityType);
        }
        return CUSTOM_ASSET;
    }

    private boolean uploadAttachment(Path file, String entityType, String entityId,
            String targetType, String orgUuid, String destinationEntityId,
            MigrationState state) {
        String filename = file.getFileName().toString();
        try {
            byte[] content = Files.readAllBytes(file);
            if (content.length == 0) {
                log.warn("Skipping empty attachment: {}", file);
                return false;
            }
            String contentType = MediaTypeFactory.getMediaType(filename)
                    .orElse(MediaType.APPLICATION_OCTET_STREAM).toString();
            JsonNode ticket = client.createAttachment(orgUuid, targetType, destinationEntityId,
                    filename, contentType, content.length);
            String uploadUrl = ApiResponses.text(ticket, "upload_url");
            if (uploadUrl == null) {
                recordFailure(state, entityType, entityId, filename,
                        "No upload URL in attachment response");
                log.error("No upload URL in attachment response for {}", filename);
                return false;
            }
            client.uploadToPresignedUrl(uploadUrl, content, contentType);
            if (state != null) {
                state.markAttachmentCompleted(entityType, entityId, filename);
            }
            log.debug("Uploaded attachment: {} -> {}/{}", filename, targetType,
                    destinationEntityId);
            return true;
        } catch (ApiException e) {
            recordFailure(state, entityType, entityId, filename, e.getMessage());
            log.warn("API error uploading attachment {}: {}", filename, e.getMessage());
            return false;
        } catch (IOException e) {
            recordFailure(state, entityType, entityId, filename, e.toString());
            log.warn("Failed to read attachment file {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static void recordFailure(MigrationState state, String entityType, String entityId,
            String filename, String error) {
        if (state != null) {
            state.markAttachmentFailed(entityType, entityId, filename,
                    StringUtils.defaultIfBlank(error, "unknown error"));
        }
    }

    // ----------------------------------------------------------------------
    // Cache and lifecycle
    // ----------------------------------------------------------------------

    /**
     * Forgets uploaded image URLs and the document folder map.
     */
    public synchronized void clearCache() {
        imageUrlCache.clear();
        documentFolders = null;
    }

    public int getCacheSize() {
        return imageUrlCache.size();
    }

    @Override
    public void close() {
        uploadPool.shutdown();
        try {
            if (!uploadPool.awaitTermination(30, TimeUnit.SECONDS)) {
                uploadPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            uploadPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
