package io.github.yok.itgluemigrate.attachment;

import com.google.common.collect.ImmutableSet;
import io.github.yok.itgluemigrate.parser.ExportNotFoundException;
import io.github.yok.itgluemigrate.util.TextFiles;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Discovers attachment files in an IT Glue export.
 *
 * <p>
 * Three on-disk conventions are recognized:
 * </p>
 * <ul>
 * <li>{@code attachments/{entity_type}/{entity_id}/**} with arbitrary nesting</li>
 * <li>{@code {asset_type}-floor-plans-photos/} (and the legacy unprefixed
 * {@code floor_plans_photos/}) holding either {@code {id}/**} subdirectories or flat
 * {@code {id}-{filename}} files</li>
 * <li>embedded document images under {@code documents/**}: files below an {@code images}
 * directory or with an image extension</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class AttachmentScanner {

    /**
     * Folder name pattern of exported documents: {@code DOC-{org_id}-{doc_id} Title}.
     */
    public static final Pattern DOC_FOLDER_PATTERN = Pattern.compile("^DOC-(\\d+)-(\\d+)\\s");

    /**
     * Extensions (lowercase, without dot) treated as images.
     */
    public static final Set<String> IMAGE_EXTENSIONS = ImmutableSet.of("jpg", "jpeg", "png",
            "gif", "bmp", "webp", "svg", "ico", "tiff", "tif");

    private static final String FLOOR_PLANS_SUFFIX = "-floor-plans-photos";
    private static final String LEGACY_FLOOR_PLANS = "floor_plans_photos";
    private static final String DOCUMENT_IMAGES = "document_images";
    private static final Pattern ID_PREFIXED_FILE = Pattern.compile("^(\\d+)-(.+)$");
    private static final Pattern IMG_SRC = Pattern.compile(
            "<img[^>]+src=[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB", "PB"};

    /**
     * Formats a byte count using 1024-based units.
     *
     * @param sizeBytes byte count
     * @return e.g. {@code "0 B"}, {@code "512 B"}, {@code "1.0 KB"}, {@code "5.4 GB"}
     */
    public static String formatSize(long sizeBytes) {
        if (sizeBytes <= 0) {
            return "0 B";
        }
        double size = sizeBytes;
        int unit = 0;
        while (size >= 1024 && unit < SIZE_UNITS.length - 1) {
            size /= 1024;
            unit++;
        }
        if (unit == 0) {
            return sizeBytes + " B";
        }
        return String.format(Locale.ROOT, "%.1f %s", size, SIZE_UNITS[unit]);
    }

    /**
     * Counts and sizes all attachments of an export, grouped by entity type.
     *
     * @param exportPath export root
     * @return statistics
     * @throws ExportNotFoundException if {@code exportPath} is not a directory
     */
    public AttachmentStats scanExport(Path exportPath) {
        validateExportPath(exportPath);
        AttachmentStats stats = new AttachmentStats();

        for (Path typeDir : listChildren(exportPath.resolve("attachments"))) {
            if (Files.isDirectory(typeDir)) {
                putIfNotEmpty(stats, typeDir.getFileName().toString(), listFiles(typeDir));
            }
        }
        for (Path floorDir : floorPlanDirectories(exportPath)) {
            putIfNotEmpty(stats, floorPlanKey(floorDir), listFiles(floorDir));
        }

        Set<Path> seen = new LinkedHashSet<>();
        for (Path docDir : listChildren(exportPath.resolve("documents"))) {
            if (!Files.isDirectory(docDir)) {
                continue;
            }
            for (Path file : listFiles(docDir)) {
                if (isUnderImagesFolder(docDir, file) || isImageFile(file)) {
                    seen.add(canonical(file));
                }
            }
        }
        putIfNotEmpty(stats, DOCUMENT_IMAGES, new ArrayList<>(seen));

        log.info("Scanned attachments: {} files, {}", stats.getTotalFiles(),
                stats.getFormattedSize());
        return stats;
    }

    /**
     * Lists every attachment group of the export.
     *
     * @param exportPath export root
     * @return {@code (type, id) → sorted canonical files}, ordered by key
     */
    public Map<AttachmentKey, List<Path>> getAllAttachments(Path exportPath) {
        validateExportPath(exportPath);
        Map<AttachmentKey, List<Path>> result = new TreeMap<>();

        for (Path typeDir : listChildren(exportPath.resolve("attachments"))) {
            if (!Files.isDirectory(typeDir)) {
                continue;
            }
            String type = typeDir.getFileName().toString();
            for (Path idDir : listChildren(typeDir)) {
                if (Files.isDirectory(idDir)) {
                    putGroup(result, new AttachmentKey(type, idDir.getFileName().toString()),
                            listFiles(idDir));
                }
            }
        }
        for (Path floorDir : floorPlanDirectories(exportPath)) {
            collectFloorPlans(floorDir, floorPlanKey(floorDir), result);
        }
        result.values().forEach(Collections::sort);
        return result;
    }

    /**
     * Lists the attachments of a single entity.
     *
     * @param exportPath export root
     * @param entityType export entity type, e.g. {@code configurations} or a custom asset slug
     * @param entityId export entity id
     * @return sorted canonical files from {@code attachments/{type}/{id}/**} plus matching
     *         {@code {type}-floor-plans-photos/{id}-*} files
     */
    public List<Path> getEntityAttachments(Path exportPath, String entityType, String entityId) {
        validateExportPath(exportPath);
        List<Path> files = new ArrayList<>();
        Path entityDir = exportPath.resolve("attachments").resolve(entityType).resolve(entityId);
        for (Path file : listFiles(entityDir)) {
            files.add(canonical(file));
        }
        String prefix = entityId + "-";
        for (Path item : listChildren(exportPath.resolve(entityType + FLOOR_PLANS_SUFFIX))) {
            if (Files.isRegularFile(item) && item.getFileName().toString().startsWith(prefix)) {
                files.add(canonical(item));
            }
        }
        Collections.sort(files);
        return files;
    }

    /**
     * Maps every document id to its folder, searching {@code documents/} recursively.
     *
     * @param exportPath export root
     * @return {@code docId → folder}
     */
    public Map<String, DocumentFolder> getDocumentFolderMapping(Path exportPath) {
        validateExportPath(exportPath);
        Map<String, DocumentFolder> mapping = new TreeMap<>();
        Path documentsDir = exportPath.resolve("documents");
        for (Path dir : listDirectories(documentsDir)) {
            Matcher m = DOC_FOLDER_PATTERN.matcher(dir.getFileName().toString());
            if (m.find()) {
                mapping.put(m.group(2), new DocumentFolder(m.group(2), dir,
                        virtualPath(documentsDir, dir)));
            }
        }
        log.debug("Document folder mapping: {} entries", mapping.size());
        return mapping;
    }

    /**
     * Finds the folder of one document.
     *
     * @param exportPath export root
     * @param docId document id
     * @return the folder, or empty if none exists
     */
    public Optional<DocumentFolder> findDocumentFolder(Path exportPath, String docId) {
        if (docId == null || !Files.isDirectory(exportPath)) {
            return Optional.empty();
        }
        Path documentsDir = exportPath.resolve("documents");
        for (Path dir : listDirectories(documentsDir)) {
            Matcher m = DOC_FOLDER_PATTERN.matcher(dir.getFileName().toString());
            if (m.find() && m.group(2).equals(docId)) {
                return Optional.of(new DocumentFolder(docId, dir, virtualPath(documentsDir, dir)));
            }
        }
        return Optional.empty();
    }

    /**
     * Lists the images of a document: sources referenced by its HTML files that exist on disk
     * plus every file below an {@code images} directory.
     *
     * @param exportPath export root
     * @param docId document id
     * @return sorted canonical image files
     * @throws DocumentNotFoundException if the document has no folder
     */
    public List<Path> getDocumentImages(Path exportPath, String docId) {
        validateExportPath(exportPath);
        DocumentFolder doc = findDocumentFolder(exportPath, docId)
                .orElseThrow(() -> new DocumentNotFoundException(docId, exportPath));
        Path folder = doc.getFolder();
        Set<Path> images = new LinkedHashSet<>();
        for (Path file : listFiles(folder)) {
            if (!file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".html")) {
                continue;
            }
            String html;
            try {
                html = TextFiles.readText(file);
            } catch (IOException e) {
                log.warn("Could not read {}: {}", file, e.getMessage());
                continue;
            }
            Matcher m = IMG_SRC.matcher(html);
            while (m.find()) {
                resolveLocal(m.group(1), file, folder).ifPresent(images::add);
            }
        }
        for (Path file : listFiles(folder)) {
            if (isUnderImagesFolder(folder, file)) {
                images.add(canonical(file));
            }
        }
        List<Path> sorted = new ArrayList<>(images);
        Collections.sort(sorted);
        return sorted;
    }

    /**
     * Classifies every discovered attachment group as matched or orphaned.
     *
     * @param exportPath export root
     * @param entitiesToMigrate {@code entity type → ids being migrated}
     * @return the partition with matched file and byte totals
     */
    public AttachmentValidationResult validateAttachments(Path exportPath,
            Map<String, Set<String>> entitiesToMigrate) {
        AttachmentValidationResult result = new AttachmentValidationResult();
        for (Map.Entry<AttachmentKey, List<Path>> e : getAllAttachments(exportPath).entrySet()) {
            AttachmentKey key = e.getKey();
            Set<String> ids = entitiesToMigrate.getOrDefault(key.getEntityType(), Set.of());
            if (ids.contains(key.getEntityId())) {
                for (Path file : e.getValue()) {
                    result.addMatched(key.getEntityType(), sizeOf(file));
                }
            } else {
                result.addOrphan(key.getEntityType(), key.getEntityId());
            }
        }
        log.info("Attachment validation: {} matched files ({}), {} orphaned folders",
                result.getTotalMatchedFiles(), result.getFormattedMatchedSize(),
                result.getTotalOrphanedFolders());
        return result;
    }

    /**
     * Resolves an image reference from an HTML file to a local file.
     *
     * <p>
     * Candidates, in order: relative to the HTML file's directory, relative to the document
     * folder, leading slashes stripped relative to the document folder, then the URL-decoded
     * reference tried the same ways.
     * </p>
     *
     * @param src {@code src} attribute value
     * @param htmlFile HTML file containing the reference
     * @param docFolder document folder
     * @return canonical path of an existing regular file, or empty
     */
    public static Optional<Path> resolveLocal(String src, Path htmlFile, Path docFolder) {
        Optional<Path> found = tryResolve(src, htmlFile, docFolder);
        if (found.isPresent()) {
            return found;
        }
        String decoded;
        try {
            decoded = URLDecoder.decode(src.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (decoded.equals(src)) {
            return Optional.empty();
        }
        return tryResolve(decoded, htmlFile, docFolder);
    }

    private static Optional<Path> tryResolve(String src, Path htmlFile, Path docFolder) {
        List<Path> candidates = new ArrayList<>();
        try {
            Path htmlDir = htmlFile.getParent() != null ? htmlFile.getParent() : docFolder;
            candidates.add(htmlDir.resolve(src));
            candidates.add(docFolder.resolve(src));
            if (src.startsWith("/")) {
                candidates.add(docFolder.resolve(src.replaceFirst("^/+", "")));
            }
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(canonical(candidate));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns whether the file has an image extension.
     *
     * @param file file to check
     * @return {@code true} for {@link #IMAGE_EXTENSIONS}
     */
    public static boolean isImageFile(Path file) {
        String ext = FilenameUtils.getExtension(file.getFileName().toString());
        return IMAGE_EXTENSIONS.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns whether a directory named {@code images} lies between {@code root} and the file.
     *
     * @param root document folder the file was listed from
     * @param file file inside {@code root}
     * @return {@code true} if an {@code images} directory contains the file
     */
    static boolean isUnderImagesFolder(Path root, Path file) {
        if (!file.startsWith(root)) {
            return false;
        }
        Path relative = root.relativize(file).getParent();
        if (relative == null) {
            return false;
        }
        for (Path part : relative) {
            if ("images".equals(part.toString())) {
                return true;
            }
        }
        return false;
    }

    private void collectFloorPlans(Path floorDir, String type,
            Map<AttachmentKey, List<Path>> result) {
        for (Path item : listChildren(floorDir)) {
            String name = item.getFileName().toString();
            if (Files.isDirectory(item)) {
                putGroup(result, new AttachmentKey(type, name), listFiles(item));
            } else if (Files.isRegularFile(item)) {
                Matcher m = ID_PREFIXED_FILE.matcher(name);
                if (m.matches()) {
                    result.computeIfAbsent(new AttachmentKey(type, m.group(1)),
                            k -> new ArrayList<>()).add(canonical(item));
                }
            }
        }
    }

    private static void putGroup(Map<AttachmentKey, List<Path>> result, AttachmentKey key,
            List<Path> files) {
        if (!files.isEmpty()) {
            result.put(key, files.stream().map(AttachmentScanner::canonical)
                    .collect(Collectors.toCollection(ArrayList::new)));
        }
    }

    private static void putIfNotEmpty(AttachmentStats stats, String type, List<Path> files) {
        if (files.isEmpty()) {
            return;
        }
        EntityAttachmentStats entity = new EntityAttachmentStats();
        for (Path file : files) {
            entity.add(sizeOf(file));
        }
        stats.put(type, entity);
    }

    private static List<Path> floorPlanDirectories(Path exportPath) {
        List<Path> dirs = new ArrayList<>();
        for (Path child : listChildren(exportPath)) {
            String name = child.getFileName().toString();
            if (Files.isDirectory(child)
                    && (name.endsWith(FLOOR_PLANS_SUFFIX) || name.equals(LEGACY_FLOOR_PLANS))) {
                dirs.add(child);
            }
        }
        return dirs;
    }

    private static String floorPlanKey(Path floorDir) {
        String name = floorDir.getFileName().toString();
        if (name.equals(LEGACY_FLOOR_PLANS)) {
            return LEGACY_FLOOR_PLANS;
        }
        return floorPlanKey(name.substring(0, name.length() - FLOOR_PLANS_SUFFIX.length()));
    }

    /**
     * Returns the attachment group type of the {@code {entityType}-floor-plans-photos} folder.
     *
     * @param entityType export entity type or custom asset slug
     * @return e.g. {@code servers_floor_plans_photos}
     */
    public static String floorPlanKey(String entityType) {
        return entityType + "_" + LEGACY_FLOOR_PLANS;
    }

    private static String virtualPath(Path documentsDir, Path docFolder) {
        Path parent = documentsDir.relativize(docFolder).getParent();
        if (parent == null) {
            return "/";
        }
        List<String> parts = new ArrayList<>();
        parent.forEach(p -> parts.add(p.toString()));
        return "/" + String.join("/", parts);
    }

    private static void validateExportPath(Path exportPath) {
        if (exportPath == null || !Files.isDirectory(exportPath)) {
            throw new ExportNotFoundException(exportPath);
        }
    }

    static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.warn("Could not read size of {}: {}", file, e.getMessage());
            return 0L;
        }
    }

    static Path canonical(Path file) {
        try {
            return file.toRealPath();
        } catch (IOException e) {
            return file.toAbsolutePath().normalize();
        }
    }

    private static List<Path> listChildren(Path dir) {
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children.sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    private static List<Path> listFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + dir, e);
        }
    }

    private static List<Path> listDirectories(Path dir) {
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(p -> !p.equals(dir)).filter(Files::isDirectory).sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + dir, e);
        }
    }
}
