package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;
import com.example.fileinventory.model.RecordStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Walks a folder tree top-down and builds a fresh record for every regular file. Each directory's files are
 * listed before its sub-directories are descended. Records leave the scanner with status {@code Added};
 * reconciliation assigns the final status.
 */
public final class InventoryScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(InventoryScanner.class);
    static final DateTimeFormatter LAST_MODIFIED_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final InventoryConfig config;
    private final ContentHintExtractor extractor;
    private final ZoneId zone;

    public InventoryScanner(InventoryConfig config, ContentHintExtractor extractor) {
        this(config, extractor, ZoneId.systemDefault());
    }

    InventoryScanner(InventoryConfig config, ContentHintExtractor extractor, ZoneId zone) {
        this.config = config;
        this.extractor = extractor;
        this.zone = zone;
    }

    /**
     * Scans {@code rootFolder}. When {@code inventoryFile} lives inside the tree, it and its backup and temp
     * companions are left out of the listing.
     */
    public ScanResult scan(Path rootFolder, Path inventoryFile) {
        List<InventoryWarning> warnings = new ArrayList<>();
        if (rootFolder == null || !Files.isDirectory(rootFolder)) {
            String message = "Start folder '" + rootFolder + "' not found.";
            LOGGER.warn(message);
            warnings.add(new InventoryWarning(InventoryError.FOLDER_NOT_FOUND, rootFolder, message));
            return ScanResult.failure(InventoryError.FOLDER_NOT_FOUND, warnings);
        }

        Path root = canonical(rootFolder);
        Path inventory = inventoryFile == null ? null : canonicalFile(inventoryFile);
        List<FileRecord> records = new ArrayList<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.addFirst(root);

        while (!pending.isEmpty()) {
            Path current = pending.removeFirst();
            List<Path> files = new ArrayList<>();
            List<Path> directories = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                for (Path entry : stream) {
                    if (Files.isDirectory(entry)) {
                        if (!isExcludedDirectory(entry) && !isSkippedLink(entry)) {
                            directories.add(entry);
                        }
                    } else if (Files.isRegularFile(entry) && !isExcludedFile(current, entry, inventory)) {
                        files.add(entry);
                    }
                }
            } catch (IOException ex) {
                LOGGER.warn("Failed to list directory {}", current, ex);
                warnings.add(new InventoryWarning(InventoryError.RECORD_READ_FAILURE, current, describe(ex)));
                continue;
            }

            files.sort(Comparator.comparing(InventoryScanner::fileName));
            for (Path file : files) {
                try {
                    records.add(recordFor(current, file));
                } catch (IOException ex) {
                    LOGGER.warn("Could not process file '{}': {}. Skipping.", file, describe(ex));
                    warnings.add(new InventoryWarning(InventoryError.RECORD_READ_FAILURE, file, describe(ex)));
                }
            }

            // Push in reverse so sub-directories are descended in name order.
            directories.sort(Comparator.comparing(InventoryScanner::fileName).reversed());
            for (Path directory : directories) {
                pending.addFirst(directory);
            }
        }

        LOGGER.info("Scanned {}: {} files, {} warnings", root, records.size(), warnings.size());
        return ScanResult.success(records, warnings);
    }

    private FileRecord recordFor(Path folder, Path file) throws IOException {
        // A linked file is described by its target.
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        String fileName = file.getFileName().toString();
        String extension = extensionOf(fileName);
        String lastModified = LocalDateTime.ofInstant(attributes.lastModifiedTime().toInstant(), zone)
                .format(LAST_MODIFIED_FORMAT);
        ContentHintExtractor.ContentDescription description = extractor.describe(file, extension);
        return new FileRecord(
                folder.toString(),
                fileName,
                extension,
                attributes.size(),
                lastModified,
                normalize(file).toString(),
                description.hint(),
                description.topics(),
                RecordStatus.ADDED,
                ""
        );
    }

    private boolean isExcludedDirectory(Path directory) {
        Path name = directory.getFileName();
        return name != null && config.excludedDirectories().contains(name.toString());
    }

    private boolean isExcludedFile(Path folder, Path file, Path inventory) {
        String name = file.getFileName().toString();
        for (String prefix : config.transientFilePrefixes()) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        if (config.excludedFileNames().contains(name) || name.equalsIgnoreCase(config.inventoryFileName())) {
            return true;
        }
        if (inventory == null || !normalize(folder).equals(inventory.getParent())) {
            return false;
        }
        return InventoryStore.isCompanionOf(inventory, name);
    }

    /**
     * Linked directories are only descended when {@code followLinks} is set. Linked files are always listed.
     */
    private boolean isSkippedLink(Path directory) {
        return !config.followLinks() && Files.isSymbolicLink(directory);
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String describe(IOException ex) {
        return ex.getClass().getSimpleName() + ": " + ex.getMessage();
    }

    /**
     * Real path of an existing folder or file, so a tree reached through a symbolic link produces the same
     * keys as its target. A path that does not exist is only made absolute.
     */
    static Path canonical(Path path) {
        Path absolute = normalize(path);
        if (!Files.exists(absolute)) {
            return absolute;
        }
        try {
            return absolute.toRealPath();
        } catch (IOException ex) {
            LOGGER.warn("Failed to resolve real path of {}", absolute, ex);
            return absolute;
        }
    }

    /**
     * Resolves the parent folder only, so a file that does not exist yet still gets a canonical location.
     */
    static Path canonicalFile(Path file) {
        Path absolute = normalize(file);
        Path parent = absolute.getParent();
        return parent == null ? absolute : canonical(parent).resolve(absolute.getFileName());
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static String fileName(Path path) {
        return path.getFileName().toString();
    }
}
