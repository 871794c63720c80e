package com.diskmap.treemap.service;

import com.diskmap.treemap.config.ScanSettings;
import com.diskmap.treemap.model.FileTypeCategory;
import com.diskmap.treemap.model.TreemapNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bounded, cancellable directory scanner.
 *
 * Only the first {@link ScanSettings#getMaxEntriesPerDirectory()} entries of a
 * directory are looked at, and only the largest
 * {@link ScanSettings#getMaxChildren()} of those are kept. Directories below
 * {@link ScanSettings#getMaxDepth()} get a placeholder size instead of being
 * walked, so the cost of a scan does not grow with the size of the tree.
 *
 * Nothing here throws for a bad path or an unreadable entry: a bad root gives
 * {@link TreemapNode#error(String)}, a bad entry is skipped and a directory
 * that cannot be listed gets no children.
 */
@Slf4j
@Service
public class DiskScanner {

    private static final Comparator<TreemapNode> LARGEST_FIRST =
            Comparator.comparingLong(TreemapNode::getSize).reversed();

    private final ScanSettings settings;

    public DiskScanner(ScanSettings settings) {
        this.settings = settings;
    }

    public TreemapNode scan(String path, CancellationToken token) {
        if (path == null || path.isBlank()) {
            return TreemapNode.error(path == null ? "" : path);
        }
        try {
            return scan(Paths.get(path), token);
        } catch (InvalidPathException e) {
            log.warn("Invalid scan path {}: {}", path, e.getMessage());
            return TreemapNode.error(path);
        }
    }

    /**
     * Scan a file or directory.
     *
     * @param root - file or directory to scan
     * @param token - polled when each directory opens and before each entry
     * @return the root node; partial if the token was cancelled during the scan
     */
    public TreemapNode scan(Path root, CancellationToken token) {
        Path target = root.toAbsolutePath().normalize();

        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(target, BasicFileAttributes.class);
        } catch (IOException | SecurityException e) {
            log.warn("Cannot scan {}: {}", target, e.getMessage());
            return TreemapNode.error(root.toString());
        }
        if (!Files.isReadable(target)) {
            log.warn("Cannot scan {}: not readable", target);
            return TreemapNode.error(root.toString());
        }

        String name = displayName(target);
        if (!attrs.isDirectory()) {
            return TreemapNode.leaf(name, target.toString(), attrs.size(), FileTypeCategory.fromFileName(name), 0);
        }

        Set<Path> visited = new HashSet<>();
        visited.add(realPath(target));
        List<TreemapNode> children = scanDirectory(target, 0, token, visited);
        return TreemapNode.directory(name, target.toString(), children, 0);
    }

    private List<TreemapNode> scanDirectory(Path dir, int depth, CancellationToken token, Set<Path> visited) {
        if (token.isCancelled()) {
            return List.of();
        }

        List<TreemapNode> nodes = new ArrayList<>();
        int considered = 0;

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                if (considered >= settings.getMaxEntriesPerDirectory()) {
                    break;
                }
                if (token.isCancelled()) {
                    log.debug("Scan of {} cancelled after {} entries", dir, considered);
                    break;
                }
                if (!settings.isIncludeHidden() && isHidden(entry)) {
                    continue;
                }
                considered++;

                TreemapNode child = scanEntry(entry, depth + 1, token, visited);
                if (child != null) {
                    nodes.add(child);
                }
            }
        } catch (IOException | DirectoryIteratorException | SecurityException e) {
            log.warn("Cannot list {}: {}", dir, e.getMessage());
            return List.of();
        }

        nodes.sort(LARGEST_FIRST);
        if (nodes.size() > settings.getMaxChildren()) {
            return new ArrayList<>(nodes.subList(0, settings.getMaxChildren()));
        }
        return nodes;
    }

    /**
     * @return the node for one directory entry, or null if it cannot be stat'ed
     */
    private TreemapNode scanEntry(Path entry, int depth, CancellationToken token, Set<Path> visited) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(entry, BasicFileAttributes.class);
        } catch (IOException | SecurityException e) {
            log.debug("Skipping {}: {}", entry, e.getMessage());
            return null;
        }

        String name = displayName(entry);
        String path = entry.toString();

        if (!attrs.isDirectory()) {
            return TreemapNode.leaf(name, path, attrs.size(), FileTypeCategory.fromFileName(name), depth);
        }

        if (depth < settings.getMaxDepth()) {
            if (visited.add(realPath(entry))) {
                List<TreemapNode> children = scanDirectory(entry, depth, token, visited);
                return TreemapNode.directory(name, path, children, depth);
            }
            log.debug("Already visited {}, not descending again", entry);
        }
        return TreemapNode.placeholderDirectory(name, path, settings.getDirectoryPlaceholderBytes(), depth);
    }

    private boolean isHidden(Path entry) {
        Path fileName = entry.getFileName();
        if (fileName != null && fileName.toString().startsWith(".")) {
            return true;
        }
        try {
            return Files.isHidden(entry);
        } catch (IOException e) {
            log.debug("Cannot read hidden flag of {}: {}", entry, e.getMessage());
            return false;
        }
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    private static String displayName(Path path) {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString() : path.toString();
    }
}
