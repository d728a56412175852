package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Removes inferior copies of the same video from the flat store. Files that differ
 * only in their extension are copies; only the largest one is kept.
 */
@Slf4j
@Service
public class DuplicateReconciler {

    /**
     * @param directory Flat store directory
     * @return Number of files removed
     */
    public int reconcile(Path directory) {
        log.info("Checking for duplicate files...");
        Map<String, List<Path>> groups;
        try (Stream<Path> files = Files.list(directory)) {
            groups = files
                    .filter(Files::isRegularFile)
                    .filter(file -> PathUtils.getStem(file.getFileName().toString()) != null)
                    .collect(Collectors.groupingBy(
                            file -> PathUtils.getStem(file.getFileName().toString()),
                            TreeMap::new,
                            Collectors.toList()));
        } catch (IOException e) {
            log.error("Failed to list {}: {}", directory, e.getMessage());
            return 0;
        }

        int removed = 0;
        for (List<Path> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            List<Path> bySize = group.stream()
                    .sorted(Comparator.comparingLong(DuplicateReconciler::sizeOf)
                            .thenComparing(Path::getFileName))
                    .collect(Collectors.toList());
            for (Path duplicate : bySize.subList(0, bySize.size() - 1)) {
                log.info("Removing duplicate {}", duplicate.getFileName());
                try {
                    Files.delete(duplicate);
                    removed++;
                } catch (IOException e) {
                    log.warn("Failed to remove duplicate {}: {}", duplicate, e.getMessage());
                }
            }
        }
        log.info("Done");
        return removed;
    }

    private static long sizeOf(Path file) {
        Long size = PathUtils.fileSize(file);
        return size == null ? -1 : size;
    }
}
