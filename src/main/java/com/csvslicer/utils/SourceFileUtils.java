package com.csvslicer.utils;

import com.csvslicer.exception.SlicerConfigException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands source arguments whose file-name part may contain glob wildcards ({@code data/*.csv}).
 */
public final class SourceFileUtils {

    private SourceFileUtils() {
    }

    public static List<Path> resolve(String source) {
        if (source == null || source.isBlank()) {
            throw new SlicerConfigException("A source file is required");
        }
        Path path = Paths.get(source.strip());
        Path fileName = path.getFileName();
        if (fileName == null || !isGlob(fileName.toString())) {
            if (!Files.isRegularFile(path)) {
                throw new SlicerConfigException("Source file " + path + " does not exist");
            }
            return List.of(path);
        }

        Path directory = path.getParent() != null ? path.getParent() : Paths.get(".");
        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, fileName.toString())) {
            for (Path match : stream) {
                if (Files.isRegularFile(match)) {
                    matches.add(match);
                }
            }
        } catch (NoSuchFileException e) {
            throw new SlicerConfigException("Source directory " + directory + " does not exist", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list " + directory, e);
        }
        if (matches.isEmpty()) {
            throw new SlicerConfigException("No files match " + source);
        }
        matches.sort(null);
        return matches;
    }

    public static List<Path> resolveAll(List<String> sources) {
        List<Path> files = new ArrayList<>();
        for (String source : sources) {
            files.addAll(resolve(source));
        }
        return files;
    }

    private static boolean isGlob(String name) {
        return name.chars().anyMatch(c -> c == '*' || c == '?' || c == '[' || c == '{');
    }
}
