package com.eainde.trace.capability;

import com.eainde.trace.error.ExternalCapabilityException;
import com.eainde.trace.error.InputValidationException;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads exactly two plain-text papers ({@code .txt} or {@code .md}) from a folder.
 * Files are taken in name order: the first is document A.
 *
 * <p>The title is the first non-blank line when it looks like one (11 to 199 characters),
 * otherwise the file name without extension.</p>
 */
@Log4j2
public class FolderDocumentSource implements DocumentSource {

    private static final int MIN_TITLE_LENGTH = 10;
    private static final int MAX_TITLE_LENGTH = 200;

    @Override
    public List<SourceDocument> read(String location) {
        if (location == null || location.isBlank()) {
            throw new InputValidationException("Input folder is not set");
        }
        Path folder = Paths.get(location);
        if (!Files.isDirectory(folder)) {
            throw new InputValidationException("Input folder does not exist: " + folder);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(folder)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(FolderDocumentSource::isTextFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ExternalCapabilityException("document-source", "cannot list " + folder, e);
        }

        if (files.size() != 2) {
            throw new InputValidationException(
                    "Expected exactly 2 text documents in " + folder + " but found " + files.size());
        }
        log.info("Reading documents {} and {}", files.get(0).getFileName(), files.get(1).getFileName());
        return List.of(readDocument(files.get(0)), readDocument(files.get(1)));
    }

    private SourceDocument readDocument(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ExternalCapabilityException("document-source", "cannot read " + file, e);
        }
        if (text.isEmpty()) {
            throw new InputValidationException("Document is empty: " + file);
        }
        return new SourceDocument(titleOf(file, text), text);
    }

    static String titleOf(Path file, String text) {
        String firstLine = text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .findFirst()
                .orElse("");
        if (firstLine.length() > MIN_TITLE_LENGTH && firstLine.length() < MAX_TITLE_LENGTH) {
            return firstLine;
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static boolean isTextFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".txt") || name.endsWith(".md");
    }
}
