package com.eainde.trace.attestation;

import com.eainde.trace.error.ExternalCapabilityException;
import com.eainde.trace.error.InputValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One pretty-printed JSON file per card: {@code <directory>/<hypothesis_id>.json}.
 */
@Log4j2
public class FileHypothesisRegistry implements HypothesisRegistry {

    private static final String CAPABILITY = "hypothesis-registry";
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileHypothesisRegistry(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    @Override
    public void save(ObjectNode card) {
        String id = card.path("hypothesis_id").asText("");
        if (id.isBlank()) {
            throw new InputValidationException("Hypothesis card must have hypothesis_id");
        }
        Path file = fileFor(id);
        try {
            Files.createDirectories(directory);
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), card);
        } catch (IOException e) {
            throw new ExternalCapabilityException(CAPABILITY, "cannot write " + file, e);
        }
        log.info("Saved hypothesis {} to {}", id, file);
    }

    @Override
    public Optional<ObjectNode> find(String hypothesisId) {
        Path file = fileFor(hypothesisId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(readCard(file));
        } catch (IOException e) {
            throw new ExternalCapabilityException(CAPABILITY, "cannot read " + file, e);
        }
    }

    @Override
    public List<ObjectNode> list(HypothesisFilter filter) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ExternalCapabilityException(CAPABILITY, "cannot list " + directory, e);
        }

        List<ObjectNode> cards = new ArrayList<>();
        for (Path file : files) {
            try {
                ObjectNode card = readCard(file);
                if (filter == null || filter.matches(card)) {
                    cards.add(card);
                }
            } catch (IOException e) {
                // a corrupt file must not hide the rest of the registry
                log.warn("Skipping unreadable registry entry {}", file, e);
            }
        }
        return cards;
    }

    private ObjectNode readCard(Path file) throws IOException {
        JsonNode node = mapper.readTree(file.toFile());
        if (node == null || !node.isObject()) {
            throw new IOException("Registry entry is not a JSON object: " + file);
        }
        return (ObjectNode) node;
    }

    private Path fileFor(String hypothesisId) {
        if (hypothesisId == null || hypothesisId.isBlank()
                || hypothesisId.contains("/") || hypothesisId.contains("\\") || hypothesisId.contains("..")) {
            throw new InputValidationException("Illegal hypothesis id: " + hypothesisId);
        }
        return directory.resolve(hypothesisId + EXTENSION);
    }
}
