package de.cwlslice.infrastructure.loading;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Strings;
import de.cwlslice.core.exception.DocumentLoadException;
import de.cwlslice.core.extraction.ExtractionOptions;
import de.cwlslice.core.model.CwlKeys;
import de.cwlslice.core.model.Process;
import de.cwlslice.core.model.ProcessFactory;
import de.cwlslice.infrastructure.utils.IdentifierUtils;
import de.cwlslice.infrastructure.utils.NodeUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads JSON or YAML process documents from files, {@code file:} URIs or the classpath and keeps every loaded
 * process in an identifier index. Not thread-safe.
 */
@Slf4j
public class YamlDocumentLoader implements DocumentLoader {

    private static final Charset ENCODING = StandardCharsets.UTF_8;
    private static final String FILE_SCHEME = "file:";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<String, Process> index = new LinkedHashMap<>();
    private final IdentifierExpander identifierExpander = new IdentifierExpander();
    private final ExtractionOptions options;

    public YamlDocumentLoader() {
        this(ExtractionOptions.ofDefault());
    }

    public YamlDocumentLoader(final ExtractionOptions options) {
        this.options = options;
    }

    @Override
    public Process resolve(final String location) {
        var known = index.get(location);
        if (Objects.nonNull(known)) {
            return known;
        }
        var baseUri = toBaseUri(location);
        known = index.get(baseUri);
        if (Objects.isNull(known)) {
            log.debug("Loading '{}'", baseUri);
            known = readContents(readContentFromLocation(location), baseUri);
        }
        index.put(location, known);
        return known;
    }

    @Override
    public Optional<Process> lookup(final String reference) {
        return Optional.ofNullable(index.get(reference));
    }

    public Map<String, Process> getIndex() {
        return Collections.unmodifiableMap(index);
    }

    /**
     * Parses a document given as text; its relative identifiers are resolved against {@code baseUri}.
     */
    public Process readContents(final String content, final String baseUri) {
        if (Strings.isNullOrEmpty(content) || content.trim().isEmpty()) {
            throw new DocumentLoadException("Null or empty document at '%s'".formatted(baseUri));
        }
        JsonNode root;
        try {
            root = getMapper(content).readTree(content);
        } catch (IOException e) {
            throw new DocumentLoadException("location:%s; msg=%s".formatted(baseUri, e.getMessage()), e);
        }
        if (Objects.isNull(root) || !root.isObject()) {
            throw new DocumentLoadException("Document at '%s' is not a mapping".formatted(baseUri));
        }

        var document = identifierExpander.expand((ObjectNode) root, baseUri);
        var process = ProcessFactory.create(document, metadataOf(document));
        // indexed before descending so that cyclic references terminate
        index.put(baseUri, process);
        index.putIfAbsent(process.getId(), process);
        if (options.isEagerLoading()) {
            loadReferences(document);
        }
        return process;
    }

    private void loadReferences(final ObjectNode process) {
        for (ObjectNode step : NodeUtils.objects(process, CwlKeys.STEPS)) {
            var run = step.get(CwlKeys.RUN);
            if (Objects.isNull(run)) {
                continue;
            }
            if (run.isTextual()) {
                resolve(run.asText());
            } else if (run.isObject()) {
                loadReferences((ObjectNode) run);
            }
        }
    }

    private ObjectNode metadataOf(final ObjectNode document) {
        var metadata = JsonNodeFactory.instance.objectNode();
        var versionField = options.getVersionField();
        if (document.has(versionField)) {
            metadata.set(versionField, document.get(versionField).deepCopy());
        }
        return metadata;
    }

    private String toBaseUri(final String location) {
        if (IdentifierUtils.isAbsolute(location)) {
            return location;
        }
        var path = locateFile(location);
        if (path.isPresent()) {
            return path.get().toAbsolutePath().normalize().toUri().toString();
        }
        var resource = getClass().getClassLoader().getResource(location);
        if (Objects.isNull(resource)) {
            throw new DocumentLoadException("Document not found: '%s'".formatted(location));
        }
        return resource.toString();
    }

    private String readContentFromLocation(final String location) {
        try {
            var path = locateFile(location);
            if (path.isPresent()) {
                return FileUtils.readFileToString(path.get().toFile(), ENCODING);
            }
            try (var is = getClass().getClassLoader().getResourceAsStream(location)) {
                if (Objects.isNull(is)) {
                    throw new DocumentLoadException("Document not found: '%s'".formatted(location));
                }
                return new String(is.readAllBytes(), ENCODING);
            }
        } catch (IOException e) {
            throw new DocumentLoadException("Failed to read '%s'".formatted(location), e);
        }
    }

    private Optional<Path> locateFile(final String location) {
        final String adjustedLocation = location.replace("\\", "/");
        try {
            final Path path = adjustedLocation.toLowerCase().startsWith(FILE_SCHEME)
                    ? Paths.get(URI.create(adjustedLocation))
                    : Paths.get(adjustedLocation);
            return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            log.debug("'{}' is not a readable file: {}", location, e.getMessage());
            return Optional.empty();
        }
    }

    private ObjectMapper getMapper(final String data) {
        if (data.trim().startsWith("{")) {
            return JSON_MAPPER;
        }
        return YAML_MAPPER;
    }
}
