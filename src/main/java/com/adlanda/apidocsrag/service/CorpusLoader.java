package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.config.CorpusProperties;
import com.adlanda.apidocsrag.exception.CorpusLoadException;
import com.adlanda.apidocsrag.exception.CorpusLoadException.Reason;
import com.adlanda.apidocsrag.model.Corpus;
import com.adlanda.apidocsrag.model.EndpointMethod;
import com.adlanda.apidocsrag.model.EndpointParameter;
import com.adlanda.apidocsrag.model.EndpointRecord;
import com.adlanda.apidocsrag.model.ParameterLocation;
import com.adlanda.apidocsrag.model.ParameterType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;

/**
 * Parses scraped API documentation into a {@link Corpus}.
 *
 * Accepts either a bare JSON array of endpoint objects or the scraper's document
 * shape ({@code base_url}, {@code scraped_at}, {@code endpoints}). Entries that fail
 * validation are skipped and counted, or abort the load when
 * {@code apidocs.corpus.skip-malformed} is false.
 */
@Service
public class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final CorpusProperties properties;

    public CorpusLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader, CorpusProperties properties) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    /**
     * Loads the corpus from the configured location.
     */
    public Corpus load() {
        return load(properties.getLocation());
    }

    /**
     * Loads the corpus from a Spring resource location such as {@code classpath:...} or {@code file:...}.
     *
     * @throws CorpusLoadException if the resource is missing, unreadable, malformed or empty
     */
    public Corpus load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CorpusLoadException(Reason.UNREADABLE, "Corpus source does not exist: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            log.info("Loading corpus from {}", location);
            return load(in);
        } catch (IOException e) {
            throw new CorpusLoadException(Reason.UNREADABLE, "Failed to read corpus source: " + location, e);
        }
    }

    /**
     * Loads the corpus from a stream. The stream is read fully but not closed.
     */
    public Corpus load(InputStream in) throws IOException {
        return load(in.readAllBytes());
    }

    /**
     * Loads the corpus from raw JSON bytes.
     */
    public Corpus load(byte[] source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(source);
        } catch (JsonProcessingException e) {
            throw new CorpusLoadException(Reason.MALFORMED, "Corpus is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CorpusLoadException(Reason.UNREADABLE, "Failed to parse corpus", e);
        }

        JsonNode entries;
        String baseUrl = null;
        Instant sourceTimestamp = null;
        if (root != null && root.isArray()) {
            entries = root;
        } else if (root != null && root.isObject() && root.path("endpoints").isArray()) {
            entries = root.get("endpoints");
            baseUrl = text(root, "base_url", "baseUrl");
            sourceTimestamp = parseTimestamp(text(root, "scraped_at", "scrapedAt"));
        } else {
            throw new CorpusLoadException(Reason.MALFORMED,
                    "Corpus must be an array of endpoint objects or an object with an 'endpoints' array");
        }

        List<EndpointRecord> records = new ArrayList<>();
        Set<String> labels = new HashSet<>();
        int skipped = 0;
        int position = 0;

        for (JsonNode entry : entries) {
            try {
                EndpointRecord record = parseEntry(entry);
                if (!labels.add(record.label())) {
                    throw new InvalidEntryException("duplicate endpoint " + record.label());
                }
                records.add(record);
            } catch (InvalidEntryException e) {
                if (!properties.isSkipMalformed()) {
                    throw new CorpusLoadException(Reason.MALFORMED,
                            "Malformed endpoint entry at position " + position + ": " + e.getMessage());
                }
                skipped++;
                log.warn("Skipping endpoint entry at position {}: {}", position, e.getMessage());
            }
            position++;
        }

        if (records.isEmpty()) {
            throw new CorpusLoadException(Reason.EMPTY,
                    "Corpus contains no valid endpoints (" + skipped + " entries skipped)");
        }

        String checksum = sha256(source);
        log.info("Loaded {} endpoints ({} skipped, checksum {})", records.size(), skipped, checksum.substring(0, 12));
        return new Corpus(records, baseUrl, sourceTimestamp, Instant.now(), skipped, checksum);
    }

    private EndpointRecord parseEntry(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            throw new InvalidEntryException("entry is not an object");
        }

        String methodLabel = text(entry, "method");
        EndpointMethod method = EndpointMethod.fromLabel(methodLabel)
                .orElseThrow(() -> new InvalidEntryException(methodLabel == null || methodLabel.isBlank()
                        ? "missing method"
                        : "unknown method '" + methodLabel + "'"));

        String path = text(entry, "path");
        if (path == null || path.isBlank()) {
            throw new InvalidEntryException("missing path");
        }
        path = path.trim();

        List<EndpointParameter> parameters = new ArrayList<>();
        JsonNode parameterNodes = entry.path("parameters");
        if (parameterNodes.isArray()) {
            for (JsonNode parameterNode : parameterNodes) {
                parameters.add(parseParameter(parameterNode, path));
            }
        } else if (!parameterNodes.isMissingNode() && !parameterNodes.isNull()) {
            throw new InvalidEntryException("parameters must be an array");
        }

        return new EndpointRecord(
                method,
                path,
                blankToNull(text(entry, "name", "title", "summary")),
                text(entry, "description"),
                parameters,
                blankToNull(text(entry, "example", "curl_example", "curlExample")),
                parseTags(entry)
        );
    }

    private EndpointParameter parseParameter(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new InvalidEntryException("parameter is not an object");
        }
        String name = text(node, "name");
        if (name == null || name.isBlank()) {
            throw new InvalidEntryException("parameter without a name");
        }
        name = name.trim();

        String locationLabel = text(node, "location", "in");
        ParameterLocation location = ParameterLocation.fromLabel(locationLabel)
                .orElseThrow(() -> new InvalidEntryException("unknown parameter location '" + locationLabel + "'"));
        if (location == ParameterLocation.UNSPECIFIED && path.contains("{" + name + "}")) {
            location = ParameterLocation.PATH;
        }

        String typeLabel = text(node, "type", "param_type", "paramType");
        ParameterType type = ParameterType.fromLabel(typeLabel)
                .orElseThrow(() -> new InvalidEntryException("unknown parameter type '" + typeLabel + "'"));

        return new EndpointParameter(
                name,
                location,
                type,
                node.path("required").asBoolean(false),
                text(node, "description"),
                text(node, "default", "defaultValue")
        );
    }

    private List<String> parseTags(JsonNode entry) {
        List<String> tags = new ArrayList<>();
        JsonNode tagNodes = entry.path("tags");
        if (tagNodes.isArray()) {
            for (JsonNode tag : tagNodes) {
                if (tag.isValueNode() && !tag.asText().isBlank()) {
                    tags.add(tag.asText().trim());
                }
            }
        } else if (tagNodes.isTextual() && !tagNodes.asText().isBlank()) {
            tags.add(tagNodes.asText().trim());
        }
        String category = text(entry, "category");
        if (category != null && !category.isBlank() && !tags.contains(category.trim())) {
            tags.add(category.trim());
        }
        return tags;
    }

    private Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable corpus timestamp '{}'", value);
            return null;
        }
    }

    /**
     * Returns the first present scalar value among {@code names}, as text.
     */
    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isValueNode() && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static final class InvalidEntryException extends RuntimeException {
        InvalidEntryException(String message) {
            super(message);
        }
    }
}
