package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.config.RetrievalProperties;
import com.adlanda.apidocsrag.model.Corpus;
import com.adlanda.apidocsrag.model.EndpointParameter;
import com.adlanda.apidocsrag.model.EndpointRecord;
import com.adlanda.apidocsrag.model.ParameterLocation;
import com.adlanda.apidocsrag.model.ParameterType;
import com.adlanda.apidocsrag.model.RankedResult;
import com.adlanda.apidocsrag.model.RetrievalResponse;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders ranked endpoints into the bounded text context handed to answer generation.
 *
 * Records are rendered whole, in rank order, until the next one would exceed the
 * length budget. A record is never truncated.
 */
@Service
public class ContextAssembler {

    public static final String NO_MATCH_CONTEXT = "No relevant endpoint found.";

    static final String SEPARATOR = "---\n\n";

    private final RetrievalProperties properties;

    public ContextAssembler(RetrievalProperties properties) {
        this.properties = properties;
    }

    /**
     * Assembles a response using the configured context length.
     */
    public RetrievalResponse assemble(Corpus corpus, List<RankedResult> results) {
        return assemble(corpus, results, properties.getMaxContextLength());
    }

    /**
     * Assembles a response from ranked results.
     *
     * @param corpus           The corpus the results index into
     * @param results          Ranked results, best first
     * @param maxContextLength Maximum context length in characters
     * @return The results plus the rendered context; the sentinel context when there are no results,
     *         or an empty context if even the sentinel exceeds {@code maxContextLength}
     */
    public RetrievalResponse assemble(Corpus corpus, List<RankedResult> results, int maxContextLength) {
        if (results.isEmpty()) {
            String sentinel = NO_MATCH_CONTEXT.length() <= maxContextLength ? NO_MATCH_CONTEXT : "";
            return new RetrievalResponse(List.of(), sentinel, 0);
        }

        StringBuilder context = new StringBuilder();
        int rendered = 0;
        for (RankedResult result : results) {
            String block = render(corpus.get(result.recordIndex()), result.score());
            if (context.length() + block.length() > maxContextLength) {
                break;
            }
            context.append(block);
            rendered++;
        }
        return new RetrievalResponse(results, context.toString(), rendered);
    }

    /**
     * Renders one endpoint with the fixed context template.
     */
    String render(EndpointRecord record, double score) {
        StringBuilder sb = new StringBuilder();
        sb.append("Endpoint: ").append(record.label()).append('\n');
        if (record.name() != null) {
            sb.append("Name: ").append(record.name()).append('\n');
        }
        sb.append("Relevance: ").append(String.format(Locale.ROOT, "%.2f", score)).append('\n');
        sb.append("Description: ").append(record.description()).append('\n');
        if (!record.tags().isEmpty()) {
            sb.append("Tags: ").append(String.join(", ", record.tags())).append('\n');
        }

        if (!record.parameters().isEmpty()) {
            sb.append("Parameters:\n");
            for (EndpointParameter parameter : record.parameters()) {
                sb.append("  - ").append(parameter.name());
                String qualifiers = qualifiers(parameter);
                if (!qualifiers.isEmpty()) {
                    sb.append(" (").append(qualifiers).append(')');
                }
                if (parameter.required()) {
                    sb.append(" [Required]");
                }
                if (parameter.defaultValue() != null) {
                    sb.append(" [Default: ").append(parameter.defaultValue()).append(']');
                }
                sb.append(": ").append(parameter.description()).append('\n');
            }
        }

        if (record.hasExample()) {
            sb.append("Example:\n").append(record.example().strip()).append('\n');
        }
        sb.append(SEPARATOR);
        return sb.toString();
    }

    private String qualifiers(EndpointParameter parameter) {
        List<String> parts = new ArrayList<>(2);
        if (parameter.type() != ParameterType.UNSPECIFIED) {
            parts.add(parameter.type().label());
        }
        if (parameter.location() != ParameterLocation.UNSPECIFIED) {
            parts.add(parameter.location().label());
        }
        return String.join(", ", parts);
    }
}
