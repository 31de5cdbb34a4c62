package io.github.cyfko.reverhttp.core.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.cyfko.reverhttp.core.config.OutputPolicy;
import io.github.cyfko.reverhttp.core.exception.IrSerializationException;
import io.github.cyfko.reverhttp.core.ir.IrDocument;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Serializes {@link IrDocument}s to JSON.
 * <p>
 * Map entries are written in key order and record properties in their declared order, so equal
 * documents always serialize to identical text. Optional sections are omitted when empty, except
 * the route's {@code cors} field which is written as {@code null} for {@code cors(none)}.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * IrJsonWriter writer = new IrJsonWriter(OutputPolicy.pretty());
 * String json = writer.write(document);
 * }</pre>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public class IrJsonWriter {

    private static final Logger log = Logger.getLogger(IrJsonWriter.class.getName());

    private final OutputPolicy policy;
    private final ObjectWriter writer;

    /**
     * Uses {@link OutputPolicy#pretty()}.
     */
    public IrJsonWriter() {
        this(OutputPolicy.pretty());
    }

    public IrJsonWriter(OutputPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "output policy cannot be null");

        ObjectMapper mapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        this.writer = policy.prettyPrint() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    /**
     * @param document the document to serialize
     * @return JSON text
     * @throws IrSerializationException if the serializer fails
     */
    public String write(IrDocument document) {
        Objects.requireNonNull(document, "document cannot be null");
        try {
            String json = writer.writeValueAsString(document);
            log.info(() -> String.format("Serialized IR document: %d routes, %d characters",
                    document.routes().size(), json.length()));
            return policy.trailingNewline() ? json + "\n" : json;
        } catch (JsonProcessingException e) {
            throw new IrSerializationException("Failed to serialize IR document", e);
        }
    }

    /**
     * Writes the document to {@code out}. The writer is flushed but not closed.
     *
     * @throws IrSerializationException if the serializer or the writer fails
     */
    public void write(IrDocument document, Writer out) {
        Objects.requireNonNull(out, "output writer cannot be null");
        String json = write(document);
        try {
            out.write(json);
            out.flush();
        } catch (IOException e) {
            throw new IrSerializationException("Failed to write IR document", e);
        }
    }
}
