package com.shellast.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shellast.ast.File;
import com.shellast.ast.Node;
import com.shellast.json.AstJsonDeserializer;
import com.shellast.json.AstJsonException;
import com.shellast.json.AstJsonProvider;
import com.shellast.json.AstJsonSerializer;

import java.util.logging.Logger;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private static final Logger LOG = Logger.getLogger(JacksonAstJsonProvider.class.getName());

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(ShellAstJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            LOG.finer(() -> "Serializing " + node.type());
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            LOG.finer(() -> "Serializing " + node.type() + " (pretty)");
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public File deserializeFile(String json) throws AstJsonException {
            try {
                File file = mapper.readValue(json, File.class);
                LOG.fine(() -> "Read File '" + file.name() + "' with " + file.stmts().size() + " statements");
                return file;
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize File", e);
            }
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
