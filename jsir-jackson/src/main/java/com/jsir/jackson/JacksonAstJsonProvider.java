package com.jsir.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsir.ast.Tree;
import com.jsir.json.AstJsonDeserializer;
import com.jsir.json.AstJsonException;
import com.jsir.json.AstJsonProvider;
import com.jsir.json.AstJsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private static final Logger logger = LoggerFactory.getLogger(JacksonAstJsonProvider.class);

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = JsirJackson.createObjectMapper();
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
        public String serialize(Tree tree) throws AstJsonException {
            try {
                return mapper.writeValueAsString(tree);
            } catch (Exception e) {
                logger.debug("Failed to serialize {}", tree.getClass().getSimpleName(), e);
                throw new AstJsonException("Failed to serialize tree", e);
            }
        }

        @Override
        public String serializePretty(Tree tree) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
            } catch (Exception e) {
                logger.debug("Failed to serialize {}", tree.getClass().getSimpleName(), e);
                throw new AstJsonException("Failed to serialize tree", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Tree deserialize(String json) throws AstJsonException {
            return deserialize(json, Tree.class);
        }

        @Override
        public <T extends Tree> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                logger.debug("Failed to deserialize {}", type.getSimpleName(), e);
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
