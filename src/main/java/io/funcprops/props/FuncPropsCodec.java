package io.funcprops.props;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Lossless single-line JSON encoding of {@link FuncProps}.
 */
public final class FuncPropsCodec {

    private static final ObjectMapper MAPPER = createMapper();

    private FuncPropsCodec() {
        // Utility class
    }

    private static ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.disable(SerializationFeature.INDENT_OUTPUT);
        m.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return m;
    }

    /**
     * Encodes the properties as one line of JSON.
     */
    public static String encode(FuncProps props) throws JsonProcessingException {
        return MAPPER.writeValueAsString(props);
    }

    public static FuncProps decode(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, FuncProps.class);
    }
}
