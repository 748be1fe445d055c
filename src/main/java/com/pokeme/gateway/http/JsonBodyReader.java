package com.pokeme.gateway.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads a JSON request body onto a fixed record type. Bodies that are empty, larger than the
 * cap or not valid JSON for the type are reported as absent; nothing is partially processed.
 */
public class JsonBodyReader {

    private static final Logger log = LoggerFactory.getLogger(JsonBodyReader.class);

    private final ObjectMapper mapper;
    private final int maxBytes;

    public JsonBodyReader(ObjectMapper mapper, int maxBytes) {
        this.mapper = mapper;
        this.maxBytes = maxBytes;
    }

    public <T> Optional<T> read(HttpServletRequest request, Class<T> type) {
        if (request.getContentLengthLong() > maxBytes) {
            log.debug("Rejected body of {} bytes on {}", request.getContentLengthLong(), request.getRequestURI());
            return Optional.empty();
        }
        byte[] bytes;
        try (var in = request.getInputStream()) {
            bytes = in.readNBytes(maxBytes + 1);
        } catch (IOException e) {
            log.debug("Failed to read body on {}: {}", request.getRequestURI(), e.getMessage());
            return Optional.empty();
        }
        if (bytes.length == 0 || bytes.length > maxBytes) {
            return Optional.empty();
        }
        try {
            T value = mapper.readerFor(type)
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readValue(bytes);
            return Optional.ofNullable(value);
        } catch (IOException e) {
            log.debug("Unparseable body on {}: {}", request.getRequestURI(), e.getMessage());
            return Optional.empty();
        }
    }

    public int maxBytes() { return maxBytes; }
}
