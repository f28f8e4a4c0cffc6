package io.vectorchat.docprocessor.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vectorchat.docprocessor.exception.ConversionServiceException;
import io.vectorchat.docprocessor.exception.DocumentValidationException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Client for the MarkItDown conversion service.
 *
 * <ul>
 *   <li>{@code POST /convert} with a multipart {@code file} part; the response body is markdown.</li>
 *   <li>{@code GET /supported-extensions} returning {@code {"extensions": [".pdf", ...]}}.</li>
 * </ul>
 *
 * <p>Non-200 responses carry a JSON error body ({@code detail}, {@code message} or {@code error})
 * which is decoded best-effort into the thrown {@link ConversionServiceException}. Calls are bounded
 * by the connect/read timeouts of the underlying request factory and are never retried here.</p>
 */
@Slf4j
public class MarkitdownClient {

    private static final String DEFAULT_FILENAME = "uploaded_file";

    private static final long DEFAULT_TIMEOUT_MS = 60000;
    private static final long DEFAULT_CONNECT_TIMEOUT_MS = 5000;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public MarkitdownClient(String baseUrl) {
        this(baseUrl, DEFAULT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS);
    }

    /**
     * @param baseUrl          base URL of the MarkItDown service
     * @param timeoutMs        read timeout for conversion and extension requests
     * @param connectTimeoutMs connect timeout
     */
    public MarkitdownClient(String baseUrl, long timeoutMs, long connectTimeoutMs) {
        this(RestClient.builder()
                        .baseUrl(normalizeBaseUrl(baseUrl))
                        .requestFactory(requestFactory(timeoutMs, connectTimeoutMs)),
                new ObjectMapper());

        log.info("MarkitdownClient initialized: baseUrl={}, timeout={}ms, connectTimeout={}ms",
                normalizeBaseUrl(baseUrl), timeoutMs, connectTimeoutMs);
    }

    /**
     * Builds the client on a caller-supplied builder (which must already carry the base URL).
     */
    public MarkitdownClient(RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
    }

    /**
     * Uploads a file and returns its markdown rendition.
     *
     * @param filename original filename; the service picks a converter from its extension
     * @param data     file bytes
     * @return trimmed, non-empty markdown
     * @throws DocumentValidationException if {@code data} is empty or the service returns no content
     * @throws ConversionServiceException  if the service fails or cannot be reached
     */
    public String convert(String filename, byte[] data) {
        if (data == null || data.length == 0) {
            throw new DocumentValidationException("file data is empty");
        }

        String name = (filename == null || filename.isBlank()) ? DEFAULT_FILENAME : filename;

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", new ByteArrayResource(data) {
            @Override
            public String getFilename() {
                return name;
            }
        });

        log.debug("Requesting markdown conversion for {} ({} bytes)", name, data.length);

        String markdown;
        try {
            markdown = restClient.post()
                    .uri("/convert")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(builder.build())
                    .exchange((request, response) -> {
                        String body = readBody(response);
                        HttpStatusCode status = response.getStatusCode();
                        if (status.value() != HttpStatus.OK.value()) {
                            String detail = decodeErrorMessage(body, statusText(status));
                            throw new ConversionServiceException(String.format(
                                    "markitdown conversion failed for file %s (status %d): %s",
                                    name, status.value(), detail), status.value(), detail);
                        }
                        return body;
                    });
        } catch (RestClientException e) {
            log.error("Markitdown convert request failed for {} ({} bytes): {}", name, data.length, e.getMessage());
            throw new ConversionServiceException(
                    "failed to call markitdown convert endpoint for file: " + name, e);
        }

        String result = markdown == null ? "" : markdown.strip();
        if (result.isEmpty()) {
            throw new DocumentValidationException("markitdown service returned empty content for file: " + name);
        }

        log.debug("Conversion of {} returned {} chars of markdown", name, result.length());
        return result;
    }

    /**
     * Fetches the file extensions the service can convert.
     *
     * @return extensions as reported by the service (may be empty)
     * @throws ConversionServiceException if the request fails or the body cannot be parsed
     */
    public List<String> supportedExtensions() {
        SupportedExtensionsResponse response;
        try {
            response = restClient.get()
                    .uri("/supported-extensions")
                    .accept(MediaType.APPLICATION_JSON)
                    .exchange((request, clientResponse) -> {
                        String body = readBody(clientResponse);
                        HttpStatusCode status = clientResponse.getStatusCode();
                        if (status.value() != HttpStatus.OK.value()) {
                            String detail = decodeErrorMessage(body, statusText(status));
                            throw new ConversionServiceException(String.format(
                                    "supported-extensions request failed (status %d): %s",
                                    status.value(), detail), status.value(), detail);
                        }
                        return parseExtensions(body);
                    });
        } catch (RestClientException e) {
            log.error("Markitdown supported-extensions request failed: {}", e.getMessage());
            throw new ConversionServiceException("failed to call supported-extensions endpoint", e);
        }

        if (response == null || response.getExtensions() == null) {
            return List.of();
        }
        return List.copyOf(response.getExtensions());
    }

    /**
     * Extracts a readable message from an error body. Tries {@code detail} (string, or FastAPI's list
     * of {@code {"msg": ...}} objects), then {@code message}, then {@code error}, then the raw body,
     * then {@code fallback}.
     */
    String decodeErrorMessage(String body, String fallback) {
        if (body == null || body.isBlank()) {
            return fallback;
        }

        try {
            JsonNode root = objectMapper.readTree(body);
            if (root != null && root.isObject()) {
                JsonNode detail = root.get("detail");
                if (detail != null && detail.isTextual() && !detail.asText().isBlank()) {
                    return detail.asText().strip();
                }
                if (detail != null && detail.isArray() && !detail.isEmpty()) {
                    JsonNode msg = detail.get(0).get("msg");
                    if (msg != null && msg.isTextual() && !msg.asText().isBlank()) {
                        return msg.asText().strip();
                    }
                }
                String message = textField(root, "message");
                if (message != null) {
                    return message;
                }
                String error = textField(root, "error");
                if (error != null) {
                    return error;
                }
            }
        } catch (JsonProcessingException e) {
            log.trace("Error body is not JSON, using raw body: {}", e.getOriginalMessage());
        }

        return body.strip();
    }

    private SupportedExtensionsResponse parseExtensions(String body) {
        try {
            return objectMapper.readValue(body, SupportedExtensionsResponse.class);
        } catch (JsonProcessingException e) {
            throw new ConversionServiceException("failed to parse supported-extensions response", e);
        }
    }

    private static String textField(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node != null && node.isTextual() && !node.asText().isBlank()) {
            return node.asText().strip();
        }
        return null;
    }

    private static String readBody(ClientHttpResponse response) throws IOException {
        return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
    }

    private static String statusText(HttpStatusCode status) {
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? status.value() + " " + known.getReasonPhrase() : String.valueOf(status.value());
    }

    private static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("markitdown base URL is required");
        }
        String normalized = baseUrl.strip();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static SimpleClientHttpRequestFactory requestFactory(long timeoutMs, long connectTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Math.toIntExact(connectTimeoutMs));
        factory.setReadTimeout(Math.toIntExact(timeoutMs));
        return factory;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SupportedExtensionsResponse {
        @JsonProperty("extensions")
        private List<String> extensions;
    }
}
