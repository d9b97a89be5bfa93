package com.kicad.extractor.inference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kicad.extractor.config.InferenceConfig;
import com.kicad.extractor.model.Net;
import com.kicad.extractor.model.ParsedSchematic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.http.HttpClient;
import java.util.List;

/**
 * Net inference through the Gemini {@code generateContent} REST endpoint.
 */
public class GeminiNetInferenceClient implements NetInferenceClient {
    private static final Logger log = LoggerFactory.getLogger(GeminiNetInferenceClient.class);

    static final String API_KEY_HEADER = "x-goog-api-key";

    private final InferenceConfig config;
    private final RestClient restClient;
    private final InferencePromptBuilder promptBuilder;
    private final InferenceResponseParser responseParser;
    private final ObjectMapper mapper;

    /**
     * @param restClientBuilder builder with transport already configured; the base URL is set here
     */
    public GeminiNetInferenceClient(InferenceConfig config, RestClient.Builder restClientBuilder) {
        this.config = config;
        this.restClient = restClientBuilder.baseUrl(config.getEndpoint()).build();
        this.promptBuilder = new InferencePromptBuilder();
        this.responseParser = new InferenceResponseParser();
        this.mapper = new ObjectMapper();
    }

    /**
     * Client on the JDK HTTP transport with the configured timeout for connect and read.
     */
    public static GeminiNetInferenceClient create(InferenceConfig config) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(config.getTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(config.getTimeout());
        return new GeminiNetInferenceClient(config, RestClient.builder().requestFactory(requestFactory));
    }

    @Override
    public List<Net> infer(ParsedSchematic schematic) throws NetInferenceException {
        String prompt = promptBuilder.build(schematic);
        String requestBody = requestBody(prompt);

        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri("/models/{model}:generateContent", config.getModel())
                    .header(API_KEY_HEADER, config.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(requestBody)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new NetInferenceException("Gemini request failed: " + e.getMessage(), e);
        }

        String text = extractText(responseBody);
        log.debug("Gemini answered with {} characters", text.length());
        return responseParser.parse(text);
    }

    @Override
    public String describe() {
        return "Gemini model " + config.getModel();
    }

    private String requestBody(String prompt) throws NetInferenceException {
        ObjectNode body = mapper.createObjectNode();
        body.putArray("contents")
                .addObject()
                .putArray("parts")
                .addObject()
                .put("text", prompt);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new NetInferenceException("Failed to build Gemini request", e);
        }
    }

    /**
     * Concatenated text parts of the first candidate.
     */
    String extractText(String responseBody) throws NetInferenceException {
        if (responseBody == null || responseBody.isBlank()) {
            throw new NetInferenceException("Gemini returned an empty body");
        }
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new NetInferenceException("Gemini returned malformed JSON", e);
        }

        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        if (text.length() == 0) {
            String reason = root.path("candidates").path(0).path("finishReason").asText("no candidates");
            throw new NetInferenceException("Gemini response carries no text (" + reason + ")");
        }
        return text.toString();
    }
}
