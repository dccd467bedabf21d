package com.example.tracking.client;

import com.example.tracking.model.CarrierTrackingInfo;
import com.example.tracking.model.PackageStatus;
import com.example.tracking.model.TrackingEvent;
import com.example.tracking.service.CarrierDecodeException;
import com.example.tracking.service.CarrierTransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CarrierApiClient} over HTTP.
 *
 * Request:  POST {base-url}/getpackageinfo, header APIKey, body {"number": [...]}
 * Response: {"data": {"<number>": {"status": "...", "events": [{"time", "location", "description"}]}}}
 */
@Component
@Slf4j
public class RestCarrierApiClient implements CarrierApiClient {

    static final String QUERY_PATH = "/getpackageinfo";
    static final String API_KEY_HEADER = "APIKey";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    public RestCarrierApiClient(
            RestTemplateBuilder restTemplateBuilder,
            ObjectMapper objectMapper,
            @Value("${app.carrier.base-url}") String baseUrl,
            @Value("${app.carrier.api-key:}") String apiKey,
            @Value("${app.carrier.timeout:PT10S}") Duration timeout) {
        this(restTemplateBuilder
                        .setConnectTimeout(timeout)
                        .setReadTimeout(timeout)
                        .build(),
                objectMapper, baseUrl, apiKey);
        log.info("Carrier API client initialized: baseUrl={}, timeout={}, apiKeyConfigured={}",
                baseUrl, timeout, !apiKey.isBlank());
    }

    RestCarrierApiClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, String apiKey) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public Map<String, CarrierTrackingInfo> query(Collection<String> trackingNumbers) {
        if (trackingNumbers.isEmpty()) {
            return Map.of();
        }

        String body = post(trackingNumbers);
        Map<String, CarrierTrackingInfo> result = decode(body);
        log.debug("Carrier reported {} of {} requested numbers", result.size(), trackingNumbers.size());
        return result;
    }

    private String post(Collection<String> trackingNumbers) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set(API_KEY_HEADER, apiKey);
        }
        HttpEntity<Map<String, Object>> request =
                new HttpEntity<>(Map.of("number", List.copyOf(trackingNumbers)), headers);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(baseUrl + QUERY_PATH, request, String.class);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            throw new CarrierTransportException("Carrier API returned " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new CarrierTransportException("Carrier API unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new CarrierTransportException("Carrier API call failed: " + e.getMessage(), e);
        }
    }

    Map<String, CarrierTrackingInfo> decode(String body) {
        if (body == null || body.isBlank()) {
            throw new CarrierDecodeException("Carrier API returned an empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CarrierDecodeException("Carrier API returned malformed JSON", e);
        }

        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.isObject()) {
            JsonNode error = root == null ? null : root.get("error");
            String detail = error != null ? ": " + error.asText() : "";
            throw new CarrierDecodeException("Carrier API response has no data object" + detail);
        }

        Map<String, CarrierTrackingInfo> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            result.put(entry.getKey(), decodeEntry(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    private CarrierTrackingInfo decodeEntry(String trackingNumber, JsonNode info) {
        if (!info.isObject()) {
            throw new CarrierDecodeException("Carrier entry for " + trackingNumber + " is not an object");
        }

        JsonNode statusNode = info.get("status");
        PackageStatus status = PackageStatus.fromCode(
                statusNode == null || statusNode.isNull() ? null : statusNode.asText());

        JsonNode eventsNode = info.get("events");
        List<TrackingEvent> events = new ArrayList<>();
        if (eventsNode != null && !eventsNode.isNull()) {
            if (!eventsNode.isArray()) {
                throw new CarrierDecodeException("Carrier events for " + trackingNumber + " are not an array");
            }
            for (JsonNode eventNode : eventsNode) {
                try {
                    events.add(objectMapper.treeToValue(eventNode, TrackingEvent.class));
                } catch (JsonProcessingException e) {
                    throw new CarrierDecodeException("Malformed carrier event for " + trackingNumber, e);
                }
            }
        }
        return new CarrierTrackingInfo(status, events);
    }
}
