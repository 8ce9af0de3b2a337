package com.smurthy.ai.assistant.tools.providers;

import com.smurthy.ai.assistant.config.ToolsProperties;
import com.smurthy.ai.assistant.tools.ToolBinding;
import com.smurthy.ai.assistant.tools.ToolCategory;
import com.smurthy.ai.assistant.tools.ToolExecutionException;
import com.smurthy.ai.assistant.tools.ToolMetadata;
import com.smurthy.ai.assistant.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Weather and web search over free, keyless APIs
 *
 * APIs used:
 * - Open-Meteo: current conditions (https://open-meteo.com)
 * - Nominatim: geocoding for location names (https://nominatim.openstreetmap.org)
 * - DuckDuckGo Instant Answer: short answers and related topics (https://api.duckduckgo.com)
 */
@Component
public class WebToolProvider implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(WebToolProvider.class);

    private static final int MAX_RELATED_TOPICS = 3;

    private static final Pattern LOCATION = Pattern.compile(
            "\\b(?:in|at|for|of)\\s+([\\p{L}][\\p{L} ,.'-]*?)\\s*(?:today|tomorrow|now|right now|please)?[?.!]*$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern SEARCH_PREFIX = Pattern.compile(
            "^(?:please\\s+)?(?:search(?:\\s+the\\s+web)?(?:\\s+for)?|google|look\\s+up|find(?:\\s+information)?(?:\\s+about)?|research)\\s+",
            Pattern.CASE_INSENSITIVE);

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<Map<String, Object>>> JSON_ARRAY = new ParameterizedTypeReference<>() {};

    private final ToolsProperties properties;
    private final RestClient restClient;

    public WebToolProvider(ToolsProperties properties, RestClient.Builder restClientBuilder) {
        this.properties = properties;
        this.restClient = restClientBuilder.build();
    }

    @Override
    public List<ToolBinding> getTools() {
        return List.of(
                new ToolBinding(ToolMetadata.builder("get_weather", ToolCategory.WEB_SEARCH)
                        .description("Current weather for a city (defaults to the configured home location)")
                        .keywords("weather", "temperature", "forecast", "rain", "humidity", "climate")
                        .priority(9)
                        .minConfidence(0.2)
                        .estimatedCost(2.0)
                        .build(), this::weather),
                new ToolBinding(ToolMetadata.builder("web_search", ToolCategory.WEB_SEARCH)
                        .description("Search the web for a quick answer about a topic")
                        .keywords("search", "google", "look up", "find", "research", "information")
                        .priority(9)
                        .minConfidence(0.2)
                        .estimatedCost(2.0)
                        .build(), this::search)
        );
    }

    String weather(String query) {
        String location = extractLocation(query).orElse(properties.defaultLocation());
        log.info("Fetching weather for location: {}", location);

        GeoLocation geo = geocode(location);
        Map<String, Object> response;
        try {
            response = restClient.get()
                    .uri(properties.weatherEndpoint()
                                    + "?latitude={lat}&longitude={lon}"
                                    + "&current=temperature_2m,relative_humidity_2m,apparent_temperature,weather_code,wind_speed_10m"
                                    + "&timezone=auto",
                            geo.lat(), geo.lon())
                    .retrieve()
                    .body(JSON_OBJECT);
        } catch (RestClientException e) {
            throw new ToolExecutionException("Weather service error: " + e.getMessage(), e);
        }

        if (response == null || !(response.get("current") instanceof Map<?, ?> current)) {
            throw new ToolExecutionException("No weather data available for " + location);
        }

        double temperature = getDouble(current, "temperature_2m");
        double feelsLike = getDouble(current, "apparent_temperature");
        double humidity = getDouble(current, "relative_humidity_2m");
        double windSpeed = getDouble(current, "wind_speed_10m");
        String condition = describe((int) getDouble(current, "weather_code"));

        return String.format(Locale.ROOT,
                "Weather in %s: %s, %.1f°C (feels like %.1f°C). Humidity %.0f%%, wind %.1f km/h.",
                location, condition, temperature, feelsLike, humidity, windSpeed);
    }

    String search(String query) {
        String terms = searchTerms(query);
        if (terms.isBlank()) {
            throw new ToolExecutionException("Nothing to search for");
        }
        log.info("Searching DuckDuckGo for: {}", terms);

        Map<String, Object> response;
        try {
            response = restClient.get()
                    .uri(properties.searchEndpoint() + "?q={q}&format=json&no_html=1&skip_disambig=1", terms)
                    .retrieve()
                    .body(JSON_OBJECT);
        } catch (RestClientException e) {
            throw new ToolExecutionException("Search service error: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new ToolExecutionException("Empty search response");
        }

        StringBuilder sb = new StringBuilder();
        String heading = getString(response, "Heading");
        String answer = getString(response, "AbstractText");
        if (answer.isBlank()) {
            answer = getString(response, "Answer");
        }
        if (!answer.isBlank()) {
            sb.append(heading.isBlank() ? terms : heading).append(": ").append(answer);
            String source = getString(response, "AbstractURL");
            if (!source.isBlank()) {
                sb.append(" (").append(source).append(")");
            }
        }

        if (response.get("RelatedTopics") instanceof List<?> topics) {
            int added = 0;
            for (Object topic : topics) {
                if (added == MAX_RELATED_TOPICS) {
                    break;
                }
                if (topic instanceof Map<?, ?> entry && entry.get("Text") instanceof String text && !text.isBlank()) {
                    sb.append(sb.isEmpty() ? "" : "\n").append("- ").append(text);
                    added++;
                }
            }
        }

        return sb.isEmpty() ? "No quick answer found for '" + terms + "'." : sb.toString();
    }

    private GeoLocation geocode(String location) {
        List<Map<String, Object>> results;
        try {
            results = restClient.get()
                    .uri(properties.geocodingEndpoint() + "?q={q}&format=json&limit=1", location)
                    .header("User-Agent", "JarvisAssistant/1.0") // Nominatim requires User-Agent
                    .retrieve()
                    .body(JSON_ARRAY);
        } catch (RestClientException e) {
            throw new ToolExecutionException("Geocoding error for " + location + ": " + e.getMessage(), e);
        }
        if (results == null || results.isEmpty()) {
            throw new ToolExecutionException("Location not found: " + location);
        }
        Map<String, Object> first = results.get(0);
        try {
            return new GeoLocation(Double.parseDouble(String.valueOf(first.get("lat"))),
                    Double.parseDouble(String.valueOf(first.get("lon"))));
        } catch (NumberFormatException e) {
            throw new ToolExecutionException("Invalid coordinates for " + location, e);
        }
    }

    static Optional<String> extractLocation(String query) {
        if (query == null) {
            return Optional.empty();
        }
        Matcher matcher = LOCATION.matcher(query.strip());
        if (matcher.find()) {
            String location = matcher.group(1).strip().replaceAll("[,.]+$", "");
            if (!location.isBlank()) {
                return Optional.of(location);
            }
        }
        return Optional.empty();
    }

    static String searchTerms(String query) {
        if (query == null) {
            return "";
        }
        return SEARCH_PREFIX.matcher(query.strip()).replaceFirst("").replaceAll("[?!.]+$", "").strip();
    }

    /**
     * WMO weather code to text (https://open-meteo.com/en/docs)
     */
    static String describe(int code) {
        return switch (code) {
            case 0 -> "Clear sky";
            case 1 -> "Mainly clear";
            case 2 -> "Partly cloudy";
            case 3 -> "Overcast";
            case 45, 48 -> "Fog";
            case 51, 53, 55 -> "Drizzle";
            case 61 -> "Slight rain";
            case 63 -> "Moderate rain";
            case 65 -> "Heavy rain";
            case 71, 73, 75, 77 -> "Snow";
            case 80, 81, 82 -> "Rain showers";
            case 85, 86 -> "Snow showers";
            case 95 -> "Thunderstorm";
            case 96, 99 -> "Thunderstorm with hail";
            default -> "Unknown conditions";
        };
    }

    private static double getDouble(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return 0.0;
    }

    private static String getString(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : "";
    }

    record GeoLocation(double lat, double lon) {}
}
