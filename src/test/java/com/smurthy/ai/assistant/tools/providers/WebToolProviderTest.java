package com.smurthy.ai.assistant.tools.providers;

import com.smurthy.ai.assistant.config.ToolsProperties;
import com.smurthy.ai.assistant.tools.ToolExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Unit tests for WebToolProvider against a mocked HTTP server
 */
class WebToolProviderTest {

    private static final String GEOCODING = "https://nominatim.openstreetmap.org/search";
    private static final String WEATHER = "https://api.open-meteo.com/v1/forecast";
    private static final String SEARCH = "https://api.duckduckgo.com/";

    private MockRestServiceServer server;
    private WebToolProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new WebToolProvider(new ToolsProperties("", "", "New Delhi", WEATHER, GEOCODING, SEARCH), builder);
    }

    @AfterEach
    void verifyServer() {
        server.verify();
    }

    // ==================== WEATHER ====================

    @Test
    @DisplayName("Should geocode the named city and describe its current weather")
    void testWeather() {
        // Given
        server.expect(requestTo(startsWith(GEOCODING)))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("q", "Mumbai"))
                .andRespond(withSuccess("""
                        [{"lat": "19.07", "lon": "72.87", "display_name": "Mumbai, Maharashtra, India"}]
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(WEATHER)))
                .andExpect(queryParam("latitude", "19.07"))
                .andRespond(withSuccess("""
                        {"current": {"temperature_2m": 31.5, "apparent_temperature": 35.2,
                                     "relative_humidity_2m": 70, "wind_speed_10m": 12.3, "weather_code": 0}}
                        """, MediaType.APPLICATION_JSON));

        // When
        String result = provider.weather("what's the weather in Mumbai today?");

        // Then
        assertThat(result).isEqualTo(
                "Weather in Mumbai: Clear sky, 31.5°C (feels like 35.2°C). Humidity 70%, wind 12.3 km/h.");
    }

    @Test
    @DisplayName("Should use the configured home location when none is named")
    void testDefaultLocation() {
        // Given
        server.expect(requestTo(startsWith(GEOCODING)))
                .andRespond(withSuccess("[{\"lat\": \"28.61\", \"lon\": \"77.20\"}]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(WEATHER)))
                .andRespond(withSuccess("{\"current\": {\"temperature_2m\": 18.0, \"weather_code\": 45}}",
                        MediaType.APPLICATION_JSON));

        // When
        String result = provider.weather("how is the weather");

        // Then
        assertThat(result).startsWith("Weather in New Delhi: Fog, 18.0°C");
    }

    @Test
    @DisplayName("Should fail when the location cannot be geocoded")
    void testUnknownLocation() {
        // Given
        server.expect(requestTo(startsWith(GEOCODING)))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        // Then
        assertThatThrownBy(() -> provider.weather("weather in Atlantis"))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("Location not found: Atlantis");
    }

    // ==================== SEARCH ====================

    @Test
    @DisplayName("Should combine the instant answer with related topics")
    void testSearch() {
        // Given
        server.expect(requestTo(startsWith(SEARCH)))
                .andExpect(queryParam("format", "json"))
                .andRespond(withSuccess("""
                        {"Heading": "Java",
                         "AbstractText": "Java is a high-level programming language.",
                         "AbstractURL": "https://en.wikipedia.org/wiki/Java",
                         "RelatedTopics": [
                             {"Text": "Java SE"},
                             {"Name": "Grouped", "Topics": []},
                             {"Text": "Jakarta EE"},
                             {"Text": "JVM"},
                             {"Text": "Kotlin"}
                         ]}
                        """, MediaType.APPLICATION_JSON));

        // When
        String result = provider.search("search for Java programming language");

        // Then
        assertThat(result).isEqualTo("""
                Java: Java is a high-level programming language. (https://en.wikipedia.org/wiki/Java)
                - Java SE
                - Jakarta EE
                - JVM""");
    }

    @Test
    @DisplayName("Should say so when there is no quick answer")
    void testSearchNoAnswer() {
        // Given
        server.expect(requestTo(startsWith(SEARCH)))
                .andRespond(withSuccess("{\"AbstractText\": \"\", \"RelatedTopics\": []}", MediaType.APPLICATION_JSON));

        // Then
        assertThat(provider.search("look up xyzzy")).isEqualTo("No quick answer found for 'xyzzy'.");
    }

    @Test
    @DisplayName("Should wrap HTTP failures")
    void testSearchServerError() {
        // Given
        server.expect(requestTo(startsWith(SEARCH))).andRespond(withServerError());

        // Then
        assertThatThrownBy(() -> provider.search("search for anything"))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageStartingWith("Search service error");
    }

    // ==================== PARSING ====================

    @Test
    @DisplayName("Should extract locations and search terms from spoken requests")
    void testParsing() {
        assertThat(WebToolProvider.extractLocation("weather at Bengaluru please")).contains("Bengaluru");
        assertThat(WebToolProvider.extractLocation("temperature for New York?")).contains("New York");
        assertThat(WebToolProvider.extractLocation("weather")).isEmpty();
        assertThat(WebToolProvider.searchTerms("Please search the web for quantum computing?"))
                .isEqualTo("quantum computing");
        assertThat(WebToolProvider.describe(95)).isEqualTo("Thunderstorm");
        assertThat(WebToolProvider.describe(1234)).isEqualTo("Unknown conditions");
    }
}
