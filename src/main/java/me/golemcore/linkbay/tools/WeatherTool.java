/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.linkbay.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.component.ToolComponent;
import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.model.ToolDefinition;
import me.golemcore.linkbay.infrastructure.http.FeignClientFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool for getting current weather using the Open-Meteo API.
 *
 * <p>
 * Uses the free Open-Meteo API, no API key required.
 *
 * <p>
 * Process:
 * <ol>
 * <li>Geocode location name to coordinates (Open-Meteo Geocoding API)
 * <li>Fetch current weather for coordinates (Open-Meteo Weather API)
 * </ol>
 *
 * @see <a href="https://open-meteo.com/">Open-Meteo API</a>
 */
@Component
@Slf4j
public class WeatherTool implements ToolComponent {

    private final OpenMeteoClient client;

    @Autowired
    public WeatherTool(FeignClientFactory feignClientFactory) {
        this(new FeignOpenMeteoClient(
                feignClientFactory.create(GeocodingApi.class, "https://geocoding-api.open-meteo.com"),
                feignClientFactory.create(WeatherApi.class, "https://api.open-meteo.com")));
    }

    WeatherTool(OpenMeteoClient client) {
        this.client = client;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("get_weather")
                .description("Get current weather for a location.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "location", Map.of(
                                        "type", "string",
                                        "description", "City name or location (e.g., 'London', 'New York', 'Tokyo')")),
                        "required", List.of("location")))
                .build();
    }

    @Override
    public Object handle(ToolArguments arguments) {
        String location = arguments.getString("location");
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Location is required");
        }

        GeocodingResponse geocoding = client.search(location);
        if (geocoding.getResults() == null || geocoding.getResults().isEmpty()) {
            throw new IllegalArgumentException("Location not found: " + location);
        }
        GeoResult geoResult = geocoding.getResults().get(0);

        WeatherResponse weather = client.currentWeather(geoResult.getLatitude(), geoResult.getLongitude());
        if (weather.getCurrentWeather() == null) {
            throw new IllegalStateException("Weather data not available for " + geoResult.getName());
        }
        CurrentWeather current = weather.getCurrentWeather();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("location", geoResult.getName());
        result.put("country", geoResult.getCountry());
        result.put("temperature_celsius", current.getTemperature());
        result.put("wind_speed_kmh", current.getWindSpeed());
        result.put("weather_code", current.getWeatherCode());
        result.put("description", getWeatherDescription(current.getWeatherCode()));
        log.debug("[Tools] Weather for {}: {}", location, result);
        return result;
    }

    static String getWeatherDescription(int code) {
        return switch (code) {
        case 0 -> "Clear sky";
        case 1, 2, 3 -> "Partly cloudy";
        case 45, 48 -> "Foggy";
        case 51, 53, 55 -> "Drizzle";
        case 61, 63, 65 -> "Rain";
        case 66, 67 -> "Freezing rain";
        case 71, 73, 75 -> "Snow";
        case 77 -> "Snow grains";
        case 80, 81, 82 -> "Rain showers";
        case 85, 86 -> "Snow showers";
        case 95 -> "Thunderstorm";
        case 96, 99 -> "Thunderstorm with hail";
        default -> "Unknown";
        };
    }

    interface OpenMeteoClient {
        GeocodingResponse search(String name);

        WeatherResponse currentWeather(double latitude, double longitude);
    }

    interface GeocodingApi {
        @RequestLine("GET /v1/search?name={name}&count={count}")
        GeocodingResponse search(@Param("name") String name, @Param("count") int count);
    }

    interface WeatherApi {
        @RequestLine("GET /v1/forecast?latitude={lat}&longitude={lon}&current_weather=true")
        WeatherResponse getCurrentWeather(@Param("lat") double latitude, @Param("lon") double longitude);
    }

    static class FeignOpenMeteoClient implements OpenMeteoClient {

        private final GeocodingApi geocodingApi;
        private final WeatherApi weatherApi;

        FeignOpenMeteoClient(GeocodingApi geocodingApi, WeatherApi weatherApi) {
            this.geocodingApi = geocodingApi;
            this.weatherApi = weatherApi;
        }

        @Override
        public GeocodingResponse search(String name) {
            return geocodingApi.search(name, 1);
        }

        @Override
        public WeatherResponse currentWeather(double latitude, double longitude) {
            return weatherApi.getCurrentWeather(latitude, longitude);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GeocodingResponse {
        private List<GeoResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GeoResult {
        private String name;
        private String country;
        private double latitude;
        private double longitude;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WeatherResponse {
        @JsonProperty("current_weather")
        private CurrentWeather currentWeather;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CurrentWeather {
        private double temperature;
        @JsonProperty("windspeed")
        private double windSpeed;
        @JsonProperty("weathercode")
        private int weatherCode;
    }
}
