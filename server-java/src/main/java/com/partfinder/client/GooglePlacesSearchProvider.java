package com.partfinder.client;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.partfinder.config.StoreLocatorProperties;
import com.partfinder.exception.MalformedResponseException;
import com.partfinder.model.CandidateStore;
import com.partfinder.model.GeoPoint;
import com.partfinder.model.Provenance;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Nearby search against Places API (New).
 */
@Component
@Slf4j
public class GooglePlacesSearchProvider implements PlacesSearchProvider {

    private static final MediaType JSON = MediaType.parse("application/json");

    private static final String FIELD_MASK = String.join(",",
            "places.id",
            "places.displayName",
            "places.formattedAddress",
            "places.location",
            "places.googleMapsUri",
            "places.websiteUri",
            "places.rating",
            "places.userRatingCount",
            "places.businessStatus",
            "places.types",
            "places.internationalPhoneNumber",
            "places.currentOpeningHours.openNow"
    );

    private final OkHttpClient httpClient;
    private final Gson gson;
    private final StoreLocatorProperties.Places settings;
    private final String apiKey;

    public GooglePlacesSearchProvider(
            OkHttpClient upstreamHttpClient,
            Gson gson,
            StoreLocatorProperties properties,
            @Value("${google.places.api.key:${google.maps.api.key:}}") String apiKey
    ) {
        this.httpClient = upstreamHttpClient;
        this.gson = gson;
        this.settings = properties.getPlaces();
        this.apiKey = apiKey;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public int maxRadiusMeters() {
        return settings.getMaxRadiusMeters();
    }

    @Override
    public List<CandidateStore> searchNearby(GeoPoint center, double radiusMeters, Collection<String> includedTypes,
                                             CancellationToken token) throws IOException {
        String body = gson.toJson(buildRequestBody(center, radiusMeters, includedTypes));
        log.info("Places searchNearby: center={}, radius={}m, types={}", center, Math.round(radiusMeters), includedTypes);

        Request request = new Request.Builder()
                .url(settings.getBaseUrl() + "/places:searchNearby")
                .post(RequestBody.create(body, JSON))
                .addHeader("X-Goog-Api-Key", apiKey)
                .addHeader("X-Goog-FieldMask", FIELD_MASK)
                .build();

        String responseBody = UpstreamCalls.execute(httpClient, request, token, "Places API");
        return parsePlaces(responseBody);
    }

    JsonObject buildRequestBody(GeoPoint center, double radiusMeters, Collection<String> includedTypes) {
        JsonObject centerJson = new JsonObject();
        centerJson.addProperty("latitude", center.getLatitude());
        centerJson.addProperty("longitude", center.getLongitude());

        JsonObject circle = new JsonObject();
        circle.add("center", centerJson);
        circle.addProperty("radius", radiusMeters);

        JsonObject restriction = new JsonObject();
        restriction.add("circle", circle);

        JsonArray types = new JsonArray();
        includedTypes.forEach(types::add);

        JsonObject body = new JsonObject();
        body.add("includedTypes", types);
        body.addProperty("maxResultCount", settings.getMaxResultCount());
        body.add("locationRestriction", restriction);
        return body;
    }

    /**
     * Converts a searchNearby response into candidates. Places without a location
     * are skipped because nothing can be said about their distance.
     */
    List<CandidateStore> parsePlaces(String responseBody) throws MalformedResponseException {
        try {
            JsonObject data = JsonParser.parseString(responseBody).getAsJsonObject();
            List<CandidateStore> stores = new ArrayList<>();
            if (data.has("places")) {
                for (JsonElement element : data.getAsJsonArray("places")) {
                    toCandidate(element.getAsJsonObject()).ifPresent(stores::add);
                }
            }
            return stores;
        } catch (RuntimeException e) {
            throw new MalformedResponseException("Places API returned an unexpected payload: " + e.getMessage(), e);
        }
    }

    private Optional<CandidateStore> toCandidate(JsonObject place) {
        if (!place.has("location")) {
            log.warn("Skipping place without location: {}", text(place, "displayName"));
            return Optional.empty();
        }
        JsonObject location = place.getAsJsonObject("location");

        List<String> types = new ArrayList<>();
        if (place.has("types")) {
            place.getAsJsonArray("types").forEach(t -> types.add(t.getAsString()));
        }

        return Optional.of(CandidateStore.builder()
                .id(string(place, "id", "unknown"))
                .name(text(place, "displayName"))
                .address(string(place, "formattedAddress", "Address not available"))
                .location(GeoPoint.of(
                        location.get("latitude").getAsDouble(),
                        location.get("longitude").getAsDouble()))
                .types(types)
                .rating(place.has("rating") ? place.get("rating").getAsDouble() : null)
                .ratingCount(place.has("userRatingCount") ? place.get("userRatingCount").getAsInt() : null)
                .phone(string(place, "internationalPhoneNumber", null))
                .website(string(place, "websiteUri", null))
                .googleMapsUri(string(place, "googleMapsUri", null))
                .openNow(openNow(place))
                .operational("OPERATIONAL".equals(string(place, "businessStatus", null)))
                .provenance(Provenance.PLACES)
                .build());
    }

    private static Boolean openNow(JsonObject place) {
        if (place.has("currentOpeningHours") && place.get("currentOpeningHours").isJsonObject()) {
            JsonObject hours = place.getAsJsonObject("currentOpeningHours");
            if (hours.has("openNow") && !hours.get("openNow").isJsonNull()) {
                return hours.get("openNow").getAsBoolean();
            }
        }
        return null;
    }

    private static String string(JsonObject object, String member, String fallback) {
        return object.has(member) && !object.get(member).isJsonNull() ? object.get(member).getAsString() : fallback;
    }

    private static String text(JsonObject object, String member) {
        if (object.has(member) && object.get(member).isJsonObject()) {
            JsonObject localized = object.getAsJsonObject(member);
            if (localized.has("text")) {
                return localized.get("text").getAsString();
            }
        }
        return "Unknown Store";
    }
}
