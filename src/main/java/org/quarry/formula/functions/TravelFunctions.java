package org.quarry.formula.functions;

import org.quarry.formula.api.FormulaContext;
import org.quarry.formula.api.FormulaException;
import org.quarry.formula.api.MentionEntity;
import org.quarry.formula.runtime.FormulaValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.quarry.formula.functions.Builtins.arg;
import static org.quarry.formula.functions.Builtins.define;
import static org.quarry.formula.functions.Builtins.defineAsync;
import static org.quarry.formula.functions.Builtins.textArg;

/**
 * Travel functions over place mentions. No routing or weather provider is wired in, so
 * {@code Route} and {@code Weather} answer with placeholder records.
 */
final class TravelFunctions {

    private static final Logger LOG = LoggerFactory.getLogger(TravelFunctions.class);

    private static final double EARTH_RADIUS_KM = 6371.0;
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private TravelFunctions() {
        // Private constructor to prevent instantiation
    }

    static List<FunctionDefinition> definitions() {
        return List.of(
                defineAsync("Route", FunctionCategory.TRAVEL, "Calculate route between two places (requires external API)",
                        "Route(@home, @office)", "object",
                        List.of(ParamInfo.required("from", "place", "Starting location"),
                                ParamInfo.required("to", "place", "Destination"),
                                ParamInfo.optional("mode", "string", "Travel mode (drive/walk/transit)", "drive")),
                        (args, ctx) -> {
                            String from = placeName(args.get(0));
                            String to = placeName(args.get(1));
                            LOG.debug("No route provider configured, returning placeholder for {} -> {}", from, to);
                            Map<String, Object> route = new LinkedHashMap<>();
                            route.put("from", from);
                            route.put("to", to);
                            route.put("mode", textArg(args, 2, "drive"));
                            route.put("distance", "-- km");
                            route.put("duration", "-- min");
                            route.put("message", "Route API not configured. Connect a routing provider for real routes.");
                            return CompletableFuture.completedFuture(route);
                        }),
                defineAsync("Weather", FunctionCategory.TRAVEL, "Get weather forecast for a place and date",
                        "Weather(@paris, \"2024-06-01\")", "object",
                        List.of(ParamInfo.required("place", "place", "Location"),
                                ParamInfo.optional("date", "date", "Date for forecast")),
                        (args, ctx) -> {
                            Instant date;
                            try {
                                date = arg(args, 1) == null ? ctx.now() : FormulaValues.toDate(args.get(1));
                            } catch (FormulaException e) {
                                return CompletableFuture.failedFuture(e);
                            }
                            String place = placeName(args.get(0));
                            LOG.debug("No weather provider configured, returning placeholder for {}", place);
                            Map<String, Object> weather = new LinkedHashMap<>();
                            weather.put("place", place);
                            weather.put("date", DAY.format(date));
                            weather.put("condition", "Unknown");
                            weather.put("temperature", "--°");
                            weather.put("message", "Weather API not configured. Connect a forecast provider for real forecasts.");
                            return CompletableFuture.completedFuture(weather);
                        }),
                define("Distance", FunctionCategory.TRAVEL, "Calculate straight-line distance between coordinates",
                        "Distance(@paris, @london) → 343.6", "number",
                        List.of(ParamInfo.required("from", "place", "Starting point"),
                                ParamInfo.required("to", "place", "End point")),
                        (args, ctx) -> {
                            Optional<double[]> from = coordinates(args.get(0), ctx);
                            Optional<double[]> to = coordinates(args.get(1), ctx);
                            if (from.isEmpty() || to.isEmpty()) {
                                return 0.0;
                            }
                            return Math.round(haversineKm(from.get(), to.get()) * 10) / 10.0;
                        })
        );
    }

    /**
     * Great-circle distance in kilometres between two {@code [latitude, longitude]} pairs.
     */
    static double haversineKm(double[] from, double[] to) {
        double dLat = Math.toRadians(to[0] - from[0]);
        double dLon = Math.toRadians(to[1] - from[1]);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(from[0])) * Math.cos(Math.toRadians(to[0]))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Finds coordinates for a place given as a label of a place mention in the context, or as a map
     * carrying {@code latitude}/{@code longitude} directly or in its {@code properties}.
     */
    private static Optional<double[]> coordinates(Object place, FormulaContext context) {
        if (place instanceof String label) {
            for (MentionEntity mention : context.mentions()) {
                if (mention.isType("place") && mention.label().equalsIgnoreCase(label)) {
                    return latLng(mention.properties());
                }
            }
            return Optional.empty();
        }
        if (place instanceof Map<?, ?> map) {
            Optional<double[]> direct = latLng(map);
            if (direct.isPresent()) {
                return direct;
            }
            if (map.get("properties") instanceof Map<?, ?> properties) {
                return latLng(properties);
            }
        }
        return Optional.empty();
    }

    private static Optional<double[]> latLng(Map<?, ?> map) {
        if (map.get("latitude") instanceof Number lat && map.get("longitude") instanceof Number lng) {
            return Optional.of(new double[]{lat.doubleValue(), lng.doubleValue()});
        }
        return Optional.empty();
    }

    private static String placeName(Object place) {
        if (place instanceof Map<?, ?> map && map.get("label") != null) {
            return String.valueOf(map.get("label"));
        }
        return FormulaValues.toText(place);
    }
}
