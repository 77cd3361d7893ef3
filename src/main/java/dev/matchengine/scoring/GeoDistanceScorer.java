package dev.matchengine.scoring;

import dev.matchengine.model.GeoPoint;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Great-circle distance and its piecewise-linear proximity score.
 */
@Component
public class GeoDistanceScorer {

    static final double EARTH_RADIUS_KM = 6371.2;
    static final double FULL_SCORE_KM = 5.0;
    static final double ZERO_SCORE_KM = 150.0;

    /**
     * Haversine distance in km rounded to 0.1, or empty when either point is missing.
     */
    public OptionalDouble distanceKm(GeoPoint a, GeoPoint b) {
        if (a == null || b == null) {
            return OptionalDouble.empty();
        }
        double dLat = Math.toRadians(b.latitude() - a.latitude());
        double dLon = Math.toRadians(b.longitude() - a.longitude());
        double lat1 = Math.toRadians(a.latitude());
        double lat2 = Math.toRadians(b.latitude());

        double h = Math.pow(Math.sin(dLat / 2), 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(dLon / 2), 2);
        double c = 2 * Math.asin(Math.min(1.0, Math.sqrt(h)));
        return OptionalDouble.of(Math.round(EARTH_RADIUS_KM * c * 10.0) / 10.0);
    }

    /**
     * 1.0 up to 5 km, linear down to 0.0 at 150 km, 0.0 beyond.
     */
    public double score(double km) {
        if (km <= FULL_SCORE_KM) {
            return 1.0;
        }
        if (km >= ZERO_SCORE_KM) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - (km - FULL_SCORE_KM) / (ZERO_SCORE_KM - FULL_SCORE_KM));
    }
}
