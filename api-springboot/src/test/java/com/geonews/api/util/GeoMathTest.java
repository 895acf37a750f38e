package com.geonews.api.util;

import com.geonews.api.model.BoundingBox;
import com.geonews.api.model.ClusterKey;
import com.geonews.api.model.GeoPoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoMathTest {

    @Test
    void distanceKm_isZeroForSamePoint() {
        assertThat(GeoMath.distanceKm(19.076, 72.877, 19.076, 72.877)).isZero();
    }

    @Test
    void distanceKm_isSymmetric() {
        double there = GeoMath.distanceKm(19.076, 72.877, 28.6139, 77.2090);
        double back = GeoMath.distanceKm(28.6139, 77.2090, 19.076, 72.877);

        assertThat(there).isEqualTo(back, within(1e-9));
    }

    @Test
    void distanceKm_oneDegreeOfLongitudeAtEquator() {
        assertThat(GeoMath.distanceKm(0, 0, 0, 1)).isCloseTo(111.19, within(111.19 * 0.005));
    }

    @Test
    void distanceKm_mumbaiToDelhi() {
        assertThat(GeoMath.distanceKm(GeoPoint.of(19.076, 72.877), GeoPoint.of(28.6139, 77.2090)))
                .isCloseTo(1150.0, within(15.0));
    }

    @Test
    void clusterKey_roundsToNearestStep() {
        ClusterKey key = GeoMath.clusterKey(19.076, 72.877);

        assertThat(key).isEqualTo(new ClusterKey(21, 81));
        assertThat(key.toString()).isEqualTo("21_81");
    }

    @Test
    void clusterKey_nearbyPointsShareACell() {
        assertThat(GeoMath.clusterKey(19.076, 72.877)).isEqualTo(GeoMath.clusterKey(19.10, 72.90));
        assertThat(GeoMath.clusterKey(19.076, 72.877)).isNotEqualTo(GeoMath.clusterKey(28.6139, 77.2090));
    }

    @Test
    void clusterKey_antimeridianHasOneKey() {
        assertThat(GeoMath.clusterKey(10.0, 180.0)).isEqualTo(GeoMath.clusterKey(10.0, -180.0));
    }

    @Test
    void clusterKey_poleIsASingleCell() {
        ClusterKey northPole = GeoMath.clusterKey(90.0, 0.0);

        assertThat(GeoMath.clusterKey(90.0, 120.0)).isEqualTo(northPole);
        assertThat(GeoMath.clusterKey(89.9, -45.0)).isEqualTo(northPole);
        assertThat(GeoMath.clusterKey(-90.0, 77.0)).isEqualTo(GeoMath.clusterKey(-90.0, -10.0));
        assertThat(GeoMath.clusterKey(northPole.centre())).isEqualTo(northPole);
    }

    @Test
    void clusterKey_centreLiesInsideItsOwnCell() {
        ClusterKey key = GeoMath.clusterKey(-33.87, 151.21);

        assertThat(GeoMath.clusterKey(key.centre())).isEqualTo(key);
        assertThat(GeoMath.distanceKm(key.centre(), GeoPoint.of(-33.87, 151.21))).isLessThan(GeoMath.CLUSTER_SIZE_KM);
    }

    @Test
    void boundingBox_containsEveryPointOnTheCircle() {
        GeoPoint centre = GeoPoint.of(19.076, 72.877);
        BoundingBox box = GeoMath.boundingBox(centre, 50);

        for (int bearing = 0; bearing < 360; bearing += 15) {
            GeoPoint edge = destination(centre, 49.9, bearing);
            assertThat(box.contains(edge.latitude(), edge.longitude()))
                    .as("bearing %d", bearing)
                    .isTrue();
        }
        assertThat(box.contains(19.076, 73.977)).isFalse();
    }

    @Test
    void boundingBox_widensToFullLongitudeNearPole() {
        BoundingBox box = GeoMath.boundingBox(GeoPoint.of(89.9, 10.0), 50);

        assertThat(box.minLongitude()).isEqualTo(-180.0);
        assertThat(box.maxLongitude()).isEqualTo(180.0);
        assertThat(box.maxLatitude()).isEqualTo(90.0);
    }

    @Test
    void boundingBox_widensAcrossAntimeridian() {
        BoundingBox box = GeoMath.boundingBox(GeoPoint.of(0.0, 179.9), 50);

        assertThat(box.contains(0.0, -179.9)).isTrue();
    }

    private static GeoPoint destination(GeoPoint start, double km, double bearingDegrees) {
        double delta = km / GeoMath.EARTH_RADIUS_KM;
        double theta = Math.toRadians(bearingDegrees);
        double lat1 = Math.toRadians(start.latitude());
        double lon1 = Math.toRadians(start.longitude());
        double lat2 = Math.asin(Math.sin(lat1) * Math.cos(delta) + Math.cos(lat1) * Math.sin(delta) * Math.cos(theta));
        double lon2 = lon1 + Math.atan2(Math.sin(theta) * Math.sin(delta) * Math.cos(lat1),
                Math.cos(delta) - Math.sin(lat1) * Math.sin(lat2));
        return GeoPoint.of(Math.toDegrees(lat2), Math.toDegrees(lon2));
    }
}
