package com.streetsignal.domain.service;

import com.streetsignal.domain.model.Attribution;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.Poi;
import com.streetsignal.domain.model.Street;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.streetsignal.module.test.support.TestFixtures.Districts.E1_CENTER;
import static com.streetsignal.module.test.support.TestFixtures.north;
import static com.streetsignal.module.test.support.TestFixtures.poi;
import static com.streetsignal.module.test.support.TestFixtures.street;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StreetAttributorTest {

    private final StreetAttributor attributor = new StreetAttributor();

    @Test
    void testAttribute_ExplicitTag_WinsOverNearerStreet() {
        Poi tagged = poi(1, E1_CENTER, "addr:street", "Brick Lane");
        List<Street> streets = List.of(street(10, "Whitechapel Road", E1_CENTER));

        Attribution attribution = attributor.attribute(tagged, streets, 200.0);

        assertThat(attribution.getStreetName()).isEqualTo("Brick Lane");
        assertThat(attribution.getMethod()).isEqualTo(Attribution.Method.TAG);
        assertThat(attribution.getDistanceMeters()).isNull();
    }

    @Test
    void testAttribute_ExplicitTag_NoDistanceCheck() {
        Poi farAway = poi(1, north(E1_CENTER, 5_000), "addr:street", "Brick Lane");

        Attribution attribution = attributor.attribute(farAway, List.of(), 10.0);

        assertThat(attribution.getStreetName()).isEqualTo("Brick Lane");
    }

    @Test
    void testAttribute_BlankTag_FallsBackToNearestStreet() {
        Poi blankTag = poi(1, E1_CENTER, "addr:street", "  ");
        List<Street> streets = List.of(
            street(10, "Far Street", north(E1_CENTER, 150)),
            street(11, "Near Street", north(E1_CENTER, 30)));

        Attribution attribution = attributor.attribute(blankTag, streets, 200.0);

        assertThat(attribution.getStreetName()).isEqualTo("Near Street");
        assertThat(attribution.getMethod()).isEqualTo(Attribution.Method.NEAREST_STREET);
        assertThat(attribution.getDistanceMeters()).isCloseTo(30.0, within(0.01));
    }

    @Test
    void testAttribute_NearestBeyondThreshold_IsUnattributed() {
        Poi untagged = poi(1, E1_CENTER);
        List<Street> streets = List.of(street(10, "Far Street", north(E1_CENTER, 250)));

        Attribution attribution = attributor.attribute(untagged, streets, 200.0);

        assertThat(attribution.isAttributed()).isFalse();
        assertThat(attribution.getMethod()).isEqualTo(Attribution.Method.NONE);
        assertThat(attribution.getDistanceMeters()).isCloseTo(250.0, within(0.01));
    }

    @Test
    void testAttribute_ExactlyAtThreshold_IsAttributed() {
        Coordinate streetPoint = north(E1_CENTER, 100);
        Poi untagged = poi(1, E1_CENTER);
        double exactDistance = GeoDistance.haversineMeters(E1_CENTER, streetPoint);

        Attribution attribution = attributor.attribute(untagged, List.of(street(10, "Edge Street", streetPoint)),
            exactDistance);

        assertThat(attribution.getStreetName()).isEqualTo("Edge Street");
    }

    @Test
    void testAttribute_NoStreets_IsUnattributed() {
        Attribution attribution = attributor.attribute(poi(1, E1_CENTER), List.of(), 200.0);

        assertThat(attribution.isAttributed()).isFalse();
        assertThat(attribution.getDistanceMeters()).isNull();
    }

    @Test
    void testAttribute_EquidistantStreets_FirstOneWins() {
        Coordinate sharedPoint = north(E1_CENTER, 40);
        List<Street> streets = List.of(
            street(10, "First Street", sharedPoint),
            street(11, "Second Street", sharedPoint));

        Attribution attribution = attributor.attribute(poi(1, E1_CENTER), streets, 200.0);

        assertThat(attribution.getStreetName()).isEqualTo("First Street");
    }

    @Test
    void testAttribute_PreservesInputOrder() {
        List<Poi> pois = List.of(
            poi(1, E1_CENTER, "addr:street", "A Street"),
            poi(2, E1_CENTER),
            poi(3, E1_CENTER, "addr:street", "C Street"));
        List<Street> streets = List.of(street(10, "B Street", north(E1_CENTER, 10)));

        List<Attribution> attributions = attributor.attribute(pois, streets, 200.0);

        assertThat(attributions)
            .extracting(Attribution::getStreetName)
            .containsExactly("A Street", "B Street", "C Street");
        assertThat(attributions)
            .extracting(attribution -> attribution.getPoi().getId())
            .containsExactly(1L, 2L, 3L);
    }
}
