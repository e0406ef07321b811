package com.streetsignal.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Durable geocode cache row. Rows are only ever inserted.
 */
@Entity
@Table(name = "geocode_entry")
@Getter
@Setter
@NoArgsConstructor
public class GeocodeEntry {

    @Id
    @Column(name = "district", nullable = false, length = 16)
    private String district;

    @Column(name = "lat", nullable = false)
    private double lat;

    @Column(name = "lng", nullable = false)
    private double lng;

    @Column(name = "source", length = 32)
    private String source;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public GeocodeEntry(District district, Coordinate coordinate, String source) {
        this.district = district.getCode();
        this.lat = coordinate.getLat();
        this.lng = coordinate.getLon();
        this.source = source;
        this.createdAt = OffsetDateTime.now();
    }

    public Coordinate toCoordinate() {
        return new Coordinate(lat, lng);
    }
}
