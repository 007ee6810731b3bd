package com.williamcallahan.local_seo_engine.repository;

import com.williamcallahan.local_seo_engine.model.Place;

import java.util.Optional;

/**
 * Read access to the slice of place data enrichment depends on.
 */
public interface PlaceRepository {

    Optional<Place> findById(String placeId);
}
