package com.williamcallahan.local_seo_engine.testutil;

import com.williamcallahan.local_seo_engine.model.Place;
import com.williamcallahan.local_seo_engine.repository.PlaceRepository;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryPlaceRepository implements PlaceRepository {

    private final Map<String, Place> places = new HashMap<>();

    public Place add(String placeId, String locationName) {
        Place place = Place.builder().placeId(placeId).displayName("Place " + placeId).searchLocationName(locationName).build();
        places.put(placeId, place);
        return place;
    }

    public void put(Place place) {
        places.put(place.getPlaceId(), place);
    }

    @Override
    public Optional<Place> findById(String placeId) {
        return Optional.ofNullable(placeId).map(places::get);
    }
}
