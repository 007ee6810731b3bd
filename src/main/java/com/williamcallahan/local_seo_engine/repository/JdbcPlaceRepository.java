package com.williamcallahan.local_seo_engine.repository;

import com.williamcallahan.local_seo_engine.model.Place;
import com.williamcallahan.local_seo_engine.util.JdbcUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JdbcPlaceRepository implements PlaceRepository {

    private static final RowMapper<Place> ROW_MAPPER = (rs, rowNum) -> Place.builder()
        .placeId(rs.getString("place_id"))
        .displayName(rs.getString("display_name"))
        .searchLocationName(rs.getString("search_location_name"))
        .reviewCount(JdbcUtils.getInteger(rs, "review_count"))
        .logoUrl(rs.getString("logo_url"))
        .logoLocalPath(rs.getString("logo_local_path"))
        .mainPhotoUrl(rs.getString("main_photo_url"))
        .mainPhotoLocalPath(rs.getString("main_photo_local_path"))
        .build();

    private final JdbcTemplate jdbcTemplate;

    public JdbcPlaceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Place> findById(String placeId) {
        if (placeId == null || placeId.isBlank()) {
            return Optional.empty();
        }
        return JdbcUtils.queryForOptionalObject(jdbcTemplate, """
            SELECT place_id, display_name, search_location_name, review_count,
                   logo_url, logo_local_path, main_photo_url, main_photo_local_path
            FROM place
            WHERE place_id = ?
            """, ROW_MAPPER, placeId);
    }
}
