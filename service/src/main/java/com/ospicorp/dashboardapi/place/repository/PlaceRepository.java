package com.ospicorp.dashboardapi.place.repository;

import com.ospicorp.dashboardapi.place.model.Place;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PlaceRepository extends JpaRepository<Place, String> {
}
