package com.ospicorp.dashboardapi.place.repository;

import com.ospicorp.dashboardapi.data.model.enums.DataType;
import com.ospicorp.dashboardapi.place.model.FeedData;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FeedDataRepository extends JpaRepository<FeedData, Long> {
  Optional<FeedData> findByPlaceIdAndDataType(String placeId, DataType dataType);
}
