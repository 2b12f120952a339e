package com.confectionery.distribution.repository;

import com.confectionery.distribution.model.Shop;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ShopRepository extends JpaRepository<Shop, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Shop s WHERE s.id = :id")
    Optional<Shop> findByIdForUpdate(@Param("id") Long id);

    List<Shop> findByManagerIdOrderByCreatedAtDesc(Long managerId);

    List<Shop> findAllByOrderByCreatedAtDesc();
}
