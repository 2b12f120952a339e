package com.confectionery.distribution.repository;

import com.confectionery.distribution.model.ShopReturn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ShopReturnRepository extends JpaRepository<ShopReturn, Long> {

    @Query("SELECT r FROM ShopReturn r WHERE (:managerId IS NULL OR r.manager.id = :managerId) "
            + "ORDER BY r.createdAt DESC, r.id DESC")
    List<ShopReturn> search(@Param("managerId") Long managerId);

    boolean existsByShopId(Long shopId);
}
