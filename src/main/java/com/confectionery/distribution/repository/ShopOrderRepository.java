package com.confectionery.distribution.repository;

import com.confectionery.distribution.model.ShopOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ShopOrderRepository extends JpaRepository<ShopOrder, Long> {

    @Query("SELECT o FROM ShopOrder o WHERE (:managerId IS NULL OR o.manager.id = :managerId) "
            + "AND (:shopId IS NULL OR o.shop.id = :shopId) ORDER BY o.createdAt DESC, o.id DESC")
    List<ShopOrder> search(@Param("managerId") Long managerId, @Param("shopId") Long shopId);

    boolean existsByShopId(Long shopId);
}
