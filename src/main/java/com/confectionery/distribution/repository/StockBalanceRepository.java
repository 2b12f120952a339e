package com.confectionery.distribution.repository;

import com.confectionery.distribution.model.StockBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface StockBalanceRepository extends JpaRepository<StockBalance, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM StockBalance b WHERE b.product.id = :productId AND b.manager IS NULL AND b.returnBin = false")
    Optional<StockBalance> findPoolBalanceForUpdate(@Param("productId") Long productId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM StockBalance b WHERE b.product.id = :productId AND b.manager.id = :managerId AND b.returnBin = :returnBin")
    Optional<StockBalance> findManagerBalanceForUpdate(@Param("productId") Long productId,
            @Param("managerId") Long managerId,
            @Param("returnBin") boolean returnBin);

    @Query("SELECT b FROM StockBalance b JOIN FETCH b.product p WHERE b.manager IS NULL AND b.returnBin = false "
            + "AND p.archived = false AND LOWER(p.name) LIKE :pattern ORDER BY p.name ASC")
    List<StockBalance> searchPool(@Param("pattern") String pattern);

    @Query("SELECT b FROM StockBalance b JOIN FETCH b.product p WHERE b.manager.id = :managerId "
            + "AND b.returnBin = :returnBin AND p.archived = false AND LOWER(p.name) LIKE :pattern ORDER BY p.name ASC")
    List<StockBalance> searchManager(@Param("managerId") Long managerId,
            @Param("returnBin") boolean returnBin,
            @Param("pattern") String pattern);
}
