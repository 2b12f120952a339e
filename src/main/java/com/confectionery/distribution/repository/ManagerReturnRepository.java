package com.confectionery.distribution.repository;

import com.confectionery.distribution.model.ManagerReturn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ManagerReturnRepository extends JpaRepository<ManagerReturn, Long> {

    @Query("SELECT r FROM ManagerReturn r WHERE (:managerId IS NULL OR r.manager.id = :managerId) "
            + "ORDER BY r.createdAt DESC, r.id DESC")
    List<ManagerReturn> search(@Param("managerId") Long managerId);
}
