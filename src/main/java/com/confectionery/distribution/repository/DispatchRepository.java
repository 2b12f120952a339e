package com.confectionery.distribution.repository;

import com.confectionery.distribution.model.Dispatch;
import com.confectionery.distribution.model.DispatchStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface DispatchRepository extends JpaRepository<Dispatch, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Dispatch d WHERE d.id = :id")
    Optional<Dispatch> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT d FROM Dispatch d WHERE (:managerId IS NULL OR d.manager.id = :managerId) "
            + "AND (:status IS NULL OR d.status = :status) ORDER BY d.createdAt DESC, d.id DESC")
    List<Dispatch> search(@Param("managerId") Long managerId, @Param("status") DispatchStatus status);
}
