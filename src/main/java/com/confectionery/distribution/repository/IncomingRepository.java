package com.confectionery.distribution.repository;

import com.confectionery.distribution.model.Incoming;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface IncomingRepository extends JpaRepository<Incoming, Long> {
    List<Incoming> findAllByOrderByCreatedAtDescIdDesc();
}
