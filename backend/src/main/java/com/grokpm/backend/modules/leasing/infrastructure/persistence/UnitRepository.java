package com.grokpm.backend.modules.leasing.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.grokpm.backend.modules.leasing.domain.Unit;

public interface UnitRepository extends JpaRepository<Unit, Long> {

    @Query("""
            select u from Unit u
              join fetch u.address a
             where (:propertyId is null or a.property.id = :propertyId)
               and (:addressId is null or a.id = :addressId)
               and (:status is null or lower(u.status) = lower(:status))
             order by u.id asc
            """)
    List<Unit> search(
            @Param("propertyId") Long propertyId,
            @Param("addressId") Long addressId,
            @Param("status") String status
    );
}
