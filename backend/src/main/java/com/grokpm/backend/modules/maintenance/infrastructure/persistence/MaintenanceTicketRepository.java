package com.grokpm.backend.modules.maintenance.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.grokpm.backend.modules.maintenance.domain.MaintenanceStatus;
import com.grokpm.backend.modules.maintenance.domain.MaintenanceTicket;

public interface MaintenanceTicketRepository extends JpaRepository<MaintenanceTicket, Long> {

    @Query("""
            select t from MaintenanceTicket t
              join fetch t.unit u
             where (:unitId is null or u.id = :unitId)
               and (:status is null or t.status = :status)
             order by t.reportedAt desc, t.id desc
            """)
    List<MaintenanceTicket> search(@Param("unitId") Long unitId, @Param("status") MaintenanceStatus status);
}
