package com.grokpm.backend.modules.leasing.presentation.dto;

import com.grokpm.backend.modules.leasing.domain.Payment;
import com.grokpm.backend.modules.leasing.domain.Tenant;
import com.grokpm.backend.modules.leasing.domain.Unit;
import com.grokpm.backend.modules.maintenance.domain.MaintenanceTicket;
import com.grokpm.backend.modules.property.presentation.dto.PropertyDtoMapper;

public final class LeasingDtoMapper {

    private LeasingDtoMapper() {
    }

    public static UnitResponse toUnitResponse(Unit unit) {
        long openTickets = unit.getMaintenanceTickets().stream()
                .map(MaintenanceTicket::getStatus)
                .filter(status -> !status.isFinished())
                .count();
        return new UnitResponse(
                unit.getId(),
                unit.getUnitNumber(),
                unit.getRentAmount(),
                unit.getStatus(),
                PropertyDtoMapper.toAddressSummary(unit.getAddress()),
                unit.getTenants().stream().map(LeasingDtoMapper::toTenantSummary).toList(),
                PropertyDtoMapper.toPhotoResponses(unit.getPhotos()),
                openTickets,
                unit.getCreatedAt(),
                unit.getUpdatedAt()
        );
    }

    public static UnitSummary toUnitSummary(Unit unit) {
        if (unit == null) {
            return null;
        }
        return new UnitSummary(unit.getId(), unit.getUnitNumber(), unit.getRentAmount(), unit.getStatus());
    }

    public static TenantResponse toTenantResponse(Tenant tenant) {
        return new TenantResponse(
                tenant.getId(),
                tenant.getName(),
                tenant.getEmail(),
                tenant.getPhone(),
                tenant.getLeaseStartDate(),
                tenant.getLeaseEndDate(),
                tenant.getRent(),
                toUnitSummary(tenant.getUnit()),
                tenant.getPayments().stream().map(LeasingDtoMapper::toPaymentSummary).toList(),
                tenant.getCreatedAt(),
                tenant.getUpdatedAt()
        );
    }

    public static TenantSummary toTenantSummary(Tenant tenant) {
        return new TenantSummary(tenant.getId(), tenant.getName(), tenant.getEmail(), tenant.getUnit().getId());
    }

    public static PaymentResponse toPaymentResponse(Payment payment) {
        return new PaymentResponse(
                payment.getId(),
                payment.getAmount(),
                payment.getDate(),
                payment.getStatus(),
                toTenantSummary(payment.getTenant()),
                payment.getCreatedAt(),
                payment.getUpdatedAt()
        );
    }

    public static PaymentSummary toPaymentSummary(Payment payment) {
        return new PaymentSummary(payment.getId(), payment.getAmount(), payment.getDate(), payment.getStatus());
    }
}
