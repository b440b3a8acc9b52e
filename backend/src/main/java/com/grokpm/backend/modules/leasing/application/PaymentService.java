package com.grokpm.backend.modules.leasing.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.leasing.domain.Payment;
import com.grokpm.backend.modules.leasing.domain.Tenant;
import com.grokpm.backend.modules.leasing.infrastructure.persistence.PaymentRepository;
import com.grokpm.backend.modules.leasing.infrastructure.persistence.TenantRepository;
import com.grokpm.backend.modules.leasing.presentation.dto.CreatePaymentRequest;
import com.grokpm.backend.modules.leasing.presentation.dto.LeasingDtoMapper;
import com.grokpm.backend.modules.leasing.presentation.dto.PaymentResponse;
import com.grokpm.backend.modules.leasing.presentation.dto.UpdatePaymentRequest;

/**
 * Rent payments recorded against a tenant. No payment provider is called; rows are bookkeeping only.
 */
@Service
@Transactional
public class PaymentService {

    static final String DEFAULT_STATUS = "pending";

    private final PaymentRepository paymentRepository;
    private final TenantRepository tenantRepository;
    private final Clock clock;

    public PaymentService(PaymentRepository paymentRepository, TenantRepository tenantRepository, Clock clock) {
        this.paymentRepository = paymentRepository;
        this.tenantRepository = tenantRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<PaymentResponse> getPayments(Long tenantId) {
        List<Payment> payments = tenantId != null
                ? paymentRepository.findByTenantIdOrderByIdAsc(tenantId)
                : paymentRepository.findAllByOrderByIdAsc();
        return payments.stream().map(LeasingDtoMapper::toPaymentResponse).toList();
    }

    @Transactional(readOnly = true)
    public PaymentResponse getPayment(Long paymentId) {
        return LeasingDtoMapper.toPaymentResponse(loadPayment(paymentId));
    }

    public PaymentResponse createPayment(CreatePaymentRequest request) {
        Payment payment = new Payment();
        payment.setTenant(resolveTenant(request.tenantId()));
        payment.setAmount(request.amount());
        payment.setDate(request.date() != null ? request.date() : LocalDate.now(clock));
        payment.setStatus(request.status() != null ? request.status() : DEFAULT_STATUS);
        return LeasingDtoMapper.toPaymentResponse(paymentRepository.saveAndFlush(payment));
    }

    public PaymentResponse updatePayment(Long paymentId, UpdatePaymentRequest request) {
        Payment payment = loadPayment(paymentId);
        if (request.tenantId() != null) {
            payment.setTenant(resolveTenant(request.tenantId()));
        }
        if (request.amount() != null) {
            payment.setAmount(request.amount());
        }
        if (request.date() != null) {
            payment.setDate(request.date());
        }
        if (request.status() != null) {
            payment.setStatus(request.status());
        }
        return LeasingDtoMapper.toPaymentResponse(paymentRepository.saveAndFlush(payment));
    }

    public void deletePayment(Long paymentId) {
        Payment payment = loadPayment(paymentId);
        payment.getTenant().getPayments().remove(payment);
        paymentRepository.delete(payment);
    }

    private Payment loadPayment(Long paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> ProblemException.notFound("Payment", paymentId));
    }

    private Tenant resolveTenant(Long tenantId) {
        return tenantRepository.findById(tenantId)
                .orElseThrow(() -> ProblemException.invalidReference("tenantId", tenantId));
    }
}
