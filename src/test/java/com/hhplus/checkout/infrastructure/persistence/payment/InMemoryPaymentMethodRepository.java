package com.hhplus.checkout.infrastructure.persistence.payment;

import com.hhplus.checkout.domain.payment.PaymentMethod;
import com.hhplus.checkout.domain.payment.PaymentMethodRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * InMemoryPaymentMethodRepository - 결제 수단 저장소 (인메모리, 테스트용)
 */
public class InMemoryPaymentMethodRepository implements PaymentMethodRepository {

    private final List<PaymentMethod> methods = new ArrayList<>();

    /**
     * bank / terminal / card 가 모두 활성화된 저장소
     */
    public static InMemoryPaymentMethodRepository withDefaults() {
        InMemoryPaymentMethodRepository repository = new InMemoryPaymentMethodRepository();
        repository.add("bank", "Bank", true, 1);
        repository.add("terminal", "IBox terminal", true, 2);
        repository.add("card", "Visa", true, 3);
        return repository;
    }

    public void add(String code, String title, boolean active, int displayOrder) {
        methods.removeIf(method -> method.getCode().equals(code));
        methods.add(PaymentMethod.builder()
                .code(code)
                .title(title)
                .active(active)
                .displayOrder(displayOrder)
                .build());
    }

    @Override
    public Optional<PaymentMethod> findActiveByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return methods.stream()
                .filter(method -> method.isActive() && method.getCode().equals(normalized))
                .findFirst();
    }

    @Override
    public List<PaymentMethod> findAllActive() {
        return methods.stream()
                .filter(PaymentMethod::isActive)
                .sorted(Comparator.comparingInt(PaymentMethod::getDisplayOrder))
                .collect(Collectors.toList());
    }
}
