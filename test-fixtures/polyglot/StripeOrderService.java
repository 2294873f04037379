package com.cfgsketch.fixture;

import java.util.UUID;

public class StripeOrderService extends AbstractOrderService {

    private final PaymentService paymentService;
    private int attempts = 0;

    public StripeOrderService(PaymentService paymentService) {
        this.paymentService = paymentService;
    }

    @Override
    public OrderResponse createOrder(OrderRequest request) {
        request.setOrderId(UUID.randomUUID().toString());
        PaymentResult result = charge(request);
        if (!result.isSuccess()) {
            throw new IllegalStateException("Payment failed: " + result.getErrorMessage());
        }
        return new OrderResponse(request.getOrderId(), "CONFIRMED", result.getTransactionId());
    }

    private PaymentResult charge(OrderRequest request) {
        while (attempts < 3) {
            attempts++;
            PaymentResult result = paymentService.charge(new PaymentRequest(request.getCustomerId(), "USD"));
            if (result.isSuccess()) {
                return result;
            }
        }
        return PaymentResult.failed("retries exhausted");
    }

    public String describe(int status) {
        switch (status) {
            case 1:
                return "pending";
            case 2:
                break;
            default:
                log("unknown status " + status);
        }
        return "other";
    }

    private void log(String message) {
        System.out.println(message);
    }
}

abstract class AbstractOrderService {
    public abstract OrderResponse createOrder(OrderRequest request);
}
