package dev.pekelund.shop.checkout;

import dev.pekelund.shop.address.Address;
import dev.pekelund.shop.payment.PaymentMethod;
import java.util.Optional;

/**
 * Address and card preselected for checkout. Either may be missing.
 */
public record CheckoutSelection(Address address, PaymentMethod paymentMethod) {

    public Optional<Address> shippingAddress() {
        return Optional.ofNullable(address);
    }

    public Optional<PaymentMethod> card() {
        return Optional.ofNullable(paymentMethod);
    }

    public boolean isComplete() {
        return address != null && paymentMethod != null;
    }
}
