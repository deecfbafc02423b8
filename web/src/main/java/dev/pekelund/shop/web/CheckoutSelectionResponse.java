package dev.pekelund.shop.web;

import dev.pekelund.shop.checkout.CheckoutSelection;

public record CheckoutSelectionResponse(
    AddressResponse address,
    PaymentMethodResponse paymentMethod,
    boolean complete
) {

    public static CheckoutSelectionResponse from(CheckoutSelection selection) {
        return new CheckoutSelectionResponse(
            selection.shippingAddress().map(AddressResponse::from).orElse(null),
            selection.card().map(PaymentMethodResponse::from).orElse(null),
            selection.isComplete());
    }
}
