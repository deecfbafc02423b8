package dev.pekelund.shop.checkout;

import dev.pekelund.shop.address.AddressService;
import dev.pekelund.shop.collection.CollectionItem;
import dev.pekelund.shop.payment.PaymentMethodService;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Picks the address and card a checkout starts with: the default item, otherwise the first one listed.
 */
@Service
public class CheckoutSelectionService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutSelectionService.class);

    private final AddressService addressService;
    private final PaymentMethodService paymentMethodService;

    public CheckoutSelectionService(AddressService addressService, PaymentMethodService paymentMethodService) {
        this.addressService = addressService;
        this.paymentMethodService = paymentMethodService;
    }

    public CheckoutSelection currentSelection() {
        CheckoutSelection selection = new CheckoutSelection(
            preferred(addressService.getMyAddresses()).orElse(null),
            preferred(paymentMethodService.getPaymentMethods()).orElse(null));
        log.debug("Checkout selection resolved (address={}, card={})",
            selection.address() != null ? selection.address().id() : null,
            selection.paymentMethod() != null ? selection.paymentMethod().id() : null);
        return selection;
    }

    static <T extends CollectionItem> Optional<T> preferred(List<T> items) {
        return items.stream()
            .filter(CollectionItem::isDefault)
            .findFirst()
            .or(() -> items.stream().findFirst());
    }
}
