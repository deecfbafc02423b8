package dev.pekelund.shop.web;

import dev.pekelund.shop.checkout.CheckoutSelectionService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CheckoutController {

    private final CheckoutSelectionService checkoutSelectionService;

    public CheckoutController(CheckoutSelectionService checkoutSelectionService) {
        this.checkoutSelectionService = checkoutSelectionService;
    }

    @GetMapping(path = "/api/checkout/selection", produces = MediaType.APPLICATION_JSON_VALUE)
    public CheckoutSelectionResponse selection() {
        return CheckoutSelectionResponse.from(checkoutSelectionService.currentSelection());
    }
}
