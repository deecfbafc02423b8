package dev.pekelund.shop.web;

import dev.pekelund.shop.collection.CollectionKind;
import dev.pekelund.shop.collection.ItemNotFoundException;
import dev.pekelund.shop.collection.ItemValidationException;
import dev.pekelund.shop.payment.CardType;
import dev.pekelund.shop.payment.PaymentMethodDraft;
import dev.pekelund.shop.payment.PaymentMethodService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping(path = "/api/payment-methods", produces = MediaType.APPLICATION_JSON_VALUE)
public class PaymentMethodController {

    private final PaymentMethodService paymentMethodService;

    public PaymentMethodController(PaymentMethodService paymentMethodService) {
        this.paymentMethodService = paymentMethodService;
    }

    @GetMapping
    public List<PaymentMethodResponse> list() {
        return paymentMethodService.getPaymentMethods().stream().map(PaymentMethodResponse::from).toList();
    }

    /**
     * @return the default card, or 204 when none is set
     */
    @GetMapping("/default")
    public ResponseEntity<PaymentMethodResponse> getDefault() {
        return paymentMethodService.getDefaultPaymentMethod()
            .map(PaymentMethodResponse::from)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}")
    public PaymentMethodResponse get(@PathVariable("id") String id) {
        return paymentMethodService.getPaymentMethod(id)
            .map(PaymentMethodResponse::from)
            .orElseThrow(() -> new ItemNotFoundException(CollectionKind.PAYMENT_METHODS, id));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public CreatedResponse add(@Valid @RequestBody PaymentMethodRequest request) {
        PaymentMethodDraft draft = new PaymentMethodDraft(
            parseCardType(request.cardType()),
            request.last4(),
            request.expiryMonth(),
            request.expiryYear(),
            request.holderName());
        return new CreatedResponse(paymentMethodService.addPaymentMethod(draft, request.makeDefault()));
    }

    @PatchMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void update(@PathVariable("id") String id, @RequestBody Map<String, Object> changes) {
        paymentMethodService.updatePaymentMethod(id, changes);
    }

    @PutMapping("/{id}/default")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setDefault(@PathVariable("id") String id) {
        paymentMethodService.setDefaultPaymentMethod(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") String id) {
        paymentMethodService.deletePaymentMethod(id);
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return SnapshotEmitters.open(paymentMethodService::subscribePaymentMethods, PaymentMethodResponse::from);
    }

    private static CardType parseCardType(String value) {
        try {
            return CardType.fromValue(value);
        } catch (IllegalArgumentException ex) {
            throw new ItemValidationException("cardType", ex.getMessage());
        }
    }
}
