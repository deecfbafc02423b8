package dev.pekelund.shop.payment;

import dev.pekelund.shop.auth.AuthenticationContextResolver;
import dev.pekelund.shop.batch.TransactionalBatchWriter;
import dev.pekelund.shop.registry.DefaultItemRegistry;
import dev.pekelund.shop.registry.DeletionGuardPolicy;
import dev.pekelund.shop.store.DocumentStore;
import dev.pekelund.shop.subscription.LiveSubscriptionChannel;
import dev.pekelund.shop.subscription.Subscription;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.springframework.stereotype.Service;

/**
 * Saved cards of the signed-in user. The default card can only be deleted while another card exists to
 * take over.
 */
@Service
public class PaymentMethodService {

    private final AuthenticationContextResolver authenticationContext;
    private final DefaultItemRegistry<PaymentMethod, PaymentMethodDraft> registry;
    private final LiveSubscriptionChannel<PaymentMethod> channel;

    public PaymentMethodService(
        DocumentStore documentStore,
        TransactionalBatchWriter batchWriter,
        AuthenticationContextResolver authenticationContext,
        Clock clock
    ) {
        PaymentMethodSchema schema = new PaymentMethodSchema(clock);
        this.authenticationContext = authenticationContext;
        this.registry = new DefaultItemRegistry<>(documentStore, batchWriter, authenticationContext, schema,
            DeletionGuardPolicy.REQUIRE_REPLACEMENT_OR_REJECT, clock);
        this.channel = new LiveSubscriptionChannel<>(documentStore, schema);
    }

    /**
     * @return saved cards, default first and then newest first
     */
    public List<PaymentMethod> getPaymentMethods() {
        return registry.list();
    }

    public Optional<PaymentMethod> getPaymentMethod(String id) {
        return registry.findById(id);
    }

    public Optional<PaymentMethod> getDefaultPaymentMethod() {
        return registry.findDefault();
    }

    public Subscription subscribePaymentMethods(Consumer<List<PaymentMethod>> onMethods,
                                                Consumer<Throwable> onError) {
        return channel.subscribe(authenticationContext.requireOwnerId(), onMethods, onError);
    }

    public String addPaymentMethod(PaymentMethodDraft draft, boolean makeDefault) {
        return registry.add(draft, makeDefault);
    }

    /**
     * @param changes {@code expiryMonth}, {@code expiryYear}, {@code holderName} and optionally {@code isDefault}
     */
    public void updatePaymentMethod(String id, Map<String, Object> changes) {
        registry.update(id, changes);
    }

    public void setDefaultPaymentMethod(String id) {
        registry.setDefault(id);
    }

    /**
     * @throws dev.pekelund.shop.collection.InvariantViolationException when deleting the only card while it is
     *     the default
     */
    public void deletePaymentMethod(String id) {
        registry.delete(id);
    }
}
