package dev.pekelund.shop.address;

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
 * Shipping addresses of the signed-in user. Deleting the default address is allowed and leaves the user
 * without a default.
 */
@Service
public class AddressService {

    private final AuthenticationContextResolver authenticationContext;
    private final DefaultItemRegistry<Address, AddressDraft> registry;
    private final LiveSubscriptionChannel<Address> channel;

    public AddressService(
        DocumentStore documentStore,
        TransactionalBatchWriter batchWriter,
        AuthenticationContextResolver authenticationContext,
        Clock clock
    ) {
        AddressSchema schema = new AddressSchema();
        this.authenticationContext = authenticationContext;
        this.registry = new DefaultItemRegistry<>(documentStore, batchWriter, authenticationContext, schema,
            DeletionGuardPolicy.UNRESTRICTED, clock);
        this.channel = new LiveSubscriptionChannel<>(documentStore, schema);
    }

    public List<Address> getMyAddresses() {
        return registry.list();
    }

    public Optional<Address> getAddress(String id) {
        return registry.findById(id);
    }

    public Optional<Address> getDefaultAddress() {
        return registry.findDefault();
    }

    public Subscription subscribeMyAddresses(Consumer<List<Address>> onAddresses, Consumer<Throwable> onError) {
        return channel.subscribe(authenticationContext.requireOwnerId(), onAddresses, onError);
    }

    public String addAddress(AddressDraft draft, boolean makeDefault) {
        return registry.add(draft, makeDefault);
    }

    /**
     * @param changes address fields keyed by {@link Address} component name, optionally with {@code isDefault}
     */
    public void updateAddress(String id, Map<String, Object> changes) {
        registry.update(id, changes);
    }

    public void setDefaultAddress(String id) {
        registry.setDefault(id);
    }

    public void deleteAddress(String id) {
        registry.delete(id);
    }
}
